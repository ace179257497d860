package com.telemetry.domain.service.extract;

import java.util.Locale;

/**
 * Normalized touch grid: 50 columns by 100 rows over the screen.
 */
public final class HeatmapGrid {

    public static final int COLUMNS = 50;
    public static final int ROWS = 100;
    public static final double DEFAULT_SCREEN_WIDTH = 375;
    public static final double DEFAULT_SCREEN_HEIGHT = 812;

    private HeatmapGrid() {
    }

    /**
     * Bucket key for a touch, e.g. {@code "0.26,0.12"}. Position is relative to
     * the screen so devices of different sizes share buckets.
     */
    public static String bucketKey(double x, double y, double screenWidth, double screenHeight) {
        double normX = clamp(x / screenWidth);
        double normY = clamp(y / screenHeight);
        double bucketX = Math.floor(normX * COLUMNS) / COLUMNS;
        double bucketY = Math.floor(normY * ROWS) / ROWS;
        return String.format(Locale.ROOT, "%.2f,%.2f", bucketX, bucketY);
    }

    private static double clamp(double value) {
        return Math.max(0, Math.min(1, value));
    }
}

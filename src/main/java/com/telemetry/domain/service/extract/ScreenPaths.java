package com.telemetry.domain.service.extract;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;

/**
 * Visited-screen sequences: trimmed names, no consecutive repeats, bounded length.
 */
public final class ScreenPaths {

    public static final int MAX_LENGTH = 200;

    private ScreenPaths() {
    }

    public static List<String> normalize(Collection<String> screens, int maxLength) {
        List<String> path = new ArrayList<>();
        if (screens == null) {
            return path;
        }
        for (String screen : screens) {
            if (path.size() >= maxLength) {
                break;
            }
            appendIfChanged(path, screen);
        }
        return path;
    }

    /**
     * Append {@code addition} to {@code existing}, collapsing a repeat where they meet.
     */
    public static List<String> merge(List<String> existing, List<String> addition, int maxLength) {
        List<String> merged = normalize(existing, maxLength);
        if (addition == null) {
            return merged;
        }
        for (String screen : addition) {
            if (merged.size() >= maxLength) {
                break;
            }
            appendIfChanged(merged, screen);
        }
        return merged;
    }

    public static int uniqueCount(Collection<String> screens) {
        return screens == null ? 0 : new HashSet<>(screens).size();
    }

    static void appendIfChanged(List<String> path, String screen) {
        if (screen == null) {
            return;
        }
        String trimmed = screen.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        if (path.isEmpty() || !path.get(path.size() - 1).equals(trimmed)) {
            path.add(trimmed);
        }
    }
}

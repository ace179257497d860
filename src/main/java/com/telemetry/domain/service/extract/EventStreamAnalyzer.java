package com.telemetry.domain.service.extract;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Set;

/**
 * Classifies the events of one artifact and accumulates counters, the screen
 * path, per-screen heatmaps, API rollups and error/ANR occurrences.
 *
 * No I/O. Rage tap state is local to one call.
 */
public class EventStreamAnalyzer {

    private static final Set<String> INPUT_TYPES = Set.of(
            "keyboard_typing", "keyboard_show", "keyboard_hide", "input", "text_input");

    // Epoch millis of 2000-01-01; smaller numeric timestamps are taken as seconds
    private static final long MILLIS_THRESHOLD = 946_684_800_000L;

    private static final long DEFAULT_ANR_DURATION_MS = 5000;

    public EventStreamSummary analyze(JsonNode events, JsonNode deviceInfo, Instant now) {
        EventStreamSummary summary = new EventStreamSummary();
        if (events == null || !events.isArray()) {
            return summary;
        }

        double screenWidth = positive(deviceInfo, "screenWidth", HeatmapGrid.DEFAULT_SCREEN_WIDTH);
        double screenHeight = positive(deviceInfo, "screenHeight", HeatmapGrid.DEFAULT_SCREEN_HEIGHT);
        RageTapDetector rageTaps = new RageTapDetector();
        String currentScreen = null;

        for (JsonNode event : events) {
            String type = lower(text(event, "type"));
            String gestureType = lower(text(event, "gestureType"));

            if ("navigation".equals(type)) {
                String screen = screenName(event);
                if (screen != null) {
                    if (summary.getScreenPath().size() < ScreenPaths.MAX_LENGTH) {
                        ScreenPaths.appendIfChanged(summary.getScreenPath(), screen);
                    }
                    currentScreen = screen;
                    if (!summary.getHeatmaps().containsKey(screen)) {
                        summary.heatmapFor(screen).setFirstSeenMs(epochMillis(event.get("timestamp")));
                    }
                }
            }

            if (type.equals("motion") || type.equals("scroll_motion") || type.equals("pan_motion")) {
                if (type.contains("scroll")) {
                    summary.setScrollCount(summary.getScrollCount() + 1);
                }
            } else if (type.equals("touch") || type.equals("tap") || gestureType.equals("tap") || gestureType.equals("single_tap")) {
                summary.setTouchCount(summary.getTouchCount() + 1);
                double x = firstNonZero(number(event, "x"), touchCoordinate(event, "x"));
                double y = firstNonZero(number(event, "y"), touchCoordinate(event, "y"));
                boolean rage = rageTaps.onTap((long) number(event, "timestamp"), x, y);
                if (rage) {
                    summary.setRageTapCount(summary.getRageTapCount() + 1);
                }
                if (currentScreen != null && x > 0 && y > 0) {
                    String bucket = HeatmapGrid.bucketKey(x, y, screenWidth, screenHeight);
                    EventStreamSummary.ScreenHeatmap heatmap = summary.heatmapFor(currentScreen);
                    heatmap.addTouch(bucket);
                    if (rage) {
                        heatmap.addRageTap(bucket);
                    }
                }
            } else if (type.equals("scroll")) {
                summary.setScrollCount(summary.getScrollCount() + 1);
            } else if (type.equals("gesture")) {
                handleGesture(event, gestureType, currentScreen, screenWidth, screenHeight, rageTaps, summary);
            } else if (type.equals("rage_tap")) {
                summary.setRageTapCount(summary.getRageTapCount() + 1);
                double x = firstNonZero(number(event, "x"), touchCoordinate(event, "x"));
                double y = firstNonZero(number(event, "y"), touchCoordinate(event, "y"));
                if (currentScreen != null && x > 0 && y > 0) {
                    summary.heatmapFor(currentScreen).addRageTap(HeatmapGrid.bucketKey(x, y, screenWidth, screenHeight));
                }
            } else if (type.equals("dead_tap") || gestureType.equals("dead_tap")) {
                summary.setDeadTapCount(summary.getDeadTapCount() + 1);
            } else if (type.equals("api_call") || type.equals("network_request")) {
                handleApiCall(event, summary);
            } else if (type.equals("error")) {
                summary.setErrorCount(summary.getErrorCount() + 1);
                String name = orDefault(text(event, "name"), "Error");
                summary.getErrors().add(new EventStreamSummary.ErrorOccurrence(
                        timestamp(event.get("timestamp"), now),
                        errorType(name),
                        name,
                        orDefault(text(event, "message"), "Unknown error"),
                        text(event, "stack"),
                        currentScreen));
            } else if (type.equals("anr")) {
                long duration = (long) number(event, "durationMs");
                summary.getAnrs().add(new EventStreamSummary.AnrOccurrence(
                        timestamp(event.get("timestamp"), now),
                        duration > 0 ? duration : DEFAULT_ANR_DURATION_MS,
                        orDefault(text(event, "threadState"), "blocked"),
                        text(event, "stack"),
                        currentScreen));
            } else if (INPUT_TYPES.contains(type)) {
                summary.setInputCount(summary.getInputCount() + 1);
            } else if (type.equals("custom")) {
                summary.setCustomEventCount(summary.getCustomEventCount() + 1);
            } else if (type.equals("app_startup")) {
                double duration = firstNonZero(number(event, "durationMs"), number(event, "duration"));
                if (duration > 0) {
                    summary.setAppStartupTimeMs(duration);
                }
            } else if (type.equals("user_identity_changed")) {
                handleIdentityChange(event, summary);
            }
        }
        return summary;
    }

    private void handleGesture(JsonNode event, String gestureType, String currentScreen,
                               double screenWidth, double screenHeight,
                               RageTapDetector rageTaps, EventStreamSummary summary) {
        summary.setGestureCount(summary.getGestureCount() + 1);
        if (gestureType.equals("dead_tap")) {
            summary.setDeadTapCount(summary.getDeadTapCount() + 1);
        } else if (gestureType.contains("scroll") || gestureType.contains("swipe")) {
            summary.setScrollCount(summary.getScrollCount() + 1);
        }

        boolean tapLike = gestureType.equals("long_press") || gestureType.contains("tap");
        if (!tapLike) {
            return;
        }
        summary.setTouchCount(summary.getTouchCount() + 1);

        JsonNode touches = event.get("touches");
        if (touches != null && touches.isArray() && touches.size() > 0) {
            for (JsonNode touch : touches) {
                double x = number(touch, "x");
                double y = number(touch, "y");
                long time = (long) firstNonZero(number(touch, "timestamp"), number(event, "timestamp"));
                if (currentScreen == null || x <= 0 || y <= 0) {
                    continue;
                }
                String bucket = HeatmapGrid.bucketKey(x, y, screenWidth, screenHeight);
                EventStreamSummary.ScreenHeatmap heatmap = summary.heatmapFor(currentScreen);
                heatmap.addTouch(bucket);
                if (rageTaps.onTap(time, x, y)) {
                    summary.setRageTapCount(summary.getRageTapCount() + 1);
                    heatmap.addRageTap(bucket);
                }
            }
        } else {
            double x = number(event, "x");
            double y = number(event, "y");
            if (currentScreen != null && x > 0 && y > 0) {
                summary.heatmapFor(currentScreen).addTouch(HeatmapGrid.bucketKey(x, y, screenWidth, screenHeight));
            }
        }
    }

    private void handleApiCall(JsonNode event, EventStreamSummary summary) {
        summary.setApiTotalCount(summary.getApiTotalCount() + 1);

        JsonNode durationNode = event.get("duration");
        boolean hasDuration = durationNode != null && durationNode.isNumber();
        double duration = hasDuration ? durationNode.asDouble() : 0;
        if (hasDuration) {
            summary.setApiLatencySum(summary.getApiLatencySum() + duration);
            summary.setApiLatencySamples(summary.getApiLatencySamples() + 1);
        }

        JsonNode successNode = event.get("success");
        int statusCode = (int) number(event, "statusCode");
        boolean explicitSuccess = successNode != null && successNode.isBoolean() && successNode.asBoolean();
        boolean explicitFailure = successNode != null && successNode.isBoolean() && !successNode.asBoolean();
        boolean isError = explicitFailure || statusCode >= 400;

        if (explicitSuccess || (statusCode >= 200 && statusCode < 400)) {
            summary.setApiSuccessCount(summary.getApiSuccessCount() + 1);
        } else if (isError) {
            summary.setApiErrorCount(summary.getApiErrorCount() + 1);
        }

        String path = urlPath(orDefault(text(event, "url"), text(event, "endpoint")));
        if (path != null && !path.isEmpty()) {
            String method = orDefault(text(event, "method"), "GET").toUpperCase(Locale.ROOT);
            EventStreamSummary.EndpointStats stats = summary.getEndpointStats()
                    .computeIfAbsent(method + " " + path, k -> new EventStreamSummary.EndpointStats());
            stats.setCalls(stats.getCalls() + 1);
            if (isError) {
                stats.setErrors(stats.getErrors() + 1);
            }
            stats.setLatencySum(stats.getLatencySum() + duration);
        }
    }

    private void handleIdentityChange(JsonNode event, EventStreamSummary summary) {
        String userId = text(event, "userId");
        if (userId == null) {
            userId = text(event.get("details"), "userId");
        }
        if (userId == null || userId.isEmpty() || userId.equals("anonymous")) {
            return;
        }
        if (userId.startsWith("anon_")) {
            summary.setAnonymousDisplayId(userId);
        } else {
            summary.setUserDisplayId(userId);
        }
    }

    static String errorType(String errorName) {
        if (errorName.equals("UnhandledRejection")) {
            return "promise_rejection";
        }
        return errorName.contains("Exception") ? "unhandled_exception" : "js_error";
    }

    /**
     * Path of an absolute URL; anything else is returned as given.
     */
    static String urlPath(String url) {
        if (url == null || url.isEmpty()) {
            return url;
        }
        try {
            URI uri = new URI(url);
            if (uri.isAbsolute() && uri.getHost() != null) {
                String path = uri.getRawPath();
                return path == null || path.isEmpty() ? "/" : path;
            }
            return url;
        } catch (URISyntaxException e) {
            return url;
        }
    }

    private static String screenName(JsonNode event) {
        JsonNode payload = event.get("payload");
        String[] candidates = {
                text(event, "screen"),
                text(event, "screenName"),
                text(payload, "screenName"),
                text(payload, "name"),
                text(payload, "route")
        };
        for (String candidate : candidates) {
            if (candidate != null && !candidate.trim().isEmpty()) {
                return candidate.trim();
            }
        }
        return null;
    }

    static Long epochMillis(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            double value = node.asDouble();
            if (value == 0) {
                return null;
            }
            return Math.round(value > MILLIS_THRESHOLD ? value : value * 1000);
        }
        if (node.isTextual()) {
            try {
                return Instant.parse(node.asText()).toEpochMilli();
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }

    private static Instant timestamp(JsonNode node, Instant fallback) {
        if (node != null && node.isNumber() && node.asLong() != 0) {
            return Instant.ofEpochMilli(node.asLong());
        }
        if (node != null && node.isTextual()) {
            try {
                return Instant.parse(node.asText());
            } catch (DateTimeParseException e) {
                return fallback;
            }
        }
        return fallback;
    }

    private static double touchCoordinate(JsonNode event, String axis) {
        JsonNode touches = event.get("touches");
        if (touches == null || !touches.isArray() || touches.size() == 0) {
            return 0;
        }
        return number(touches.get(0), axis);
    }

    private static double positive(JsonNode node, String field, double fallback) {
        double value = number(node, field);
        return value > 0 ? value : fallback;
    }

    static double number(JsonNode node, String field) {
        if (node == null) {
            return 0;
        }
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asDouble() : 0;
    }

    static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private static double firstNonZero(double first, double second) {
        return first != 0 ? first : second;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}

package com.telemetry.domain.service.extract;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grouping keys for crashes, ANRs and errors.
 *
 * Stack-based keys keep up to three symbolic frames and ignore addresses, so
 * the same hang reported from different builds groups together.
 */
public final class Fingerprints {

    private static final Pattern CRASH_FRAME = Pattern.compile("\\[\\w+\\s+\\w+\\]|\\w+::\\w+|@objc\\s+\\w+|_\\$[\\w.]+");
    private static final Pattern ANR_FRAME = Pattern.compile("\\[\\w+\\s+\\w+[:\\w]*\\]|\\w+::\\w+[\\w:]*|@objc\\s+\\w+|_\\$s[\\w.]+");
    private static final int MAX_FRAMES = 3;

    private Fingerprints() {
    }

    /**
     * Row fingerprint: {@code sha256(projectId:name:message)}.
     */
    public static String occurrence(Object projectId, String name, String message) {
        return sha256(projectId + ":" + nullToEmpty(name) + ":" + nullToEmpty(message));
    }

    /**
     * Issue grouping key, {@code type:name:normalized}. Crash and ANR messages
     * are reduced to their first symbolic frames, error messages to a
     * lower-cased 100 character prefix with digits replaced by {@code N}.
     */
    public static String groupingKey(String type, String name, String message) {
        String normalized = nullToEmpty(message);
        if (type.equals("anr") || type.equals("crash")) {
            List<String> frames = frames(CRASH_FRAME, normalized);
            normalized = frames.isEmpty() ? type : String.join(":", frames);
        } else {
            normalized = normalized.substring(0, Math.min(100, normalized.length()))
                    .toLowerCase(Locale.ROOT)
                    .replaceAll("[0-9]+", "N");
        }
        return type + ":" + name + ":" + normalized;
    }

    public static String anrGroupingKey(String threadState) {
        if (threadState == null || threadState.isEmpty()) {
            return "anr:ANR:unknown";
        }
        List<String> frames = new ArrayList<>();
        for (String line : threadState.split("\n")) {
            if (line.contains("Thread Stack") || line.contains("PC:") || line.contains("LR:") || line.contains("SP:")) {
                continue;
            }
            Matcher matcher = ANR_FRAME.matcher(line);
            if (matcher.find()) {
                frames.add(matcher.group());
            }
            if (frames.size() == MAX_FRAMES) {
                break;
            }
        }
        return frames.isEmpty() ? "anr:ANR:main_thread_blocked" : "anr:ANR:" + String.join(":", frames);
    }

    public static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static List<String> frames(Pattern pattern, String text) {
        List<String> frames = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find() && frames.size() < MAX_FRAMES) {
            frames.add(matcher.group());
        }
        return frames;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}

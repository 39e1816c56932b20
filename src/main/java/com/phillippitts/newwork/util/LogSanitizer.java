package com.phillippitts.newwork.util;

/** Utility for log-safe rendering of text produced by the backend process. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Replaces control characters (ANSI escapes, carriage returns) with spaces and truncates,
     * so one child output line stays one log line.
     */
    public static String singleLine(String s, int max) {
        String truncated = truncate(s, max);
        StringBuilder sb = new StringBuilder(truncated.length());
        for (int i = 0; i < truncated.length(); i++) {
            char c = truncated.charAt(i);
            sb.append(Character.isISOControl(c) ? ' ' : c);
        }
        return sb.toString().strip();
    }
}

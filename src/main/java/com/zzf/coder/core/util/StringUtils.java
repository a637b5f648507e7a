package com.zzf.coder.core.util;

public final class StringUtils {
    private StringUtils() {}

    /** Cuts {@code s} to {@code maxChars} and appends a marker naming how much was dropped. */
    public static String truncate(String s, int maxChars) {
        if (s == null) {
            return "";
        }
        if (maxChars <= 0 || s.length() <= maxChars) {
            return s;
        }
        return s.substring(0, maxChars) + "\n... [truncated " + (s.length() - maxChars) + " chars]";
    }

    public static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}

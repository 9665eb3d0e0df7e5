package com.example.OfferScan.util;

public final class Texts {
    private Texts() {}

    public static final int SNIPPET_MAX_CHARS = 240;

    public static String snippet(String text) {
        if (text == null) return "";
        if (text.length() <= SNIPPET_MAX_CHARS) return text;
        return text.substring(0, SNIPPET_MAX_CHARS - 3) + "...";
    }

    public static String cut(String s, int n) {
        if (s == null) return "";
        return s.length() <= n ? s : s.substring(0, n) + "...";
    }

    public static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}

package com.phillippitts.speechmaker.util;

/** Utility for privacy-safe logging of user text. */
public final class LogSanitizer {

    private static final int DEFAULT_PREVIEW_CHARS = 24;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Short single-line description of user text: its length and a preview with line breaks
     * flattened, e.g. {@code [812 chars] "The quick brown fox jump..."}.
     */
    public static String preview(String text) {
        if (text == null) {
            return "[null]";
        }
        String flat = truncate(text, DEFAULT_PREVIEW_CHARS).replaceAll("\\s+", " ");
        String ellipsis = text.length() > DEFAULT_PREVIEW_CHARS ? "..." : "";
        return "[" + text.length() + " chars] \"" + flat + ellipsis + '"';
    }
}

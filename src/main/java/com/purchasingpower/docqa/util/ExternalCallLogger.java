package com.purchasingpower.docqa.util;

/**
 * Helpers for logging calls to external model providers without flooding the log.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    /**
     * Truncate large strings for logging (to avoid log spam)
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }

    /**
     * Shorten a passage for display: the first {@code maxLength} characters followed by "...".
     */
    public static String snippet(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }
}

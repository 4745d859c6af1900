package io.courier.util;

public final class Texts {
    private Texts() {
    }

    public static String truncate(String raw, int maxChars) {
        if (raw == null) {
            return null;
        }
        if (raw.length() <= maxChars) {
            return raw;
        }
        return raw.substring(0, Math.max(0, maxChars));
    }

    public static String preview(String raw, int maxChars) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= maxChars) {
            return normalized;
        }
        return normalized.substring(0, maxChars) + "...";
    }

    public static String describe(Throwable error) {
        if (error == null) {
            return "";
        }
        String message = error.getMessage();
        String type = error.getClass().getSimpleName();
        return message == null || message.isBlank() ? type : type + ": " + message;
    }
}

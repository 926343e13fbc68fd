package com.delta.research.pipeline.util;

public final class ErrorText {
    public static final int MAX_ERROR_LENGTH = 500;

    private ErrorText() {
    }

    public static String truncate(String error) {
        if (error == null) {
            return null;
        }
        String trimmed = error.trim();
        if (trimmed.length() <= MAX_ERROR_LENGTH) {
            return trimmed;
        }
        return trimmed.substring(0, MAX_ERROR_LENGTH);
    }

    public static String describe(Throwable error) {
        if (error == null) {
            return null;
        }
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return truncate(error.getClass().getSimpleName());
        }
        return truncate(error.getClass().getSimpleName() + ": " + message);
    }
}

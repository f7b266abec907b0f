package com.kmg.pageocr.service;

/**
 * Renders failures as {@code "<ExceptionType>: <message>"} for tallies, markers and error logs.
 */
public final class ExceptionClassifier {

    private ExceptionClassifier() {
    }

    public static String describe(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            Throwable cause = error.getCause();
            message = cause != null && cause.getMessage() != null ? cause.getMessage() : "(no message)";
        }
        return error.getClass().getSimpleName() + ": " + message;
    }
}

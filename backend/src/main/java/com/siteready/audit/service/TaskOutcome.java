package com.siteready.audit.service;

public record TaskOutcome<T>(T value, String error) {

    public static <T> TaskOutcome<T> success(T value) {
        return new TaskOutcome<>(value, null);
    }

    public static <T> TaskOutcome<T> failure(Throwable error) {
        String message = error.getMessage();
        return new TaskOutcome<>(null, message == null || message.isBlank() ? error.getClass().getSimpleName() : message);
    }

    public boolean isSuccess() {
        return error == null;
    }
}

package com.tradescan.backend.service.governor;

/**
 * Settled result of one task in a batch: either a value or the failure that rejected it.
 */
public record BatchOutcome<T>(T value, Throwable error) {

    public static <T> BatchOutcome<T> success(T value) {
        return new BatchOutcome<>(value, null);
    }

    public static <T> BatchOutcome<T> failure(Throwable error) {
        return new BatchOutcome<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}

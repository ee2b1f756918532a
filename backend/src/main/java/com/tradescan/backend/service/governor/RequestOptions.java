package com.tradescan.backend.service.governor;

import java.time.Duration;

/**
 * Per-call governor options. A null timeout falls back to the configured default.
 */
public record RequestOptions(RequestPriority priority, Duration timeout) {

    public static RequestOptions normal() {
        return new RequestOptions(RequestPriority.NORMAL, null);
    }

    public static RequestOptions high() {
        return new RequestOptions(RequestPriority.HIGH, null);
    }

    public RequestOptions withTimeout(Duration value) {
        return new RequestOptions(priority, value);
    }
}

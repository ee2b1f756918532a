package com.tradescan.backend.exception;

import com.tradescan.backend.model.Provider;
import lombok.Getter;

import java.time.Duration;

/**
 * A governed request waited in its provider queue longer than its timeout and was dropped unrun.
 */
@Getter
public class RequestTimeoutException extends RuntimeException {

    private final Provider provider;
    private final Duration waited;

    public RequestTimeoutException(Provider provider, Duration waited) {
        super("Request timeout: " + provider.getKey() + " request waited " + waited.toMillis() + "ms in queue");
        this.provider = provider;
        this.waited = waited;
    }
}

package com.tradescan.backend.exception;

import com.tradescan.backend.model.Provider;
import lombok.Getter;

@Getter
public class ProviderCallException extends RuntimeException {

    private final Provider provider;
    private final Integer statusCode;
    private final boolean retryable;

    public ProviderCallException(Provider provider, String message, Integer statusCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public ProviderCallException(Provider provider, String message, Throwable cause) {
        this(provider, message, null, false, cause);
    }

    public static ProviderCallException transientFailure(Provider provider, String message, Integer statusCode, Throwable cause) {
        return new ProviderCallException(provider, message, statusCode, true, cause);
    }
}

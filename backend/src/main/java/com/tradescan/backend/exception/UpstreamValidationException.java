package com.tradescan.backend.exception;

import com.tradescan.backend.model.Provider;
import lombok.Getter;

/**
 * Provider answered, but the body could not be interpreted.
 */
@Getter
public class UpstreamValidationException extends RuntimeException {

    private final Provider provider;

    public UpstreamValidationException(Provider provider, String message) {
        super(message);
        this.provider = provider;
    }

    public UpstreamValidationException(Provider provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }
}

package com.tradescan.backend.exception;

import lombok.Getter;

@Getter
public class BrokerRejectionException extends RuntimeException {

    private final Integer statusCode;
    private final String reason;

    public BrokerRejectionException(String reason, Integer statusCode) {
        super("Broker rejected order: " + reason);
        this.reason = reason;
        this.statusCode = statusCode;
    }
}

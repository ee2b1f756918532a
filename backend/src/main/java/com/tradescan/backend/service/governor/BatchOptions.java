package com.tradescan.backend.service.governor;

import java.time.Duration;

public record BatchOptions(int batchSize, Duration delayBetweenBatches, RequestOptions requestOptions) {

    public BatchOptions {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        if (delayBetweenBatches == null) {
            delayBetweenBatches = Duration.ZERO;
        }
        if (requestOptions == null) {
            requestOptions = RequestOptions.normal();
        }
    }

    public static BatchOptions of(int batchSize, Duration delayBetweenBatches) {
        return new BatchOptions(batchSize, delayBetweenBatches, RequestOptions.normal());
    }
}

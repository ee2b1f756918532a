package com.tradescan.backend.service.governor;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

final class PendingRequest<T> {

    private final Callable<T> task;
    private final CompletableFuture<T> future = new CompletableFuture<>();
    private final RequestPriority priority;
    private final Instant enqueuedAt;
    private final Instant deadline;

    PendingRequest(Callable<T> task, RequestPriority priority, Instant enqueuedAt, Duration timeout) {
        this.task = task;
        this.priority = priority;
        this.enqueuedAt = enqueuedAt;
        this.deadline = enqueuedAt.plus(timeout);
    }

    CompletableFuture<T> future() {
        return future;
    }

    RequestPriority priority() {
        return priority;
    }

    Instant enqueuedAt() {
        return enqueuedAt;
    }

    Instant deadline() {
        return deadline;
    }

    boolean isExpired(Instant now) {
        return !now.isBefore(deadline);
    }

    void run() {
        if (future.isDone()) {
            return;
        }
        try {
            future.complete(task.call());
        } catch (Exception e) {
            future.completeExceptionally(e);
        }
    }

    void fail(Throwable error) {
        future.completeExceptionally(error);
    }
}

package com.tradescan.backend.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Pacing pauses for the request governor and batch sweeps. Tests substitute an implementation that advances a clock.
 */
@Service
@Slf4j
public class AsyncDelayService {

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "pacing-delay");
        thread.setDaemon(true);
        return thread;
    });

    public void await(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        scheduler.schedule(() -> future.complete(null), duration.toMillis(), TimeUnit.MILLISECONDS);
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Pacing delay of {}ms interrupted", duration.toMillis());
        } catch (ExecutionException e) {
            throw new IllegalStateException("Pacing delay failed", e.getCause());
        }
    }
}

package com.tradescan.backend.service.governor;

import com.tradescan.backend.exception.ProviderCallException;
import com.tradescan.backend.exception.RequestTimeoutException;
import com.tradescan.backend.model.Provider;
import com.tradescan.backend.service.AsyncDelayService;
import com.tradescan.backend.service.MetricsService;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Admits outbound provider calls so that no provider ever sees more than its per-minute and per-day quota.
 * <p>
 * A call is dispatched at once when its provider has spare quota and nothing is already waiting. Otherwise it joins
 * the provider queue (high priority calls in a lane served first, FIFO within each lane) and a single drain loop per
 * provider dispatches queued calls one at a time, pausing {@code dispatchDelay} between them. Windows are sliding and
 * evaluated against the clock on every admission, so nothing needs to be scheduled to reset them. Calls that sit in
 * the queue past their timeout fail with {@link RequestTimeoutException} without running.
 */
@Slf4j
public class RequestGovernor {

    // Upper bound on a single wait so newly expired requests are noticed.
    private static final long MAX_WAIT_SLICE_MS = 60_000;

    private final Clock clock;
    private final AsyncDelayService delayService;
    private final Executor dispatchExecutor;
    private final Executor drainExecutor;
    private final Duration dispatchDelay;
    private final Duration defaultTimeout;
    private final MetricsService metricsService;
    private final Map<Provider, ProviderQuotaState> states = new EnumMap<>(Provider.class);

    public RequestGovernor(Clock clock,
                           AsyncDelayService delayService,
                           Executor dispatchExecutor,
                           Executor drainExecutor,
                           Map<Provider, QuotaLimits> initialLimits,
                           Duration dispatchDelay,
                           Duration defaultTimeout,
                           MetricsService metricsService) {
        this.clock = clock;
        this.delayService = delayService;
        this.dispatchExecutor = dispatchExecutor;
        this.drainExecutor = drainExecutor;
        this.dispatchDelay = dispatchDelay;
        this.defaultTimeout = defaultTimeout;
        this.metricsService = metricsService;
        for (Provider provider : Provider.values()) {
            QuotaLimits limits = initialLimits.get(provider);
            if (limits == null) {
                throw new IllegalArgumentException("No quota configured for provider " + provider);
            }
            ProviderQuotaState state = new ProviderQuotaState(provider, limits);
            states.put(provider, state);
            if (metricsService != null) {
                metricsService.registerQueueDepth(provider, () -> queuedCount(state));
            }
        }
    }

    /**
     * Runs {@code task} under the provider's quota and blocks for its result.
     *
     * @throws RequestTimeoutException when the call expired in the queue
     */
    public <T> T execute(Provider provider, Callable<T> task, RequestOptions options) {
        try {
            return submit(provider, task, options).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderCallException(provider, "Interrupted while waiting for " + provider.getKey(), e);
        } catch (ExecutionException e) {
            throw unwrap(provider, e.getCause());
        }
    }

    public <T> T execute(Provider provider, Callable<T> task) {
        return execute(provider, task, RequestOptions.normal());
    }

    public <T> CompletableFuture<T> submit(Provider provider, Callable<T> task, RequestOptions options) {
        RequestOptions effective = options == null ? RequestOptions.normal() : options;
        Duration timeout = effective.timeout() == null ? defaultTimeout : effective.timeout();
        RequestPriority priority = effective.priority() == null ? RequestPriority.NORMAL : effective.priority();
        ProviderQuotaState state = states.get(provider);

        boolean runNow = false;
        boolean startDrain = false;
        PendingRequest<T> request;
        synchronized (state) {
            Instant now = clock.instant();
            request = new PendingRequest<>(task, priority, now, timeout);
            if (!state.isDraining() && !state.hasQueued() && state.millisUntilCapacity(now) == 0) {
                state.recordDispatch(now);
                runNow = true;
            } else {
                state.enqueue(request);
                if (!state.isDraining()) {
                    state.setDraining(true);
                    startDrain = true;
                }
            }
        }

        if (runNow) {
            dispatch(provider, request);
        } else {
            log.debug("Queued {} request priority={} queued={}", provider.getKey(), priority, queuedCount(state));
            record(provider, "queued");
            if (startDrain) {
                startDrain(state);
            }
        }
        return request.future();
    }

    /**
     * Runs the tasks in groups of {@code batchSize}, waiting for each group to settle and pausing between groups.
     * Results come back in input order; a failed task never fails the batch.
     */
    public <T> List<BatchOutcome<T>> batch(Provider provider, List<? extends Callable<T>> tasks, BatchOptions options) {
        List<BatchOutcome<T>> outcomes = new ArrayList<>(tasks.size());
        for (int start = 0; start < tasks.size(); start += options.batchSize()) {
            int end = Math.min(start + options.batchSize(), tasks.size());
            List<CompletableFuture<T>> group = new ArrayList<>(end - start);
            for (Callable<T> task : tasks.subList(start, end)) {
                group.add(submit(provider, task, options.requestOptions()));
            }
            for (CompletableFuture<T> future : group) {
                outcomes.add(settle(future));
            }
            if (end < tasks.size()) {
                delayService.await(options.delayBetweenBatches());
            }
        }
        return outcomes;
    }

    /**
     * Non-blocking probe: would a call to {@code provider} be dispatched immediately right now?
     */
    public boolean canExecute(Provider provider) {
        ProviderQuotaState state = states.get(provider);
        synchronized (state) {
            return !state.isDraining() && !state.hasQueued() && state.millisUntilCapacity(clock.instant()) == 0;
        }
    }

    public Map<Provider, RateLimitStatus> status() {
        Map<Provider, RateLimitStatus> snapshot = new LinkedHashMap<>();
        Instant now = clock.instant();
        for (Map.Entry<Provider, ProviderQuotaState> entry : states.entrySet()) {
            synchronized (entry.getValue()) {
                snapshot.put(entry.getKey(), entry.getValue().status(now));
            }
        }
        return Collections.unmodifiableMap(snapshot);
    }

    public QuotaLimits limits(Provider provider) {
        ProviderQuotaState state = states.get(provider);
        synchronized (state) {
            return state.limits();
        }
    }

    /**
     * Swaps the provider's limits. Queued calls and usage already counted in the current windows are kept.
     */
    public void updateLimits(Provider provider, QuotaLimits limits) {
        ProviderQuotaState state = states.get(provider);
        synchronized (state) {
            state.updateLimits(limits);
        }
        log.info("Rate limits for {} set to {}/min, {}/day", provider.getKey(), limits.maxPerMinute(),
                limits.maxPerDay() == null ? "unlimited" : limits.maxPerDay());
    }

    private void drain(ProviderQuotaState state) {
        Provider provider = state.provider();
        while (true) {
            PendingRequest<?> next = null;
            List<PendingRequest<?>> expired;
            long waitMillis = 0;
            boolean idle = false;
            synchronized (state) {
                Instant now = clock.instant();
                expired = state.removeExpired(now);
                if (!state.hasQueued()) {
                    state.setDraining(false);
                    idle = true;
                } else {
                    waitMillis = state.millisUntilCapacity(now);
                    if (waitMillis == 0) {
                        next = state.poll();
                        state.recordDispatch(now);
                    } else {
                        waitMillis = Math.max(1, Math.min(Math.min(waitMillis, state.millisUntilNextExpiry(now)),
                                MAX_WAIT_SLICE_MS));
                    }
                }
            }
            Instant now = clock.instant();
            for (PendingRequest<?> request : expired) {
                record(provider, "timeout");
                request.fail(new RequestTimeoutException(provider, Duration.between(request.enqueuedAt(), now)));
            }
            if (idle) {
                return;
            }
            if (next == null) {
                log.debug("{} over quota, waiting {}ms", provider.getKey(), waitMillis);
                delayService.await(Duration.ofMillis(waitMillis));
                continue;
            }
            record(provider, "dispatched");
            next.run();
            delayService.await(dispatchDelay);
        }
    }

    private void startDrain(ProviderQuotaState state) {
        try {
            drainExecutor.execute(() -> {
                try {
                    drain(state);
                } catch (RuntimeException | Error e) {
                    log.error("Drain loop for {} failed", state.provider().getKey(), e);
                    restartAfterFailure(state);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Could not start drain loop for {}", state.provider().getKey(), e);
            List<PendingRequest<?>> abandoned = new ArrayList<>();
            synchronized (state) {
                PendingRequest<?> request;
                while ((request = state.poll()) != null) {
                    abandoned.add(request);
                }
                state.setDraining(false);
            }
            abandoned.forEach(request -> request.fail(
                    new ProviderCallException(state.provider(), "Governor drain loop unavailable", e)));
        }
    }

    private void restartAfterFailure(ProviderQuotaState state) {
        boolean restart;
        synchronized (state) {
            restart = state.hasQueued();
            state.setDraining(restart);
        }
        if (restart) {
            startDrain(state);
        }
    }

    private <T> void dispatch(Provider provider, PendingRequest<T> request) {
        record(provider, "dispatched");
        try {
            dispatchExecutor.execute(request::run);
        } catch (RejectedExecutionException e) {
            request.fail(new ProviderCallException(provider, "Governor dispatch pool saturated", e));
        }
    }

    private int queuedCount(ProviderQuotaState state) {
        synchronized (state) {
            return state.queued();
        }
    }

    private void record(Provider provider, String outcome) {
        if (metricsService != null) {
            metricsService.recordGovernedRequest(provider, outcome);
        }
    }

    private static <T> BatchOutcome<T> settle(CompletableFuture<T> future) {
        try {
            return BatchOutcome.success(future.join());
        } catch (CompletionException e) {
            return BatchOutcome.failure(e.getCause() != null ? e.getCause() : e);
        } catch (RuntimeException e) {
            return BatchOutcome.failure(e);
        }
    }

    private static RuntimeException unwrap(Provider provider, Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new ProviderCallException(provider, provider.getKey() + " call failed: " + cause.getMessage(), cause);
    }
}

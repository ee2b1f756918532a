package com.tradescan.backend.service.governor;

import com.tradescan.backend.exception.RequestTimeoutException;
import com.tradescan.backend.model.Provider;
import com.tradescan.backend.service.MetricsService;
import com.tradescan.backend.support.ClockAdvancingDelayService;
import com.tradescan.backend.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestGovernorTest {

    private static final Instant START = Instant.parse("2026-10-19T14:00:30Z");

    private MutableClock clock;
    private ClockAdvancingDelayService delayService;
    private SimpleMeterRegistry meterRegistry;
    private final List<Runnable> pendingDrains = new ArrayList<>();
    private final List<String> executionOrder = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        delayService = new ClockAdvancingDelayService(clock);
        meterRegistry = new SimpleMeterRegistry();
        pendingDrains.clear();
        executionOrder.clear();
    }

    @Test
    void callsBeyondPerMinuteQuotaWaitForTheWindowToSlide() {
        RequestGovernor governor = governor(new QuotaLimits(5, null), Duration.ofMinutes(5));
        List<CompletableFuture<Instant>> futures = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            futures.add(governor.submit(Provider.ALPACA, clock::instant, RequestOptions.normal()));
        }

        assertThat(futures.subList(0, 5)).allMatch(CompletableFuture::isDone);
        assertThat(futures.subList(5, 10)).noneMatch(CompletableFuture::isDone);
        assertThat(governor.status().get(Provider.ALPACA).queued()).isEqualTo(5);
        assertThat(governor.canExecute(Provider.ALPACA)).isFalse();

        runDrains();

        assertThat(futures.subList(0, 5)).allMatch(future -> future.join().equals(START));
        assertThat(futures.subList(5, 10))
                .allMatch(future -> !future.join().isBefore(START.plus(Duration.ofMinutes(1))));
        assertThat(governor.status().get(Provider.ALPACA).usedThisMinute()).isEqualTo(5);
        assertThat(meterRegistry.counter("governor_requests_total", "provider", "alpaca", "outcome", "queued").count())
                .isEqualTo(5.0);
    }

    @Test
    void highPriorityCallsLeaveTheQueueFirst() {
        RequestGovernor governor = governor(new QuotaLimits(1, null), Duration.ofMinutes(10));
        governor.submit(Provider.ALPACA, record("first"), RequestOptions.normal());
        governor.submit(Provider.ALPACA, record("normal-1"), RequestOptions.normal());
        governor.submit(Provider.ALPACA, record("normal-2"), RequestOptions.normal());
        governor.submit(Provider.ALPACA, record("high"), RequestOptions.high());

        runDrains();

        assertThat(executionOrder).containsExactly("first", "high", "normal-1", "normal-2");
    }

    @Test
    void queuedCallPastItsTimeoutFailsWithoutRunning() {
        RequestGovernor governor = governor(new QuotaLimits(1, null), Duration.ofMinutes(5));
        governor.submit(Provider.ALPACA, record("first"), RequestOptions.normal());
        CompletableFuture<String> late = governor.submit(Provider.ALPACA, record("late"),
                RequestOptions.normal().withTimeout(Duration.ofSeconds(10)));

        runDrains();

        assertThat(late).isCompletedExceptionally();
        assertThatThrownBy(late::join).hasCauseInstanceOf(RequestTimeoutException.class);
        assertThat(executionOrder).containsExactly("first");
        assertThat(governor.status().get(Provider.ALPACA).queued()).isZero();
    }

    @Test
    void dailyQuotaHoldsCallsUntilTheDayWindowMoves() {
        RequestGovernor governor = governor(new QuotaLimits(10, 3), Duration.ofDays(3));
        for (int i = 0; i < 3; i++) {
            governor.submit(Provider.ALPACA, clock::instant, RequestOptions.normal());
        }
        CompletableFuture<Instant> fourth = governor.submit(Provider.ALPACA, clock::instant, RequestOptions.normal());

        RateLimitStatus status = governor.status().get(Provider.ALPACA);
        assertThat(status.usedToday()).isEqualTo(3);
        assertThat(status.maxPerDay()).isEqualTo(3);
        assertThat(fourth).isNotDone();

        runDrains();

        assertThat(fourth.join()).isAfterOrEqualTo(START.plus(Duration.ofDays(1)));
    }

    @Test
    void batchSettlesEveryTaskInInputOrderAndPausesBetweenGroups() {
        RequestGovernor governor = governor(new QuotaLimits(100, null), Duration.ofMinutes(1));
        List<Callable<String>> tasks = List.of(
                () -> "a",
                () -> {
                    throw new IllegalStateException("boom");
                },
                () -> "c");

        List<BatchOutcome<String>> outcomes = governor.batch(Provider.ALPACA, tasks,
                BatchOptions.of(2, Duration.ofSeconds(5)));

        assertThat(outcomes).hasSize(3);
        assertThat(outcomes.get(0).value()).isEqualTo("a");
        assertThat(outcomes.get(1).isSuccess()).isFalse();
        assertThat(outcomes.get(1).error()).isInstanceOf(IllegalStateException.class).hasMessage("boom");
        assertThat(outcomes.get(2).value()).isEqualTo("c");
        assertThat(delayService.waits()).containsExactly(Duration.ofSeconds(5));
    }

    @Test
    void raisedLimitsApplyToCallsAlreadyQueued() {
        RequestGovernor governor = governor(new QuotaLimits(1, null), Duration.ofMinutes(5));
        governor.submit(Provider.ALPACA, clock::instant, RequestOptions.normal());
        CompletableFuture<Instant> queued = governor.submit(Provider.ALPACA, clock::instant, RequestOptions.normal());

        governor.updateLimits(Provider.ALPACA, new QuotaLimits(2, null));
        runDrains();

        assertThat(queued.join()).isEqualTo(START);
        assertThat(governor.limits(Provider.ALPACA).maxPerMinute()).isEqualTo(2);
    }

    @Test
    void providersAreGovernedIndependently() {
        RequestGovernor governor = governor(new QuotaLimits(1, null), Duration.ofMinutes(5));
        governor.submit(Provider.ALPACA, record("alpaca"), RequestOptions.normal());

        assertThat(governor.canExecute(Provider.ALPACA)).isFalse();
        assertThat(governor.canExecute(Provider.ALPHA_VANTAGE)).isTrue();
        assertThat(governor.execute(Provider.ALPHA_VANTAGE, () -> "fundamentals")).isEqualTo("fundamentals");
    }

    private RequestGovernor governor(QuotaLimits limits, Duration defaultTimeout) {
        Map<Provider, QuotaLimits> quotas = new EnumMap<>(Provider.class);
        for (Provider provider : Provider.values()) {
            quotas.put(provider, limits);
        }
        Executor direct = Runnable::run;
        Executor deferred = pendingDrains::add;
        return new RequestGovernor(clock, delayService, direct, deferred, quotas, Duration.ZERO, defaultTimeout,
                new MetricsService(meterRegistry));
    }

    private Callable<String> record(String name) {
        return () -> {
            executionOrder.add(name);
            return name;
        };
    }

    private void runDrains() {
        while (!pendingDrains.isEmpty()) {
            pendingDrains.remove(0).run();
        }
    }
}

package com.tradescan.backend.service.governor;

import com.tradescan.backend.model.Provider;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Quota windows and queues of one provider. Every method must be called while holding this object's monitor.
 */
final class ProviderQuotaState {

    private static final Duration MINUTE = Duration.ofMinutes(1);
    // Day usage is counted in minute buckets; a bucket leaves the window a minute late, never early.
    private static final long DAY_BUCKETS = 24 * 60 + 1;

    private final Provider provider;
    private QuotaLimits limits;
    private final ArrayDeque<Instant> minuteLog = new ArrayDeque<>();
    private final ArrayDeque<long[]> dayBuckets = new ArrayDeque<>();
    private long dayCount;
    private final ArrayDeque<PendingRequest<?>> highLane = new ArrayDeque<>();
    private final ArrayDeque<PendingRequest<?>> normalLane = new ArrayDeque<>();
    private boolean draining;

    ProviderQuotaState(Provider provider, QuotaLimits limits) {
        this.provider = provider;
        this.limits = limits;
    }

    Provider provider() {
        return provider;
    }

    QuotaLimits limits() {
        return limits;
    }

    void updateLimits(QuotaLimits limits) {
        this.limits = limits;
    }

    boolean isDraining() {
        return draining;
    }

    void setDraining(boolean draining) {
        this.draining = draining;
    }

    boolean hasQueued() {
        return !highLane.isEmpty() || !normalLane.isEmpty();
    }

    int queued() {
        return highLane.size() + normalLane.size();
    }

    void enqueue(PendingRequest<?> request) {
        if (request.priority() == RequestPriority.HIGH) {
            highLane.addLast(request);
        } else {
            normalLane.addLast(request);
        }
    }

    PendingRequest<?> poll() {
        PendingRequest<?> next = highLane.pollFirst();
        return next != null ? next : normalLane.pollFirst();
    }

    void recordDispatch(Instant now) {
        minuteLog.addLast(now);
        long minute = epochMinute(now);
        long[] last = dayBuckets.peekLast();
        if (last != null && last[0] == minute) {
            last[1]++;
        } else {
            dayBuckets.addLast(new long[]{minute, 1});
        }
        dayCount++;
    }

    /**
     * @return 0 when a call may be dispatched now, otherwise how long until a slot frees up
     */
    long millisUntilCapacity(Instant now) {
        prune(now);
        long wait = 0;
        int minuteOverflow = minuteLog.size() - limits.maxPerMinute() + 1;
        if (minuteOverflow > 0) {
            Iterator<Instant> iterator = minuteLog.iterator();
            Instant releasing = iterator.next();
            for (int i = 1; i < minuteOverflow; i++) {
                releasing = iterator.next();
            }
            wait = Math.max(wait, millisUntil(now, releasing.plus(MINUTE)));
        }
        if (limits.maxPerDay() != null) {
            long dayOverflow = dayCount - limits.maxPerDay() + 1;
            if (dayOverflow > 0) {
                long released = 0;
                for (long[] bucket : dayBuckets) {
                    released += bucket[1];
                    if (released >= dayOverflow) {
                        wait = Math.max(wait, millisUntil(now, bucketExpiry(bucket)));
                        break;
                    }
                }
            }
        }
        return wait;
    }

    List<PendingRequest<?>> removeExpired(Instant now) {
        List<PendingRequest<?>> expired = new ArrayList<>();
        removeExpired(highLane, now, expired);
        removeExpired(normalLane, now, expired);
        return expired;
    }

    long millisUntilNextExpiry(Instant now) {
        long min = Long.MAX_VALUE;
        for (PendingRequest<?> request : highLane) {
            min = Math.min(min, millisUntil(now, request.deadline()));
        }
        for (PendingRequest<?> request : normalLane) {
            min = Math.min(min, millisUntil(now, request.deadline()));
        }
        return min;
    }

    RateLimitStatus status(Instant now) {
        prune(now);
        long minuteReset = minuteLog.isEmpty() ? 0 : millisUntil(now, minuteLog.peekFirst().plus(MINUTE));
        long dayReset = dayBuckets.isEmpty() ? 0 : millisUntil(now, bucketExpiry(dayBuckets.peekFirst()));
        return new RateLimitStatus(minuteLog.size(), limits.maxPerMinute(), dayCount, limits.maxPerDay(),
                queued(), minuteReset, dayReset);
    }

    private void prune(Instant now) {
        while (!minuteLog.isEmpty() && !now.isBefore(minuteLog.peekFirst().plus(MINUTE))) {
            minuteLog.pollFirst();
        }
        long currentMinute = epochMinute(now);
        while (!dayBuckets.isEmpty() && dayBuckets.peekFirst()[0] + DAY_BUCKETS <= currentMinute) {
            dayCount -= dayBuckets.pollFirst()[1];
        }
    }

    private static void removeExpired(ArrayDeque<PendingRequest<?>> lane, Instant now, List<PendingRequest<?>> sink) {
        Iterator<PendingRequest<?>> iterator = lane.iterator();
        while (iterator.hasNext()) {
            PendingRequest<?> request = iterator.next();
            if (request.isExpired(now)) {
                iterator.remove();
                sink.add(request);
            }
        }
    }

    private static Instant bucketExpiry(long[] bucket) {
        return Instant.ofEpochSecond((bucket[0] + DAY_BUCKETS) * 60);
    }

    private static long epochMinute(Instant instant) {
        return Math.floorDiv(instant.getEpochSecond(), 60);
    }

    private static long millisUntil(Instant now, Instant target) {
        long nanos = Duration.between(now, target).toNanos();
        if (nanos <= 0) {
            return 0;
        }
        return (nanos + 999_999) / 1_000_000;
    }
}

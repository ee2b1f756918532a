package com.tradescan.backend.support;

import com.tradescan.backend.service.AsyncDelayService;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Pacing delay that moves a {@link MutableClock} forward instead of sleeping.
 */
public class ClockAdvancingDelayService extends AsyncDelayService {

    private final MutableClock clock;
    private final List<Duration> waits = new ArrayList<>();

    public ClockAdvancingDelayService(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public void await(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        synchronized (waits) {
            waits.add(duration);
        }
        clock.advance(duration);
    }

    public List<Duration> waits() {
        synchronized (waits) {
            return List.copyOf(waits);
        }
    }
}

package com.tradescan.backend.service;

import com.tradescan.backend.model.CloseReason;
import com.tradescan.backend.model.Provider;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    public void recordGovernedRequest(Provider provider, String outcome) {
        meterRegistry.counter("governor_requests_total", "provider", provider.getKey(), "outcome", outcome).increment();
    }

    public void registerQueueDepth(Provider provider, Supplier<Number> depth) {
        Gauge.builder("governor_queue_depth", depth, value -> value.get().doubleValue())
                .tag("provider", provider.getKey())
                .register(meterRegistry);
    }

    public void recordProviderLatency(Provider provider, String method, boolean success, Duration elapsed) {
        Timer.builder("provider_call_latency")
                .tag("provider", provider.getKey())
                .tag("method", method)
                .tag("status", success ? "success" : "error")
                .register(meterRegistry)
                .record(elapsed);
    }

    public void recordScanRun(String status) {
        meterRegistry.counter("scan_runs_total", "status", status).increment();
    }

    public void recordOrderSubmitted() {
        meterRegistry.counter("orders_submitted_total").increment();
    }

    public void recordOrderRejected(String reason) {
        meterRegistry.counter("orders_rejected_total", "reason", reason).increment();
    }

    public void recordPositionClosed(CloseReason reason) {
        meterRegistry.counter("positions_closed_total", "reason", reason.wireValue()).increment();
    }

    public void recordMonitorCycle() {
        meterRegistry.counter("monitor_cycles_total").increment();
    }
}

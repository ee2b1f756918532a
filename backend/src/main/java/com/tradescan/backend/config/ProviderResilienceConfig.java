package com.tradescan.backend.config;

import com.tradescan.backend.exception.ProviderCallException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ProviderResilienceConfig {

    @Bean
    public CircuitBreakerRegistry providerCircuitBreakers(
            @Value("${tradescan.resilience.circuit.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${tradescan.resilience.circuit.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${tradescan.resilience.circuit.sliding-window-size:20}") int slidingWindowSize
    ) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                .recordException(ex -> ex instanceof ProviderCallException pce && pce.isRetryable())
                .build();
        return CircuitBreakerRegistry.of(config);
    }

    /**
     * Retries wrap governed calls, so every attempt is admitted against the provider quota.
     */
    @Bean
    public RetryRegistry providerRetries(
            @Value("${tradescan.resilience.retry.max-attempts:3}") int maxAttempts,
            @Value("${tradescan.resilience.retry.base-delay-ms:500}") long baseDelayMs,
            @Value("${tradescan.resilience.retry.jitter-factor:0.2}") double jitterFactor
    ) {
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(baseDelayMs),
                2.0,
                jitterFactor
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction)
                .retryOnException(ex -> ex instanceof ProviderCallException pce && pce.isRetryable())
                .build();
        return RetryRegistry.of(config);
    }
}

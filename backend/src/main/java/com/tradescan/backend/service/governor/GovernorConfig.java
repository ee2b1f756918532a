package com.tradescan.backend.service.governor;

import com.tradescan.backend.config.RateLimitProperties;
import com.tradescan.backend.model.Provider;
import com.tradescan.backend.service.AppSettingsService;
import com.tradescan.backend.service.AsyncDelayService;
import com.tradescan.backend.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Executor;

@Slf4j
@Configuration
public class GovernorConfig {

    /**
     * Quotas come from {@code tradescan.rate-limit}, overridden by any persisted {@code *_rate_limit_*} settings.
     */
    @Bean
    public RequestGovernor requestGovernor(Clock clock,
                                           AsyncDelayService asyncDelayService,
                                           @Qualifier("governorDispatchExecutor") Executor dispatchExecutor,
                                           @Qualifier("governorDrainExecutor") Executor drainExecutor,
                                           RateLimitProperties properties,
                                           AppSettingsService appSettingsService,
                                           MetricsService metricsService) {
        Map<Provider, QuotaLimits> limits = new EnumMap<>(Provider.class);
        for (Provider provider : Provider.values()) {
            limits.put(provider, RateLimitSettingsService.resolveLimits(provider, properties, appSettingsService));
            log.info("Governor quota {}: {}", provider.getKey(), limits.get(provider));
        }
        return new RequestGovernor(
                clock,
                asyncDelayService,
                dispatchExecutor,
                drainExecutor,
                limits,
                Duration.ofMillis(properties.getDispatchDelayMs()),
                Duration.ofMillis(properties.getDefaultTimeoutMs()),
                metricsService
        );
    }
}

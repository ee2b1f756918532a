package com.tradescan.backend.config;

import com.tradescan.backend.model.Provider;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.EnumMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "tradescan.rate-limit")
@Validated
@Data
public class RateLimitProperties {

    private Map<Provider, Quota> providers = defaults();

    @Min(0)
    private long dispatchDelayMs = 100;

    @Min(1)
    private long defaultTimeoutMs = 30_000;

    @Min(1)
    private int batchSize = 10;

    @Min(0)
    private long delayBetweenBatchesMs = 1_000;

    public Quota quotaFor(Provider provider) {
        Quota quota = providers.get(provider);
        return quota != null ? quota : defaults().get(provider);
    }

    private static Map<Provider, Quota> defaults() {
        Map<Provider, Quota> quotas = new EnumMap<>(Provider.class);
        quotas.put(Provider.ALPACA, new Quota(10_000, null));
        quotas.put(Provider.ALPHA_VANTAGE, new Quota(5, 25));
        return quotas;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Quota {
        private int maxPerMinute;
        private Integer maxPerDay;
    }
}

package com.tradescan.backend.service.governor;

import com.tradescan.backend.config.RateLimitProperties;
import com.tradescan.backend.dto.RateLimitUpdateRequest;
import com.tradescan.backend.exception.BadRequestException;
import com.tradescan.backend.model.Provider;
import com.tradescan.backend.service.AppSettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Reads and persists provider quotas and pushes changes into the live governor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimitSettingsService {

    private static final String NO_LIMIT = "null";

    private final RequestGovernor requestGovernor;
    private final AppSettingsService appSettingsService;

    public Map<Provider, RateLimitStatus> status() {
        return requestGovernor.status();
    }

    public QuotaLimits update(Provider provider, RateLimitUpdateRequest request) {
        QuotaLimits current = requestGovernor.limits(provider);
        int perMinute = request.getMaxPerMinute() != null ? request.getMaxPerMinute() : current.maxPerMinute();
        Integer perDay = current.maxPerDay();
        if (Boolean.TRUE.equals(request.getUnlimitedDaily())) {
            perDay = null;
        } else if (request.getMaxPerDay() != null) {
            perDay = request.getMaxPerDay();
        }
        QuotaLimits updated;
        try {
            updated = new QuotaLimits(perMinute, perDay);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(e.getMessage());
        }
        appSettingsService.put(provider.perMinuteSettingKey(), String.valueOf(updated.maxPerMinute()));
        appSettingsService.put(provider.perDaySettingKey(),
                updated.maxPerDay() == null ? NO_LIMIT : String.valueOf(updated.maxPerDay()));
        requestGovernor.updateLimits(provider, updated);
        return updated;
    }

    static QuotaLimits resolveLimits(Provider provider, RateLimitProperties properties, AppSettingsService settings) {
        RateLimitProperties.Quota defaults = properties.quotaFor(provider);
        int perMinute = settings.getInt(provider.perMinuteSettingKey())
                .filter(value -> value > 0)
                .orElse(defaults.getMaxPerMinute());
        Integer perDay = defaults.getMaxPerDay();
        String storedPerDay = settings.get(provider.perDaySettingKey()).orElse(null);
        if (storedPerDay != null) {
            perDay = NO_LIMIT.equalsIgnoreCase(storedPerDay.trim())
                    ? null
                    : settings.getInt(provider.perDaySettingKey()).filter(value -> value > 0).orElse(perDay);
        }
        return new QuotaLimits(perMinute, perDay);
    }
}

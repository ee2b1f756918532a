package com.tradescan.backend.service.governor;

import com.tradescan.backend.config.RateLimitProperties;
import com.tradescan.backend.dto.RateLimitUpdateRequest;
import com.tradescan.backend.exception.BadRequestException;
import com.tradescan.backend.model.Provider;
import com.tradescan.backend.service.AppSettingsService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RateLimitSettingsServiceTest {

    @Mock
    private RequestGovernor requestGovernor;

    @Mock
    private AppSettingsService appSettingsService;

    @InjectMocks
    private RateLimitSettingsService service;

    @Test
    void partialUpdateKeepsDailyCapAndPersists() {
        when(requestGovernor.limits(Provider.ALPHA_VANTAGE)).thenReturn(new QuotaLimits(5, 25));

        QuotaLimits updated = service.update(Provider.ALPHA_VANTAGE,
                RateLimitUpdateRequest.builder().maxPerMinute(3).build());

        assertThat(updated).isEqualTo(new QuotaLimits(3, 25));
        verify(appSettingsService).put("alpha_vantage_rate_limit_per_minute", "3");
        verify(appSettingsService).put("alpha_vantage_rate_limit_per_day", "25");
        verify(requestGovernor).updateLimits(Provider.ALPHA_VANTAGE, new QuotaLimits(3, 25));
    }

    @Test
    void unlimitedDailyClearsCap() {
        when(requestGovernor.limits(Provider.ALPHA_VANTAGE)).thenReturn(new QuotaLimits(5, 25));

        QuotaLimits updated = service.update(Provider.ALPHA_VANTAGE,
                RateLimitUpdateRequest.builder().unlimitedDaily(true).build());

        assertThat(updated.maxPerDay()).isNull();
        verify(appSettingsService).put("alpha_vantage_rate_limit_per_day", "null");
    }

    @Test
    void invalidLimitIsBadRequestAndNothingChanges() {
        when(requestGovernor.limits(Provider.ALPACA)).thenReturn(new QuotaLimits(10_000, null));

        assertThatThrownBy(() -> service.update(Provider.ALPACA, RateLimitUpdateRequest.builder().maxPerMinute(0).build()))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("maxPerMinute");
        verify(appSettingsService, never()).put(anyString(), anyString());
        verify(requestGovernor, never()).updateLimits(any(), any());
    }

    @Test
    void storedSettingsOverrideConfiguredDefaults() {
        when(appSettingsService.getInt("alpha_vantage_rate_limit_per_minute")).thenReturn(Optional.of(2));
        when(appSettingsService.get("alpha_vantage_rate_limit_per_day")).thenReturn(Optional.of("null"));

        QuotaLimits limits = RateLimitSettingsService.resolveLimits(Provider.ALPHA_VANTAGE, new RateLimitProperties(),
                appSettingsService);

        assertThat(limits).isEqualTo(new QuotaLimits(2, null));
    }

    @Test
    void missingSettingsFallBackToDefaults() {
        when(appSettingsService.getInt(anyString())).thenReturn(Optional.empty());
        when(appSettingsService.get(anyString())).thenReturn(Optional.empty());

        QuotaLimits limits = RateLimitSettingsService.resolveLimits(Provider.ALPHA_VANTAGE, new RateLimitProperties(),
                appSettingsService);

        assertThat(limits).isEqualTo(new QuotaLimits(5, 25));
    }
}

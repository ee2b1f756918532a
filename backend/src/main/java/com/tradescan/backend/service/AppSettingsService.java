package com.tradescan.backend.service;

import com.tradescan.backend.model.AppSetting;
import com.tradescan.backend.repository.AppSettingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

/**
 * Persisted runtime configuration ({@code app_settings}).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppSettingsService {

    public static final String SCHEDULER_RUNNING = "scheduler_running";
    public static final String TRADING_MODE = "trading_mode";

    private final AppSettingRepository appSettingRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<String> get(String key) {
        return appSettingRepository.findById(key).map(AppSetting::getSettingValue);
    }

    public Optional<Integer> getInt(String key) {
        return get(key)
                .filter(value -> !value.isBlank() && !"null".equalsIgnoreCase(value))
                .flatMap(value -> {
                    try {
                        return Optional.of(Integer.parseInt(value.trim()));
                    } catch (NumberFormatException e) {
                        log.warn("Ignoring non-numeric setting {}={}", key, value);
                        return Optional.empty();
                    }
                });
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        return get(key)
                .map(value -> "true".equalsIgnoreCase(value) || "1".equals(value))
                .orElse(defaultValue);
    }

    @Transactional
    public void put(String key, String value) {
        AppSetting setting = appSettingRepository.findById(key)
                .orElseGet(() -> AppSetting.builder().settingKey(key).build());
        setting.setSettingValue(value);
        setting.setUpdatedAt(clock.instant());
        appSettingRepository.save(setting);
    }
}

package com.tradescan.backend.service;

import com.tradescan.backend.dto.RiskSettingsUpdateRequest;
import com.tradescan.backend.model.RiskSettings;
import com.tradescan.backend.repository.RiskSettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Slf4j
@Service
@RequiredArgsConstructor
public class RiskSettingsService {

    private final RiskSettingsRepository riskSettingsRepository;
    private final LedgerWriter ledgerWriter;
    private final Clock clock;

    public RiskSettings current() {
        return riskSettingsRepository.findById(RiskSettings.SINGLETON_ID)
                .orElseGet(() -> ledgerWriter.write(() -> riskSettingsRepository.findById(RiskSettings.SINGLETON_ID)
                        .orElseGet(() -> riskSettingsRepository.save(RiskSettings.builder()
                                .id(RiskSettings.SINGLETON_ID)
                                .updatedAt(clock.instant())
                                .build()))));
    }

    public RiskSettings update(RiskSettingsUpdateRequest request) {
        return ledgerWriter.write(() -> {
            RiskSettings settings = current();
            if (request.getEnabled() != null) {
                settings.setEnabled(request.getEnabled());
            }
            if (request.getMaxTransactionAmount() != null) {
                settings.setMaxTransactionAmount(request.getMaxTransactionAmount());
            }
            if (request.getDailySpendLimit() != null) {
                settings.setDailySpendLimit(request.getDailySpendLimit());
            }
            if (request.getWeeklySpendLimit() != null) {
                settings.setWeeklySpendLimit(request.getWeeklySpendLimit());
            }
            if (request.getMaxOpenPositions() != null) {
                settings.setMaxOpenPositions(request.getMaxOpenPositions());
            }
            if (request.getStopLossDefaultPercent() != null) {
                settings.setStopLossDefaultPercent(request.getStopLossDefaultPercent());
            }
            if (request.getTakeProfitDefaultPercent() != null) {
                settings.setTakeProfitDefaultPercent(request.getTakeProfitDefaultPercent());
            }
            if (request.getAllowDuplicatePositions() != null) {
                settings.setAllowDuplicatePositions(request.getAllowDuplicatePositions());
            }
            settings.setUpdatedAt(clock.instant());
            RiskSettings saved = riskSettingsRepository.save(settings);
            log.info("Risk settings updated: enabled={} maxTxn={} daily={} weekly={} maxPositions={}",
                    saved.isEnabled(), saved.getMaxTransactionAmount(), saved.getDailySpendLimit(),
                    saved.getWeeklySpendLimit(), saved.getMaxOpenPositions());
            return saved;
        });
    }
}

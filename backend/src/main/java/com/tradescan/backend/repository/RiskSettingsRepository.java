package com.tradescan.backend.repository;

import com.tradescan.backend.model.RiskSettings;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RiskSettingsRepository extends JpaRepository<RiskSettings, Long> {
}

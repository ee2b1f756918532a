package com.tradescan.backend.db;

import com.tradescan.backend.model.CloseReason;
import com.tradescan.backend.model.Position;
import com.tradescan.backend.model.PositionState;
import com.tradescan.backend.model.TradingMode;
import com.tradescan.backend.repository.PositionRepository;
import com.tradescan.backend.service.AppSettingsService;
import com.tradescan.backend.service.LedgerWriter;
import com.tradescan.backend.util.MoneyUtils;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
class FlywayMigrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("tradescan_test")
            .withUsername("tradescan")
            .withPassword("tradescan");

    @DynamicPropertySource
    static void registerProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "none");
        registry.add("spring.flyway.enabled", () -> "true");
    }

    @Autowired
    private Flyway flyway;

    @Autowired
    private AppSettingsService appSettingsService;

    @Autowired
    private PositionRepository positionRepository;

    @Autowired
    private LedgerWriter ledgerWriter;

    @Test
    void migrationsApplyAndSeedSettings() {
        assertThat(flyway.info().applied()).isNotEmpty();
        assertThat(appSettingsService.get(AppSettingsService.TRADING_MODE)).contains("PAPER");
        assertThat(appSettingsService.getBoolean(AppSettingsService.SCHEDULER_RUNNING, true)).isFalse();
    }

    @Test
    void positionStateTransitionIsCompareAndSet() {
        Instant now = Instant.now();
        Position position = positionRepository.save(Position.builder()
                .tradingMode(TradingMode.PAPER)
                .symbol("FLYW")
                .quantity(3)
                .avgCost(MoneyUtils.bd("25"))
                .stopLossPercent(MoneyUtils.bd("5"))
                .takeProfitPercent(MoneyUtils.bd("10"))
                .openedAt(now)
                .updatedAt(now)
                .build());

        int first = ledgerWriter.write(() -> positionRepository.transitionState(position.getId(), TradingMode.PAPER,
                PositionState.OPEN, PositionState.CLOSING, CloseReason.STOP_LOSS, now));
        int second = ledgerWriter.write(() -> positionRepository.transitionState(position.getId(), TradingMode.PAPER,
                PositionState.OPEN, PositionState.CLOSING, CloseReason.TAKE_PROFIT, now));

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        Position stored = positionRepository.findById(position.getId()).orElseThrow();
        assertThat(stored.getState()).isEqualTo(PositionState.CLOSING);
        assertThat(stored.getPendingCloseReason()).isEqualTo(CloseReason.STOP_LOSS);
        assertThat(positionRepository.findByIdAndTradingMode(position.getId(), TradingMode.LIVE)).isEmpty();
    }
}

package com.tradescan.backend.service.scheduler;

import com.tradescan.backend.exception.ConflictException;
import com.tradescan.backend.exception.NotFoundException;
import com.tradescan.backend.model.AssetType;
import com.tradescan.backend.model.JobRun;
import com.tradescan.backend.model.NotificationType;
import com.tradescan.backend.model.RiskSettings;
import com.tradescan.backend.model.ScreeningProfile;
import com.tradescan.backend.model.TradeRecord;
import com.tradescan.backend.model.TradeStatus;
import com.tradescan.backend.model.TradingMode;
import com.tradescan.backend.repository.ScreeningProfileRepository;
import com.tradescan.backend.service.JobRunService;
import com.tradescan.backend.service.MetricsService;
import com.tradescan.backend.service.NotificationService;
import com.tradescan.backend.service.RiskSettingsService;
import com.tradescan.backend.service.ScheduledTaskGuard;
import com.tradescan.backend.service.TradingModeService;
import com.tradescan.backend.service.scanner.ScanMatch;
import com.tradescan.backend.service.scanner.ScanOutcome;
import com.tradescan.backend.service.scanner.ScreeningEngine;
import com.tradescan.backend.service.trading.AutoOrderPlanner;
import com.tradescan.backend.service.trading.TradeExecutor;
import com.tradescan.backend.service.trading.TradeIntent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScanJobRunnerTest {

    @Mock
    private ScreeningEngine screeningEngine;
    @Mock
    private ScreeningProfileRepository profileRepository;
    @Mock
    private JobRunService jobRunService;
    @Mock
    private TradeExecutor tradeExecutor;
    @Mock
    private RiskSettingsService riskSettingsService;
    @Mock
    private TradingModeService tradingModeService;
    @Mock
    private NotificationService notificationService;
    @Mock
    private MetricsService metricsService;

    private final List<Runnable> submitted = new ArrayList<>();
    private final JobRun run = JobRun.builder().id(10L).build();
    private ScreeningProfile profile;

    @BeforeEach
    void setUp() {
        profile = ScreeningProfile.builder()
                .id(1L)
                .name("Momentum")
                .assetType(AssetType.STOCK)
                .autoExecute(true)
                .maxOrderValue(new BigDecimal("500"))
                .build();
    }

    @Test
    void scheduledScanAutoExecutesMatches() {
        ScanJobRunner runner = runner(Runnable::run);
        givenScanStarts(JobRun.Trigger.SCHEDULED);
        when(screeningEngine.runScan(1L, 10L)).thenReturn(outcome(new ScanMatch("F", AssetType.STOCK, 12.5, null)));
        when(profileRepository.findById(1L)).thenReturn(Optional.of(profile));
        when(riskSettingsService.current()).thenReturn(RiskSettings.builder().id(1L).build());
        when(tradeExecutor.submit(any(TradeIntent.class), eq(TradingMode.PAPER)))
                .thenReturn(TradeRecord.builder().status(TradeStatus.PENDING).build());

        assertThat(runner.dispatchScheduled(profile)).isTrue();

        ArgumentCaptor<TradeIntent> intent = ArgumentCaptor.forClass(TradeIntent.class);
        verify(tradeExecutor).submit(intent.capture(), eq(TradingMode.PAPER));
        assertThat(intent.getValue().quantity()).isEqualTo(40);
        verify(jobRunService).complete(run, 1, 1, 0, null);
        verify(notificationService).notify(eq(NotificationType.SCAN_MATCHES), anyString(), anyString(), eq(1L), isNull());
        assertThat(runner.isRunning(1L)).isFalse();
    }

    @Test
    void riskRejectedAutoOrderIsCountedAndNoted() {
        ScanJobRunner runner = runner(Runnable::run);
        givenScanStarts(JobRun.Trigger.SCHEDULED);
        when(screeningEngine.runScan(1L, 10L)).thenReturn(outcome(new ScanMatch("F", AssetType.STOCK, 12.5, null)));
        when(profileRepository.findById(1L)).thenReturn(Optional.of(profile));
        when(riskSettingsService.current()).thenReturn(RiskSettings.builder().id(1L).build());
        when(tradeExecutor.submit(any(TradeIntent.class), eq(TradingMode.PAPER)))
                .thenReturn(TradeRecord.builder().status(TradeStatus.REJECTED).rejectionReason("Daily limit").build());

        runner.dispatchScheduled(profile);

        verify(jobRunService).complete(run, 1, 0, 1, "F: rejected, Daily limit");
    }

    @Test
    void manualScanNeverPlacesOrders() {
        ScanJobRunner runner = runner(Runnable::run);
        when(profileRepository.existsById(1L)).thenReturn(true);
        givenScanStarts(JobRun.Trigger.MANUAL);
        when(screeningEngine.runScan(1L, 10L)).thenReturn(outcome(new ScanMatch("F", AssetType.STOCK, 12.5, null)));

        ScanOutcome outcome = runner.runManual(1L);

        assertThat(outcome.matchCount()).isEqualTo(1);
        verify(tradeExecutor, never()).submit(any(), any());
        verify(jobRunService).complete(run, 1, null, null, null);
    }

    @Test
    void overlappingTickIsRecordedAsSkipped() {
        ScanJobRunner runner = runner(submitted::add);

        assertThat(runner.dispatchScheduled(profile)).isTrue();
        assertThat(runner.dispatchScheduled(profile)).isFalse();

        verify(jobRunService).skipped(1L, JobRun.Type.SCAN, JobRun.Trigger.SCHEDULED, ScanJobRunner.SKIPPED_NOTE);
        verify(metricsService).recordScanRun("skipped");
        assertThat(runner.runningProfiles()).containsExactly(1L);
        assertThat(submitted).hasSize(1);
    }

    @Test
    void manualScanOfBusyProfileConflicts() {
        ScanJobRunner runner = runner(submitted::add);
        when(profileRepository.existsById(1L)).thenReturn(true);
        runner.dispatchScheduled(profile);

        assertThatThrownBy(() -> runner.runManual(1L)).isInstanceOf(ConflictException.class);
    }

    @Test
    void manualScanOfUnknownProfileIsNotFound() {
        ScanJobRunner runner = runner(Runnable::run);
        when(profileRepository.existsById(9L)).thenReturn(false);

        assertThatThrownBy(() -> runner.runManual(9L)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void failedScanMarksRunFailedAndNotifies() {
        ScanJobRunner runner = runner(Runnable::run);
        when(profileRepository.existsById(1L)).thenReturn(true);
        givenScanStarts(JobRun.Trigger.MANUAL);
        when(screeningEngine.runScan(1L, 10L)).thenThrow(new IllegalStateException("universe empty"));

        assertThatThrownBy(() -> runner.runManual(1L)).hasMessage("universe empty");

        verify(jobRunService).fail(run, "universe empty");
        verify(metricsService).recordScanRun("failed");
        verify(notificationService).notify(eq(NotificationType.SCAN_FAILED), anyString(), anyString(), eq(1L), isNull());
        assertThat(runner.isRunning(1L)).isFalse();
    }

    private void givenScanStarts(JobRun.Trigger trigger) {
        when(jobRunService.start(1L, JobRun.Type.SCAN, trigger)).thenReturn(run);
        when(tradingModeService.current()).thenReturn(TradingMode.PAPER);
    }

    private ScanJobRunner runner(Executor executor) {
        return new ScanJobRunner(screeningEngine, profileRepository, jobRunService, new AutoOrderPlanner(), tradeExecutor,
                riskSettingsService, tradingModeService, notificationService, metricsService, new ScheduledTaskGuard(),
                executor);
    }

    private static ScanOutcome outcome(ScanMatch... matches) {
        return new ScanOutcome(1L, 10L, AssetType.STOCK, List.of(matches), 5, 0, 12L, Instant.parse("2026-10-19T14:00:00Z"));
    }
}

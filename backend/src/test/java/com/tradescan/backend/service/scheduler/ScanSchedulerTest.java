package com.tradescan.backend.service.scheduler;

import com.tradescan.backend.config.SchedulerProperties;
import com.tradescan.backend.dto.SchedulerStatus;
import com.tradescan.backend.model.AssetType;
import com.tradescan.backend.model.JobRun;
import com.tradescan.backend.model.ScreeningProfile;
import com.tradescan.backend.repository.ScreeningProfileRepository;
import com.tradescan.backend.service.AppSettingsService;
import com.tradescan.backend.service.JobRunService;
import com.tradescan.backend.service.ScheduledTaskGuard;
import com.tradescan.backend.service.marketdata.MarketClock;
import com.tradescan.backend.service.scheduler.ScanScheduler.TickResult;
import com.tradescan.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScanSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-10-19T14:00:00Z");

    @Mock
    private TaskScheduler taskScheduler;
    @Mock
    private ScreeningProfileRepository profileRepository;
    @Mock
    private ScanJobRunner scanJobRunner;
    @Mock
    private MarketClock marketClock;
    @Mock
    private AppSettingsService appSettingsService;
    @Mock
    private JobRunService jobRunService;

    private ScanScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ScanScheduler(taskScheduler, profileRepository, scanJobRunner, marketClock, appSettingsService,
                new SchedulerProperties(), new ScheduledTaskGuard(), jobRunService, new MutableClock(NOW));
    }

    @Test
    void closedMarketTickNeverReachesTheScanner() {
        ScreeningProfile profile = profile(1L, true);
        when(profileRepository.findById(1L)).thenReturn(Optional.of(profile));
        when(marketClock.isOpen()).thenReturn(false);

        assertThat(scheduler.tick(1L)).isEqualTo(TickResult.MARKET_CLOSED);
        verifyNoInteractions(scanJobRunner);
    }

    @Test
    void unreachableMarketClockRecordsFailedScanRun() {
        ScreeningProfile profile = profile(1L, true);
        JobRun run = JobRun.builder().id(9L).profileId(1L).build();
        when(profileRepository.findById(1L)).thenReturn(Optional.of(profile));
        when(marketClock.isOpen()).thenThrow(new IllegalStateException("clock timeout"));
        when(jobRunService.start(1L, JobRun.Type.SCAN, JobRun.Trigger.SCHEDULED)).thenReturn(run);

        assertThat(scheduler.tick(1L)).isEqualTo(TickResult.CLOCK_UNAVAILABLE);

        verify(jobRunService).fail(run, "Market clock unavailable: clock timeout");
        verifyNoInteractions(scanJobRunner);
    }

    @Test
    void closedMarketLeavesNoJobRun() {
        ScreeningProfile profile = profile(1L, true);
        when(profileRepository.findById(1L)).thenReturn(Optional.of(profile));
        when(marketClock.isOpen()).thenReturn(false);

        scheduler.tick(1L);

        verifyNoInteractions(jobRunService);
    }

    @Test
    void profileWithoutMarketHoursRestrictionScansAnyTime() {
        ScreeningProfile profile = profile(1L, false);
        when(profileRepository.findById(1L)).thenReturn(Optional.of(profile));
        when(scanJobRunner.dispatchScheduled(profile)).thenReturn(true);

        assertThat(scheduler.tick(1L)).isEqualTo(TickResult.DISPATCHED);
        verifyNoInteractions(marketClock);
    }

    @Test
    void busyProfileReportsSkippedTick() {
        ScreeningProfile profile = profile(1L, true);
        when(profileRepository.findById(1L)).thenReturn(Optional.of(profile));
        when(marketClock.isOpen()).thenReturn(true);
        when(scanJobRunner.dispatchScheduled(profile)).thenReturn(false);

        assertThat(scheduler.tick(1L)).isEqualTo(TickResult.SKIPPED_RUNNING);
    }

    @Test
    void startArmsOneTriggerPerEnabledProfileFirstFiringAfterOneInterval() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        when(profileRepository.findByScheduleEnabledTrue()).thenReturn(List.of(profile(1L, true), profile(2L, true)));

        SchedulerStatus status = scheduler.start();

        assertThat(status.isRunning()).isTrue();
        assertThat(status.getActiveTriggers()).isEqualTo(2);
        assertThat(status.getScheduledProfileIds()).containsExactly(1L, 2L);
        verify(taskScheduler, times(2))
                .scheduleAtFixedRate(any(Runnable.class), eq(NOW.plus(Duration.ofMinutes(15))), eq(Duration.ofMinutes(15)));
        verify(appSettingsService).put(AppSettingsService.SCHEDULER_RUNNING, "true");
    }

    @Test
    void stopCancelsTriggersAndPersistsState() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        when(profileRepository.findByScheduleEnabledTrue()).thenReturn(List.of(profile(1L, true)));
        scheduler.start();

        SchedulerStatus status = scheduler.stop();

        assertThat(status.isRunning()).isFalse();
        assertThat(status.getActiveTriggers()).isZero();
        verify(future).cancel(false);
        verify(appSettingsService).put(AppSettingsService.SCHEDULER_RUNNING, "false");
    }

    @Test
    void disablingAProfileDropsItsTrigger() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        ScreeningProfile profile = profile(1L, true);
        when(profileRepository.findByScheduleEnabledTrue()).thenReturn(List.of(profile));
        scheduler.start();

        profile.setScheduleEnabled(false);
        when(profileRepository.findById(1L)).thenReturn(Optional.of(profile));
        scheduler.refreshProfile(1L);

        verify(future).cancel(false);
        assertThat(scheduler.status().getActiveTriggers()).isZero();
    }

    @Test
    void firedTriggerRunsTheTick() {
        ArgumentCaptor<Runnable> trigger = ArgumentCaptor.forClass(Runnable.class);
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(trigger.capture(), any(Instant.class), any(Duration.class));
        ScreeningProfile profile = profile(1L, false);
        when(profileRepository.findByScheduleEnabledTrue()).thenReturn(List.of(profile));
        when(profileRepository.findById(1L)).thenReturn(Optional.of(profile));
        when(scanJobRunner.dispatchScheduled(profile)).thenReturn(true);
        scheduler.start();

        trigger.getValue().run();

        verify(scanJobRunner).dispatchScheduled(profile);
    }

    @Test
    void refreshWhileStoppedSchedulesNothing() {
        scheduler.refreshProfile(5L);

        verify(taskScheduler, never()).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        verifyNoInteractions(profileRepository);
    }

    private static ScreeningProfile profile(Long id, boolean marketHoursOnly) {
        return ScreeningProfile.builder()
                .id(id)
                .name("Profile " + id)
                .assetType(AssetType.STOCK)
                .scheduleEnabled(true)
                .scheduleIntervalMinutes(15)
                .marketHoursOnly(marketHoursOnly)
                .build();
    }
}

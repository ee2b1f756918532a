package com.tradescan.backend.service.scheduler;

import com.tradescan.backend.config.SchedulerProperties;
import com.tradescan.backend.dto.SchedulerStatus;
import com.tradescan.backend.model.JobRun;
import com.tradescan.backend.model.ScreeningProfile;
import com.tradescan.backend.repository.ScreeningProfileRepository;
import com.tradescan.backend.service.AppSettingsService;
import com.tradescan.backend.service.JobRunService;
import com.tradescan.backend.service.ScheduledTaskGuard;
import com.tradescan.backend.service.marketdata.MarketClock;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One periodic trigger per schedule-enabled profile, each with its own cancellation handle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScanScheduler {

    public enum TickResult {
        DISPATCHED,
        SKIPPED_RUNNING,
        MARKET_CLOSED,
        CLOCK_UNAVAILABLE,
        UNSCHEDULED
    }

    private final Map<Long, ScheduledFuture<?>> triggers = new ConcurrentHashMap<>();
    private volatile boolean running;

    private final TaskScheduler taskScheduler;
    private final ScreeningProfileRepository profileRepository;
    private final ScanJobRunner scanJobRunner;
    private final MarketClock marketClock;
    private final AppSettingsService appSettingsService;
    private final SchedulerProperties schedulerProperties;
    private final ScheduledTaskGuard scheduledTaskGuard;
    private final JobRunService jobRunService;
    private final Clock clock;

    public synchronized SchedulerStatus start() {
        if (!running) {
            running = true;
            profileRepository.findByScheduleEnabledTrue().forEach(this::schedule);
            appSettingsService.put(AppSettingsService.SCHEDULER_RUNNING, "true");
            log.info("Scheduler started with {} profile trigger(s)", triggers.size());
        }
        return status();
    }

    public synchronized SchedulerStatus stop() {
        running = false;
        cancelAll();
        appSettingsService.put(AppSettingsService.SCHEDULER_RUNNING, "false");
        log.info("Scheduler stopped");
        return status();
    }

    public SchedulerStatus status() {
        Map<Long, Instant> nextRuns = new TreeMap<>();
        Instant now = clock.instant();
        triggers.forEach((profileId, future) ->
                nextRuns.put(profileId, now.plusMillis(Math.max(0, future.getDelay(TimeUnit.MILLISECONDS)))));
        return SchedulerStatus.builder()
                .running(running)
                .activeTriggers(triggers.size())
                .scheduledProfileIds(new ArrayList<>(nextRuns.keySet()))
                .runningProfileIds(List.copyOf(scanJobRunner.runningProfiles()))
                .nextRunAt(nextRuns)
                .build();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Re-reads one profile and re-creates or drops its trigger. Call after the profile changed or was deleted.
     */
    public synchronized void refreshProfile(Long profileId) {
        cancel(profileId);
        if (!running) {
            return;
        }
        profileRepository.findById(profileId)
                .filter(ScreeningProfile::isScheduleEnabled)
                .ifPresent(this::schedule);
    }

    /**
     * One trigger firing for a profile. A closed market on a market-hours-only profile leaves no trace,
     * an unreachable market clock leaves a failed scan run.
     */
    public TickResult tick(Long profileId) {
        ScreeningProfile profile = profileRepository.findById(profileId).orElse(null);
        if (profile == null || !profile.isScheduleEnabled()) {
            cancel(profileId);
            return TickResult.UNSCHEDULED;
        }
        if (profile.isMarketHoursOnly()) {
            boolean open;
            try {
                open = marketClock.isOpen();
            } catch (RuntimeException e) {
                log.warn("Market clock check failed, tick for profile {} not run", profileId, e);
                JobRun run = jobRunService.start(profileId, JobRun.Type.SCAN, JobRun.Trigger.SCHEDULED);
                jobRunService.fail(run, "Market clock unavailable: " + e.getMessage());
                return TickResult.CLOCK_UNAVAILABLE;
            }
            if (!open) {
                log.debug("Market closed, tick for profile {} skipped", profileId);
                return TickResult.MARKET_CLOSED;
            }
        }
        return scanJobRunner.dispatchScheduled(profile) ? TickResult.DISPATCHED : TickResult.SKIPPED_RUNNING;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void resumeOnStartup() {
        if (schedulerProperties.isResumeOnStartup()
                && appSettingsService.getBoolean(AppSettingsService.SCHEDULER_RUNNING, false)) {
            log.info("Resuming scheduler from persisted state");
            start();
        }
    }

    @PreDestroy
    public void shutdown() {
        cancelAll();
    }

    private void schedule(ScreeningProfile profile) {
        Long profileId = profile.getId();
        int minutes = profile.getScheduleIntervalMinutes() != null && profile.getScheduleIntervalMinutes() > 0
                ? profile.getScheduleIntervalMinutes()
                : schedulerProperties.getDefaultIntervalMinutes();
        Duration interval = Duration.ofMinutes(minutes);
        ScheduledFuture<?> future = taskScheduler.scheduleAtFixedRate(
                () -> scheduledTaskGuard.run("scan-tick-" + profileId, () -> tick(profileId)),
                clock.instant().plus(interval),
                interval);
        ScheduledFuture<?> previous = triggers.put(profileId, future);
        if (previous != null) {
            previous.cancel(false);
        }
        log.info("Scheduled profile {} ({}) every {} min", profileId, profile.getName(), minutes);
    }

    private void cancel(Long profileId) {
        ScheduledFuture<?> future = triggers.remove(profileId);
        if (future != null) {
            future.cancel(false);
            log.info("Removed schedule for profile {}", profileId);
        }
    }

    private void cancelAll() {
        triggers.values().forEach(future -> future.cancel(false));
        triggers.clear();
    }
}

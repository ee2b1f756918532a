package com.tradescan.backend.service.scheduler;

import com.tradescan.backend.exception.ConflictException;
import com.tradescan.backend.exception.NotFoundException;
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
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs scans for the scheduler and for manual triggers. At most one scan per profile is in flight;
 * different profiles run independently.
 */
@Slf4j
@Service
public class ScanJobRunner {

    static final String SKIPPED_NOTE = "Skipped: previous scan of this profile is still running";

    private final Set<Long> running = ConcurrentHashMap.newKeySet();

    private final ScreeningEngine screeningEngine;
    private final ScreeningProfileRepository profileRepository;
    private final JobRunService jobRunService;
    private final AutoOrderPlanner autoOrderPlanner;
    private final TradeExecutor tradeExecutor;
    private final RiskSettingsService riskSettingsService;
    private final TradingModeService tradingModeService;
    private final NotificationService notificationService;
    private final MetricsService metricsService;
    private final ScheduledTaskGuard scheduledTaskGuard;
    private final Executor scannerExecutor;

    public ScanJobRunner(ScreeningEngine screeningEngine,
                         ScreeningProfileRepository profileRepository,
                         JobRunService jobRunService,
                         AutoOrderPlanner autoOrderPlanner,
                         TradeExecutor tradeExecutor,
                         RiskSettingsService riskSettingsService,
                         TradingModeService tradingModeService,
                         NotificationService notificationService,
                         MetricsService metricsService,
                         ScheduledTaskGuard scheduledTaskGuard,
                         @Qualifier("scannerExecutor") Executor scannerExecutor) {
        this.screeningEngine = screeningEngine;
        this.profileRepository = profileRepository;
        this.jobRunService = jobRunService;
        this.autoOrderPlanner = autoOrderPlanner;
        this.tradeExecutor = tradeExecutor;
        this.riskSettingsService = riskSettingsService;
        this.tradingModeService = tradingModeService;
        this.notificationService = notificationService;
        this.metricsService = metricsService;
        this.scheduledTaskGuard = scheduledTaskGuard;
        this.scannerExecutor = scannerExecutor;
    }

    /**
     * Starts a scheduled scan in the background. When the profile is still busy the tick is recorded as skipped.
     *
     * @return true if a scan was started
     */
    public boolean dispatchScheduled(ScreeningProfile profile) {
        Long profileId = profile.getId();
        if (!running.add(profileId)) {
            log.info("Profile {} still scanning, tick skipped", profileId);
            jobRunService.skipped(profileId, JobRun.Type.SCAN, JobRun.Trigger.SCHEDULED, SKIPPED_NOTE);
            metricsService.recordScanRun("skipped");
            return false;
        }
        try {
            scannerExecutor.execute(() -> {
                try {
                    scheduledTaskGuard.run("scan-" + profileId, () -> execute(profileId, JobRun.Trigger.SCHEDULED));
                } finally {
                    running.remove(profileId);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            running.remove(profileId);
            throw e;
        }
    }

    /**
     * Runs a scan on the caller's thread. Manual scans never place orders.
     *
     * @throws ConflictException when the profile is already scanning
     */
    public ScanOutcome runManual(Long profileId) {
        if (!profileRepository.existsById(profileId)) {
            throw new NotFoundException("Profile not found: " + profileId);
        }
        if (!running.add(profileId)) {
            throw new ConflictException("A scan of profile " + profileId + " is already running");
        }
        try {
            return execute(profileId, JobRun.Trigger.MANUAL);
        } finally {
            running.remove(profileId);
        }
    }

    public Set<Long> runningProfiles() {
        return new TreeSet<>(running);
    }

    public boolean isRunning(Long profileId) {
        return running.contains(profileId);
    }

    ScanOutcome execute(Long profileId, JobRun.Trigger trigger) {
        JobRun run = jobRunService.start(profileId, JobRun.Type.SCAN, trigger);
        TradingMode mode = tradingModeService.current();
        try (MDC.MDCCloseable ignoredProfile = MDC.putCloseable("profileId", String.valueOf(profileId));
             MDC.MDCCloseable ignoredRun = MDC.putCloseable("jobRunId", String.valueOf(run.getId()));
             MDC.MDCCloseable ignoredMode = MDC.putCloseable("tradingMode", mode.name())) {
            ScanOutcome outcome;
            try {
                outcome = screeningEngine.runScan(profileId, run.getId());
            } catch (RuntimeException e) {
                log.error("Scan of profile {} failed", profileId, e);
                jobRunService.fail(run, e.getMessage());
                metricsService.recordScanRun("failed");
                notificationService.notify(NotificationType.SCAN_FAILED, "Scan failed",
                        "Scan of profile " + profileId + " failed: " + e.getMessage(), profileId, null);
                throw e;
            }

            AutoExecution auto = trigger == JobRun.Trigger.SCHEDULED
                    ? autoExecute(profileId, outcome, mode)
                    : AutoExecution.NONE;
            jobRunService.complete(run, outcome.matchCount(), auto.submitted(), auto.rejected(), auto.note());
            if (outcome.matchCount() > 0) {
                notificationService.notify(NotificationType.SCAN_MATCHES, "Scan complete",
                        "Found " + outcome.matchCount() + " match(es) for profile " + profileId, profileId, null);
            }
            return outcome;
        }
    }

    private AutoExecution autoExecute(Long profileId, ScanOutcome outcome, TradingMode mode) {
        Optional<ScreeningProfile> profile = profileRepository.findById(profileId);
        if (profile.isEmpty() || !profile.get().isAutoExecute() || outcome.matches().isEmpty()) {
            return AutoExecution.NONE;
        }
        RiskSettings settings = riskSettingsService.current();
        int submitted = 0;
        int rejected = 0;
        List<String> notes = new ArrayList<>();
        for (ScanMatch match : outcome.matches()) {
            Optional<TradeIntent> intent = autoOrderPlanner.plan(profile.get(), match, settings);
            if (intent.isEmpty()) {
                notes.add(match.symbol() + ": skipped, order cap buys less than one unit");
                continue;
            }
            try {
                TradeRecord trade = tradeExecutor.submit(intent.get(), mode);
                if (trade.getStatus() == TradeStatus.REJECTED) {
                    rejected++;
                    notes.add(match.symbol() + ": rejected, " + trade.getRejectionReason());
                } else {
                    submitted++;
                }
            } catch (RuntimeException e) {
                rejected++;
                notes.add(match.symbol() + ": failed, " + e.getMessage());
                log.warn("Auto-execute of {} for profile {} failed: {}", match.symbol(), profileId, e.getMessage());
            }
        }
        log.info("Auto-execute for profile {}: {} submitted, {} rejected", profileId, submitted, rejected);
        return new AutoExecution(submitted, rejected, notes.isEmpty() ? null : String.join("\n", notes));
    }

    private record AutoExecution(Integer submitted, Integer rejected, String note) {
        static final AutoExecution NONE = new AutoExecution(null, null, null);
    }
}

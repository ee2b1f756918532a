package com.tradescan.backend.service;

import com.tradescan.backend.model.JobRun;
import com.tradescan.backend.repository.JobRunRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Append-only audit trail of scan and monitor runs.
 */
@Service
@RequiredArgsConstructor
public class JobRunService {

    private static final int MAX_TEXT = 2000;

    private final JobRunRepository jobRunRepository;
    private final LedgerWriter ledgerWriter;
    private final Clock clock;

    public JobRun start(Long profileId, JobRun.Type type, JobRun.Trigger trigger) {
        JobRun run = JobRun.builder()
                .profileId(profileId)
                .jobType(type)
                .trigger(trigger)
                .status(JobRun.Status.STARTED)
                .startedAt(clock.instant())
                .build();
        return ledgerWriter.write(() -> jobRunRepository.save(run));
    }

    public JobRun complete(JobRun run, Integer matchCount, Integer ordersSubmitted, Integer ordersRejected, String note) {
        run.setMatchCount(matchCount);
        run.setOrdersSubmitted(ordersSubmitted);
        run.setOrdersRejected(ordersRejected);
        run.setNote(truncate(note));
        return finish(run, JobRun.Status.COMPLETED);
    }

    public JobRun fail(JobRun run, String errorMessage) {
        run.setErrorMessage(truncate(errorMessage));
        return finish(run, JobRun.Status.FAILED);
    }

    /**
     * Records a tick that was not executed, e.g. because the previous run of the same profile is still going.
     */
    public JobRun skipped(Long profileId, JobRun.Type type, JobRun.Trigger trigger, String note) {
        Instant now = clock.instant();
        JobRun run = JobRun.builder()
                .profileId(profileId)
                .jobType(type)
                .trigger(trigger)
                .status(JobRun.Status.SKIPPED)
                .startedAt(now)
                .completedAt(now)
                .executionTimeMs(0L)
                .note(truncate(note))
                .build();
        return ledgerWriter.write(() -> jobRunRepository.save(run));
    }

    public List<JobRun> recent(int limit) {
        return jobRunRepository.findAllByOrderByStartedAtDesc(PageRequest.of(0, clamp(limit)));
    }

    public List<JobRun> forProfile(Long profileId, int limit) {
        return jobRunRepository.findByProfileIdOrderByStartedAtDesc(profileId, PageRequest.of(0, clamp(limit)));
    }

    private JobRun finish(JobRun run, JobRun.Status status) {
        Instant now = clock.instant();
        run.setStatus(status);
        run.setCompletedAt(now);
        run.setExecutionTimeMs(Duration.between(run.getStartedAt(), now).toMillis());
        return ledgerWriter.write(() -> jobRunRepository.save(run));
    }

    private static int clamp(int limit) {
        return Math.max(1, Math.min(limit, 500));
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= MAX_TEXT) {
            return text;
        }
        return text.substring(0, MAX_TEXT);
    }
}

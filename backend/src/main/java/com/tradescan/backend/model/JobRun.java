package com.tradescan.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only audit row for one scan or monitor execution.
 */
@Entity
@Table(name = "scheduler_log")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long profileId;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false, length = 16)
    private Type jobType;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_trigger", nullable = false, length = 16)
    private Trigger trigger;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status;

    @Column(nullable = false)
    private Instant startedAt;

    private Instant completedAt;

    private Long executionTimeMs;

    private Integer matchCount;

    private Integer ordersSubmitted;

    private Integer ordersRejected;

    @Column(length = 2000)
    private String note;

    @Column(length = 2000)
    private String errorMessage;

    public enum Type {
        SCAN,
        MONITOR
    }

    public enum Trigger {
        SCHEDULED,
        MANUAL
    }

    public enum Status {
        STARTED,
        COMPLETED,
        FAILED,
        SKIPPED
    }
}

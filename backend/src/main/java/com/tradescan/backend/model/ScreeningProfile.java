package com.tradescan.backend.model;

import com.tradescan.backend.model.params.ProfileParameters;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "screening_profiles")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScreeningProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 120)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AssetType assetType;

    @Convert(converter = ProfileParametersConverter.class)
    @Column(nullable = false, length = 8000)
    private ProfileParameters parameters;

    @Builder.Default
    @Column(nullable = false)
    private boolean scheduleEnabled = false;

    @Builder.Default
    @Column(name = "schedule_interval_minutes", nullable = false)
    private Integer scheduleIntervalMinutes = 15;

    @Builder.Default
    @Column(nullable = false)
    private boolean marketHoursOnly = true;

    @Builder.Default
    @Column(nullable = false)
    private boolean autoExecute = false;

    @Column(precision = 19, scale = 4)
    private BigDecimal maxOrderValue;

    private Instant lastRunAt;

    private Integer lastMatchCount;

    private Instant createdAt;

    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}

package com.tradescan.backend.repository;

import com.tradescan.backend.model.ScreeningProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface ScreeningProfileRepository extends JpaRepository<ScreeningProfile, Long> {

    List<ScreeningProfile> findByScheduleEnabledTrue();

    List<ScreeningProfile> findAllByOrderByNameAsc();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ScreeningProfile p set p.lastRunAt = :runAt, p.lastMatchCount = :matches where p.id = :id")
    int recordLastRun(@Param("id") Long id, @Param("runAt") Instant runAt, @Param("matches") int matches);
}

package com.tradescan.backend.repository;

import com.tradescan.backend.model.JobRun;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface JobRunRepository extends JpaRepository<JobRun, Long> {

    List<JobRun> findAllByOrderByStartedAtDesc(Pageable pageable);

    List<JobRun> findByProfileIdOrderByStartedAtDesc(Long profileId, Pageable pageable);
}

package com.tradescan.backend.repository;

import com.tradescan.backend.model.ScanResult;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ScanResultRepository extends JpaRepository<ScanResult, Long> {

    List<ScanResult> findByProfileIdOrderByScannedAtDescSymbolAsc(Long profileId, Pageable pageable);

    void deleteByProfileId(Long profileId);
}

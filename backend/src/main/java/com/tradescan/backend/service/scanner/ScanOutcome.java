package com.tradescan.backend.service.scanner;

import com.tradescan.backend.model.AssetType;

import java.time.Instant;
import java.util.List;

public record ScanOutcome(
        Long profileId,
        Long jobRunId,
        AssetType assetType,
        List<ScanMatch> matches,
        int symbolsScanned,
        int symbolsFailed,
        long durationMs,
        Instant scannedAt
) {

    public int matchCount() {
        return matches.size();
    }
}

package com.tradescan.backend.service;

import com.tradescan.backend.dto.ProfileRequest;
import com.tradescan.backend.exception.BadRequestException;
import com.tradescan.backend.exception.NotFoundException;
import com.tradescan.backend.model.AssetType;
import com.tradescan.backend.model.ScanResult;
import com.tradescan.backend.model.ScreeningProfile;
import com.tradescan.backend.model.params.OptionParameters;
import com.tradescan.backend.model.params.ProfileParameters;
import com.tradescan.backend.model.params.StockParameters;
import com.tradescan.backend.repository.ScanResultRepository;
import com.tradescan.backend.repository.ScreeningProfileRepository;
import com.tradescan.backend.service.scheduler.ScanScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileService {

    private static final int DEFAULT_INTERVAL_MINUTES = 15;

    private final ScreeningProfileRepository profileRepository;
    private final ScanResultRepository scanResultRepository;
    private final LedgerWriter ledgerWriter;
    private final ScanScheduler scanScheduler;

    public List<ScreeningProfile> list() {
        return profileRepository.findAllByOrderByNameAsc();
    }

    public ScreeningProfile get(Long id) {
        return profileRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Profile " + id + " not found"));
    }

    public ScreeningProfile create(ProfileRequest request) {
        validate(request);
        ScreeningProfile saved = ledgerWriter.write(() -> {
            ScreeningProfile profile = new ScreeningProfile();
            apply(profile, request);
            return profileRepository.save(profile);
        });
        log.info("Created profile {} ({}, {})", saved.getId(), saved.getName(), saved.getAssetType());
        scanScheduler.refreshProfile(saved.getId());
        return saved;
    }

    public ScreeningProfile update(Long id, ProfileRequest request) {
        validate(request);
        ScreeningProfile saved = ledgerWriter.write(() -> {
            ScreeningProfile profile = get(id);
            apply(profile, request);
            return profileRepository.save(profile);
        });
        log.info("Updated profile {} ({})", saved.getId(), saved.getName());
        scanScheduler.refreshProfile(id);
        return saved;
    }

    /**
     * Removes the profile with its stored scan results and drops its trigger.
     */
    public void delete(Long id) {
        ledgerWriter.run(() -> {
            ScreeningProfile profile = get(id);
            scanResultRepository.deleteByProfileId(id);
            profileRepository.delete(profile);
        });
        log.info("Deleted profile {}", id);
        scanScheduler.refreshProfile(id);
    }

    public List<ScanResult> results(Long profileId, int limit) {
        get(profileId);
        return scanResultRepository.findByProfileIdOrderByScannedAtDescSymbolAsc(profileId,
                PageRequest.of(0, Math.max(1, limit)));
    }

    private static void apply(ScreeningProfile profile, ProfileRequest request) {
        profile.setName(request.getName().trim());
        profile.setAssetType(request.getAssetType());
        profile.setParameters(request.getParameters());
        profile.setScheduleEnabled(Boolean.TRUE.equals(request.getScheduleEnabled()));
        profile.setScheduleIntervalMinutes(request.getScheduleIntervalMinutes() != null
                ? request.getScheduleIntervalMinutes()
                : DEFAULT_INTERVAL_MINUTES);
        profile.setMarketHoursOnly(request.getMarketHoursOnly() == null || request.getMarketHoursOnly());
        profile.setAutoExecute(Boolean.TRUE.equals(request.getAutoExecute()));
        profile.setMaxOrderValue(request.getMaxOrderValue());
    }

    static void validate(ProfileRequest request) {
        ProfileParameters parameters = request.getParameters();
        List<String> problems = new ArrayList<>();
        if (request.getAssetType() == AssetType.STOCK && !(parameters instanceof StockParameters)) {
            problems.add("stock profiles need stock parameters");
        }
        if (request.getAssetType() != null && request.getAssetType().isOption() && !(parameters instanceof OptionParameters)) {
            problems.add("option profiles need option parameters");
        }
        if (parameters != null) {
            problems.addAll(parameters.validate());
        }
        if (!problems.isEmpty()) {
            throw new BadRequestException("Invalid profile: " + String.join("; ", problems));
        }
    }
}

package com.tradescan.backend.controller;

import com.tradescan.backend.dto.ProfileRequest;
import com.tradescan.backend.model.ScanResult;
import com.tradescan.backend.model.ScreeningProfile;
import com.tradescan.backend.service.ProfileService;
import com.tradescan.backend.service.scanner.ScanOutcome;
import com.tradescan.backend.service.scheduler.ScanJobRunner;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/profiles")
@RequiredArgsConstructor
@Tag(name = "Screening profiles")
public class ProfileController {

    private final ProfileService profileService;
    private final ScanJobRunner scanJobRunner;

    @GetMapping
    public ResponseEntity<List<ScreeningProfile>> list() {
        return ResponseEntity.ok(profileService.list());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ScreeningProfile> get(@PathVariable Long id) {
        return ResponseEntity.ok(profileService.get(id));
    }

    @PostMapping
    @Operation(summary = "Create a screening profile")
    @ApiResponse(responseCode = "201")
    public ResponseEntity<ScreeningProfile> create(@Valid @RequestBody ProfileRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(profileService.create(request));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ScreeningProfile> update(@PathVariable Long id, @Valid @RequestBody ProfileRequest request) {
        return ResponseEntity.ok(profileService.update(id, request));
    }

    @DeleteMapping("/{id}")
    @ApiResponse(responseCode = "204")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        profileService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/scan")
    @Operation(summary = "Run the profile's scan now", description = "Manual scans never place orders")
    @ApiResponse(responseCode = "409", description = "A scan of this profile is already running")
    public ResponseEntity<ScanOutcome> scan(@PathVariable Long id) {
        return ResponseEntity.ok(scanJobRunner.runManual(id));
    }

    @GetMapping("/{id}/results")
    @Operation(summary = "Stored matches of the profile, newest first")
    public ResponseEntity<List<ScanResult>> results(@PathVariable Long id,
                                                    @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(profileService.results(id, limit));
    }
}

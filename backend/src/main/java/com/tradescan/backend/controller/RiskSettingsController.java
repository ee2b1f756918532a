package com.tradescan.backend.controller;

import com.tradescan.backend.dto.RiskSettingsUpdateRequest;
import com.tradescan.backend.model.RiskSettings;
import com.tradescan.backend.service.RiskSettingsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/risk-settings")
@RequiredArgsConstructor
@Tag(name = "Risk settings")
public class RiskSettingsController {

    private final RiskSettingsService riskSettingsService;

    @GetMapping
    public ResponseEntity<RiskSettings> get() {
        return ResponseEntity.ok(riskSettingsService.current());
    }

    @PutMapping
    @Operation(summary = "Update risk limits; omitted fields keep their value")
    public ResponseEntity<RiskSettings> update(@Valid @RequestBody RiskSettingsUpdateRequest request) {
        return ResponseEntity.ok(riskSettingsService.update(request));
    }
}

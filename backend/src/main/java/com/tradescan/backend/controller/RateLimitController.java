package com.tradescan.backend.controller;

import com.tradescan.backend.dto.RateLimitUpdateRequest;
import com.tradescan.backend.model.Provider;
import com.tradescan.backend.service.governor.QuotaLimits;
import com.tradescan.backend.service.governor.RateLimitSettingsService;
import com.tradescan.backend.service.governor.RateLimitStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/rate-limits")
@RequiredArgsConstructor
@Tag(name = "Rate limits")
public class RateLimitController {

    private final RateLimitSettingsService rateLimitSettingsService;

    @GetMapping
    @Operation(summary = "Usage, limits and queue depth per provider")
    public ResponseEntity<Map<Provider, RateLimitStatus>> status() {
        return ResponseEntity.ok(rateLimitSettingsService.status());
    }

    @PutMapping("/{provider}")
    @Operation(summary = "Change a provider's quota; takes effect without restart")
    public ResponseEntity<QuotaLimits> update(@PathVariable String provider,
                                              @Valid @RequestBody RateLimitUpdateRequest request) {
        return ResponseEntity.ok(rateLimitSettingsService.update(Provider.fromKey(provider), request));
    }
}

package com.tradescan.backend.controller;

import com.tradescan.backend.dto.TradingModeRequest;
import com.tradescan.backend.model.TradingMode;
import com.tradescan.backend.service.TradingModeService;
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

import java.util.Map;

@RestController
@RequestMapping("/api/trading-mode")
@RequiredArgsConstructor
@Tag(name = "Trading mode")
public class TradingModeController {

    private final TradingModeService tradingModeService;

    @GetMapping
    public ResponseEntity<Map<String, TradingMode>> get() {
        return ResponseEntity.ok(Map.of("mode", tradingModeService.current()));
    }

    @PutMapping
    @Operation(summary = "Switch between paper and live trading")
    public ResponseEntity<Map<String, TradingMode>> set(@Valid @RequestBody TradingModeRequest request) {
        return ResponseEntity.ok(Map.of("mode", tradingModeService.switchTo(TradingMode.fromRequest(request.getMode()))));
    }
}

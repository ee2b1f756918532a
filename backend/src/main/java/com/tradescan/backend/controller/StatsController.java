package com.tradescan.backend.controller;

import com.tradescan.backend.model.DailyStats;
import com.tradescan.backend.service.DailyStatsService;
import com.tradescan.backend.service.TradingModeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/stats")
@RequiredArgsConstructor
@Tag(name = "Daily stats")
public class StatsController {

    private final DailyStatsService dailyStatsService;
    private final TradingModeService tradingModeService;

    @GetMapping("/today")
    public ResponseEntity<DailyStats> today() {
        return ResponseEntity.ok(dailyStatsService.todayStats(tradingModeService.current()));
    }

    @GetMapping("/history")
    @Operation(summary = "Daily rows of the current trading mode, defaults to the last week")
    public ResponseEntity<List<DailyStats>> history(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        LocalDate end = to != null ? to : dailyStatsService.today();
        LocalDate start = from != null ? from : dailyStatsService.weekStart();
        return ResponseEntity.ok(dailyStatsService.history(tradingModeService.current(), start, end));
    }
}

package com.tradescan.backend.controller;

import com.tradescan.backend.dto.SchedulerStatus;
import com.tradescan.backend.service.scheduler.ScanScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scheduler")
@RequiredArgsConstructor
@Tag(name = "Scheduler")
public class SchedulerController {

    private final ScanScheduler scanScheduler;

    @PostMapping("/start")
    @Operation(summary = "Arm triggers for every schedule-enabled profile")
    public ResponseEntity<SchedulerStatus> start() {
        return ResponseEntity.ok(scanScheduler.start());
    }

    @PostMapping("/stop")
    @Operation(summary = "Cancel all triggers")
    public ResponseEntity<SchedulerStatus> stop() {
        return ResponseEntity.ok(scanScheduler.stop());
    }

    @GetMapping("/status")
    public ResponseEntity<SchedulerStatus> status() {
        return ResponseEntity.ok(scanScheduler.status());
    }
}

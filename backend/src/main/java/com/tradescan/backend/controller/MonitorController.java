package com.tradescan.backend.controller;

import com.tradescan.backend.dto.MonitorIntervalRequest;
import com.tradescan.backend.dto.MonitorStatus;
import com.tradescan.backend.service.monitor.PositionMonitor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/monitor")
@RequiredArgsConstructor
@Tag(name = "Position monitor")
public class MonitorController {

    private final PositionMonitor positionMonitor;

    @PostMapping("/start")
    public ResponseEntity<MonitorStatus> start() {
        return ResponseEntity.ok(positionMonitor.start());
    }

    @PostMapping("/stop")
    public ResponseEntity<MonitorStatus> stop() {
        return ResponseEntity.ok(positionMonitor.stop());
    }

    @GetMapping("/status")
    public ResponseEntity<MonitorStatus> status() {
        return ResponseEntity.ok(positionMonitor.status());
    }

    @PutMapping("/interval")
    @Operation(summary = "Change the check interval; values under the floor are raised to it")
    public ResponseEntity<MonitorStatus> interval(@Valid @RequestBody MonitorIntervalRequest request) {
        return ResponseEntity.ok(positionMonitor.setCheckInterval(request.getSeconds()));
    }
}

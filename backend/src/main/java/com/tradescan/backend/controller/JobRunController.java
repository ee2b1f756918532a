package com.tradescan.backend.controller;

import com.tradescan.backend.model.JobRun;
import com.tradescan.backend.service.JobRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/job-runs")
@RequiredArgsConstructor
@Tag(name = "Job runs")
public class JobRunController {

    private final JobRunService jobRunService;

    @GetMapping
    @Operation(summary = "Recent scan and monitor runs, optionally for one profile")
    public ResponseEntity<List<JobRun>> list(@RequestParam(required = false) Long profileId,
                                             @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(profileId == null
                ? jobRunService.recent(limit)
                : jobRunService.forProfile(profileId, limit));
    }
}

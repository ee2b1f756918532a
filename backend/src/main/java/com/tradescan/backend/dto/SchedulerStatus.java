package com.tradescan.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStatus {

    private boolean running;
    private int activeTriggers;
    private List<Long> scheduledProfileIds;
    private List<Long> runningProfileIds;
    private Map<Long, Instant> nextRunAt;
}

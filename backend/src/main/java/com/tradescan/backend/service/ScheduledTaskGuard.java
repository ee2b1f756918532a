package com.tradescan.backend.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one tick of a background loop so that a failing tick is logged and the loop keeps its schedule.
 */
@Service
@Slf4j
public class ScheduledTaskGuard {

    public boolean run(String taskName, Runnable task) {
        try {
            task.run();
            return true;
        } catch (RuntimeException e) {
            log.error("Scheduled task failed task={}", taskName, e);
            return false;
        }
    }
}

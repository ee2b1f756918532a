package com.tradescan.backend.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "tradescan.scheduler")
@Validated
@Data
public class SchedulerProperties {

    @Min(1)
    private int defaultIntervalMinutes = 15;

    /** Restart profile triggers on boot when {@code scheduler_running} was left true. */
    private boolean resumeOnStartup = true;

    @Min(1)
    private int poolSize = 4;
}

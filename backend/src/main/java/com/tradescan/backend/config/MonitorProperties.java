package com.tradescan.backend.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "tradescan.monitor")
@Validated
@Data
public class MonitorProperties {

    private boolean autoStart = true;

    @Min(1)
    private long intervalSeconds = 60;

    @Min(1)
    private long minIntervalSeconds = 10;
}

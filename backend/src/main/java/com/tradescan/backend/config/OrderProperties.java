package com.tradescan.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "tradescan.orders")
@Data
public class OrderProperties {

    private boolean reconcileEnabled = true;

    private long reconcileIntervalMs = 15_000;

    private String timeInForce = "day";
}

package com.tradescan.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "tradescan.market")
@Data
public class MarketProperties {

    /** Exchange zone used to bucket daily and weekly spend. */
    private String zone = "America/New_York";

    private long clockCacheSeconds = 30;
}

package com.tradescan.backend.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "tradescan.scanner")
@Validated
@Data
public class ScannerProperties {

    private List<String> defaultUniverse = new ArrayList<>();

    @Min(1)
    private long fundamentalsTtlHours = 24;

    @Min(1)
    private long technicalsTtlHours = 1;

    @Min(30)
    private int historyBars = 250;

    /** Strike within this percent of the underlying counts as at-the-money. */
    private double atmBandPercent = 2.0;
}

package com.tradescan.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "tradescan.alpha-vantage")
@Data
public class AlphaVantageProperties {

    private String baseUrl = "https://www.alphavantage.co";
    private String apiKey;
}

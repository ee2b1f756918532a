package com.tradescan.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI tradeScanOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("TradeScan API")
                        .description("Screening profiles, scheduler, risk-gated trading and position monitoring")
                        .version("1.0"));
    }
}

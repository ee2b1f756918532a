package com.tradescan.backend.config;

import com.tradescan.backend.model.TradingMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "tradescan.alpaca")
@Data
public class AlpacaProperties {

    private String dataBaseUrl = "https://data.alpaca.markets";
    private String stockFeed = "iex";
    private String optionFeed = "indicative";
    private Account paper = new Account("https://paper-api.alpaca.markets");
    private Account live = new Account("https://api.alpaca.markets");

    public Account accountFor(TradingMode mode) {
        return mode == TradingMode.LIVE ? live : paper;
    }

    /** Market data is not mode specific; prefer live keys when configured. */
    public Account dataAccount() {
        return live.isConfigured() ? live : paper;
    }

    @Data
    public static class Account {
        private String baseUrl;
        private String keyId;
        private String secretKey;

        public Account() {
        }

        public Account(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public boolean isConfigured() {
            return keyId != null && !keyId.isBlank() && secretKey != null && !secretKey.isBlank();
        }
    }
}

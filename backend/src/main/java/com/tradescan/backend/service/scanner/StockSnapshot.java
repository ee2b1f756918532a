package com.tradescan.backend.service.scanner;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything known about one stock during a scan. Stored as the match snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StockSnapshot {

    private String symbol;
    private Double price;
    private Double bid;
    private Double ask;
    private Double open;
    private Double high;
    private Double low;
    private Double close;
    private Long volume;
    private Double dayChangePercent;

    private Double pe;
    private Double pb;
    private Double eps;
    private Double marketCap;
    private Double dividendYield;
    private Double beta;
    private Double debtToEquity;
    private Double currentRatio;
    private String sector;
    private String industry;

    private Double rsi;
    private Double sma20;
    private Double sma50;
    private Double sma200;
    private Double macd;
    private String macdSignal;
}

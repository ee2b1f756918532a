package com.tradescan.backend.dto;

import com.tradescan.backend.model.TradingMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitorStatus {

    private boolean running;
    private long intervalSeconds;
    private TradingMode tradingMode;
    private Instant lastCycleAt;
    private int lastCycleChecked;
    private int lastCycleCloses;
}

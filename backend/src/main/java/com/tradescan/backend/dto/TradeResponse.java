package com.tradescan.backend.dto;

import com.tradescan.backend.model.TradeRecord;
import com.tradescan.backend.model.TradeStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a trade request. {@code accepted=false} carries the local or broker rejection reason.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TradeResponse {

    private boolean accepted;
    private String reason;
    private TradeRecord trade;

    public static TradeResponse of(TradeRecord trade) {
        boolean accepted = trade.getStatus() != TradeStatus.REJECTED;
        return new TradeResponse(accepted, trade.getRejectionReason(), trade);
    }
}

package com.tradescan.backend.controller;

import com.tradescan.backend.dto.TradeRequest;
import com.tradescan.backend.dto.TradeResponse;
import com.tradescan.backend.model.TradeRecord;
import com.tradescan.backend.service.trading.PortfolioService;
import com.tradescan.backend.service.trading.TradeExecutor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/trades")
@RequiredArgsConstructor
@Tag(name = "Trades")
public class TradeController {

    private final TradeExecutor tradeExecutor;
    private final PortfolioService portfolioService;

    @PostMapping
    @Operation(summary = "Place a manual order in the current trading mode")
    @ApiResponse(responseCode = "201", description = "Order accepted and sent to the broker")
    @ApiResponse(responseCode = "422", description = "Order rejected by the risk gate or the broker")
    public ResponseEntity<TradeResponse> execute(@Valid @RequestBody TradeRequest request) {
        TradeResponse response = TradeResponse.of(tradeExecutor.executeTrade(request));
        HttpStatus status = response.isAccepted() ? HttpStatus.CREATED : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(response);
    }

    @GetMapping
    @Operation(summary = "Trade history of the current trading mode, newest first")
    public ResponseEntity<List<TradeRecord>> history(@RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(portfolioService.tradeHistory(limit));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TradeRecord> get(@PathVariable Long id) {
        return ResponseEntity.ok(portfolioService.trade(id));
    }
}

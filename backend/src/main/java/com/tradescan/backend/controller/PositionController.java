package com.tradescan.backend.controller;

import com.tradescan.backend.dto.PositionThresholdsRequest;
import com.tradescan.backend.dto.TradeResponse;
import com.tradescan.backend.model.ClosedPosition;
import com.tradescan.backend.model.Position;
import com.tradescan.backend.service.trading.PortfolioService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/positions")
@RequiredArgsConstructor
@Tag(name = "Positions")
public class PositionController {

    private final PortfolioService portfolioService;

    @GetMapping
    @Operation(summary = "Open and closing positions of the current trading mode")
    public ResponseEntity<List<Position>> list() {
        return ResponseEntity.ok(portfolioService.positions());
    }

    @PutMapping("/{id}/thresholds")
    @Operation(summary = "Adjust stop-loss and take-profit percentages")
    public ResponseEntity<Position> thresholds(@PathVariable Long id,
                                               @Valid @RequestBody PositionThresholdsRequest request) {
        return ResponseEntity.ok(portfolioService.updateThresholds(id, request));
    }

    @PostMapping("/{id}/close")
    @Operation(summary = "Close the full position at market")
    @ApiResponse(responseCode = "409", description = "The position is already being closed")
    public ResponseEntity<TradeResponse> close(@PathVariable Long id) {
        return ResponseEntity.ok(TradeResponse.of(portfolioService.closePosition(id)));
    }

    @GetMapping("/closed")
    public ResponseEntity<List<ClosedPosition>> closed(@RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(portfolioService.closedPositions(limit));
    }
}

package com.tradescan.backend.controller;

import com.tradescan.backend.model.TradingMode;
import com.tradescan.backend.service.brokerage.BrokerAccountService;
import com.tradescan.backend.service.brokerage.BrokerageProvider;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/account")
@RequiredArgsConstructor
@Tag(name = "Brokerage account")
public class AccountController {

    private final BrokerAccountService brokerAccountService;

    @GetMapping
    @Operation(summary = "Brokerage account of the current trading mode, or of the requested mode")
    public ResponseEntity<BrokerageProvider.BrokerAccount> get(@RequestParam(required = false) String mode) {
        BrokerageProvider.BrokerAccount account = mode == null
                ? brokerAccountService.currentAccount()
                : brokerAccountService.account(TradingMode.fromRequest(mode));
        return ResponseEntity.ok(account);
    }
}

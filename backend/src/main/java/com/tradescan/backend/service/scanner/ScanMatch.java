package com.tradescan.backend.service.scanner;

import com.tradescan.backend.model.AssetType;

/**
 * One matching instrument. {@code price} is the per-unit reference price (share price or option premium).
 */
public record ScanMatch(String symbol, AssetType assetType, Double price, Object snapshot) {}

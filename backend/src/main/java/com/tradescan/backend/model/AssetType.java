package com.tradescan.backend.model;

public enum AssetType {
    STOCK,
    CALL_OPTION,
    PUT_OPTION;

    public boolean isOption() {
        return this != STOCK;
    }

    /**
     * Shares controlled by one unit of this asset.
     */
    public int contractMultiplier() {
        return isOption() ? 100 : 1;
    }
}

package com.crabtrading.backend.dto;

public record PositionMark(
        String symbol,
        AssetClass assetClass,
        double qty,
        double avgCost,
        double lastPrice,
        double multiplier,
        double marketValue,
        double unrealizedPnl
) {

    public enum AssetClass {
        STOCK,
        CRYPTO,
        OPTION,
        PRE_IPO
    }
}

package com.crabtrading.backend.model;

public record PredictionHolding(double shares, double costBasis) {

    public PredictionHolding plus(double addedShares, double addedCost) {
        return new PredictionHolding(shares + addedShares, costBasis + addedCost);
    }
}

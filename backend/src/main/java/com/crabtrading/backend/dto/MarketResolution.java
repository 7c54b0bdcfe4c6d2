package com.crabtrading.backend.dto;

import java.util.List;

public record MarketResolution(String marketId, String winningOutcome, List<ResolutionPayout> payouts) {

    public double totalPayout() {
        return payouts.stream().mapToDouble(ResolutionPayout::payout).sum();
    }
}

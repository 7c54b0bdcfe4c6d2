package com.crabtrading.backend.dto;

public record Bet(
        String accountId,
        String marketId,
        String outcome,
        double amount,
        double odds,
        double shares,
        double cashAfter
) {
}

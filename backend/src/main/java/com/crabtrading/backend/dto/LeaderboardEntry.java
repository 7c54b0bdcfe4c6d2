package com.crabtrading.backend.dto;

public record LeaderboardEntry(
        int rank,
        String accountId,
        String displayName,
        String avatar,
        boolean test,
        boolean blocked,
        Valuation valuation
) {
}

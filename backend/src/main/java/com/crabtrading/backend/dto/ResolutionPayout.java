package com.crabtrading.backend.dto;

/**
 * Per-account settlement of a resolved market. {@code costBasis} is the total amount the
 * account had staked on the market across all outcomes.
 */
public record ResolutionPayout(String accountId, double payout, double costBasis) {
}

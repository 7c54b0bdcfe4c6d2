package com.crabtrading.backend.dto;

public record AccountRegistration(
        String accountId,
        String displayName,
        String apiKey,
        double startingCash
) {
}

package com.crabtrading.backend.dto;

import java.time.Instant;

public record MarkToMarketStatus(
        Instant lastAttemptAt,
        Instant lastSuccessAt,
        long intervalSeconds,
        int symbolsRefreshed,
        int marketsRefreshed
) {
}

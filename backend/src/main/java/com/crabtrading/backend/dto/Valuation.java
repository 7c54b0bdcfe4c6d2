package com.crabtrading.backend.dto;

import java.util.List;

public record Valuation(
        String accountId,
        double cash,
        double stockValue,
        double cryptoValue,
        double polyValue,
        double equity,
        double returnPct,
        double realizedPnl,
        double polyRealizedPnl,
        List<PositionMark> positions
) {
}

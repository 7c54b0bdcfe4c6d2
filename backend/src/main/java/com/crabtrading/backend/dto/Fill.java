package com.crabtrading.backend.dto;

import com.crabtrading.backend.model.OrderSide;

public record Fill(
        String accountId,
        String symbol,
        OrderSide side,
        double qty,
        double fillPrice,
        double multiplier,
        double notional,
        double realizedPnlDelta,
        double positionQty,
        double avgCost,
        double cashAfter,
        boolean accountBlocked
) {
}

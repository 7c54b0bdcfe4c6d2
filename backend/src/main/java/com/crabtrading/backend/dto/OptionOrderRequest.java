package com.crabtrading.backend.dto;

import com.crabtrading.backend.model.OrderSide;

import java.time.LocalDate;

/**
 * An order for a listed equity option, addressed by its contract terms rather than the
 * OCC symbol. {@code right} is {@code CALL}/{@code PUT} (or {@code C}/{@code P}).
 */
public record OptionOrderRequest(
        String underlying,
        LocalDate expiry,
        String right,
        double strike,
        OrderSide side,
        double qty
) {
}

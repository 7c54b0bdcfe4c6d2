package com.crabtrading.backend.model;

import java.util.Locale;
import java.util.Optional;

public enum OrderSide {
    BUY,
    SELL;

    public double signed(double qty) {
        return this == BUY ? qty : -qty;
    }

    public static Optional<OrderSide> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(OrderSide.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}

package com.crabtrading.backend.dto;

import com.crabtrading.backend.model.OrderSide;

public record OrderRequest(String symbol, OrderSide side, double qty) {
}

package com.crabtrading.backend.dto;

public record PriceQuote(String symbol, double price, String source) {
}

package com.crabtrading.backend.dto;

public record OrderReceipt(Fill fill, PriceSource priceSource, long eventId) {

    public enum PriceSource {
        LIVE,
        CACHE_FALLBACK
    }
}

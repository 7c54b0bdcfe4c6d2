package com.crabtrading.backend.dto;

import com.crabtrading.backend.model.PredictionMarket;

import java.util.List;

/**
 * Markets returned to a caller. {@code source} is the live feed name, or {@code cache} when the
 * feed could not be reached.
 */
public record MarketListing(List<PredictionMarket> markets, String source) {

    public static final String CACHE = "cache";

    public boolean fromCache() {
        return CACHE.equals(source);
    }
}

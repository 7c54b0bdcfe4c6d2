package com.crabtrading.backend.service.marketdata;

import com.crabtrading.backend.model.PredictionMarket;

import java.util.List;

/**
 * Source of open prediction markets with their current odds.
 */
public interface MarketListFeed {

    /**
     * Returns at most {@code limit} open markets. Outcome names are upper case and every odds value is positive.
     *
     * @throws com.crabtrading.backend.exception.MarketDataException when the upstream cannot be read
     */
    List<PredictionMarket> fetchMarkets(int limit);
}

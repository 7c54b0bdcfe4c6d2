package com.crabtrading.backend.service.marketdata;

import com.crabtrading.backend.dto.PriceQuote;

/**
 * Source of live prices for canonical ledger symbols.
 */
public interface PriceFeed {

    /**
     * @throws com.crabtrading.backend.exception.MarketDataException when no positive price is available
     */
    PriceQuote fetchPrice(String symbol);
}

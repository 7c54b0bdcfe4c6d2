package com.crabtrading.backend.service.marketdata;

import com.crabtrading.backend.config.MarketDataProperties;
import com.crabtrading.backend.dto.PriceQuote;
import com.crabtrading.backend.exception.MarketDataException;
import com.crabtrading.backend.service.execution.SymbolClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Latest trade prices from the Alpaca market data API, falling back to the latest quote.
 * Stocks use the configured feed, crypto pairs trade against USD, options are looked up by
 * their OCC symbol. Pre-IPO symbols have no live source.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlpacaPriceFeed implements PriceFeed {

    static final String FEED = "alpaca";

    private final MarketDataHttpClient httpClient;
    private final MarketDataProperties marketDataProperties;
    private final SymbolClassifier symbolClassifier;
    private final ObjectMapper objectMapper;

    @Override
    public PriceQuote fetchPrice(String symbol) {
        if (symbolClassifier.isPreIpo(symbol)) {
            throw new MarketDataException(MarketDataException.Kind.MISSING_PRICE, "No live price source for " + symbol);
        }
        if (symbolClassifier.isOption(symbol)) {
            return fetchOption(symbol);
        }
        if (symbolClassifier.isCrypto(symbol)) {
            return fetchCrypto(symbol);
        }
        return fetchStock(symbol);
    }

    private PriceQuote fetchStock(String symbol) {
        MarketDataProperties.Alpaca alpaca = marketDataProperties.getAlpaca();
        String base = alpaca.getDataBaseUrl() + "/v2/stocks/" + symbol;
        String feedParam = "?feed=" + alpaca.getStockFeed();
        try {
            JsonNode trade = read(base + "/trades/latest" + feedParam).path("trade");
            double price = trade.path("p").asDouble(0.0);
            if (price > 0) {
                return new PriceQuote(symbol, price, "alpaca_trade");
            }
        } catch (MarketDataException e) {
            log.debug("Stock trade lookup failed symbol={} kind={}", symbol, e.getKind());
        }
        JsonNode quote = read(base + "/quotes/latest" + feedParam).path("quote");
        return fromQuote(symbol, quote);
    }

    private PriceQuote fetchCrypto(String symbol) {
        String pair = cryptoPair(symbol);
        String base = marketDataProperties.getAlpaca().getDataBaseUrl() + "/v1beta3/crypto/us/latest";
        try {
            JsonNode trade = row(read(base + "/trades?symbols=" + pair).path("trades"), pair);
            double price = trade.path("p").asDouble(0.0);
            if (price > 0) {
                return new PriceQuote(symbol, price, "alpaca_trade");
            }
        } catch (MarketDataException e) {
            log.debug("Crypto trade lookup failed symbol={} kind={}", symbol, e.getKind());
        }
        JsonNode quote = row(read(base + "/quotes?symbols=" + pair).path("quotes"), pair);
        return fromQuote(symbol, quote);
    }

    private PriceQuote fetchOption(String symbol) {
        String base = marketDataProperties.getAlpaca().getDataBaseUrl() + "/v1beta1/options";
        try {
            JsonNode trade = row(read(base + "/trades/latest?symbols=" + symbol).path("trades"), symbol);
            double price = trade.path("p").asDouble(0.0);
            if (price > 0) {
                return new PriceQuote(symbol, price, "alpaca_trade");
            }
        } catch (MarketDataException e) {
            log.debug("Option trade lookup failed symbol={} kind={}", symbol, e.getKind());
        }
        JsonNode quote = row(read(base + "/quotes/latest?symbols=" + symbol).path("quotes"), symbol);
        return fromQuote(symbol, quote);
    }

    /**
     * Mid of bid and ask when both are positive, otherwise whichever side is.
     */
    private PriceQuote fromQuote(String symbol, JsonNode quote) {
        double ask = quote.path("ap").asDouble(0.0);
        double bid = quote.path("bp").asDouble(0.0);
        double price;
        if (ask > 0 && bid > 0) {
            price = (ask + bid) / 2.0;
        } else {
            price = ask > 0 ? ask : bid;
        }
        if (!(price > 0)) {
            throw new MarketDataException(MarketDataException.Kind.MISSING_PRICE, "No positive price for " + symbol);
        }
        return new PriceQuote(symbol, price, "alpaca_quote");
    }

    private JsonNode row(JsonNode rows, String key) {
        JsonNode row = rows.path(key);
        if (row.isObject()) {
            return row;
        }
        if (rows.isObject() && rows.size() == 1) {
            Iterator<JsonNode> values = rows.elements();
            return values.next();
        }
        return row;
    }

    private JsonNode read(String url) {
        String body = httpClient.get(FEED, url, headers());
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MarketDataException(MarketDataException.Kind.INVALID_RESPONSE, "Unparseable response from " + FEED, e);
        }
    }

    private Map<String, String> headers() {
        MarketDataProperties.Alpaca alpaca = marketDataProperties.getAlpaca();
        Map<String, String> headers = new LinkedHashMap<>();
        if (alpaca.getApiKey() != null && !alpaca.getApiKey().isBlank()) {
            headers.put("APCA-API-KEY-ID", alpaca.getApiKey());
        }
        if (alpaca.getApiSecret() != null && !alpaca.getApiSecret().isBlank()) {
            headers.put("APCA-API-SECRET-KEY", alpaca.getApiSecret());
        }
        return headers;
    }

    static String cryptoPair(String symbol) {
        if (symbol.endsWith("USD")) {
            return symbol.substring(0, symbol.length() - 3) + "/USD";
        }
        if (symbol.endsWith("BTC") || symbol.endsWith("ETH")) {
            return symbol.substring(0, symbol.length() - 3) + "/" + symbol.substring(symbol.length() - 3);
        }
        return symbol + "/USD";
    }
}

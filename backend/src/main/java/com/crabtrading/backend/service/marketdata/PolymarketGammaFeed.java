package com.crabtrading.backend.service.marketdata;

import com.crabtrading.backend.config.MarketDataProperties;
import com.crabtrading.backend.exception.MarketDataException;
import com.crabtrading.backend.model.PredictionMarket;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Open markets from the Polymarket Gamma API. Outcome names and prices arrive either as JSON
 * arrays or as strings holding a JSON array.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolymarketGammaFeed implements MarketListFeed {

    public static final String SOURCE = "polymarket_gamma";
    static final int MAX_LIMIT = 100;

    private final MarketDataHttpClient httpClient;
    private final MarketDataProperties marketDataProperties;
    private final ObjectMapper objectMapper;

    @Override
    public List<PredictionMarket> fetchMarkets(int limit) {
        int safeLimit = Math.max(1, Math.min(limit, MAX_LIMIT));
        String url = marketDataProperties.getPolymarket().getGammaBaseUrl()
                + "/markets?active=true&closed=false&limit=" + safeLimit;
        String body = httpClient.get(SOURCE, url, Map.of("User-Agent", "CrabTrading/1.0"));
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MarketDataException(MarketDataException.Kind.INVALID_RESPONSE, "Unparseable market list", e);
        }
        if (!root.isArray()) {
            throw new MarketDataException(MarketDataException.Kind.INVALID_RESPONSE, "Market list is not an array");
        }
        List<PredictionMarket> markets = new ArrayList<>();
        for (JsonNode item : root) {
            PredictionMarket market = toMarket(item);
            if (market != null) {
                markets.add(market);
            }
        }
        log.debug("Fetched {} open markets (requested {})", markets.size(), safeLimit);
        return markets;
    }

    private PredictionMarket toMarket(JsonNode item) {
        if (!item.isObject()) {
            return null;
        }
        String marketId = firstText(item, "id", "conditionId", "slug");
        if (marketId.isEmpty()) {
            return null;
        }
        String question = firstText(item, "question", "title", "slug");
        List<JsonNode> names = asList(item.get("outcomes"));
        List<JsonNode> prices = asList(item.get("outcomePrices"));
        Map<String, Double> outcomes = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i).asText("").trim().toUpperCase(Locale.ROOT);
            if (name.isEmpty()) {
                continue;
            }
            double price = i < prices.size() ? parsePrice(prices.get(i)) : 0.0;
            if (price > 0) {
                outcomes.put(name, price);
            }
        }
        if (outcomes.isEmpty()) {
            return null;
        }
        return PredictionMarket.builder()
                .marketId(marketId)
                .question(question.isEmpty() ? marketId : question)
                .outcomes(outcomes)
                .resolved(false)
                .winningOutcome("")
                .source(SOURCE)
                .build();
    }

    private List<JsonNode> asList(JsonNode node) {
        List<JsonNode> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        JsonNode array = node;
        if (node.isTextual()) {
            try {
                array = objectMapper.readTree(node.asText());
            } catch (JsonProcessingException e) {
                log.debug("Ignoring malformed outcome list {}: {}", node.asText(), e.getOriginalMessage());
                return values;
            }
        }
        if (array.isArray()) {
            array.forEach(values::add);
        }
        return values;
    }

    private double parsePrice(JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        try {
            return Double.parseDouble(node.asText("").trim());
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private String firstText(JsonNode item, String... fields) {
        for (String field : fields) {
            JsonNode value = item.get(field);
            if (value != null && !value.isNull()) {
                String text = value.asText("").trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return "";
    }
}

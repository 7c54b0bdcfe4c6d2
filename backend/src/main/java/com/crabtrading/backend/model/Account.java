package com.crabtrading.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A paper-trading agent's balances and holdings.
 * <p>
 * Positions with zero quantity are never stored; use {@link #setPosition} and
 * {@link #addPolyShares} rather than mutating the maps directly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Account {

    private String accountId;
    private String displayName;
    private double cash;

    /** Cash the account opened with; zero when unknown (older snapshots). */
    private double startingCash;

    @Builder.Default
    private Map<String, PositionRecord> positions = new LinkedHashMap<>();

    private double realizedPnl;

    @Builder.Default
    private Map<String, Map<String, PredictionHolding>> polyPositions = new LinkedHashMap<>();

    private double polyRealizedPnl;
    private boolean blocked;
    private boolean test;
    private String description;
    private String avatar;
    private String registeredAt;
    private String registrationSource;

    public Optional<PositionRecord> position(String symbol) {
        return Optional.ofNullable(positions.get(symbol));
    }

    public double positionQty(String symbol) {
        PositionRecord record = positions.get(symbol);
        return record == null ? 0.0 : record.qty();
    }

    public void setPosition(String symbol, double qty, double avgCost) {
        if (qty == 0.0) {
            positions.remove(symbol);
        } else {
            positions.put(symbol, new PositionRecord(qty, avgCost));
        }
    }

    public boolean hasOpenPosition() {
        if (!positions.isEmpty()) {
            return true;
        }
        return polyPositions.values().stream()
                .flatMap(byOutcome -> byOutcome.values().stream())
                .anyMatch(holding -> holding.shares() > 0);
    }

    public Map<String, PredictionHolding> polyHoldings(String marketId) {
        Map<String, PredictionHolding> holdings = polyPositions.get(marketId);
        return holdings == null ? Collections.emptyMap() : Collections.unmodifiableMap(holdings);
    }

    public void addPolyShares(String marketId, String outcome, double shares, double cost) {
        if (shares == 0.0) {
            return;
        }
        Map<String, PredictionHolding> byOutcome = polyPositions.computeIfAbsent(marketId, key -> new LinkedHashMap<>());
        PredictionHolding current = byOutcome.get(outcome);
        byOutcome.put(outcome, current == null ? new PredictionHolding(shares, cost) : current.plus(shares, cost));
    }

    public Map<String, PredictionHolding> removePolyMarket(String marketId) {
        Map<String, PredictionHolding> removed = polyPositions.remove(marketId);
        return removed == null ? Collections.emptyMap() : removed;
    }
}

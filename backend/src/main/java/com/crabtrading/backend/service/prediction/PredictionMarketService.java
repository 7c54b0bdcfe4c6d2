package com.crabtrading.backend.service.prediction;

import com.crabtrading.backend.config.LedgerProperties;
import com.crabtrading.backend.dto.Bet;
import com.crabtrading.backend.dto.LedgerResult;
import com.crabtrading.backend.dto.MarketListing;
import com.crabtrading.backend.dto.MarketResolution;
import com.crabtrading.backend.dto.ResolutionPayout;
import com.crabtrading.backend.exception.LedgerErrorCode;
import com.crabtrading.backend.exception.MarketDataException;
import com.crabtrading.backend.model.ActivityType;
import com.crabtrading.backend.model.LedgerState;
import com.crabtrading.backend.model.PredictionMarket;
import com.crabtrading.backend.service.LedgerMetrics;
import com.crabtrading.backend.service.LedgerStore;
import com.crabtrading.backend.service.marketdata.MarketListFeed;
import com.crabtrading.backend.service.marketdata.PolymarketGammaFeed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class PredictionMarketService {

    private final LedgerStore ledgerStore;
    private final PredictionMarketEngine predictionMarketEngine;
    private final MarketListFeed marketListFeed;
    private final LedgerProperties ledgerProperties;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Refreshes open markets from the feed and returns them. Falls back to every cached market
     * when the feed fails.
     */
    public MarketListing listMarkets() {
        int limit = ledgerProperties.getMarkets().getListLimit();
        try {
            List<PredictionMarket> fetched = marketListFeed.fetchMarkets(limit);
            List<PredictionMarket> stored = ledgerStore.withLock(() -> {
                List<PredictionMarket> result = upsert(ledgerStore.state(), fetched);
                ledgerStore.commit();
                return result;
            });
            return new MarketListing(stored, PolymarketGammaFeed.SOURCE);
        } catch (MarketDataException e) {
            log.warn("Market list refresh failed, serving cache kind={} message={}", e.getKind(), e.getMessage());
            List<PredictionMarket> cached = ledgerStore.withLock(() -> copies(ledgerStore.state().getMarkets().values()));
            return new MarketListing(cached, MarketListing.CACHE);
        }
    }

    public Optional<PredictionMarket> market(String marketId) {
        if (marketId == null) {
            return Optional.empty();
        }
        return ledgerStore.withLock(() -> Optional.ofNullable(ledgerStore.state().getMarkets().get(marketId.trim()))
                .map(PredictionMarketService::copy));
    }

    public LedgerResult<Bet> placeBet(String identifier, String marketId, String outcome, double amount) {
        Optional<String> accountId = ledgerStore.resolve(identifier);
        if (accountId.isEmpty()) {
            return rejected("bet", LedgerResult.reject(LedgerErrorCode.AGENT_NOT_FOUND));
        }
        refreshQuietly();
        return ledgerStore.withLock(() -> {
            LedgerResult<Bet> placed = predictionMarketEngine.placeBet(ledgerStore.state(), accountId.get(),
                    marketId, outcome, amount);
            if (placed.isRejected()) {
                return rejected("bet", placed);
            }
            Bet bet = placed.value();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("market_id", bet.marketId());
            details.put("outcome", bet.outcome());
            details.put("amount", bet.amount());
            details.put("odds", bet.odds());
            details.put("shares", bet.shares());
            ledgerStore.recordEvent(ActivityType.POLY_BET, bet.accountId(), details);
            ledgerStore.commit();
            ledgerMetrics.recordBetPlaced();
            log.info("Bet placed account={} market={} outcome={} amount={} odds={}",
                    bet.accountId(), bet.marketId(), bet.outcome(), bet.amount(), bet.odds());
            return placed;
        });
    }

    public LedgerResult<MarketResolution> resolveMarket(String marketId, String winningOutcome) {
        return ledgerStore.withLock(() -> {
            LedgerResult<MarketResolution> resolved = predictionMarketEngine.resolveMarket(ledgerStore.state(),
                    marketId, winningOutcome);
            if (resolved.isRejected()) {
                return rejected("resolve", resolved);
            }
            MarketResolution resolution = resolved.value();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("market_id", resolution.marketId());
            details.put("winning_outcome", resolution.winningOutcome());
            details.put("holders", resolution.payouts().size());
            details.put("total_payout", resolution.totalPayout());
            ledgerStore.recordEvent(ActivityType.POLY_RESOLVE, null, LedgerStore.ADMIN_ACTOR, details);
            for (ResolutionPayout payout : resolution.payouts()) {
                Map<String, Object> accountDetails = new LinkedHashMap<>();
                accountDetails.put("market_id", resolution.marketId());
                accountDetails.put("winning_outcome", resolution.winningOutcome());
                accountDetails.put("payout", payout.payout());
                accountDetails.put("cost_basis", payout.costBasis());
                ledgerStore.recordEvent(ActivityType.POLY_RESOLVED, payout.accountId(), accountDetails);
            }
            ledgerStore.commit();
            ledgerMetrics.recordMarketResolved();
            return resolved;
        });
    }

    private void refreshQuietly() {
        try {
            List<PredictionMarket> fetched = marketListFeed.fetchMarkets(ledgerProperties.getMarkets().getListLimit());
            ledgerStore.runLocked(() -> {
                upsert(ledgerStore.state(), fetched);
                ledgerStore.commit();
            });
        } catch (MarketDataException e) {
            log.debug("Pre-bet market refresh skipped kind={} message={}", e.getKind(), e.getMessage());
        }
    }

    /**
     * Resolved markets are never overwritten by feed data.
     */
    static List<PredictionMarket> upsert(LedgerState state, List<PredictionMarket> fetched) {
        List<PredictionMarket> stored = new ArrayList<>();
        for (PredictionMarket market : fetched) {
            if (market.getMarketId() == null || market.getOutcomes().isEmpty()) {
                continue;
            }
            PredictionMarket existing = state.getMarkets().get(market.getMarketId());
            if (existing != null && existing.isResolved()) {
                stored.add(copy(existing));
                continue;
            }
            PredictionMarket updated = copy(market);
            updated.setResolved(false);
            state.getMarkets().put(updated.getMarketId(), updated);
            stored.add(copy(updated));
        }
        return stored;
    }

    private static List<PredictionMarket> copies(Iterable<PredictionMarket> markets) {
        List<PredictionMarket> result = new ArrayList<>();
        markets.forEach(market -> result.add(copy(market)));
        return result;
    }

    static PredictionMarket copy(PredictionMarket market) {
        return PredictionMarket.builder()
                .marketId(market.getMarketId())
                .question(market.getQuestion())
                .outcomes(new LinkedHashMap<>(market.getOutcomes()))
                .resolved(market.isResolved())
                .winningOutcome(market.getWinningOutcome())
                .source(market.getSource())
                .build();
    }

    private <T> LedgerResult<T> rejected(String operation, LedgerResult<T> result) {
        ledgerMetrics.recordReject(operation, result.error().code());
        return result;
    }
}

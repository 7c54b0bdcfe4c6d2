package com.crabtrading.backend.service.valuation;

import com.crabtrading.backend.config.LedgerProperties;
import com.crabtrading.backend.dto.MarkToMarketStatus;
import com.crabtrading.backend.dto.PriceQuote;
import com.crabtrading.backend.dto.RefreshOutcome;
import com.crabtrading.backend.exception.MarketDataException;
import com.crabtrading.backend.model.Account;
import com.crabtrading.backend.model.LedgerState;
import com.crabtrading.backend.model.PredictionHolding;
import com.crabtrading.backend.model.PredictionMarket;
import com.crabtrading.backend.service.LedgerStore;
import com.crabtrading.backend.service.execution.SymbolClassifier;
import com.crabtrading.backend.service.marketdata.MarketListFeed;
import com.crabtrading.backend.service.marketdata.PriceFeed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Refreshes last prices for held symbols and odds for held markets, at most once per refresh
 * interval. Feed calls run outside the ledger lock; a symbol whose fetch fails keeps its stale
 * price.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarkToMarketService {

    static final int MARKET_FETCH_LIMIT = 100;

    private final LedgerStore ledgerStore;
    private final PriceFeed priceFeed;
    private final MarketListFeed marketListFeed;
    private final SymbolClassifier symbolClassifier;
    private final LedgerProperties ledgerProperties;

    private final ReentrantLock refreshLock = new ReentrantLock();
    private final AtomicReference<Instant> lastAttemptAt = new AtomicReference<>();
    private final AtomicReference<Instant> lastSuccessAt = new AtomicReference<>();
    private final AtomicReference<RefreshOutcome> lastOutcome = new AtomicReference<>(RefreshOutcome.skipped());

    public RefreshOutcome refreshIfDue(boolean force) {
        return refreshIfDue(force, Instant.now());
    }

    RefreshOutcome refreshIfDue(boolean force, Instant now) {
        LedgerProperties.MarkToMarket config = ledgerProperties.getMarkToMarket();
        if (!force && !config.isEnabled()) {
            return RefreshOutcome.skipped();
        }
        Instant previous = lastAttemptAt.get();
        if (!force && previous != null && now.isBefore(previous.plusSeconds(config.getRefreshSeconds()))) {
            return RefreshOutcome.skipped();
        }
        if (!refreshLock.tryLock()) {
            log.debug("Mark-to-market already running, skipping");
            return RefreshOutcome.skipped();
        }
        try {
            lastAttemptAt.set(now);
            RefreshOutcome outcome = refresh(config.getMaxSymbols());
            lastSuccessAt.set(now);
            lastOutcome.set(outcome);
            return outcome;
        } finally {
            refreshLock.unlock();
        }
    }

    public MarkToMarketStatus status() {
        RefreshOutcome outcome = lastOutcome.get();
        return new MarkToMarketStatus(lastAttemptAt.get(), lastSuccessAt.get(),
                ledgerProperties.getMarkToMarket().getRefreshSeconds(),
                outcome.symbolsRefreshed(), outcome.marketsRefreshed());
    }

    private RefreshOutcome refresh(int maxSymbols) {
        Tracked tracked = ledgerStore.withLock(() -> collect(ledgerStore.state(), maxSymbols));

        Map<String, Double> prices = new LinkedHashMap<>();
        for (String symbol : tracked.symbols()) {
            try {
                PriceQuote quote = priceFeed.fetchPrice(symbol);
                if (quote != null && quote.price() > 0) {
                    prices.put(symbol, quote.price());
                }
            } catch (MarketDataException e) {
                log.debug("Mark-to-market price skipped symbol={} kind={}", symbol, e.getKind());
            }
        }

        List<PredictionMarket> markets = new ArrayList<>();
        if (!tracked.marketIds().isEmpty()) {
            try {
                for (PredictionMarket market : marketListFeed.fetchMarkets(MARKET_FETCH_LIMIT)) {
                    if (tracked.marketIds().contains(market.getMarketId())) {
                        markets.add(market);
                    }
                }
            } catch (MarketDataException e) {
                log.debug("Mark-to-market market refresh skipped kind={}", e.getKind());
            }
        }

        if (prices.isEmpty() && markets.isEmpty()) {
            return new RefreshOutcome(true, 0, 0, false);
        }
        return ledgerStore.withLock(() -> {
            LedgerState state = ledgerStore.state();
            int symbolsChanged = 0;
            for (Map.Entry<String, Double> entry : prices.entrySet()) {
                Double old = state.getPrices().put(entry.getKey(), entry.getValue());
                if (old == null || old.doubleValue() != entry.getValue()) {
                    symbolsChanged++;
                }
            }
            int marketsChanged = 0;
            for (PredictionMarket fetched : markets) {
                PredictionMarket existing = state.getMarkets().get(fetched.getMarketId());
                if (existing == null || existing.isResolved()) {
                    continue;
                }
                if (!existing.getOutcomes().equals(fetched.getOutcomes())) {
                    existing.setOutcomes(new LinkedHashMap<>(fetched.getOutcomes()));
                    marketsChanged++;
                }
                if (fetched.getQuestion() != null) {
                    existing.setQuestion(fetched.getQuestion());
                }
            }
            boolean changed = symbolsChanged > 0 || marketsChanged > 0;
            if (changed) {
                ledgerStore.commit();
            }
            log.info("Mark-to-market refreshed symbols={}/{} markets={}/{} persisted={}",
                    symbolsChanged, tracked.symbols().size(), marketsChanged, tracked.marketIds().size(), changed);
            return new RefreshOutcome(true, symbolsChanged, marketsChanged, changed);
        });
    }

    private Tracked collect(LedgerState state, int maxSymbols) {
        Set<String> symbols = new TreeSet<>();
        Set<String> marketIds = new TreeSet<>();
        for (Account account : state.getAccounts().values()) {
            account.getPositions().forEach((symbol, position) -> {
                if (position.qty() != 0.0 && !symbolClassifier.isPreIpo(symbol)) {
                    symbols.add(symbol);
                }
            });
            for (Map.Entry<String, Map<String, PredictionHolding>> entry : account.getPolyPositions().entrySet()) {
                PredictionMarket market = state.getMarkets().get(entry.getKey());
                boolean held = entry.getValue().values().stream().anyMatch(holding -> holding.shares() > 0);
                if (held && market != null && !market.isResolved()) {
                    marketIds.add(entry.getKey());
                }
            }
        }
        List<String> limited = new ArrayList<>(symbols);
        if (limited.size() > maxSymbols) {
            limited = new ArrayList<>(limited.subList(0, maxSymbols));
        }
        return new Tracked(List.copyOf(limited), Set.copyOf(marketIds));
    }

    private record Tracked(List<String> symbols, Set<String> marketIds) {
    }
}

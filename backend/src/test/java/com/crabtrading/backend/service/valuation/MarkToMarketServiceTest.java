package com.crabtrading.backend.service.valuation;

import com.crabtrading.backend.config.LedgerProperties;
import com.crabtrading.backend.dto.PriceQuote;
import com.crabtrading.backend.dto.RefreshOutcome;
import com.crabtrading.backend.exception.MarketDataException;
import com.crabtrading.backend.model.Account;
import com.crabtrading.backend.model.LedgerState;
import com.crabtrading.backend.model.PredictionMarket;
import com.crabtrading.backend.service.LedgerStore;
import com.crabtrading.backend.service.LedgerStoreTestSupport;
import com.crabtrading.backend.service.execution.SymbolClassifier;
import com.crabtrading.backend.service.marketdata.MarketListFeed;
import com.crabtrading.backend.service.marketdata.PriceFeed;
import com.crabtrading.backend.service.persistence.LedgerPersistenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MarkToMarketServiceTest {

    private static final Instant T0 = Instant.parse("2026-01-05T14:00:00Z");

    @Mock
    private PriceFeed priceFeed;

    @Mock
    private MarketListFeed marketListFeed;

    private LedgerProperties properties;
    private LedgerPersistenceService persistence;
    private LedgerStore ledgerStore;
    private MarkToMarketService service;
    private String accountId;

    @BeforeEach
    void setUp() {
        properties = new LedgerProperties();
        persistence = LedgerStoreTestSupport.emptyPersistence();
        ledgerStore = LedgerStoreTestSupport.newStore(properties, persistence);
        service = new MarkToMarketService(ledgerStore, priceFeed, marketListFeed, new SymbolClassifier(), properties);
        accountId = ledgerStore.createAccount("holder").orElseThrow().accountId();
        ledgerStore.runLocked(() -> {
            Account account = ledgerStore.state().account(accountId).orElseThrow();
            account.setPosition("AAPL", 1, 100);
            account.setPosition("MSFT", 1, 50);
            account.setPosition("PRE:OPENAI", 1, 10);
            ledgerStore.state().getPrices().put("AAPL", 100.0);
            ledgerStore.state().getPrices().put("MSFT", 50.0);
        });
    }

    @Test
    void refreshUpdatesHeldSymbolsAndKeepsStalePriceOnFailure() {
        when(priceFeed.fetchPrice("AAPL")).thenReturn(new PriceQuote("AAPL", 105.0, "alpaca_trade"));
        when(priceFeed.fetchPrice("MSFT")).thenThrow(new MarketDataException(MarketDataException.Kind.UNREACHABLE, "x"));

        RefreshOutcome outcome = service.refreshIfDue(false, T0);

        assertThat(outcome.attempted()).isTrue();
        assertThat(outcome.symbolsRefreshed()).isEqualTo(1);
        assertThat(outcome.persisted()).isTrue();
        assertThat(ledgerStore.lastPrice("AAPL")).contains(105.0);
        assertThat(ledgerStore.lastPrice("MSFT")).contains(50.0);
        verify(priceFeed, never()).fetchPrice("PRE:OPENAI");
        verifyNoInteractions(marketListFeed);
        assertThat(service.status().lastSuccessAt()).isEqualTo(T0);
    }

    @Test
    void gateSkipsUntilIntervalElapsesUnlessForced() {
        when(priceFeed.fetchPrice(any())).thenReturn(new PriceQuote("AAPL", 100.0, "alpaca_trade"));

        assertThat(service.refreshIfDue(false, T0).attempted()).isTrue();
        assertThat(service.refreshIfDue(false, T0.plusSeconds(10)).attempted()).isFalse();
        assertThat(service.refreshIfDue(true, T0.plusSeconds(10)).attempted()).isTrue();
        assertThat(service.refreshIfDue(false, T0.plusSeconds(10 + properties.getMarkToMarket().getRefreshSeconds()))
                .attempted()).isTrue();
    }

    @Test
    void unchangedPricesAreNotPersisted() {
        when(priceFeed.fetchPrice("AAPL")).thenReturn(new PriceQuote("AAPL", 100.0, "alpaca_trade"));
        when(priceFeed.fetchPrice("MSFT")).thenReturn(new PriceQuote("MSFT", 50.0, "alpaca_trade"));

        RefreshOutcome outcome = service.refreshIfDue(true, T0);

        assertThat(outcome.persisted()).isFalse();
        verify(persistence, times(1)).save(any());
    }

    @Test
    void disabledRefreshOnlyRunsWhenForced() {
        properties.getMarkToMarket().setEnabled(false);

        assertThat(service.refreshIfDue(false, T0)).isEqualTo(RefreshOutcome.skipped());
        verifyNoInteractions(priceFeed);
    }

    @Test
    void heldMarketOddsAreRefreshedButResolvedMarketsAreLeftAlone() {
        when(priceFeed.fetchPrice(any())).thenThrow(new MarketDataException(MarketDataException.Kind.UNREACHABLE, "x"));
        ledgerStore.runLocked(() -> {
            LedgerState state = ledgerStore.state();
            state.getMarkets().put("open", market("open", 0.3, false));
            state.getMarkets().put("done", market("done", 0.3, true));
            Account account = state.account(accountId).orElseThrow();
            account.addPolyShares("open", "YES", 10, 3);
            account.addPolyShares("done", "YES", 10, 3);
        });
        when(marketListFeed.fetchMarkets(anyInt())).thenReturn(List.of(market("open", 0.6, false), market("done", 0.9, false)));

        RefreshOutcome outcome = service.refreshIfDue(true, T0);

        assertThat(outcome.marketsRefreshed()).isEqualTo(1);
        ledgerStore.runLocked(() -> {
            assertThat(ledgerStore.state().getMarkets().get("open").getOutcomes()).containsEntry("YES", 0.6);
            assertThat(ledgerStore.state().getMarkets().get("done").getOutcomes()).containsEntry("YES", 0.3);
            assertThat(ledgerStore.state().getMarkets().get("done").isResolved()).isTrue();
        });
    }

    private static PredictionMarket market(String id, double yes, boolean resolved) {
        Map<String, Double> outcomes = new LinkedHashMap<>();
        outcomes.put("YES", yes);
        outcomes.put("NO", 1.0 - yes);
        return PredictionMarket.builder().marketId(id).question(id).outcomes(outcomes).resolved(resolved).build();
    }
}

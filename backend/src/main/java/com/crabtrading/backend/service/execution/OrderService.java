package com.crabtrading.backend.service.execution;

import com.crabtrading.backend.dto.Fill;
import com.crabtrading.backend.dto.LedgerResult;
import com.crabtrading.backend.dto.OptionOrderRequest;
import com.crabtrading.backend.dto.OrderReceipt;
import com.crabtrading.backend.dto.OrderRequest;
import com.crabtrading.backend.dto.PriceQuote;
import com.crabtrading.backend.exception.LedgerErrorCode;
import com.crabtrading.backend.exception.MarketDataException;
import com.crabtrading.backend.model.ActivityEvent;
import com.crabtrading.backend.model.ActivityType;
import com.crabtrading.backend.service.LedgerMetrics;
import com.crabtrading.backend.service.LedgerStore;
import com.crabtrading.backend.service.marketdata.PriceFeed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Places market orders for an account: prices the symbol outside the ledger lock, then fills,
 * records and persists it under the lock.
 * <p>
 * When the live feed fails the last cached price is used; with no cached price the order
 * fails closed with {@code market_data_unavailable}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderService {

    private final LedgerStore ledgerStore;
    private final ExecutionEngine executionEngine;
    private final SymbolClassifier symbolClassifier;
    private final PriceFeed priceFeed;
    private final LedgerMetrics ledgerMetrics;

    public LedgerResult<OrderReceipt> placeOrder(String identifier, OrderRequest request) {
        Optional<String> accountId = ledgerStore.resolve(identifier);
        if (accountId.isEmpty()) {
            return rejected(LedgerErrorCode.AGENT_NOT_FOUND, null);
        }
        if (request == null || request.side() == null) {
            return rejected(LedgerErrorCode.INVALID_ORDER, "side is required");
        }
        LedgerResult<String> normalized = symbolClassifier.normalize(request.symbol());
        if (normalized.isRejected()) {
            return normalized.asRejection();
        }
        String symbol = normalized.value();
        if (!(request.qty() > 0) || Double.isInfinite(request.qty())) {
            return rejected(LedgerErrorCode.INVALID_ORDER, "qty must be positive");
        }

        PricedSymbol priced = price(symbol);
        if (priced == null) {
            return rejected(LedgerErrorCode.MARKET_DATA_UNAVAILABLE, "no live or cached price for " + symbol);
        }
        double multiplier = symbolClassifier.contractMultiplier(symbol);

        return ledgerStore.withLock(() -> {
            LedgerResult<Fill> filled = executionEngine.executeOrder(ledgerStore.state(), accountId.get(), symbol,
                    request.side(), request.qty(), priced.price(), multiplier);
            if (filled.isRejected()) {
                if (filled.error() == LedgerErrorCode.RISK_REJECT_MAX_DAILY_LOSS) {
                    ledgerStore.commit();
                }
                return filled.<OrderReceipt>asRejection();
            }
            Fill fill = filled.value();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("symbol", symbol);
            details.put("side", fill.side().name());
            details.put("qty", fill.qty());
            details.put("fill_price", fill.fillPrice());
            details.put("multiplier", fill.multiplier());
            details.put("notional", fill.notional());
            details.put("realized_pnl_delta", fill.realizedPnlDelta());
            details.put("price_source", priced.source().name().toLowerCase(Locale.ROOT));
            ActivityEvent event = ledgerStore.recordEvent(ActivityType.STOCK_ORDER, fill.accountId(), details);
            ledgerStore.commit();
            log.info("Order filled account={} symbol={} side={} qty={} price={} source={}",
                    fill.accountId(), symbol, fill.side(), fill.qty(), fill.fillPrice(), priced.source());
            return LedgerResult.ok(new OrderReceipt(fill, priced.source(), event.getId()));
        });
    }

    public LedgerResult<OrderReceipt> placeOptionOrder(String identifier, OptionOrderRequest request) {
        if (request == null) {
            return rejected(LedgerErrorCode.INVALID_ORDER, "order is required");
        }
        LedgerResult<String> occ = symbolClassifier.buildOptionSymbol(
                request.underlying(), request.expiry(), request.right(), request.strike());
        if (occ.isRejected()) {
            return occ.asRejection();
        }
        return placeOrder(identifier, new OrderRequest(occ.value(), request.side(), request.qty()));
    }

    private PricedSymbol price(String symbol) {
        try {
            PriceQuote quote = priceFeed.fetchPrice(symbol);
            if (quote != null && quote.price() > 0) {
                return new PricedSymbol(quote.price(), OrderReceipt.PriceSource.LIVE);
            }
            log.warn("Live feed returned no usable price symbol={}", symbol);
        } catch (MarketDataException e) {
            log.warn("Live price unavailable symbol={} kind={} message={}", symbol, e.getKind(), e.getMessage());
        }
        return ledgerStore.lastPrice(symbol)
                .map(cached -> new PricedSymbol(cached, OrderReceipt.PriceSource.CACHE_FALLBACK))
                .orElse(null);
    }

    private LedgerResult<OrderReceipt> rejected(LedgerErrorCode code, String message) {
        ledgerMetrics.recordReject("order", code.code());
        return message == null ? LedgerResult.reject(code) : LedgerResult.reject(code, message);
    }

    private record PricedSymbol(double price, OrderReceipt.PriceSource source) {
    }
}

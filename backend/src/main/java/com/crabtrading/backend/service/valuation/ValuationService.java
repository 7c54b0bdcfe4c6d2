package com.crabtrading.backend.service.valuation;

import com.crabtrading.backend.config.LedgerProperties;
import com.crabtrading.backend.dto.EquityPoint;
import com.crabtrading.backend.dto.LeaderboardEntry;
import com.crabtrading.backend.dto.LedgerResult;
import com.crabtrading.backend.dto.PositionMark;
import com.crabtrading.backend.dto.Valuation;
import com.crabtrading.backend.exception.LedgerErrorCode;
import com.crabtrading.backend.model.Account;
import com.crabtrading.backend.model.ActivityEvent;
import com.crabtrading.backend.model.ActivityType;
import com.crabtrading.backend.model.LedgerState;
import com.crabtrading.backend.model.PredictionHolding;
import com.crabtrading.backend.model.PredictionMarket;
import com.crabtrading.backend.model.PositionRecord;
import com.crabtrading.backend.service.LedgerStore;
import com.crabtrading.backend.service.execution.SymbolClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only valuation of accounts at the last known prices and odds.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValuationService {

    public static final int DEFAULT_CURVE_POINTS = 80;
    static final int MIN_CURVE_POINTS = 3;
    static final int MAX_CURVE_POINTS = 200;

    private final LedgerStore ledgerStore;
    private final SymbolClassifier symbolClassifier;
    private final LedgerProperties ledgerProperties;

    public LedgerResult<Valuation> valuation(String identifier) {
        return ledgerStore.withLock(() -> {
            LedgerState state = ledgerStore.state();
            Optional<Account> account = state.resolveAccountId(identifier).flatMap(state::account);
            if (account.isEmpty()) {
                return LedgerResult.<Valuation>reject(LedgerErrorCode.AGENT_NOT_FOUND);
            }
            return LedgerResult.ok(value(state, account.get()));
        });
    }

    /**
     * Caller must hold the ledger lock. Symbols without a known price count as zero; resolved
     * markets and non-positive odds contribute nothing.
     */
    public Valuation value(LedgerState state, Account account) {
        double stockValue = 0.0;
        double cryptoValue = 0.0;
        List<PositionMark> marks = new ArrayList<>();
        for (Map.Entry<String, PositionRecord> entry : account.getPositions().entrySet()) {
            String symbol = entry.getKey();
            PositionRecord position = entry.getValue();
            if (position.qty() == 0.0) {
                continue;
            }
            double lastPrice = state.lastPrice(symbol).orElse(0.0);
            double multiplier = symbolClassifier.contractMultiplier(symbol);
            double marketValue = position.qty() * lastPrice * multiplier;
            double unrealized = lastPrice > 0
                    ? (lastPrice - position.avgCost()) * position.qty() * multiplier
                    : 0.0;
            PositionMark.AssetClass assetClass = symbolClassifier.assetClass(symbol);
            if (assetClass == PositionMark.AssetClass.CRYPTO) {
                cryptoValue += marketValue;
            } else {
                stockValue += marketValue;
            }
            marks.add(new PositionMark(symbol, assetClass, position.qty(), position.avgCost(), lastPrice,
                    multiplier, marketValue, unrealized));
        }
        marks.sort(Comparator.comparingDouble((PositionMark mark) -> Math.abs(mark.marketValue())).reversed());

        double polyValue = 0.0;
        for (Map.Entry<String, Map<String, PredictionHolding>> entry : account.getPolyPositions().entrySet()) {
            PredictionMarket market = state.getMarkets().get(entry.getKey());
            if (market == null || market.isResolved()) {
                continue;
            }
            for (Map.Entry<String, PredictionHolding> holding : entry.getValue().entrySet()) {
                Double odds = market.odds(holding.getKey());
                if (odds != null && odds > 0) {
                    polyValue += holding.getValue().shares() * odds;
                }
            }
        }

        double equity = account.getCash() + stockValue + cryptoValue + polyValue;
        double startingCash = startingCash(account);
        double returnPct = startingCash > 0 ? (equity - startingCash) / startingCash * 100.0 : 0.0;
        return new Valuation(account.getAccountId(), account.getCash(), stockValue, cryptoValue, polyValue, equity,
                returnPct, account.getRealizedPnl(), account.getPolyRealizedPnl(), List.copyOf(marks));
    }

    /**
     * Accounts ranked by equity, highest first. Ties keep registration order.
     *
     * @param activeOnly  only accounts with an open position or a stock order in their history
     * @param includeTest include accounts flagged as test accounts
     */
    public List<LeaderboardEntry> leaderboard(boolean activeOnly, boolean includeTest) {
        return ledgerStore.withLock(() -> {
            LedgerState state = ledgerStore.state();
            Set<String> traded = activeOnly ? stockTraders(state) : Set.of();
            List<Account> eligible = new ArrayList<>();
            List<Valuation> valuations = new ArrayList<>();
            for (Account account : state.getAccounts().values()) {
                if (!includeTest && (account.isTest() || state.getTestAccounts().contains(account.getAccountId()))) {
                    continue;
                }
                if (activeOnly && !account.hasOpenPosition() && !traded.contains(account.getAccountId())) {
                    continue;
                }
                eligible.add(account);
                valuations.add(value(state, account));
            }
            List<Integer> order = new ArrayList<>();
            for (int i = 0; i < eligible.size(); i++) {
                order.add(i);
            }
            order.sort(Comparator.comparingDouble((Integer i) -> valuations.get(i).equity()).reversed());

            List<LeaderboardEntry> entries = new ArrayList<>(order.size());
            int rank = 1;
            for (int index : order) {
                Account account = eligible.get(index);
                entries.add(new LeaderboardEntry(rank++, account.getAccountId(), account.getDisplayName(),
                        account.getAvatar(), account.isTest(), account.isBlocked(), valuations.get(index)));
            }
            return entries;
        });
    }

    public Optional<Integer> rankOf(String identifier, boolean activeOnly, boolean includeTest) {
        Optional<String> accountId = ledgerStore.resolve(identifier);
        if (accountId.isEmpty()) {
            return Optional.empty();
        }
        return leaderboard(activeOnly, includeTest).stream()
                .filter(entry -> entry.accountId().equals(accountId.get()))
                .map(LeaderboardEntry::rank)
                .findFirst();
    }

    /**
     * Equity series rebuilt from the account's registration, order and bet events, ending with a
     * live point at current prices. Orders are valued at their own fill prices; bets are carried
     * at cost.
     */
    public LedgerResult<List<EquityPoint>> equityCurve(String identifier, int maxPoints) {
        int limit = Math.max(MIN_CURVE_POINTS, Math.min(maxPoints, MAX_CURVE_POINTS));
        return ledgerStore.withLock(() -> {
            LedgerState state = ledgerStore.state();
            Optional<Account> found = state.resolveAccountId(identifier).flatMap(state::account);
            if (found.isEmpty()) {
                return LedgerResult.<List<EquityPoint>>reject(LedgerErrorCode.AGENT_NOT_FOUND);
            }
            Account account = found.get();
            List<ActivityEvent> events = curveEvents(state, account.getAccountId(), limit);

            double cash = startingCash(account);
            double polyAtCost = 0.0;
            Map<String, Double> quantities = new LinkedHashMap<>();
            Map<String, Double> fillPrices = new LinkedHashMap<>();
            List<EquityPoint> points = new ArrayList<>();
            for (ActivityEvent event : events) {
                Map<String, Object> details = event.getDetails() == null ? Map.of() : event.getDetails();
                if (event.isType(ActivityType.AGENT_REGISTERED)) {
                    cash = number(details.get("initial_cash"), cash);
                } else if (event.isType(ActivityType.STOCK_ORDER)) {
                    String symbol = String.valueOf(details.getOrDefault("symbol", "")).trim().toUpperCase(Locale.ROOT);
                    if (!symbol.isEmpty()) {
                        String side = String.valueOf(details.getOrDefault("side", "")).trim().toUpperCase(Locale.ROOT);
                        double qty = number(details.get("qty"), 0.0);
                        double fill = number(details.get("fill_price"), 0.0);
                        double multiplier = number(details.get("multiplier"), 1.0);
                        double notional = number(details.get("notional"), qty * fill * multiplier);
                        fillPrices.put(symbol, fill * multiplier);
                        if ("BUY".equals(side)) {
                            cash -= notional;
                            quantities.merge(symbol, qty, Double::sum);
                        } else if ("SELL".equals(side)) {
                            cash += notional;
                            quantities.merge(symbol, -qty, Double::sum);
                        }
                        if (Math.abs(quantities.getOrDefault(symbol, 0.0)) < 1e-12) {
                            quantities.remove(symbol);
                        }
                    }
                } else if (event.isType(ActivityType.POLY_BET)) {
                    double amount = number(details.get("amount"), 0.0);
                    cash -= amount;
                    polyAtCost += amount;
                }
                double equity = cash + polyAtCost;
                for (Map.Entry<String, Double> position : quantities.entrySet()) {
                    equity += position.getValue() * fillPrices.getOrDefault(position.getKey(), 0.0);
                }
                points.add(new EquityPoint(event.getCreatedAt(), equity));
            }
            points.add(new EquityPoint(Instant.now().toString(), value(state, account).equity()));
            if (points.size() > MAX_CURVE_POINTS) {
                points = new ArrayList<>(points.subList(points.size() - MAX_CURVE_POINTS, points.size()));
            }
            return LedgerResult.ok(List.copyOf(points));
        });
    }

    /**
     * Keeps the most recent events, plus the registration event when it falls in the first ten.
     */
    private List<ActivityEvent> curveEvents(LedgerState state, String accountId, int limit) {
        List<ActivityEvent> events = new ArrayList<>();
        for (ActivityEvent event : state.getActivityLog()) {
            if (!accountId.equals(event.getAccountId())) {
                continue;
            }
            if (event.isType(ActivityType.AGENT_REGISTERED) || event.isType(ActivityType.STOCK_ORDER)
                    || event.isType(ActivityType.POLY_BET)) {
                events.add(event);
            }
        }
        events.sort(Comparator.comparingLong(ActivityEvent::getId));
        if (events.size() <= limit) {
            return events;
        }
        List<ActivityEvent> head = new ArrayList<>();
        for (ActivityEvent event : events.subList(0, Math.min(10, events.size()))) {
            if (event.isType(ActivityType.AGENT_REGISTERED)) {
                head.add(event);
                break;
            }
        }
        List<ActivityEvent> trimmed = new ArrayList<>(head);
        trimmed.addAll(events.subList(events.size() - (limit - head.size()), events.size()));
        return trimmed;
    }

    private double startingCash(Account account) {
        return account.getStartingCash() > 0 ? account.getStartingCash() : ledgerProperties.getStartingCash();
    }

    private Set<String> stockTraders(LedgerState state) {
        Set<String> traders = new HashSet<>();
        for (ActivityEvent event : state.getActivityLog()) {
            if (!event.isType(ActivityType.STOCK_ORDER) || event.getAccountId() == null) {
                continue;
            }
            Object symbol = event.getDetails() == null ? null : event.getDetails().get("symbol");
            if (symbol == null || symbolClassifier.isCrypto(String.valueOf(symbol))) {
                continue;
            }
            traders.add(event.getAccountId());
        }
        return traders;
    }

    private static double number(Object value, double fallback) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }
}

package com.crabtrading.backend.service.prediction;

import com.crabtrading.backend.dto.Bet;
import com.crabtrading.backend.dto.LedgerResult;
import com.crabtrading.backend.dto.MarketResolution;
import com.crabtrading.backend.dto.ResolutionPayout;
import com.crabtrading.backend.exception.LedgerErrorCode;
import com.crabtrading.backend.model.Account;
import com.crabtrading.backend.model.LedgerState;
import com.crabtrading.backend.model.PredictionHolding;
import com.crabtrading.backend.model.PredictionMarket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Bets and settlement for binary or multi-outcome prediction markets. The caller holds the
 * ledger lock and commits afterwards.
 * <p>
 * A bet buys {@code amount / odds} shares of one outcome. On resolution each share of the
 * winning outcome pays 1.0, and every position in the market is closed.
 */
@Slf4j
@Service
public class PredictionMarketEngine {

    public LedgerResult<Bet> placeBet(LedgerState state, String accountId, String marketId, String outcome, double amount) {
        Account account = state.account(accountId).orElse(null);
        if (account == null) {
            return LedgerResult.reject(LedgerErrorCode.AGENT_NOT_FOUND);
        }
        if (!(amount > 0) || Double.isInfinite(amount)) {
            return LedgerResult.reject(LedgerErrorCode.INVALID_AMOUNT, "amount must be positive");
        }
        PredictionMarket market = marketId == null ? null : state.getMarkets().get(marketId.trim());
        if (market == null) {
            return LedgerResult.reject(LedgerErrorCode.MARKET_NOT_FOUND);
        }
        if (market.isResolved()) {
            return LedgerResult.reject(LedgerErrorCode.MARKET_ALREADY_RESOLVED);
        }
        String key = normalizeOutcome(outcome);
        Double odds = market.odds(key);
        if (odds == null) {
            return LedgerResult.reject(LedgerErrorCode.INVALID_OUTCOME);
        }
        if (!(odds > 0)) {
            return LedgerResult.reject(LedgerErrorCode.INVALID_ODDS);
        }
        if (account.getCash() < amount) {
            return LedgerResult.reject(LedgerErrorCode.INSUFFICIENT_CASH);
        }

        double shares = amount / odds;
        account.setCash(account.getCash() - amount);
        account.addPolyShares(market.getMarketId(), key, shares, amount);
        return LedgerResult.ok(new Bet(accountId, market.getMarketId(), key, amount, odds, shares, account.getCash()));
    }

    public LedgerResult<MarketResolution> resolveMarket(LedgerState state, String marketId, String winningOutcome) {
        PredictionMarket market = marketId == null ? null : state.getMarkets().get(marketId.trim());
        if (market == null) {
            return LedgerResult.reject(LedgerErrorCode.MARKET_NOT_FOUND);
        }
        if (market.isResolved()) {
            return LedgerResult.reject(LedgerErrorCode.ALREADY_RESOLVED);
        }
        String winner = normalizeOutcome(winningOutcome);
        if (!market.getOutcomes().containsKey(winner)) {
            return LedgerResult.reject(LedgerErrorCode.INVALID_WINNING_OUTCOME);
        }

        market.setResolved(true);
        market.setWinningOutcome(winner);
        List<ResolutionPayout> payouts = new ArrayList<>();
        for (Account account : state.getAccounts().values()) {
            Map<String, PredictionHolding> holdings = account.removePolyMarket(market.getMarketId());
            if (holdings.isEmpty()) {
                continue;
            }
            PredictionHolding winning = holdings.get(winner);
            double payout = winning == null ? 0.0 : Math.max(0.0, winning.shares());
            double costBasis = holdings.values().stream().mapToDouble(PredictionHolding::costBasis).sum();
            if (payout > 0) {
                account.setCash(account.getCash() + payout);
                account.setPolyRealizedPnl(account.getPolyRealizedPnl() + payout);
            }
            payouts.add(new ResolutionPayout(account.getAccountId(), payout, costBasis));
        }
        log.info("Market resolved marketId={} winner={} holders={}", market.getMarketId(), winner, payouts.size());
        return LedgerResult.ok(new MarketResolution(market.getMarketId(), winner, List.copyOf(payouts)));
    }

    static String normalizeOutcome(String outcome) {
        return outcome == null ? "" : outcome.trim().toUpperCase(Locale.ROOT);
    }
}

package com.crabtrading.backend.service.execution;

import com.crabtrading.backend.config.RiskProperties;
import com.crabtrading.backend.exception.LedgerErrorCode;
import com.crabtrading.backend.model.Account;
import com.crabtrading.backend.model.LedgerState;
import com.crabtrading.backend.model.OrderSide;
import com.crabtrading.backend.model.PositionRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
@RequiredArgsConstructor
public class RiskGatekeeper {

    private final RiskProperties riskProperties;
    private final SymbolClassifier symbolClassifier;

    /**
     * Pre-trade checks, in order: daily loss, sell holding when shorting is off, position limit,
     * cash. Runs against the state before the fill is applied.
     */
    public RiskGateDecision evaluate(LedgerState state, Account account, String symbol, OrderSide side,
                                     double qty, double notional) {
        double loss = dailyLoss(state, account);
        if (loss <= -riskProperties.getMaxDailyLoss()) {
            return RiskGateDecision.reject(
                    LedgerErrorCode.RISK_REJECT_MAX_DAILY_LOSS,
                    "max_daily_loss_breached",
                    -riskProperties.getMaxDailyLoss(),
                    loss,
                    symbol
            );
        }

        double currentQty = account.positionQty(symbol);
        if (side == OrderSide.SELL && !riskProperties.isAllowShortSelling() && currentQty + PositionAccounting.QTY_EPSILON < qty) {
            return RiskGateDecision.reject(
                    LedgerErrorCode.INSUFFICIENT_POSITION,
                    "insufficient_position",
                    currentQty,
                    qty,
                    symbol
            );
        }
        double newQty = PositionAccounting.normalize(currentQty + side.signed(qty));
        if (Math.abs(newQty) > riskProperties.getMaxAbsPositionPerSymbol()) {
            return RiskGateDecision.reject(
                    LedgerErrorCode.RISK_REJECT_MAX_POSITION,
                    "max_abs_position_per_symbol",
                    riskProperties.getMaxAbsPositionPerSymbol(),
                    Math.abs(newQty),
                    symbol
            );
        }

        if (side == OrderSide.BUY && account.getCash() < notional) {
            return RiskGateDecision.reject(
                    LedgerErrorCode.INSUFFICIENT_CASH,
                    "insufficient_cash",
                    account.getCash(),
                    notional,
                    symbol
            );
        }
        return RiskGateDecision.allow();
    }

    public boolean dailyLossBreached(LedgerState state, Account account) {
        return dailyLoss(state, account) <= -riskProperties.getMaxDailyLoss();
    }

    /**
     * Realized P&amp;L plus the sum of unrealized losses (gains are ignored) at last known prices.
     */
    public double dailyLoss(LedgerState state, Account account) {
        return account.getRealizedPnl() + unrealizedLoss(state, account);
    }

    public double unrealizedLoss(LedgerState state, Account account) {
        double loss = 0.0;
        for (Map.Entry<String, PositionRecord> entry : account.getPositions().entrySet()) {
            PositionRecord position = entry.getValue();
            double price = state.lastPrice(entry.getKey()).orElse(position.avgCost());
            double pnl = (price - position.avgCost()) * position.qty() * symbolClassifier.contractMultiplier(entry.getKey());
            loss += Math.min(0.0, pnl);
        }
        return loss;
    }

    public record RiskGateDecision(
            boolean allowed,
            LedgerErrorCode reason,
            String message,
            Double threshold,
            Double currentValue,
            String symbol
    ) {
        static RiskGateDecision allow() {
            return new RiskGateDecision(true, null, null, null, null, null);
        }

        static RiskGateDecision reject(LedgerErrorCode reason, String message, Double threshold, Double currentValue, String symbol) {
            return new RiskGateDecision(false, reason, message, threshold, currentValue, symbol);
        }
    }
}

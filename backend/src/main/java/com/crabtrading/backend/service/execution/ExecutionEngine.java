package com.crabtrading.backend.service.execution;

import com.crabtrading.backend.dto.Fill;
import com.crabtrading.backend.dto.LedgerResult;
import com.crabtrading.backend.exception.LedgerErrorCode;
import com.crabtrading.backend.model.Account;
import com.crabtrading.backend.model.LedgerState;
import com.crabtrading.backend.model.OrderSide;
import com.crabtrading.backend.model.PositionRecord;
import com.crabtrading.backend.service.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Applies a fill to an account. The caller holds the ledger lock and commits afterwards.
 * <p>
 * A rejected order leaves balances and positions untouched. The one exception is a daily-loss
 * breach detected before the fill, which blocks the account as well as rejecting the order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionEngine {

    private final RiskGatekeeper riskGatekeeper;
    private final LedgerMetrics ledgerMetrics;

    public LedgerResult<Fill> executeOrder(LedgerState state, String accountId, String symbol, OrderSide side,
                                           double qty, double fillPrice, double multiplier) {
        Optional<Account> found = state.account(accountId);
        if (found.isEmpty()) {
            return rejected(LedgerErrorCode.AGENT_NOT_FOUND, null);
        }
        Account account = found.get();
        if (account.isBlocked()) {
            return rejected(LedgerErrorCode.AGENT_BLOCKED, null);
        }
        if (symbol == null || symbol.isBlank() || side == null
                || !(qty > 0) || Double.isInfinite(qty)
                || !(fillPrice > 0) || Double.isInfinite(fillPrice)
                || !(multiplier >= 1) || Double.isInfinite(multiplier)) {
            return rejected(LedgerErrorCode.INVALID_ORDER, "qty, price and multiplier must be positive");
        }

        double notional = qty * fillPrice * multiplier;
        RiskGatekeeper.RiskGateDecision decision = riskGatekeeper.evaluate(state, account, symbol, side, qty, notional);
        if (!decision.allowed()) {
            if (decision.reason() == LedgerErrorCode.RISK_REJECT_MAX_DAILY_LOSS) {
                block(account, decision.currentValue());
            }
            log.info("Order rejected account={} symbol={} side={} qty={} reason={} threshold={} current={}",
                    accountId, symbol, side, qty, decision.reason().code(), decision.threshold(), decision.currentValue());
            return rejected(decision.reason(), decision.message());
        }

        PositionRecord current = account.position(symbol).orElse(null);
        double oldQty = current == null ? 0.0 : current.qty();
        double oldAvg = current == null ? 0.0 : current.avgCost();
        PositionAccounting.Result result = PositionAccounting.apply(oldQty, oldAvg, side.signed(qty), fillPrice, multiplier);

        if (side == OrderSide.BUY) {
            account.setCash(account.getCash() - notional);
        } else {
            account.setCash(account.getCash() + notional);
        }
        account.setPosition(symbol, result.qty(), result.avgCost());
        account.setRealizedPnl(account.getRealizedPnl() + result.realizedPnl());
        state.getPrices().put(symbol, fillPrice);

        if (riskGatekeeper.dailyLossBreached(state, account)) {
            block(account, riskGatekeeper.dailyLoss(state, account));
        }
        ledgerMetrics.recordOrderFilled();
        return LedgerResult.ok(new Fill(
                accountId,
                symbol,
                side,
                qty,
                fillPrice,
                multiplier,
                notional,
                result.realizedPnl(),
                result.qty(),
                result.flat() ? 0.0 : result.avgCost(),
                account.getCash(),
                account.isBlocked()
        ));
    }

    private void block(Account account, Double dailyLoss) {
        if (account.isBlocked()) {
            return;
        }
        account.setBlocked(true);
        ledgerMetrics.recordAccountBlocked();
        log.warn("⛔ Account blocked after daily loss breach account={} dailyLoss={}", account.getAccountId(), dailyLoss);
    }

    private LedgerResult<Fill> rejected(LedgerErrorCode code, String message) {
        ledgerMetrics.recordReject("order", code.code());
        return message == null ? LedgerResult.reject(code) : LedgerResult.reject(code, message);
    }
}

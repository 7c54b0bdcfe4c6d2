package com.crabtrading.backend.service.execution;

import com.crabtrading.backend.config.RiskProperties;
import com.crabtrading.backend.exception.LedgerErrorCode;
import com.crabtrading.backend.model.Account;
import com.crabtrading.backend.model.LedgerState;
import com.crabtrading.backend.model.OrderSide;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RiskGatekeeperTest {

    private RiskProperties riskProperties;
    private RiskGatekeeper riskGatekeeper;
    private LedgerState state;
    private Account account;

    @BeforeEach
    void setUp() {
        riskProperties = new RiskProperties();
        riskProperties.setMaxAbsPositionPerSymbol(50);
        riskProperties.setMaxDailyLoss(500);
        riskGatekeeper = new RiskGatekeeper(riskProperties, new SymbolClassifier());
        state = new LedgerState();
        account = Account.builder().accountId("acc-1").displayName("alpha").cash(2000).build();
        state.getAccounts().put(account.getAccountId(), account);
    }

    @Test
    void allowsOrderWithinLimits() {
        RiskGatekeeper.RiskGateDecision decision =
                riskGatekeeper.evaluate(state, account, "AAPL", OrderSide.BUY, 10, 1000);

        assertThat(decision.allowed()).isTrue();
    }

    @Test
    void rejectsPositionAboveAbsoluteLimit() {
        account.setPosition("AAPL", 45, 10);

        RiskGatekeeper.RiskGateDecision decision =
                riskGatekeeper.evaluate(state, account, "AAPL", OrderSide.BUY, 10, 100);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo(LedgerErrorCode.RISK_REJECT_MAX_POSITION);
        assertThat(decision.currentValue()).isEqualTo(55.0);
    }

    @Test
    void rejectsBuyAboveCash() {
        RiskGatekeeper.RiskGateDecision decision =
                riskGatekeeper.evaluate(state, account, "AAPL", OrderSide.BUY, 10, 2500);

        assertThat(decision.reason()).isEqualTo(LedgerErrorCode.INSUFFICIENT_CASH);
    }

    @Test
    void rejectsSellBeyondHoldingUnlessShortingAllowed() {
        account.setPosition("AAPL", 5, 10);

        assertThat(riskGatekeeper.evaluate(state, account, "AAPL", OrderSide.SELL, 6, 60).reason())
                .isEqualTo(LedgerErrorCode.INSUFFICIENT_POSITION);

        riskProperties.setAllowShortSelling(true);
        assertThat(riskGatekeeper.evaluate(state, account, "AAPL", OrderSide.SELL, 6, 60).allowed()).isTrue();
    }

    @Test
    void dailyLossCountsRealizedAndUnrealizedLossesOnly() {
        account.setRealizedPnl(-100);
        account.setPosition("AAPL", 10, 50);
        account.setPosition("MSFT", 10, 50);
        state.getPrices().put("AAPL", 30.0);
        state.getPrices().put("MSFT", 80.0);

        assertThat(riskGatekeeper.dailyLoss(state, account)).isCloseTo(-300.0, within(1e-9));
        assertThat(riskGatekeeper.dailyLossBreached(state, account)).isFalse();
    }

    @Test
    void oversizedSellReportsMissingHoldingBeforePositionLimit() {
        account.setPosition("AAPL", 5, 10);

        RiskGatekeeper.RiskGateDecision decision =
                riskGatekeeper.evaluate(state, account, "AAPL", OrderSide.SELL, 80, 800);

        assertThat(decision.reason()).isEqualTo(LedgerErrorCode.INSUFFICIENT_POSITION);
        assertThat(decision.threshold()).isEqualTo(5.0);
        assertThat(decision.currentValue()).isEqualTo(80.0);

        riskProperties.setAllowShortSelling(true);
        assertThat(riskGatekeeper.evaluate(state, account, "AAPL", OrderSide.SELL, 80, 800).reason())
                .isEqualTo(LedgerErrorCode.RISK_REJECT_MAX_POSITION);
    }

    @Test
    void dailyLossBreachIsCheckedFirst() {
        account.setRealizedPnl(-600);

        RiskGatekeeper.RiskGateDecision decision =
                riskGatekeeper.evaluate(state, account, "AAPL", OrderSide.BUY, 1000, 1_000_000);

        assertThat(decision.reason()).isEqualTo(LedgerErrorCode.RISK_REJECT_MAX_DAILY_LOSS);
        assertThat(decision.threshold()).isEqualTo(-500.0);
    }
}

package com.crabtrading.backend.service.execution;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PositionAccountingTest {

    @Test
    void addingToPositionReweightsAverage() {
        PositionAccounting.Result result = PositionAccounting.apply(10, 100, 10, 110, 1);

        assertThat(result.qty()).isEqualTo(20.0);
        assertThat(result.avgCost()).isCloseTo(105.0, within(1e-9));
        assertThat(result.realizedPnl()).isZero();
    }

    @Test
    void partialCloseRealizesAtExistingAverage() {
        PositionAccounting.Result result = PositionAccounting.apply(10, 100, -4, 120, 1);

        assertThat(result.qty()).isCloseTo(6.0, within(1e-9));
        assertThat(result.avgCost()).isEqualTo(100.0);
        assertThat(result.realizedPnl()).isCloseTo(80.0, within(1e-9));
    }

    @Test
    void fullCloseLeavesFlatPosition() {
        PositionAccounting.Result result = PositionAccounting.apply(10, 100, -10, 90, 1);

        assertThat(result.flat()).isTrue();
        assertThat(result.avgCost()).isZero();
        assertThat(result.realizedPnl()).isCloseTo(-100.0, within(1e-9));
    }

    @Test
    void crossingZeroOpensResidualAtFillPrice() {
        PositionAccounting.Result result = PositionAccounting.apply(10, 100, -15, 120, 1);

        assertThat(result.qty()).isCloseTo(-5.0, within(1e-9));
        assertThat(result.avgCost()).isEqualTo(120.0);
        assertThat(result.realizedPnl()).isCloseTo(200.0, within(1e-9));
    }

    @Test
    void coveringShortRealizesWithInvertedSign() {
        PositionAccounting.Result result = PositionAccounting.apply(-5, 120, 5, 100, 1);

        assertThat(result.flat()).isTrue();
        assertThat(result.realizedPnl()).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void contractMultiplierScalesRealizedPnl() {
        PositionAccounting.Result result = PositionAccounting.apply(2, 1.5, -2, 2.0, 100);

        assertThat(result.realizedPnl()).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void dustBelowEpsilonIsTreatedAsFlat() {
        PositionAccounting.Result result = PositionAccounting.apply(0.1 + 0.2, 10, -0.3, 10, 1);

        assertThat(result.qty()).isZero();
        assertThat(result.flat()).isTrue();
    }

    @Test
    void zeroQuantityFillIsRejected() {
        assertThatThrownBy(() -> PositionAccounting.apply(1, 10, 0, 10, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

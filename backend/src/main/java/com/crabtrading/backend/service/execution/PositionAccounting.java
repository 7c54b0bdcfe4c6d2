package com.crabtrading.backend.service.execution;

/**
 * Weighted-average cost accounting for a single symbol.
 * <p>
 * Adding in the direction of the position re-weights the average; trading against it realizes
 * P&amp;L on the closed quantity at the existing average. When a fill crosses through zero the
 * residual opens at the fill price.
 */
public final class PositionAccounting {

    /**
     * Quantities closer to zero than this are treated as flat.
     */
    public static final double QTY_EPSILON = 1e-9;

    private PositionAccounting() {
    }

    public record Result(double qty, double avgCost, double realizedPnl) {
        public boolean flat() {
            return qty == 0.0;
        }
    }

    public static Result apply(double oldQty, double oldAvgCost, double signedQty, double price, double multiplier) {
        if (signedQty == 0.0) {
            throw new IllegalArgumentException("Fill quantity must be non-zero");
        }
        double newQty = normalize(oldQty + signedQty);
        if (oldQty == 0.0 || Math.signum(oldQty) == Math.signum(signedQty)) {
            double avg = (Math.abs(oldQty) * oldAvgCost + Math.abs(signedQty) * price) / Math.abs(newQty);
            return new Result(newQty, avg, 0.0);
        }

        double closedQty = Math.min(Math.abs(oldQty), Math.abs(signedQty));
        double realized = closedQty * (price - oldAvgCost) * Math.signum(oldQty) * multiplier;
        if (newQty == 0.0) {
            return new Result(0.0, 0.0, realized);
        }
        if (Math.signum(newQty) == Math.signum(oldQty)) {
            return new Result(newQty, oldAvgCost, realized);
        }
        return new Result(newQty, price, realized);
    }

    static double normalize(double qty) {
        return Math.abs(qty) < QTY_EPSILON ? 0.0 : qty;
    }
}

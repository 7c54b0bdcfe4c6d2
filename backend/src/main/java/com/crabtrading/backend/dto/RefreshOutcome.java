package com.crabtrading.backend.dto;

public record RefreshOutcome(boolean attempted, int symbolsRefreshed, int marketsRefreshed, boolean persisted) {

    public static RefreshOutcome skipped() {
        return new RefreshOutcome(false, 0, 0, false);
    }
}

package com.crabtrading.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Service
@Slf4j
@RequiredArgsConstructor
public class LedgerMetrics {

    private final MeterRegistry meterRegistry;

    private final AtomicInteger accountCount = new AtomicInteger();

    private Counter ordersFilledCounter;
    private Counter betsPlacedCounter;
    private Counter marketsResolvedCounter;
    private Counter accountsBlockedCounter;
    private Counter accountsPurgedCounter;
    private Counter snapshotFailuresCounter;

    @jakarta.annotation.PostConstruct
    void init() {
        ordersFilledCounter = Counter.builder("ledger_orders_filled_total").register(meterRegistry);
        betsPlacedCounter = Counter.builder("ledger_bets_placed_total").register(meterRegistry);
        marketsResolvedCounter = Counter.builder("ledger_markets_resolved_total").register(meterRegistry);
        accountsBlockedCounter = Counter.builder("ledger_accounts_blocked_total").register(meterRegistry);
        accountsPurgedCounter = Counter.builder("ledger_accounts_purged_total").register(meterRegistry);
        snapshotFailuresCounter = Counter.builder("ledger_snapshot_failures_total").register(meterRegistry);
        Gauge.builder("ledger_accounts", accountCount, AtomicInteger::get).register(meterRegistry);
    }

    public void recordOrderFilled() {
        if (ordersFilledCounter != null) {
            ordersFilledCounter.increment();
        }
    }

    public void recordBetPlaced() {
        if (betsPlacedCounter != null) {
            betsPlacedCounter.increment();
        }
    }

    public void recordMarketResolved() {
        if (marketsResolvedCounter != null) {
            marketsResolvedCounter.increment();
        }
    }

    public void recordAccountBlocked() {
        if (accountsBlockedCounter != null) {
            accountsBlockedCounter.increment();
        }
    }

    public void recordAccountPurged() {
        if (accountsPurgedCounter != null) {
            accountsPurgedCounter.increment();
        }
    }

    public void recordReject(String operation, String reason) {
        Counter.builder("ledger_rejects_total")
                .tag("operation", operation)
                .tag("reason", reason == null ? "unknown" : reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordSnapshotWrite(long elapsedNanos, boolean success) {
        Timer.builder("ledger_snapshot_write_latency")
                .tag("status", success ? "success" : "error")
                .register(meterRegistry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);
        if (!success && snapshotFailuresCounter != null) {
            snapshotFailuresCounter.increment();
        }
    }

    public void recordFeedFailure(String feed, String kind) {
        Counter.builder("market_data_failures_total")
                .tag("feed", feed)
                .tag("kind", kind)
                .register(meterRegistry)
                .increment();
    }

    public void recordTaskFailure(String task) {
        Counter.builder("scheduled_task_failures_total")
                .tag("task", task)
                .register(meterRegistry)
                .increment();
    }

    public void updateAccountCount(int accounts) {
        accountCount.set(accounts);
    }
}

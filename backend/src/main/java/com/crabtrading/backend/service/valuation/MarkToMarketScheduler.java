package com.crabtrading.backend.service.valuation;

import com.crabtrading.backend.service.ScheduledTaskGuard;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ledger.mark-to-market", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MarkToMarketScheduler {

    private final MarkToMarketService markToMarketService;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(fixedDelayString = "${ledger.mark-to-market.poll-interval-ms:60000}",
            initialDelayString = "${ledger.mark-to-market.poll-interval-ms:60000}")
    public void poll() {
        scheduledTaskGuard.run("markToMarket", () -> markToMarketService.refreshIfDue(false));
    }
}

package com.crabtrading.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Keeps a failing scheduled task from killing its schedule.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final LedgerMetrics ledgerMetrics;

    public void run(String taskName, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Scheduled task failed task={}", taskName, e);
            ledgerMetrics.recordTaskFailure(taskName);
        }
    }
}

package com.crabtrading.backend.config;

import com.crabtrading.backend.exception.LedgerPersistenceException;
import com.crabtrading.backend.exception.SnapshotCorruptedException;
import com.crabtrading.backend.service.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationFailedEvent;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.event.SpringApplicationEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Logs ledger size once the application is ready, and names the ledger setting to look at when
 * startup fails on the stored snapshot or the database behind it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StartupLifecycleListener implements ApplicationListener<SpringApplicationEvent> {

    private final ObjectProvider<LedgerStore> ledgerStore;
    private final LedgerProperties ledgerProperties;

    @Override
    public void onApplicationEvent(SpringApplicationEvent event) {
        if (event instanceof ApplicationReadyEvent) {
            onReady();
        } else if (event instanceof ApplicationFailedEvent failed) {
            onFailure(failed.getException());
        }
    }

    private void onReady() {
        LedgerStore store = ledgerStore.getIfAvailable();
        if (store == null) {
            log.warn("Ledger store not available at startup");
            return;
        }
        LedgerStore.Stats stats = store.stats();
        log.info("🚀 LEDGER READY accounts={} markets={} events={} pricedSymbols={}",
                stats.accounts(), stats.markets(), stats.activityEvents(), stats.pricedSymbols());
    }

    private void onFailure(Throwable exception) {
        Optional<String> hint = failureHint(exception);
        if (hint.isPresent()) {
            log.error("FATAL Ledger failed to start: {}", hint.get(), exception);
        } else {
            log.error("FATAL Startup failure: {}", exception.getMessage(), exception);
        }
    }

    /**
     * Operator hint for ledger storage failures found anywhere in the cause chain.
     */
    Optional<String> failureHint(Throwable exception) {
        for (Throwable current = exception; current != null; current = current.getCause()) {
            if (current instanceof SnapshotCorruptedException) {
                return Optional.of(current.getMessage()
                        + ". Repair the stored snapshot, or set ledger.state.fail-on-corrupt-snapshot=false"
                        + " to start empty with a copy kept in " + ledgerProperties.getState().getQuarantineDir());
            }
            if (current instanceof LedgerPersistenceException) {
                return Optional.of(current.getMessage()
                        + ". Check spring.datasource.url and ledger.state.legacy-file ("
                        + ledgerProperties.getState().getLegacyFile() + ")");
            }
        }
        return Optional.empty();
    }
}

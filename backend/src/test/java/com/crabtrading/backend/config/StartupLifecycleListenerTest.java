package com.crabtrading.backend.config;

import com.crabtrading.backend.exception.LedgerPersistenceException;
import com.crabtrading.backend.exception.SnapshotCorruptedException;
import com.crabtrading.backend.service.LedgerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.context.event.ApplicationFailedEvent;
import org.springframework.boot.context.event.ApplicationReadyEvent;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StartupLifecycleListenerTest {

    @Mock
    private ObjectProvider<LedgerStore> ledgerStoreProvider;

    @Mock
    private LedgerStore ledgerStore;

    private LedgerProperties ledgerProperties;
    private StartupLifecycleListener listener;

    @BeforeEach
    void setUp() {
        ledgerProperties = new LedgerProperties();
        ledgerProperties.getState().setQuarantineDir("/var/ledger/quarantine");
        listener = new StartupLifecycleListener(ledgerStoreProvider, ledgerProperties);
    }

    @Test
    void corruptSnapshotHintNamesStrictFlagAndQuarantineDir() {
        Throwable failure = new BeanCreationException("ledgerStore",
                new SnapshotCorruptedException("Unreadable ledger snapshot", new IOException("bad json")));

        assertThat(listener.failureHint(failure)).hasValueSatisfying(hint -> assertThat(hint)
                .startsWith("Unreadable ledger snapshot")
                .contains("ledger.state.fail-on-corrupt-snapshot=false")
                .contains("/var/ledger/quarantine"));
    }

    @Test
    void storageFailureHintNamesDatasourceAndLegacyFile() {
        Throwable failure = new BeanCreationException("ledgerStore",
                new LedgerPersistenceException("Failed to write ledger snapshot", new IllegalStateException("db down")));

        assertThat(listener.failureHint(failure)).hasValueSatisfying(hint -> assertThat(hint)
                .contains("spring.datasource.url")
                .contains(ledgerProperties.getState().getLegacyFile()));
    }

    @Test
    void unrelatedFailureHasNoLedgerHint() {
        IllegalStateException failure = new IllegalStateException("port in use");

        assertThat(listener.failureHint(failure)).isEmpty();
        assertThatCode(() -> listener.onApplicationEvent(
                new ApplicationFailedEvent(new SpringApplication(), new String[0], null, failure)))
                .doesNotThrowAnyException();
        verifyNoInteractions(ledgerStoreProvider);
    }

    @Test
    void readyEventReportsLedgerCounts() {
        when(ledgerStoreProvider.getIfAvailable()).thenReturn(ledgerStore);
        when(ledgerStore.stats()).thenReturn(new LedgerStore.Stats(3, 1, 12, 4));

        listener.onApplicationEvent(new ApplicationReadyEvent(new SpringApplication(), new String[0], null,
                Duration.ofSeconds(1)));

        verify(ledgerStore).stats();
    }

    @Test
    void readyEventWithoutStoreIsTolerated() {
        assertThatCode(() -> listener.onApplicationEvent(new ApplicationReadyEvent(new SpringApplication(),
                new String[0], null, Duration.ofSeconds(1))))
                .doesNotThrowAnyException();
    }
}

package com.crabtrading.backend.service.persistence;

import com.crabtrading.backend.config.LedgerProperties;
import com.crabtrading.backend.exception.LedgerPersistenceException;
import com.crabtrading.backend.exception.SnapshotCorruptedException;
import com.crabtrading.backend.model.Account;
import com.crabtrading.backend.model.LedgerState;
import com.crabtrading.backend.repository.LegacyStateFileReader;
import com.crabtrading.backend.repository.SnapshotRepository;
import com.crabtrading.backend.service.LedgerMetrics;
import com.crabtrading.backend.service.persistence.migration.FieldNamingMigration;
import com.crabtrading.backend.service.persistence.migration.LegacyIdentityMigration;
import com.crabtrading.backend.service.persistence.migration.PolyCostBasisMigration;
import com.crabtrading.backend.service.persistence.migration.SnapshotMigrator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerPersistenceServiceTest {

    @Mock
    private SnapshotRepository snapshotRepository;

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private LedgerProperties properties;
    private LedgerPersistenceService persistence;

    @BeforeEach
    void setUp() {
        properties = new LedgerProperties();
        properties.getState().setLegacyFile(tempDir.resolve("ledger_state.json").toString());
        properties.getState().setQuarantineDir(tempDir.resolve("quarantine").toString());
        SnapshotMigrator migrator = new SnapshotMigrator(List.of(
                new LegacyIdentityMigration(), new FieldNamingMigration(), new PolyCostBasisMigration()));
        persistence = new LedgerPersistenceService(
                snapshotRepository,
                new LegacyStateFileReader(properties),
                migrator,
                new LedgerSnapshotCodec(objectMapper),
                objectMapper,
                properties,
                new LedgerMetrics(new SimpleMeterRegistry()));
    }

    @Test
    void startsEmptyWhenNothingIsStored() {
        when(snapshotRepository.loadLatest()).thenReturn(Optional.empty());

        LedgerState state = persistence.load();

        assertThat(state.getAccounts()).isEmpty();
        verify(snapshotRepository, never()).save(anyString());
    }

    @Test
    void cleanCurrentSnapshotIsNotRewritten() {
        LedgerState original = new LedgerState();
        original.getAccounts().put("a1", Account.builder().accountId("a1").displayName("crab").cash(10).build());
        original.getNameIndex().put("crab", "a1");
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        persistence.save(original);
        verify(snapshotRepository).save(payload.capture());
        when(snapshotRepository.loadLatest()).thenReturn(Optional.of(payload.getValue()));

        LedgerState state = persistence.load();

        assertThat(state.getAccounts().get("a1").getCash()).isEqualTo(10.0);
        verify(snapshotRepository).save(anyString());
    }

    @Test
    void importsLegacyFileAndWritesItToTheDatabase() throws Exception {
        when(snapshotRepository.loadLatest()).thenReturn(Optional.empty());
        Files.writeString(tempDir.resolve("ledger_state.json"),
                "{\"accounts\": {\"crab\": {\"cash\": 1900.0}}, \"agent_keys\": {\"crab\": \"key-1\"}}");

        LedgerState state = persistence.load();

        String id = state.resolveAccountId("crab").orElseThrow();
        assertThat(state.getAccounts().get(id).getCash()).isEqualTo(1900.0);
        assertThat(state.getKeyToAgent()).containsEntry("key-1", id);
        ArgumentCaptor<String> saved = ArgumentCaptor.forClass(String.class);
        verify(snapshotRepository).save(saved.capture());
        assertThat(objectMapper.readTree(saved.getValue()).path("version").asInt())
                .isEqualTo(SnapshotMigrator.CURRENT_VERSION);
    }

    @Test
    void unreadableSnapshotIsQuarantinedAndLedgerStartsEmpty() throws Exception {
        when(snapshotRepository.loadLatest()).thenReturn(Optional.of("{not json"));

        LedgerState state = persistence.load();

        assertThat(state.getAccounts()).isEmpty();
        try (Stream<Path> files = Files.list(tempDir.resolve("quarantine"))) {
            List<Path> copies = files.toList();
            assertThat(copies).hasSize(1);
            assertThat(Files.readString(copies.get(0))).isEqualTo("{not json");
        }
        verify(snapshotRepository, never()).save(anyString());
    }

    @Test
    void unsupportedVersionCountsAsUnreadable() {
        when(snapshotRepository.loadLatest()).thenReturn(Optional.of("{\"version\": 99}"));

        assertThat(persistence.load().getAccounts()).isEmpty();
    }

    @Test
    void refusesToStartWhenConfiguredToFailOnCorruption() {
        properties.getState().setFailOnCorruptSnapshot(true);
        when(snapshotRepository.loadLatest()).thenReturn(Optional.of("[1, 2, 3]"));

        assertThatThrownBy(() -> persistence.load())
                .isInstanceOf(SnapshotCorruptedException.class)
                .hasMessageContaining("database snapshot");
    }

    @Test
    void writeFailureSurfacesAsPersistenceException() {
        doThrow(new DataAccessResourceFailureException("db down")).when(snapshotRepository).save(anyString());

        assertThatThrownBy(() -> persistence.save(new LedgerState()))
                .isInstanceOf(LedgerPersistenceException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }
}

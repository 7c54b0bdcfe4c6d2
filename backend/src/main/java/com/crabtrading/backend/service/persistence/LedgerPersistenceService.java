package com.crabtrading.backend.service.persistence;

import com.crabtrading.backend.config.LedgerProperties;
import com.crabtrading.backend.exception.LedgerPersistenceException;
import com.crabtrading.backend.exception.SnapshotCorruptedException;
import com.crabtrading.backend.model.LedgerState;
import com.crabtrading.backend.repository.LegacyStateFileReader;
import com.crabtrading.backend.repository.SnapshotRepository;
import com.crabtrading.backend.service.LedgerMetrics;
import com.crabtrading.backend.service.persistence.migration.SnapshotMigrator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Optional;

/**
 * Loads the ledger at startup and writes it after every mutation.
 * <p>
 * Load order: database snapshot, then the legacy state file. Whatever is found is upgraded
 * through the {@link SnapshotMigrator} chain and repaired by the codec; a migrated, repaired
 * or file-sourced ledger is written back to the database immediately.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerPersistenceService {

    private final SnapshotRepository snapshotRepository;
    private final LegacyStateFileReader legacyStateFileReader;
    private final SnapshotMigrator snapshotMigrator;
    private final LedgerSnapshotCodec snapshotCodec;
    private final ObjectMapper objectMapper;
    private final LedgerProperties ledgerProperties;
    private final LedgerMetrics ledgerMetrics;

    public LedgerState load() {
        Optional<String> payload = snapshotRepository.loadLatest();
        boolean fromLegacyFile = false;
        if (payload.isEmpty()) {
            try {
                payload = legacyStateFileReader.read();
            } catch (LedgerPersistenceException e) {
                return onUnreadableSnapshot("legacy state file", null, e);
            }
            fromLegacyFile = payload.isPresent();
        }
        if (payload.isEmpty()) {
            log.info("No ledger snapshot found, starting with an empty ledger");
            return new LedgerState();
        }

        String source = fromLegacyFile ? "legacy state file" : "database snapshot";
        SnapshotMigrator.Result migrated;
        LedgerSnapshotCodec.DecodeResult decoded;
        try {
            JsonNode root = objectMapper.readTree(payload.get());
            if (!(root instanceof ObjectNode object)) {
                throw new IllegalStateException("Snapshot root is not a JSON object");
            }
            migrated = snapshotMigrator.migrate(object);
            decoded = snapshotCodec.decode(migrated.snapshot());
        } catch (JsonProcessingException | RuntimeException e) {
            return onUnreadableSnapshot(source, payload.get(), e);
        }

        if (decoded.repaired()) {
            log.warn("Ledger snapshot repaired on load: {}", decoded.repairs());
        }
        if (fromLegacyFile || migrated.upgraded() || decoded.repaired()) {
            save(decoded.state());
            log.info("Ledger re-saved after load source={} version {} -> {} repairs={}",
                    source, migrated.fromVersion(), migrated.toVersion(), decoded.repairs().size());
        }
        return decoded.state();
    }

    /**
     * Caller must hold the ledger lock.
     */
    public void save(LedgerState state) {
        long start = System.nanoTime();
        boolean success = false;
        try {
            String payload = objectMapper.writeValueAsString(snapshotCodec.encode(state));
            snapshotRepository.save(payload);
            success = true;
        } catch (JsonProcessingException e) {
            throw new LedgerPersistenceException("Failed to encode ledger snapshot", e);
        } catch (DataAccessException e) {
            log.error("Ledger snapshot write failed: {}", e.getMessage());
            throw new LedgerPersistenceException("Failed to write ledger snapshot", e);
        } finally {
            ledgerMetrics.recordSnapshotWrite(System.nanoTime() - start, success);
        }
    }

    private LedgerState onUnreadableSnapshot(String source, String payload, Exception e) {
        if (ledgerProperties.getState().isFailOnCorruptSnapshot()) {
            throw new SnapshotCorruptedException("Unreadable ledger " + source, e);
        }
        if (payload != null) {
            quarantine(payload);
        }
        log.error("❌ Unreadable ledger {}, starting with an empty ledger: {}", source, e.getMessage(), e);
        return new LedgerState();
    }

    private void quarantine(String payload) {
        String dir = ledgerProperties.getState().getQuarantineDir();
        if (dir == null || dir.isBlank()) {
            return;
        }
        Path target = Paths.get(dir).resolve("ledger-snapshot-" + Instant.now().toEpochMilli() + ".json");
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, payload, StandardCharsets.UTF_8);
            log.warn("Unreadable ledger snapshot copied to {}", target);
        } catch (IOException e) {
            log.error("Failed to quarantine unreadable ledger snapshot to {}: {}", target, e.getMessage());
        }
    }
}

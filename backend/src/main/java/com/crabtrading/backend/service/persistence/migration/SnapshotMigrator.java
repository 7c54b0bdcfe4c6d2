package com.crabtrading.backend.service.persistence.migration;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Upgrades a snapshot document to {@link #CURRENT_VERSION} by applying migrations in order.
 */
@Slf4j
@Component
public class SnapshotMigrator {

    public static final int CURRENT_VERSION = 7;

    private final List<SnapshotMigration> migrations;

    public SnapshotMigrator(List<SnapshotMigration> migrations) {
        this.migrations = migrations.stream()
                .sorted(Comparator.comparingInt(SnapshotMigration::targetVersion))
                .toList();
    }

    public record Result(ObjectNode snapshot, int fromVersion, int toVersion) {
        public boolean upgraded() {
            return fromVersion != toVersion;
        }
    }

    public Result migrate(ObjectNode snapshot) {
        int fromVersion = snapshot.path("version").asInt(0);
        if (fromVersion > CURRENT_VERSION) {
            throw new IllegalStateException("Snapshot version " + fromVersion
                    + " is newer than supported version " + CURRENT_VERSION);
        }
        ObjectNode current = snapshot.deepCopy();
        int version = fromVersion;
        while (version < CURRENT_VERSION) {
            int from = version;
            SnapshotMigration migration = migrations.stream()
                    .filter(candidate -> candidate.appliesTo(from))
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No snapshot migration from version " + from));
            current = migration.migrate(current.deepCopy());
            version = migration.targetVersion();
            current.put("version", version);
            log.info("Snapshot migrated {} -> {} via {}", from, version, migration.getClass().getSimpleName());
        }
        return new Result(current, fromVersion, version);
    }
}

package com.crabtrading.backend.service.persistence.migration;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One step of the snapshot upgrade chain. Implementations are pure: they receive a private
 * copy of the document and return the upgraded document.
 */
public interface SnapshotMigration {

    boolean appliesTo(int version);

    int targetVersion();

    ObjectNode migrate(ObjectNode snapshot);
}

package com.crabtrading.backend.repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Single-row store for the serialized ledger. {@link #save} replaces the row atomically.
 */
public interface SnapshotRepository {

    Optional<String> loadLatest();

    Optional<Instant> lastUpdatedAt();

    void save(String payload);
}

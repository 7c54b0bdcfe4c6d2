package com.crabtrading.backend.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcSnapshotRepository implements SnapshotRepository {

    private static final int SNAPSHOT_ROW_ID = 1;

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<String> loadLatest() {
        List<String> rows = jdbcTemplate.query(
                "SELECT payload FROM ledger_state WHERE id = ?",
                (rs, rowNum) -> rs.getString("payload"),
                SNAPSHOT_ROW_ID);
        return rows.stream().filter(payload -> payload != null && !payload.isBlank()).findFirst();
    }

    @Override
    public Optional<Instant> lastUpdatedAt() {
        List<Timestamp> rows = jdbcTemplate.query(
                "SELECT updated_at FROM ledger_state WHERE id = ?",
                (rs, rowNum) -> rs.getTimestamp("updated_at"),
                SNAPSHOT_ROW_ID);
        return rows.stream().findFirst().map(Timestamp::toInstant);
    }

    @Override
    @Transactional
    public void save(String payload) {
        Timestamp now = Timestamp.from(Instant.now());
        int updated = jdbcTemplate.update(
                "UPDATE ledger_state SET payload = ?, updated_at = ? WHERE id = ?",
                payload, now, SNAPSHOT_ROW_ID);
        if (updated == 0) {
            jdbcTemplate.update(
                    "INSERT INTO ledger_state (id, payload, updated_at) VALUES (?, ?, ?)",
                    SNAPSHOT_ROW_ID, payload, now);
        }
        log.debug("Ledger snapshot written bytes={}", payload.length());
    }
}

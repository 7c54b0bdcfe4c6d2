package com.crabtrading.backend.repository;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.assertj.core.api.Assertions.assertThat;

@JdbcTest
@Import(JdbcSnapshotRepository.class)
class JdbcSnapshotRepositoryTest {

    @Autowired
    private JdbcSnapshotRepository snapshotRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    void emptyTableHasNoSnapshot() {
        assertThat(snapshotRepository.loadLatest()).isEmpty();
        assertThat(snapshotRepository.lastUpdatedAt()).isEmpty();
    }

    @Test
    void saveReplacesTheSingleRow() {
        snapshotRepository.save("{\"version\":7,\"n\":1}");
        snapshotRepository.save("{\"version\":7,\"n\":2}");

        assertThat(snapshotRepository.loadLatest()).contains("{\"version\":7,\"n\":2}");
        assertThat(snapshotRepository.lastUpdatedAt()).isPresent();
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM ledger_state", Integer.class)).isEqualTo(1);
    }
}

package com.wpanther.cgaca.service;

import com.wpanther.cgaca.entity.SchemaVersion;
import com.wpanther.cgaca.repository.SchemaVersionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Tracks the registry schema version and applies additive migrations at startup.
 * Tables and columns are created by Hibernate; migrations here only add what it cannot, such as indexes.
 */
@Service
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
@Slf4j
public class SchemaVersionManager implements ApplicationRunner {

    static final int BASELINE_VERSION = 1;

    // Version -> statements, applied in ascending order; never edit a released entry
    private static final TreeMap<Integer, List<String>> MIGRATIONS = new TreeMap<>(Map.of(
            2, List.of(
                    "CREATE INDEX IF NOT EXISTS idx_audit_log_action ON audit_log (action)",
                    "CREATE INDEX IF NOT EXISTS idx_revocations_revoked_at ON revocations (revoked_at)")));

    static final int CODE_VERSION = MIGRATIONS.lastKey();

    private final SchemaVersionRepository schemaVersionRepository;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    @Override
    public void run(ApplicationArguments args) {
        migrate();
    }

    /**
     * Brings the database up to the version of this code.
     *
     * @return the version after migration
     * @throws IllegalStateException when the database was written by newer code
     */
    @Transactional
    public int migrate() {
        int current = schemaVersionRepository.findCurrentVersion().orElse(0);
        if (current > CODE_VERSION) {
            throw new IllegalStateException(String.format(
                    "Database schema version %d is newer than supported version %d, refusing to start",
                    current, CODE_VERSION));
        }

        if (current == 0) {
            record(BASELINE_VERSION);
            current = BASELINE_VERSION;
            log.info("Recorded baseline schema version {}", BASELINE_VERSION);
        }

        for (Map.Entry<Integer, List<String>> migration : MIGRATIONS.entrySet()) {
            if (migration.getKey() <= current) {
                continue;
            }
            for (String statement : migration.getValue()) {
                log.debug("Schema migration {}: {}", migration.getKey(), statement);
                jdbcTemplate.execute(statement);
            }
            record(migration.getKey());
            current = migration.getKey();
            log.info("Applied schema migration {}", current);
        }
        return current;
    }

    public int getCurrentVersion() {
        return schemaVersionRepository.findCurrentVersion().orElse(0);
    }

    private void record(int version) {
        schemaVersionRepository.save(SchemaVersion.builder()
                .version(version)
                .appliedAt(Instant.now(clock).truncatedTo(ChronoUnit.MILLIS))
                .build());
    }
}

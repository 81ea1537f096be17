package net.javahippie.workoutlog.migration;

import lombok.extern.slf4j.Slf4j;
import net.javahippie.workoutlog.exception.SchemaMigrationException;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Creates the store schema and brings it to the target version.
 *
 * Each pending migration runs in its own transaction together with the version update,
 * so a failure leaves the store at the last successfully applied version.
 */
@Slf4j
public class SchemaMigrationService {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final List<Migration> migrations;
    private final int targetVersion;

    public SchemaMigrationService(JdbcTemplate jdbcTemplate,
                                  TransactionTemplate transactionTemplate,
                                  List<Migration> migrations,
                                  int targetVersion) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.migrations = List.copyOf(migrations);
        this.targetVersion = targetVersion;
    }

    public int getTargetVersion() {
        return targetVersion;
    }

    /**
     * Create tables if absent, make sure the version record exists and apply pending migrations.
     *
     * @return number of migrations applied
     * @throws SchemaMigrationException if a migration fails
     */
    public int initialize() {
        boolean untrackedTables = tableExists("exercise_definitions") && !tableExists(SchemaMigrations.VERSION_TABLE);

        SchemaMigrations.CREATE_STATEMENTS.forEach(jdbcTemplate::execute);
        jdbcTemplate.execute(SchemaMigrations.CREATE_VERSION_TABLE);

        ensureVersionRecord(untrackedTables ? SchemaMigrations.BASELINE_VERSION : targetVersion);

        return runMigrations();
    }

    /**
     * Apply every registered migration newer than the stored version, in ascending order.
     *
     * @return number of migrations applied
     * @throws SchemaMigrationException if a migration fails
     */
    public int runMigrations() {
        int currentVersion = getCurrentVersion();

        if (currentVersion >= targetVersion) {
            log.info("Schema is up to date (version {})", currentVersion);
            return 0;
        }

        List<Migration> pending = migrations.stream()
                .filter(m -> m.version() > currentVersion && m.version() <= targetVersion)
                .sorted(Comparator.comparingInt(Migration::version))
                .toList();

        if (pending.isEmpty()) {
            setVersion(targetVersion);
            log.info("No migrations registered, bumped schema version from {} to {}", currentVersion, targetVersion);
            return 0;
        }

        for (Migration migration : pending) {
            log.info("Running migration {}: {}", migration.version(), migration.name());
            try {
                transactionTemplate.executeWithoutResult(status -> {
                    migration.apply(jdbcTemplate);
                    setVersion(migration.version());
                });
            } catch (RuntimeException e) {
                log.error("Migration {} ({}) failed", migration.version(), migration.name(), e);
                throw new SchemaMigrationException(migration.version(),
                        String.format("Migration %d (%s) failed: %s",
                                migration.version(), migration.name(), e.getMessage()), e);
            }
            log.info("Migration {} completed successfully", migration.version());
        }

        if (getCurrentVersion() < targetVersion) {
            setVersion(targetVersion);
        }

        return pending.size();
    }

    /**
     * Stored schema version, or 0 when version tracking does not exist yet.
     */
    public int getCurrentVersion() {
        if (!tableExists(SchemaMigrations.VERSION_TABLE)) {
            return 0;
        }
        List<Integer> versions = jdbcTemplate.queryForList(
                "SELECT version FROM schema_version WHERE id = 1", Integer.class);
        return versions.isEmpty() ? 0 : versions.get(0);
    }

    /**
     * Check that all expected tables exist and compare the stored version with the target.
     * Advisory only: a version mismatch is reported, not treated as invalid.
     */
    public SchemaValidationResult validateSchema() {
        List<String> missing = new ArrayList<>();
        try {
            for (String table : SchemaMigrations.EXPECTED_TABLES) {
                if (!tableExists(table)) {
                    log.error("Missing table: {}", table);
                    missing.add(table);
                }
            }
        } catch (DataAccessException e) {
            log.error("Schema validation failed", e);
            return SchemaValidationResult.builder()
                    .valid(false)
                    .missingTables(new ArrayList<>(SchemaMigrations.EXPECTED_TABLES))
                    .expectedVersion(targetVersion)
                    .build();
        }

        int storedVersion = missing.contains(SchemaMigrations.VERSION_TABLE) ? 0 : getCurrentVersion();
        if (storedVersion != targetVersion) {
            log.warn("Schema version mismatch: expected {}, got {}", targetVersion, storedVersion);
        }

        return SchemaValidationResult.builder()
                .valid(missing.isEmpty())
                .missingTables(missing)
                .storedVersion(storedVersion)
                .expectedVersion(targetVersion)
                .build();
    }

    private void ensureVersionRecord(int initialVersion) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM schema_version WHERE id = 1", Integer.class);
        if (count == null || count == 0) {
            jdbcTemplate.update("INSERT INTO schema_version (id, version, updatedAt) VALUES (1, ?, ?)",
                    initialVersion, System.currentTimeMillis());
            log.info("Initialized schema version to {}", initialVersion);
        }
    }

    private void setVersion(int version) {
        jdbcTemplate.update("UPDATE schema_version SET version = ?, updatedAt = ? WHERE id = 1",
                version, System.currentTimeMillis());
    }

    private boolean tableExists(String table) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM sqlite_master WHERE type = 'table' AND name = ?", Integer.class, table);
        return count != null && count > 0;
    }
}

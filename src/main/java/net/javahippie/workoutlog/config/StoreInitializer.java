package net.javahippie.workoutlog.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.workoutlog.migration.SchemaMigrationService;
import net.javahippie.workoutlog.migration.SchemaValidationResult;
import net.javahippie.workoutlog.service.StoreAccessGuard;
import net.javahippie.workoutlog.service.StoreMaintenanceService;
import org.springframework.stereotype.Component;

/**
 * Brings the store to a usable state: schema, migrations, seed data.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StoreInitializer {

    private final SchemaMigrationService schemaMigrationService;
    private final StoreMaintenanceService maintenanceService;
    private final StoreAccessGuard guard;

    /**
     * Create and migrate the schema, then seed the catalog if it is empty.
     *
     * @throws net.javahippie.workoutlog.exception.SchemaMigrationException if a migration fails
     * @throws IllegalStateException if tables are still missing afterwards
     */
    public void initialize() {
        int applied = schemaMigrationService.initialize();

        SchemaValidationResult validation = schemaMigrationService.validateSchema();
        if (!validation.isValid()) {
            throw new IllegalStateException("Store schema is invalid, missing tables: " + validation.getMissingTables());
        }
        if (!validation.isUpToDate()) {
            log.warn("Store schema version {} differs from expected version {}",
                    validation.getStoredVersion(), validation.getExpectedVersion());
        }

        guard.markReady();
        int seeded = maintenanceService.seedInitialDefinitions();
        log.info("Store initialized at schema version {} ({} migrations applied, {} definitions seeded)",
                validation.getStoredVersion(), applied, seeded);
    }

    /**
     * Run initialization again after the store file was replaced by a restore.
     */
    public void reinitialize() {
        log.info("Reinitializing store");
        initialize();
    }
}

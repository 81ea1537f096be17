package net.javahippie.workoutlog.service;

import lombok.extern.slf4j.Slf4j;
import net.javahippie.workoutlog.model.dto.ExerciseDefinitionImport;
import net.javahippie.workoutlog.repository.ExerciseDefinitionRepository;
import net.javahippie.workoutlog.repository.LoggedExerciseRepository;
import net.javahippie.workoutlog.repository.WorkoutSetRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Seeding and wiping of the store.
 */
@Service
@Slf4j
public class StoreMaintenanceService {

    private final ExerciseDefinitionRepository definitionRepository;
    private final LoggedExerciseRepository exerciseRepository;
    private final WorkoutSetRepository setRepository;
    private final ExerciseCatalogImportService importService;
    private final StoreAccessGuard guard;
    private final TransactionTemplate transactionTemplate;
    private final Resource seedResource;

    public StoreMaintenanceService(ExerciseDefinitionRepository definitionRepository,
                                   LoggedExerciseRepository exerciseRepository,
                                   WorkoutSetRepository setRepository,
                                   ExerciseCatalogImportService importService,
                                   StoreAccessGuard guard,
                                   TransactionTemplate transactionTemplate,
                                   @Value("${workoutlog.seed.resource}") Resource seedResource) {
        this.definitionRepository = definitionRepository;
        this.exerciseRepository = exerciseRepository;
        this.setRepository = setRepository;
        this.importService = importService;
        this.guard = guard;
        this.transactionTemplate = transactionTemplate;
        this.seedResource = seedResource;
    }

    /**
     * Insert the bundled exercise definitions when the catalog is empty.
     *
     * @return number of definitions inserted, 0 when the catalog already had entries
     */
    public int seedInitialDefinitions() {
        return guard.exclusive("seedInitialDefinitions", () -> transactionTemplate.execute(status -> {
            if (definitionRepository.count() > 0) {
                log.debug("Exercise catalog already populated, skipping seed");
                return 0;
            }
            List<ExerciseDefinitionImport> seed = importService.parse(readSeed());
            int inserted = importService.insertAll(seed);
            log.info("Seeded {} exercise definitions from {}", inserted, seedResource.getDescription());
            return inserted;
        }));
    }

    /**
     * Delete all logged exercises and sets, keeping the catalog.
     */
    public void clearWorkoutData() {
        guard.exclusiveRun("clearWorkoutData", () -> transactionTemplate.executeWithoutResult(status -> {
            int sets = setRepository.deleteAll();
            int exercises = exerciseRepository.deleteAll();
            log.info("Cleared workout data: {} exercises, {} sets", exercises, sets);
        }));
    }

    /**
     * Delete everything and reseed the catalog in one transaction.
     */
    public void clearDatabase() {
        guard.exclusiveRun("clearDatabase", () -> transactionTemplate.executeWithoutResult(status -> {
            setRepository.deleteAll();
            exerciseRepository.deleteAll();
            int definitions = definitionRepository.deleteAll();
            log.info("Cleared store, removed {} exercise definitions", definitions);
            seedInitialDefinitions();
        }));
    }

    private String readSeed() {
        try (InputStream in = seedResource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read seed definitions from " + seedResource.getDescription(), e);
        }
    }
}

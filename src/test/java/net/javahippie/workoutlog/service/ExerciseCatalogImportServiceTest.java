package net.javahippie.workoutlog.service;

import net.javahippie.workoutlog.exception.CatalogImportException;
import net.javahippie.workoutlog.model.dto.ImportPreview;
import net.javahippie.workoutlog.model.dto.ImportSummary;
import net.javahippie.workoutlog.model.dto.ImportSummary.ImportMode;
import net.javahippie.workoutlog.model.dto.SetInput;
import net.javahippie.workoutlog.model.entity.ExerciseDefinition;
import net.javahippie.workoutlog.model.entity.ExerciseType;
import net.javahippie.workoutlog.model.entity.LoggedExercise;
import net.javahippie.workoutlog.repository.ExerciseDefinitionRepository;
import net.javahippie.workoutlog.repository.WorkoutSetRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for ExerciseCatalogImportService.
 */
@SpringBootTest
class ExerciseCatalogImportServiceTest {

    @Autowired
    private ExerciseCatalogImportService importService;

    @Autowired
    private WorkoutService workoutService;

    @Autowired
    private StoreMaintenanceService maintenanceService;

    @Autowired
    private ExerciseDefinitionRepository definitionRepository;

    @Autowired
    private WorkoutSetRepository setRepository;

    private ExerciseDefinition squats;

    @BeforeEach
    void setUp() {
        maintenanceService.clearDatabase();
        squats = workoutService.createDefinition("Squats", "Legs", ExerciseType.WEIGHT_REPS, "kg", null);
    }

    @Test
    @DisplayName("Preview should match names case-insensitively against the store and the batch")
    void testPreview() {
        String payload = """
                [
                  {"name": "squats ", "category": "Legs", "type": "weight_reps", "unit": "kg"},
                  {"name": "Box Jumps", "category": "Legs", "type": "reps", "unit": "reps"},
                  {"name": "box jumps", "category": "Legs", "type": "reps", "unit": "reps"}
                ]""";

        ImportPreview preview = importService.preview(payload);

        assertEquals(1, preview.getToAdd().size());
        assertEquals("Box Jumps", preview.getToAdd().get(0).getName());
        assertEquals(2, preview.getExisting().size());
    }

    @Test
    @DisplayName("Merge should add new names and report existing ones")
    void testImportDefinitions_Merge() {
        long before = definitionRepository.count();
        String payload = """
                [
                  {"name": "squats", "category": "Legs", "type": "weight_reps", "unit": "kg"},
                  {"name": "Sled Push", "category": "Full Body", "type": "weight_distance", "unit": "kg",
                   "description": "Push a loaded sled", "difficulty": "hard"}
                ]""";

        ImportSummary summary = importService.importDefinitions(payload, ImportMode.MERGE);

        assertEquals(ImportMode.MERGE, summary.getMode());
        assertEquals(1, summary.getAdded());
        assertEquals(1, summary.getAlreadyExisting());
        assertEquals(0, summary.getFailed());
        assertEquals(before + 1, definitionRepository.count());
        assertEquals(ExerciseType.WEIGHT_DISTANCE, workoutService.definitionByName("Sled Push").orElseThrow().getType());
    }

    @Test
    @DisplayName("Merge should continue past a record that cannot be inserted")
    void testImportDefinitions_MergeContinuesPastFailure() {
        String payload = """
                [
                  {"id": "%s", "name": "Clashing Id", "category": "Legs", "type": "reps", "unit": "reps"},
                  {"name": "Wall Sit", "category": "Legs", "type": "time_duration", "unit": "seconds"}
                ]""".formatted(squats.getId());

        ImportSummary summary = importService.importDefinitions(payload, ImportMode.MERGE);

        assertEquals(1, summary.getAdded());
        assertEquals(1, summary.getFailed());
        assertEquals(List.of("Clashing Id"), summary.getFailedNames());
        assertTrue(workoutService.definitionByName("Wall Sit").isPresent());
    }

    @Test
    @DisplayName("Invalid records should reject the whole payload before writing")
    void testImportDefinitions_InvalidPayload() {
        long before = definitionRepository.count();
        String payload = """
                [
                  {"name": "Valid One", "category": "Legs", "type": "reps", "unit": "reps"},
                  {"name": "No Unit", "category": "Legs", "type": "reps", "unit": ""},
                  {"name": "Bad Type", "category": "Legs", "type": "juggling", "unit": "reps"}
                ]""";

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> importService.importDefinitions(payload, ImportMode.MERGE));

        assertTrue(exception.getMessage().contains("unit"));
        assertTrue(exception.getMessage().contains("juggling"));
        assertEquals(before, definitionRepository.count());
    }

    @Test
    @DisplayName("Malformed JSON should raise a catalog import error")
    void testImportDefinitions_MalformedJson() {
        assertThrows(CatalogImportException.class,
                () -> importService.importDefinitions("{\"name\": \"not an array\"", ImportMode.MERGE));
    }

    @Test
    @DisplayName("Replace should remove logged data and install only the payload")
    void testImportDefinitions_Replace() {
        LoggedExercise exercise = workoutService.createExercise(squats.getId(), LocalDate.of(2025, 5, 1));
        workoutService.addSet(exercise.getId(), SetInput.builder().weight(100.0).reps(5).build());
        String payload = """
                [
                  {"name": "Goblet Squat", "category": "Legs", "type": "weight_reps", "unit": "kg"},
                  {"name": "goblet squat", "category": "Legs", "type": "weight_reps", "unit": "kg"},
                  {"name": "Burpees", "category": "Full Body", "type": "reps", "unit": "reps"}
                ]""";

        ImportSummary summary = importService.importDefinitions(payload, ImportMode.REPLACE);

        assertEquals(ImportMode.REPLACE, summary.getMode());
        assertEquals(2, summary.getAdded());
        assertEquals(1, summary.getAlreadyExisting());
        assertEquals(2, definitionRepository.count());
        assertEquals(0, setRepository.count());
        assertTrue(workoutService.definitionByName("Squats").isEmpty());
    }

    @Test
    @DisplayName("Replace should roll back completely when an insert fails")
    void testImportDefinitions_ReplaceRollsBack() {
        long before = definitionRepository.count();
        String payload = """
                [
                  {"id": "same-id", "name": "First", "category": "Legs", "type": "reps", "unit": "reps"},
                  {"id": "same-id", "name": "Second", "category": "Legs", "type": "reps", "unit": "reps"}
                ]""";

        assertThrows(DataAccessException.class, () -> importService.importDefinitions(payload, ImportMode.REPLACE));

        assertEquals(before, definitionRepository.count());
        assertTrue(workoutService.definitionByName("Squats").isPresent());
        assertTrue(workoutService.definitionByName("First").isEmpty());
    }
}

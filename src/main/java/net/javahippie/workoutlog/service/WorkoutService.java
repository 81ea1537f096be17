package net.javahippie.workoutlog.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.workoutlog.model.dto.DefinitionUpdateRequest;
import net.javahippie.workoutlog.model.dto.ExerciseWithSets;
import net.javahippie.workoutlog.model.dto.SetInput;
import net.javahippie.workoutlog.model.entity.ExerciseDefinition;
import net.javahippie.workoutlog.model.entity.ExerciseType;
import net.javahippie.workoutlog.model.entity.LoggedExercise;
import net.javahippie.workoutlog.model.entity.WorkoutSet;
import net.javahippie.workoutlog.repository.ExerciseDefinitionRepository;
import net.javahippie.workoutlog.repository.LoggedExerciseRepository;
import net.javahippie.workoutlog.repository.WorkoutQueryRepository;
import net.javahippie.workoutlog.repository.WorkoutSetRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads and writes exercise definitions, logged exercises and sets.
 *
 * Writes run through the {@link StoreAccessGuard}; multi-statement writes run in a
 * transaction. A write that throws has made no change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkoutService {

    private static final int MAX_NOTE_LENGTH = 1000;

    private final ExerciseDefinitionRepository definitionRepository;
    private final LoggedExerciseRepository exerciseRepository;
    private final WorkoutSetRepository setRepository;
    private final WorkoutQueryRepository queryRepository;
    private final PersonalRecordService personalRecordService;
    private final StoreAccessGuard guard;
    private final TransactionTemplate transactionTemplate;

    // ---------------------------------------------------------------------
    // Exercise definitions
    // ---------------------------------------------------------------------

    /**
     * Create a catalog entry.
     *
     * @throws IllegalArgumentException if a required field is blank
     * @throws org.springframework.dao.DuplicateKeyException if the name is taken
     */
    public ExerciseDefinition createDefinition(String name, String category, ExerciseType type,
                                               String unit, String description) {
        requireText(name, "Exercise name");
        requireText(category, "Category");
        requireText(unit, "Unit");
        if (type == null) {
            throw new IllegalArgumentException("Exercise type is required");
        }

        ExerciseDefinition definition = ExerciseDefinition.builder()
                .id(UUID.randomUUID().toString())
                .name(name.trim())
                .category(category.trim())
                .type(type)
                .unit(unit.trim())
                .description(blankToNull(description))
                .createdAt(System.currentTimeMillis())
                .build();

        return guard.exclusive("createDefinition", () -> {
            definitionRepository.save(definition);
            log.info("Created exercise definition '{}' ({})", definition.getName(), type.getKey());
            return definition;
        });
    }

    /**
     * Apply the non-null fields of a request to a definition.
     *
     * @throws IllegalArgumentException if the definition does not exist or a field is blank
     */
    public ExerciseDefinition updateDefinition(String id, DefinitionUpdateRequest request) {
        return guard.exclusive("updateDefinition", () -> {
            ExerciseDefinition definition = definitionRepository.findById(id)
                    .orElseThrow(() -> new IllegalArgumentException("Exercise definition not found: " + id));

            if (request.getName() != null) {
                requireText(request.getName(), "Exercise name");
                definition.setName(request.getName().trim());
            }
            if (request.getCategory() != null) {
                requireText(request.getCategory(), "Category");
                definition.setCategory(request.getCategory().trim());
            }
            if (request.getType() != null) {
                definition.setType(request.getType());
            }
            if (request.getUnit() != null) {
                requireText(request.getUnit(), "Unit");
                definition.setUnit(request.getUnit().trim());
            }
            if (request.getDescription() != null) {
                definition.setDescription(blankToNull(request.getDescription()));
            }

            definitionRepository.update(definition);
            log.debug("Updated exercise definition {}", id);
            return definition;
        });
    }

    /**
     * Move several definitions to one category.
     *
     * @return number of definitions changed
     */
    public int updateCategory(Collection<String> ids, String category) {
        requireText(category, "Category");
        return guard.exclusive("updateCategory", () -> transactionTemplate.execute(status ->
                definitionRepository.updateCategory(ids, category.trim())));
    }

    /**
     * Delete a definition with all its logged exercises and sets.
     *
     * @return true if the definition existed
     */
    public boolean deleteDefinition(String id) {
        return Boolean.TRUE.equals(guard.exclusive("deleteDefinition", () -> transactionTemplate.execute(status -> {
            int sets = setRepository.deleteByDefinitionId(id);
            int exercises = exerciseRepository.deleteByDefinitionId(id);
            int definitions = definitionRepository.deleteById(id);
            log.info("Deleted exercise definition {} with {} exercises and {} sets", id, exercises, sets);
            return definitions > 0;
        })));
    }

    public List<ExerciseDefinition> allDefinitions() {
        return definitionRepository.findAllOrderByName();
    }

    public Optional<ExerciseDefinition> definitionById(String id) {
        return definitionRepository.findById(id);
    }

    public Optional<ExerciseDefinition> definitionByName(String name) {
        return definitionRepository.findByName(name);
    }

    /**
     * Distinct categories, ascending.
     */
    public List<String> categories() {
        return definitionRepository.findDistinctCategories();
    }

    /**
     * Definitions that were logged at least once.
     */
    public List<ExerciseDefinition> usedExercises() {
        return definitionRepository.findUsed();
    }

    // ---------------------------------------------------------------------
    // Logged exercises
    // ---------------------------------------------------------------------

    /**
     * Log a definition on a date.
     *
     * @throws IllegalArgumentException if the definition does not exist
     */
    public LoggedExercise createExercise(String definitionId, LocalDate date) {
        requireDate(date);
        return guard.exclusive("createExercise", () -> {
            requireDefinition(definitionId);
            LoggedExercise exercise = LoggedExercise.builder()
                    .id(UUID.randomUUID().toString())
                    .definitionId(definitionId)
                    .date(date)
                    .createdAt(System.currentTimeMillis())
                    .build();
            exerciseRepository.save(exercise);
            log.debug("Logged exercise {} for definition {} on {}", exercise.getId(), definitionId, date);
            return exercise;
        });
    }

    /**
     * Return the record for a definition and date, creating it when absent.
     */
    public LoggedExercise findOrCreateExercise(String definitionId, LocalDate date) {
        requireDate(date);
        return guard.exclusive("findOrCreateExercise", () -> exerciseRepository
                .findByDefinitionIdAndDate(definitionId, date)
                .orElseGet(() -> createExercise(definitionId, date)));
    }

    /**
     * Delete a logged exercise and its sets.
     *
     * @return true if the exercise existed
     */
    public boolean deleteExercise(String exerciseId) {
        return Boolean.TRUE.equals(guard.exclusive("deleteExercise", () -> transactionTemplate.execute(status -> {
            int sets = setRepository.deleteByExerciseId(exerciseId);
            int exercises = exerciseRepository.deleteById(exerciseId);
            log.debug("Deleted exercise {} with {} sets", exerciseId, sets);
            return exercises > 0;
        })));
    }

    /**
     * Exercises logged on a date with their sets, personal bests flagged.
     * Exercises without sets are included with an empty list.
     */
    public List<ExerciseWithSets> exercisesForDate(LocalDate date) {
        requireDate(date);
        List<ExerciseWithSets> exercises = queryRepository.findExercisesWithSetsForDate(date);
        personalRecordService.flagPersonalBests(exercises);
        return exercises;
    }

    /**
     * Every logged exercise with its sets, newest date first.
     */
    public List<ExerciseWithSets> allExercisesWithSets() {
        return queryRepository.findAllExercisesWithSets();
    }

    /**
     * Dates with at least one logged exercise, inclusive range, ascending.
     */
    public List<LocalDate> datesWithExercises(LocalDate startDate, LocalDate endDate) {
        requireDate(startDate);
        requireDate(endDate);
        return exerciseRepository.findDistinctDatesBetween(startDate, endDate);
    }

    /**
     * Most recent session of an exercise, used to pre-fill inputs.
     *
     * @param excludeDate date to skip, usually today; may be null
     */
    public Optional<ExerciseWithSets> lastExerciseByName(String name, LocalDate excludeDate) {
        return exerciseRepository.findLatestByDefinitionName(name, excludeDate)
                .flatMap(exercise -> definitionRepository.findById(exercise.getDefinitionId())
                        .map(definition -> ExerciseWithSets.builder()
                                .id(exercise.getId())
                                .definitionId(definition.getId())
                                .name(definition.getName())
                                .category(definition.getCategory())
                                .type(definition.getType())
                                .date(exercise.getDate())
                                .createdAt(exercise.getCreatedAt())
                                .sets(setRepository.findByExerciseId(exercise.getId()))
                                .build()));
    }

    /**
     * Best set ever recorded for an exercise.
     *
     * @param excludeDate date whose sets are ignored, may be null
     */
    public Optional<WorkoutSet> personalBestForExercise(String name, LocalDate excludeDate) {
        return personalRecordService.personalBestForExercise(name, excludeDate);
    }

    // ---------------------------------------------------------------------
    // Sets
    // ---------------------------------------------------------------------

    /**
     * Record a set. The returned set is flagged when it beats every earlier set.
     *
     * @throws IllegalArgumentException if the exercise does not exist or the input
     *                                  does not match the exercise type
     */
    public WorkoutSet addSet(String exerciseId, SetInput input) {
        return guard.exclusive("addSet", () -> {
            LoggedExercise exercise = exerciseRepository.findById(exerciseId)
                    .orElseThrow(() -> new IllegalArgumentException("Exercise not found: " + exerciseId));
            ExerciseDefinition definition = requireDefinition(exercise.getDefinitionId());

            validateSetInput(definition.getType(), input);

            long lastTimestamp = setRepository.maxTimestamp();

            WorkoutSet set = WorkoutSet.builder()
                    .id(UUID.randomUUID().toString())
                    .exerciseId(exerciseId)
                    .weight(input.getWeight())
                    .reps(input.getReps())
                    .distance(input.getDistance())
                    .time(input.getTime())
                    .note(blankToNull(input.getNote()))
                    .timestamp(Math.max(System.currentTimeMillis(), lastTimestamp + 1))
                    .build();

            set.setPersonalBest(personalRecordService.isNewPersonalBest(
                    definition.getName(), definition.getType(), exercise.getDate(), set));
            setRepository.save(set);
            return set;
        });
    }

    /**
     * Apply the non-null fields of an input to a set.
     *
     * @throws IllegalArgumentException if the set does not exist or the result does not match the type
     */
    public WorkoutSet updateSet(String setId, SetInput input) {
        return guard.exclusive("updateSet", () -> {
            WorkoutSet set = setRepository.findById(setId)
                    .orElseThrow(() -> new IllegalArgumentException("Set not found: " + setId));
            LoggedExercise exercise = exerciseRepository.findById(set.getExerciseId())
                    .orElseThrow(() -> new IllegalStateException("Set " + setId + " has no exercise"));
            ExerciseDefinition definition = requireDefinition(exercise.getDefinitionId());

            SetInput merged = SetInput.builder()
                    .weight(input.getWeight() != null ? input.getWeight() : set.getWeight())
                    .reps(input.getReps() != null ? input.getReps() : set.getReps())
                    .distance(input.getDistance() != null ? input.getDistance() : set.getDistance())
                    .time(input.getTime() != null ? input.getTime() : set.getTime())
                    .note(input.getNote() != null ? input.getNote() : set.getNote())
                    .build();
            validateSetInput(definition.getType(), merged);

            set.setWeight(merged.getWeight());
            set.setReps(merged.getReps());
            set.setDistance(merged.getDistance());
            set.setTime(merged.getTime());
            set.setNote(blankToNull(merged.getNote()));
            setRepository.update(set);
            return set;
        });
    }

    /**
     * @return true if the set existed
     */
    public boolean deleteSet(String setId) {
        return guard.exclusive("deleteSet", () -> setRepository.deleteById(setId) > 0);
    }

    /**
     * Sets of one exercise in insertion order.
     */
    public List<WorkoutSet> setsForExercise(String exerciseId) {
        return setRepository.findByExerciseId(exerciseId);
    }

    /**
     * Check that exactly the fields the type measures are present and positive.
     *
     * @throws IllegalArgumentException if the input does not match
     */
    static void validateSetInput(ExerciseType type, SetInput input) {
        if (input == null) {
            throw new IllegalArgumentException("Set input is required");
        }
        checkField("weight", type.usesWeight(), input.getWeight(), type);
        checkField("reps", type.usesReps(), input.getReps(), type);
        checkField("distance", type.usesDistance(), input.getDistance(), type);
        checkField("time", type.usesTime(), input.getTime(), type);
        if (input.getNote() != null && input.getNote().length() > MAX_NOTE_LENGTH) {
            throw new IllegalArgumentException("Note exceeds " + MAX_NOTE_LENGTH + " characters");
        }
    }

    private static void checkField(String field, boolean required, Number value, ExerciseType type) {
        if (required && (value == null || value.doubleValue() <= 0)) {
            throw new IllegalArgumentException(
                    String.format("Exercise type %s requires a positive %s", type.getKey(), field));
        }
        if (!required && value != null) {
            throw new IllegalArgumentException(
                    String.format("Exercise type %s does not record %s", type.getKey(), field));
        }
    }

    private ExerciseDefinition requireDefinition(String definitionId) {
        return definitionRepository.findById(definitionId)
                .orElseThrow(() -> new IllegalArgumentException("Exercise definition not found: " + definitionId));
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }

    private static void requireDate(LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("Date is required");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}

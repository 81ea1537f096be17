package net.javahippie.workoutlog.service;

import net.javahippie.workoutlog.model.dto.ExerciseWithSets;
import net.javahippie.workoutlog.model.entity.ExerciseDefinition;
import net.javahippie.workoutlog.model.entity.ExerciseType;
import net.javahippie.workoutlog.model.entity.WorkoutSet;
import net.javahippie.workoutlog.repository.ExerciseDefinitionRepository;
import net.javahippie.workoutlog.repository.WorkoutQueryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PersonalRecordService.
 * Tests personal best detection for new and recorded sets.
 */
@ExtendWith(MockitoExtension.class)
class PersonalRecordServiceTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 12, 1);
    private static final LocalDate WEDNESDAY = LocalDate.of(2025, 12, 3);

    @Mock
    private ExerciseDefinitionRepository definitionRepository;

    @Mock
    private WorkoutQueryRepository queryRepository;

    @InjectMocks
    private PersonalRecordService personalRecordService;

    private ExerciseDefinition sprint;

    @BeforeEach
    void setUp() {
        sprint = ExerciseDefinition.builder()
                .id("def-1")
                .name("Sprints")
                .category("Cardio")
                .type(ExerciseType.TIME_SPEED)
                .unit("seconds")
                .build();
    }

    @Test
    @DisplayName("Should detect a faster sprint as a new personal best")
    void testIsNewPersonalBest_FasterTime() {
        // Given
        when(queryRepository.findExercisesWithSetsByName(eq("Sprints"), isNull(), isNull(), eq(WEDNESDAY)))
                .thenReturn(List.of(exercise(MONDAY, timed("s1", 60), timed("s2", 55))));

        // When
        boolean faster = personalRecordService.isNewPersonalBest("Sprints", ExerciseType.TIME_SPEED, WEDNESDAY, timed("new", 45));
        boolean slower = personalRecordService.isNewPersonalBest("Sprints", ExerciseType.TIME_SPEED, WEDNESDAY, timed("new", 58));

        // Then
        assertTrue(faster);
        assertFalse(slower);
    }

    @Test
    @DisplayName("Should only compare against sets up to the exercise date")
    void testIsNewPersonalBest_BoundedByDate() {
        // Given
        when(queryRepository.findExercisesWithSetsByName(eq("Sprints"), isNull(), isNull(), eq(MONDAY)))
                .thenReturn(List.of());

        // When
        boolean personalBest = personalRecordService.isNewPersonalBest("Sprints", ExerciseType.TIME_SPEED, MONDAY, timed("new", 70));

        // Then
        assertTrue(personalBest);
        verify(queryRepository).findExercisesWithSetsByName("Sprints", null, null, MONDAY);
        verifyNoInteractions(definitionRepository);
    }

    @Test
    @DisplayName("First set of an exercise should be a personal best")
    void testIsNewPersonalBest_NoHistory() {
        when(queryRepository.findExercisesWithSetsByName(any(), any(), any(), any())).thenReturn(List.of());

        assertTrue(personalRecordService.isNewPersonalBest("Sprints", ExerciseType.TIME_SPEED, MONDAY, timed("new", 70)));
    }

    @Test
    @DisplayName("Unknown exercise should have no personal best")
    void testPersonalBestForExercise_Unknown() {
        when(definitionRepository.findByName("Unknown")).thenReturn(Optional.empty());

        assertTrue(personalRecordService.personalBestForExercise("Unknown", null).isEmpty());
        verifyNoInteractions(queryRepository);
    }

    @Test
    @DisplayName("Should flag only sets that beat every earlier set")
    void testFlagPersonalBests() {
        // Given
        ExerciseWithSets wednesday = exercise(WEDNESDAY, timed("w1", 58), timed("w2", 50), timed("w3", 50));
        when(queryRepository.findExercisesWithSetsByName("Sprints", null, null, WEDNESDAY))
                .thenReturn(List.of(
                        exercise(MONDAY, timed("m1", 60), timed("m2", 55)),
                        exercise(WEDNESDAY, timed("w1", 58), timed("w2", 50), timed("w3", 50))));

        // When
        personalRecordService.flagPersonalBests(List.of(wednesday));

        // Then
        List<WorkoutSet> sets = wednesday.getSets();
        assertFalse(sets.get(0).isPersonalBest());
        assertTrue(sets.get(1).isPersonalBest());
        assertFalse(sets.get(2).isPersonalBest());
    }

    @Test
    @DisplayName("Sets of two records on one date should be ranked by timestamp")
    void testFlagPersonalBests_RecordsMergedByTimestamp() {
        // Given
        ExerciseWithSets first = exercise(MONDAY, timed("a1", 60, 1L), timed("a2", 50, 3L));
        ExerciseWithSets second = exercise(MONDAY, timed("b1", 55, 2L));
        when(queryRepository.findExercisesWithSetsByName("Sprints", null, null, MONDAY))
                .thenReturn(List.of(
                        exercise(MONDAY, timed("a1", 60, 1L), timed("a2", 50, 3L)),
                        exercise(MONDAY, timed("b1", 55, 2L))));

        // When
        personalRecordService.flagPersonalBests(List.of(first, second));

        // Then
        assertTrue(first.getSets().get(0).isPersonalBest());
        assertTrue(second.getSets().get(0).isPersonalBest());
        assertTrue(first.getSets().get(1).isPersonalBest());
    }

    @Test
    @DisplayName("Exercises without sets should not query history")
    void testFlagPersonalBests_NoSets() {
        personalRecordService.flagPersonalBests(List.of(exercise(MONDAY)));

        verifyNoInteractions(queryRepository);
    }

    private static ExerciseWithSets exercise(LocalDate date, WorkoutSet... sets) {
        return ExerciseWithSets.builder()
                .id("ex-" + date)
                .name("Sprints")
                .type(ExerciseType.TIME_SPEED)
                .date(date)
                .sets(new ArrayList<>(List.of(sets)))
                .build();
    }

    private static WorkoutSet timed(String id, int seconds) {
        return WorkoutSet.builder().id(id).time(seconds).build();
    }

    private static WorkoutSet timed(String id, int seconds, long timestamp) {
        return WorkoutSet.builder().id(id).time(seconds).timestamp(timestamp).build();
    }
}

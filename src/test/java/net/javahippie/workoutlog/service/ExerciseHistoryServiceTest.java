package net.javahippie.workoutlog.service;

import net.javahippie.workoutlog.model.dto.ChartDataPoint;
import net.javahippie.workoutlog.model.dto.DailySets;
import net.javahippie.workoutlog.model.dto.ExerciseWithSets;
import net.javahippie.workoutlog.model.entity.ExerciseType;
import net.javahippie.workoutlog.model.entity.WorkoutSet;
import net.javahippie.workoutlog.repository.WorkoutQueryRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ExerciseHistoryService.
 */
@ExtendWith(MockitoExtension.class)
class ExerciseHistoryServiceTest {

    private static final LocalDate DAY_1 = LocalDate.of(2025, 1, 6);
    private static final LocalDate DAY_2 = LocalDate.of(2025, 1, 8);
    private static final LocalDate DAY_3 = LocalDate.of(2025, 1, 10);

    @Mock
    private WorkoutQueryRepository queryRepository;

    @InjectMocks
    private ExerciseHistoryService historyService;

    @Test
    @DisplayName("Chart points should aggregate each day independently, oldest first")
    void testExerciseHistoryForChart() {
        // Given
        when(queryRepository.findExercisesWithSetsByName(eq("Bench"), isNull(), any(), any()))
                .thenReturn(List.of(
                        exercise(DAY_1, set(100.0, 5), set(80.0, 10)),
                        exercise(DAY_2, set(105.0, 3))));

        // When
        List<ChartDataPoint> points = historyService.exerciseHistoryForChart("Bench", DAY_1, DAY_2);

        // Then
        assertEquals(2, points.size());
        ChartDataPoint first = points.get(0);
        assertEquals(DAY_1, first.getDate());
        assertEquals(100.0, first.getBestWeight());
        assertEquals(10, first.getBestReps());
        assertEquals(1300.0, first.getTotalVolume());
        assertEquals(2, first.getSetCount());
        assertEquals(116.67, first.getBestEstimatedOneRepMax(), 0.01);
        assertEquals(DAY_2, points.get(1).getDate());
        verify(queryRepository).findExercisesWithSetsByName("Bench", null, DAY_1, DAY_2);
    }

    @Test
    @DisplayName("Days without sets should not produce chart points")
    void testExerciseHistoryForChart_SkipsEmptyDays() {
        when(queryRepository.findExercisesWithSetsByName(any(), any(), any(), any()))
                .thenReturn(List.of(exercise(DAY_1), exercise(DAY_2, set(50.0, 5))));

        List<ChartDataPoint> points = historyService.exerciseHistoryForChart("Bench", null, null);

        assertEquals(1, points.size());
        assertEquals(DAY_2, points.get(0).getDate());
    }

    @Test
    @DisplayName("Sets without weight should leave the one-rep-max estimate empty")
    void testExerciseHistoryForChart_NoOneRepMax() {
        WorkoutSet run = WorkoutSet.builder().id("r").distance(5.0).time(1500).build();
        when(queryRepository.findExercisesWithSetsByName(any(), any(), any(), any()))
                .thenReturn(List.of(exercise(DAY_1, run)));

        ChartDataPoint point = historyService.exerciseHistoryForChart("Running", null, null).get(0);

        assertNull(point.getBestEstimatedOneRepMax());
        assertEquals(5.0, point.getBestDistance());
        assertEquals(1500, point.getBestTime());
        assertEquals(0.0, point.getTotalVolume());
    }

    @Test
    @DisplayName("Best time of a sprint day should be the fastest run")
    void testExerciseHistoryForChart_SprintBestTimeIsFastest() {
        // Given
        ExerciseWithSets sprints = ExerciseWithSets.builder()
                .id("e-sprints")
                .name("Sprints")
                .type(ExerciseType.TIME_SPEED)
                .date(DAY_1)
                .sets(new ArrayList<>(List.of(
                        WorkoutSet.builder().id("s1").time(62).build(),
                        WorkoutSet.builder().id("s2").time(55).build(),
                        WorkoutSet.builder().id("s3").time(58).build())))
                .build();
        when(queryRepository.findExercisesWithSetsByName(any(), any(), any(), any())).thenReturn(List.of(sprints));

        // When
        ChartDataPoint point = historyService.exerciseHistoryForChart("Sprints", null, null).get(0);

        // Then
        assertEquals(55, point.getBestTime());
        assertEquals(3, point.getSetCount());
    }

    @Test
    @DisplayName("History with sets should be newest first and limited to N days")
    void testExerciseHistoryWithSets_Limit() {
        when(queryRepository.findExercisesWithSetsByName("Bench", null, null, null))
                .thenReturn(List.of(
                        exercise(DAY_1, set(100.0, 5)),
                        exercise(DAY_2, set(100.0, 6)),
                        exercise(DAY_3, set(100.0, 7), set(100.0, 6))));

        List<DailySets> history = historyService.exerciseHistoryWithSets("Bench", 2);

        assertEquals(2, history.size());
        assertEquals(DAY_3, history.get(0).getDate());
        assertEquals(2, history.get(0).getSets().size());
        assertEquals(DAY_2, history.get(1).getDate());
    }

    @Test
    @DisplayName("Unknown exercise should produce empty history")
    void testExerciseHistory_UnknownName() {
        when(queryRepository.findExercisesWithSetsByName(any(), any(), any(), any())).thenReturn(List.of());

        assertTrue(historyService.exerciseHistoryForChart("Unknown", null, null).isEmpty());
        assertTrue(historyService.exerciseHistoryWithSets("Unknown", 10).isEmpty());
        assertTrue(historyService.exerciseHistoryWithSetsInRange("Unknown", DAY_1, DAY_3).isEmpty());
    }

    private static ExerciseWithSets exercise(LocalDate date, WorkoutSet... sets) {
        return ExerciseWithSets.builder()
                .id("e-" + date)
                .name("Bench")
                .type(ExerciseType.WEIGHT_REPS)
                .date(date)
                .sets(new ArrayList<>(List.of(sets)))
                .build();
    }

    private static WorkoutSet set(double weight, int reps) {
        return WorkoutSet.builder()
                .id(weight + "x" + reps)
                .weight(weight)
                .reps(reps)
                .build();
    }
}

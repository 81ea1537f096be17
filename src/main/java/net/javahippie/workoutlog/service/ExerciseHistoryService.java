package net.javahippie.workoutlog.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.workoutlog.model.dto.ChartDataPoint;
import net.javahippie.workoutlog.model.dto.DailySets;
import net.javahippie.workoutlog.model.dto.ExerciseWithSets;
import net.javahippie.workoutlog.model.entity.ExerciseType;
import net.javahippie.workoutlog.model.entity.WorkoutSet;
import net.javahippie.workoutlog.repository.WorkoutQueryRepository;
import net.javahippie.workoutlog.util.OneRepMaxCalculator;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Service for per-day exercise history, feeding progress charts and history lists.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExerciseHistoryService {

    private final WorkoutQueryRepository queryRepository;

    /**
     * One aggregate per date with at least one set, oldest first.
     *
     * @param name      definition name
     * @param startDate inclusive lower bound, may be null
     * @param endDate   inclusive upper bound, may be null
     * @return chart points, empty for an unknown exercise
     */
    public List<ChartDataPoint> exerciseHistoryForChart(String name, LocalDate startDate, LocalDate endDate) {
        List<ExerciseWithSets> exercises = queryRepository.findExercisesWithSetsByName(name, null, startDate, endDate);
        ExerciseType type = exercises.isEmpty() ? null : exercises.get(0).getType();
        Map<LocalDate, List<WorkoutSet>> setsByDate = groupByDate(exercises);

        List<ChartDataPoint> points = new ArrayList<>();
        setsByDate.forEach((date, sets) -> {
            if (!sets.isEmpty()) {
                points.add(aggregate(date, type, sets));
            }
        });

        log.debug("Built {} chart points for {}", points.size(), name);
        return points;
    }

    /**
     * Full set detail per date, newest first.
     *
     * @param name  definition name
     * @param limit maximum number of dates, values below 1 mean no limit
     */
    public List<DailySets> exerciseHistoryWithSets(String name, int limit) {
        List<DailySets> history = dailySets(queryRepository.findExercisesWithSetsByName(name, null, null, null));
        if (limit > 0 && history.size() > limit) {
            return new ArrayList<>(history.subList(0, limit));
        }
        return history;
    }

    /**
     * Full set detail per date within an inclusive range, newest first.
     */
    public List<DailySets> exerciseHistoryWithSetsInRange(String name, LocalDate startDate, LocalDate endDate) {
        return dailySets(queryRepository.findExercisesWithSetsByName(name, null, startDate, endDate));
    }

    private List<DailySets> dailySets(List<ExerciseWithSets> exercises) {
        List<DailySets> result = new ArrayList<>();
        groupByDate(exercises).forEach((date, sets) -> {
            if (!sets.isEmpty()) {
                result.add(DailySets.builder().date(date).sets(sets).build());
            }
        });
        result.sort(Comparator.comparing(DailySets::getDate).reversed());
        return result;
    }

    private static Map<LocalDate, List<WorkoutSet>> groupByDate(List<ExerciseWithSets> exercises) {
        Map<LocalDate, List<WorkoutSet>> setsByDate = new TreeMap<>();
        for (ExerciseWithSets exercise : exercises) {
            setsByDate.computeIfAbsent(exercise.getDate(), d -> new ArrayList<>()).addAll(exercise.getSets());
        }
        return setsByDate;
    }

    /**
     * Per-day maxima of each value. Best time is the shortest time for sprint-style
     * exercises and the longest otherwise.
     */
    static ChartDataPoint aggregate(LocalDate date, ExerciseType type, List<WorkoutSet> sets) {
        boolean fasterIsBetter = type == ExerciseType.TIME_SPEED;
        double bestWeight = 0;
        int bestReps = 0;
        double bestDistance = 0;
        Integer bestTime = null;
        double totalVolume = 0;
        Double bestOneRepMax = null;

        for (WorkoutSet set : sets) {
            if (set.getWeight() != null) {
                bestWeight = Math.max(bestWeight, set.getWeight());
            }
            if (set.getReps() != null) {
                bestReps = Math.max(bestReps, set.getReps());
            }
            if (set.getDistance() != null) {
                bestDistance = Math.max(bestDistance, set.getDistance());
            }
            if (set.getTime() != null) {
                if (bestTime == null) {
                    bestTime = set.getTime();
                } else {
                    bestTime = fasterIsBetter ? Math.min(bestTime, set.getTime()) : Math.max(bestTime, set.getTime());
                }
            }
            if (set.getWeight() != null && set.getReps() != null) {
                totalVolume += set.getWeight() * set.getReps();
            }
            OptionalDouble estimate = OneRepMaxCalculator.estimate(set.getWeight(), set.getReps());
            if (estimate.isPresent() && (bestOneRepMax == null || estimate.getAsDouble() > bestOneRepMax)) {
                bestOneRepMax = estimate.getAsDouble();
            }
        }

        return ChartDataPoint.builder()
                .date(date)
                .bestWeight(bestWeight)
                .bestReps(bestReps)
                .bestDistance(bestDistance)
                .bestTime(bestTime != null ? bestTime : 0)
                .totalVolume(totalVolume)
                .setCount(sets.size())
                .bestEstimatedOneRepMax(bestOneRepMax)
                .build();
    }
}

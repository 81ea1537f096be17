package net.javahippie.workoutlog.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.workoutlog.model.dto.ExerciseWithSets;
import net.javahippie.workoutlog.model.entity.ExerciseDefinition;
import net.javahippie.workoutlog.model.entity.ExerciseType;
import net.javahippie.workoutlog.model.entity.WorkoutSet;
import net.javahippie.workoutlog.repository.ExerciseDefinitionRepository;
import net.javahippie.workoutlog.repository.WorkoutQueryRepository;
import net.javahippie.workoutlog.util.SetComparator;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Service for finding and flagging personal bests.
 * Personal bests are derived from the recorded sets on demand, nothing is persisted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PersonalRecordService {

    private final ExerciseDefinitionRepository definitionRepository;
    private final WorkoutQueryRepository queryRepository;

    /**
     * Best set ever recorded for an exercise.
     *
     * @param name        definition name
     * @param excludeDate date whose sets are ignored, may be null
     * @return the best set, or empty if the exercise is unknown or has no sets
     */
    public Optional<WorkoutSet> personalBestForExercise(String name, LocalDate excludeDate) {
        Optional<ExerciseDefinition> definition = definitionRepository.findByName(name);
        if (definition.isEmpty()) {
            return Optional.empty();
        }

        List<WorkoutSet> history = queryRepository.findExercisesWithSetsByName(name, excludeDate, null, null)
                .stream()
                .flatMap(exercise -> exercise.getSets().stream())
                .toList();

        return SetComparator.findBestSet(history, definition.get().getType());
    }

    /**
     * Decide whether a set about to be recorded on a date beats every set ordered before it,
     * which is every set on that date or earlier.
     *
     * @param name      definition name
     * @param type      exercise type
     * @param date      date of the exercise the set is added to
     * @param candidate the new set
     * @return true if the candidate is a new personal best
     */
    public boolean isNewPersonalBest(String name, ExerciseType type, LocalDate date, WorkoutSet candidate) {
        List<WorkoutSet> earlier = chronologicalSets(name, date);
        WorkoutSet currentBest = SetComparator.findBestSet(earlier, type).orElse(null);
        boolean personalBest = SetComparator.isNewPersonalBest(candidate, currentBest, type);
        if (personalBest) {
            log.info("Personal best set for {} on {}: weight={}, reps={}, distance={}, time={}",
                    name, date, candidate.getWeight(), candidate.getReps(), candidate.getDistance(), candidate.getTime());
        }
        return personalBest;
    }

    /**
     * Mark the sets that were a personal best at the moment they were recorded,
     * i.e. that beat every earlier set of the same exercise.
     *
     * @param exercises exercises whose sets get their flag updated in place
     */
    public void flagPersonalBests(List<ExerciseWithSets> exercises) {
        for (ExerciseWithSets exercise : exercises) {
            if (exercise.getSets().isEmpty()) {
                continue;
            }

            Set<String> personalBestIds = findPersonalBestIds(exercise.getName(), exercise.getType(), exercise.getDate());
            exercise.getSets().forEach(set -> set.setPersonalBest(personalBestIds.contains(set.getId())));
        }
    }

    private Set<String> findPersonalBestIds(String name, ExerciseType type, LocalDate upToDate) {
        Set<String> ids = new HashSet<>();
        WorkoutSet runningBest = null;
        for (WorkoutSet set : chronologicalSets(name, upToDate)) {
            if (SetComparator.isNewPersonalBest(set, runningBest, type)) {
                runningBest = set;
                ids.add(set.getId());
            }
        }
        return ids;
    }

    /**
     * Sets of an exercise up to a date, ordered by date and then by timestamp across
     * every record logged on the same date.
     */
    private List<WorkoutSet> chronologicalSets(String name, LocalDate upToDate) {
        List<DatedSet> dated = new ArrayList<>();
        for (ExerciseWithSets exercise : queryRepository.findExercisesWithSetsByName(name, null, null, upToDate)) {
            exercise.getSets().forEach(set -> dated.add(new DatedSet(exercise.getDate(), set)));
        }
        dated.sort(Comparator.comparing(DatedSet::date).thenComparingLong(d -> d.set().getTimestamp()));
        return dated.stream().map(DatedSet::set).toList();
    }

    private record DatedSet(LocalDate date, WorkoutSet set) {
    }
}

package net.javahippie.workoutlog.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.workoutlog.model.dto.ExerciseWithSets;
import net.javahippie.workoutlog.model.entity.ExerciseType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Join queries across definitions, exercises and sets.
 *
 * Every query fetches all three tables in one roundtrip with a LEFT JOIN on sets,
 * so exercises without sets come back with an empty set list.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class WorkoutQueryRepository {

    private static final String SELECT_EXERCISES_WITH_SETS =
            "SELECT e.id AS exercise_id, e.definitionId, e.date, e.createdAt, " +
            "ed.name, ed.category, ed.type, " +
            "s.id AS set_id, s.exerciseId AS set_exercise_id, s.weight, s.reps, s.distance, s.time, s.note, s.timestamp " +
            "FROM exercises e " +
            "JOIN exercise_definitions ed ON e.definitionId = ed.id " +
            "LEFT JOIN sets s ON e.id = s.exerciseId ";

    /**
     * Groups joined rows into exercises, keeping row order for both exercises and sets.
     */
    private static final ResultSetExtractor<List<ExerciseWithSets>> GROUPING_EXTRACTOR = rs -> {
        Map<String, ExerciseWithSets> exercises = new LinkedHashMap<>();
        while (rs.next()) {
            String exerciseId = rs.getString("exercise_id");
            ExerciseWithSets exercise = exercises.get(exerciseId);
            if (exercise == null) {
                exercise = mapExercise(rs);
                exercises.put(exerciseId, exercise);
            }
            if (rs.getString("set_id") != null) {
                exercise.getSets().add(ResultSetValues.mapSet(rs, "set_id", "set_exercise_id"));
            }
        }
        return new ArrayList<>(exercises.values());
    };

    /**
     * Groups joined rows by date and exercise name instead of by record.
     */
    private static final ResultSetExtractor<List<ExerciseWithSets>> MERGING_EXTRACTOR = rs -> {
        Map<String, ExerciseWithSets> exercises = new LinkedHashMap<>();
        while (rs.next()) {
            String key = rs.getString("date") + "|" + rs.getString("name");
            ExerciseWithSets exercise = exercises.get(key);
            if (exercise == null) {
                exercise = mapExercise(rs);
                exercises.put(key, exercise);
            }
            if (rs.getString("set_id") != null) {
                exercise.getSets().add(ResultSetValues.mapSet(rs, "set_id", "set_exercise_id"));
            }
        }
        return new ArrayList<>(exercises.values());
    };

    private final JdbcTemplate jdbcTemplate;

    private static ExerciseWithSets mapExercise(ResultSet rs) throws SQLException {
        return ExerciseWithSets.builder()
                .id(rs.getString("exercise_id"))
                .definitionId(rs.getString("definitionId"))
                .name(rs.getString("name"))
                .category(rs.getString("category"))
                .type(ExerciseType.fromKey(rs.getString("type")))
                .date(LocalDate.parse(rs.getString("date")))
                .createdAt(rs.getLong("createdAt"))
                .sets(new ArrayList<>())
                .build();
    }

    /**
     * Exercises logged on a date, in creation order, each with its sets.
     */
    public List<ExerciseWithSets> findExercisesWithSetsForDate(LocalDate date) {
        long start = System.currentTimeMillis();
        List<ExerciseWithSets> result = jdbcTemplate.query(
                SELECT_EXERCISES_WITH_SETS +
                "WHERE e.date = ? " +
                "ORDER BY e.createdAt ASC, s.timestamp ASC",
                GROUPING_EXTRACTOR, date.toString());
        log.debug("Loaded {} exercises for {} in {}ms", result.size(), date, System.currentTimeMillis() - start);
        return result;
    }

    /**
     * Every logged exercise, newest date first.
     */
    public List<ExerciseWithSets> findAllExercisesWithSets() {
        return jdbcTemplate.query(
                SELECT_EXERCISES_WITH_SETS +
                "ORDER BY e.date DESC, e.createdAt ASC, s.timestamp ASC",
                GROUPING_EXTRACTOR);
    }

    /**
     * Logged exercises of one definition, oldest first.
     *
     * @param name        definition name
     * @param excludeDate date to skip, may be null
     * @param startDate   inclusive lower bound, may be null
     * @param endDate     inclusive upper bound, may be null
     */
    public List<ExerciseWithSets> findExercisesWithSetsByName(String name, LocalDate excludeDate,
                                                              LocalDate startDate, LocalDate endDate) {
        StringBuilder sql = new StringBuilder(SELECT_EXERCISES_WITH_SETS).append("WHERE ed.name = ? ");
        List<Object> params = new ArrayList<>();
        params.add(name);

        if (excludeDate != null) {
            sql.append("AND e.date != ? ");
            params.add(excludeDate.toString());
        }
        if (startDate != null) {
            sql.append("AND e.date >= ? ");
            params.add(startDate.toString());
        }
        if (endDate != null) {
            sql.append("AND e.date <= ? ");
            params.add(endDate.toString());
        }
        sql.append("ORDER BY e.date ASC, e.createdAt ASC, s.timestamp ASC");

        return jdbcTemplate.query(sql.toString(), GROUPING_EXTRACTOR, params.toArray());
    }

    /**
     * Rows for the CSV export: date descending, name ascending, sets in insertion order.
     * Records of the same exercise on the same date are merged, so their sets
     * interleave by timestamp.
     */
    public List<ExerciseWithSets> findAllForExport() {
        return jdbcTemplate.query(
                SELECT_EXERCISES_WITH_SETS +
                "ORDER BY e.date DESC, ed.name ASC, s.timestamp ASC",
                MERGING_EXTRACTOR);
    }
}

package net.javahippie.workoutlog.repository;

import lombok.RequiredArgsConstructor;
import net.javahippie.workoutlog.model.entity.WorkoutSet;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class WorkoutSetRepository {

    private static final RowMapper<WorkoutSet> ROW_MAPPER =
            (rs, rowNum) -> ResultSetValues.mapSet(rs, "id", "exerciseId");

    private final JdbcTemplate jdbcTemplate;

    public WorkoutSet save(WorkoutSet set) {
        jdbcTemplate.update(
                "INSERT INTO sets (id, exerciseId, weight, reps, distance, time, note, timestamp) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                set.getId(),
                set.getExerciseId(),
                set.getWeight(),
                set.getReps(),
                set.getDistance(),
                set.getTime(),
                set.getNote(),
                set.getTimestamp());
        return set;
    }

    public int update(WorkoutSet set) {
        return jdbcTemplate.update(
                "UPDATE sets SET weight = ?, reps = ?, distance = ?, time = ?, note = ? WHERE id = ?",
                set.getWeight(),
                set.getReps(),
                set.getDistance(),
                set.getTime(),
                set.getNote(),
                set.getId());
    }

    public Optional<WorkoutSet> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM sets WHERE id = ?", ROW_MAPPER, id)
                .stream()
                .findFirst();
    }

    /**
     * Sets of one exercise in insertion order.
     */
    public List<WorkoutSet> findByExerciseId(String exerciseId) {
        return jdbcTemplate.query(
                "SELECT * FROM sets WHERE exerciseId = ? ORDER BY timestamp ASC", ROW_MAPPER, exerciseId);
    }

    /**
     * Latest set timestamp in the store, 0 when there are no sets.
     */
    public long maxTimestamp() {
        Long max = jdbcTemplate.queryForObject("SELECT max(timestamp) FROM sets", Long.class);
        return max != null ? max : 0;
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT count(*) FROM sets", Long.class);
        return count != null ? count : 0;
    }

    public int deleteById(String id) {
        return jdbcTemplate.update("DELETE FROM sets WHERE id = ?", id);
    }

    public int deleteByExerciseId(String exerciseId) {
        return jdbcTemplate.update("DELETE FROM sets WHERE exerciseId = ?", exerciseId);
    }

    public int deleteByDefinitionId(String definitionId) {
        return jdbcTemplate.update(
                "DELETE FROM sets WHERE exerciseId IN (SELECT id FROM exercises WHERE definitionId = ?)",
                definitionId);
    }

    public int deleteAll() {
        return jdbcTemplate.update("DELETE FROM sets");
    }
}

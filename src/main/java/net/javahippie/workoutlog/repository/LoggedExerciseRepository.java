package net.javahippie.workoutlog.repository;

import lombok.RequiredArgsConstructor;
import net.javahippie.workoutlog.model.entity.LoggedExercise;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class LoggedExerciseRepository {

    private static final RowMapper<LoggedExercise> ROW_MAPPER = (rs, rowNum) -> LoggedExercise.builder()
            .id(rs.getString("id"))
            .definitionId(rs.getString("definitionId"))
            .date(LocalDate.parse(rs.getString("date")))
            .createdAt(rs.getLong("createdAt"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public LoggedExercise save(LoggedExercise exercise) {
        jdbcTemplate.update(
                "INSERT INTO exercises (id, definitionId, date, createdAt) VALUES (?, ?, ?, ?)",
                exercise.getId(),
                exercise.getDefinitionId(),
                exercise.getDate().toString(),
                exercise.getCreatedAt());
        return exercise;
    }

    public Optional<LoggedExercise> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM exercises WHERE id = ?", ROW_MAPPER, id)
                .stream()
                .findFirst();
    }

    /**
     * Earliest record for a definition on a date. Normal flow keeps at most one.
     */
    public Optional<LoggedExercise> findByDefinitionIdAndDate(String definitionId, LocalDate date) {
        return jdbcTemplate.query(
                        "SELECT * FROM exercises WHERE definitionId = ? AND date = ? ORDER BY createdAt ASC LIMIT 1",
                        ROW_MAPPER, definitionId, date.toString())
                .stream()
                .findFirst();
    }

    /**
     * Most recent record for a definition name, by date then creation time.
     *
     * @param excludeDate date to skip, may be null
     */
    public Optional<LoggedExercise> findLatestByDefinitionName(String name, LocalDate excludeDate) {
        String sql = "SELECT e.* FROM exercises e " +
                "JOIN exercise_definitions ed ON e.definitionId = ed.id " +
                "WHERE ed.name = ? " +
                (excludeDate != null ? "AND e.date != ? " : "") +
                "ORDER BY e.date DESC, e.createdAt DESC LIMIT 1";
        Object[] params = excludeDate != null
                ? new Object[]{name, excludeDate.toString()}
                : new Object[]{name};
        return jdbcTemplate.query(sql, ROW_MAPPER, params).stream().findFirst();
    }

    /**
     * Distinct dates with at least one logged exercise, inclusive range, ascending.
     */
    public List<LocalDate> findDistinctDatesBetween(LocalDate startDate, LocalDate endDate) {
        return jdbcTemplate.queryForList(
                        "SELECT DISTINCT date FROM exercises WHERE date >= ? AND date <= ? ORDER BY date ASC",
                        String.class, startDate.toString(), endDate.toString())
                .stream()
                .map(LocalDate::parse)
                .toList();
    }

    public long countByDefinitionId(String definitionId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM exercises WHERE definitionId = ?", Long.class, definitionId);
        return count != null ? count : 0;
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT count(*) FROM exercises", Long.class);
        return count != null ? count : 0;
    }

    public int deleteById(String id) {
        return jdbcTemplate.update("DELETE FROM exercises WHERE id = ?", id);
    }

    public int deleteByDefinitionId(String definitionId) {
        return jdbcTemplate.update("DELETE FROM exercises WHERE definitionId = ?", definitionId);
    }

    public int deleteAll() {
        return jdbcTemplate.update("DELETE FROM exercises");
    }
}

package net.javahippie.workoutlog.repository;

import lombok.RequiredArgsConstructor;
import net.javahippie.workoutlog.model.entity.ExerciseDefinition;
import net.javahippie.workoutlog.model.entity.ExerciseType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class ExerciseDefinitionRepository {

    private static final RowMapper<ExerciseDefinition> ROW_MAPPER = (rs, rowNum) -> ExerciseDefinition.builder()
            .id(rs.getString("id"))
            .name(rs.getString("name"))
            .category(rs.getString("category"))
            .type(ExerciseType.fromKey(rs.getString("type")))
            .unit(rs.getString("unit"))
            .description(rs.getString("description"))
            .createdAt(rs.getLong("createdAt"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public ExerciseDefinition save(ExerciseDefinition definition) {
        jdbcTemplate.update(
                "INSERT INTO exercise_definitions (id, name, category, type, unit, description, createdAt) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?)",
                definition.getId(),
                definition.getName(),
                definition.getCategory(),
                definition.getType().getKey(),
                definition.getUnit(),
                definition.getDescription(),
                definition.getCreatedAt());
        return definition;
    }

    public int update(ExerciseDefinition definition) {
        return jdbcTemplate.update(
                "UPDATE exercise_definitions SET name = ?, category = ?, type = ?, unit = ?, description = ? " +
                "WHERE id = ?",
                definition.getName(),
                definition.getCategory(),
                definition.getType().getKey(),
                definition.getUnit(),
                definition.getDescription(),
                definition.getId());
    }

    /**
     * Move several definitions to one category.
     *
     * @return number of rows changed
     */
    public int updateCategory(Collection<String> ids, String category) {
        return ids.stream()
                .mapToInt(id -> jdbcTemplate.update(
                        "UPDATE exercise_definitions SET category = ? WHERE id = ?", category, id))
                .sum();
    }

    public Optional<ExerciseDefinition> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM exercise_definitions WHERE id = ?", ROW_MAPPER, id)
                .stream()
                .findFirst();
    }

    /**
     * Exact, case-sensitive name lookup.
     */
    public Optional<ExerciseDefinition> findByName(String name) {
        return jdbcTemplate.query("SELECT * FROM exercise_definitions WHERE name = ? LIMIT 1", ROW_MAPPER, name)
                .stream()
                .findFirst();
    }

    public List<ExerciseDefinition> findAllOrderByName() {
        return jdbcTemplate.query("SELECT * FROM exercise_definitions ORDER BY name ASC", ROW_MAPPER);
    }

    /**
     * Definitions that have at least one logged exercise.
     */
    public List<ExerciseDefinition> findUsed() {
        return jdbcTemplate.query(
                "SELECT DISTINCT ed.* FROM exercise_definitions ed " +
                "JOIN exercises e ON e.definitionId = ed.id " +
                "ORDER BY ed.name ASC",
                ROW_MAPPER);
    }

    public List<String> findDistinctCategories() {
        return jdbcTemplate.queryForList(
                "SELECT DISTINCT category FROM exercise_definitions ORDER BY category ASC", String.class);
    }

    public List<String> findAllNames() {
        return jdbcTemplate.queryForList("SELECT name FROM exercise_definitions", String.class);
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT count(*) FROM exercise_definitions", Long.class);
        return count != null ? count : 0;
    }

    public int deleteById(String id) {
        return jdbcTemplate.update("DELETE FROM exercise_definitions WHERE id = ?", id);
    }

    public int deleteAll() {
        return jdbcTemplate.update("DELETE FROM exercise_definitions");
    }
}

package net.javahippie.workoutlog.repository;

import net.javahippie.workoutlog.model.entity.WorkoutSet;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Null-aware column readers shared by the row mappers.
 */
final class ResultSetValues {

    private ResultSetValues() {
    }

    static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    /**
     * Map the set columns of a row. Column names are prefixed when the
     * query aliases them, e.g. {@code set_id}.
     */
    static WorkoutSet mapSet(ResultSet rs, String idColumn, String exerciseIdColumn) throws SQLException {
        return WorkoutSet.builder()
                .id(rs.getString(idColumn))
                .exerciseId(rs.getString(exerciseIdColumn))
                .weight(nullableDouble(rs, "weight"))
                .reps(nullableInt(rs, "reps"))
                .distance(nullableDouble(rs, "distance"))
                .time(nullableInt(rs, "time"))
                .note(rs.getString("note"))
                .timestamp(rs.getLong("timestamp"))
                .build();
    }
}

package net.javahippie.workoutlog.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Catalog entry describing an exercise that can be logged.
 * Maps to the {@code exercise_definitions} table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExerciseDefinition {

    private String id;

    /**
     * Unique across the catalog.
     */
    private String name;

    private String category;

    private ExerciseType type;

    /**
     * Display unit, e.g. "kg", "reps", "km".
     */
    private String unit;

    private String description;

    /**
     * Epoch millis.
     */
    private long createdAt;
}

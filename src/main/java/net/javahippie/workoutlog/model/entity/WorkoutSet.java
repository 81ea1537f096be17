package net.javahippie.workoutlog.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One recorded attempt within a logged exercise.
 * Maps to the {@code sets} table. Which measurements are populated depends on
 * the exercise type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkoutSet {

    private String id;

    private String exerciseId;

    /**
     * Kilograms.
     */
    private Double weight;

    private Integer reps;

    /**
     * Kilometers.
     */
    private Double distance;

    /**
     * Seconds.
     */
    private Integer time;

    private String note;

    /**
     * Epoch millis, defines insertion order.
     */
    private long timestamp;

    /**
     * Not persisted. Computed when sets are read or inserted.
     */
    private boolean personalBest;
}

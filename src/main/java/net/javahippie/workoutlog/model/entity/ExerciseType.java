package net.javahippie.workoutlog.model.entity;

import java.util.Arrays;
import java.util.Locale;

/**
 * Measurement shape of an exercise.
 * Determines which of weight, reps, distance and time a set carries.
 */
public enum ExerciseType {
    WEIGHT_REPS("weight_reps", "Weight & Reps", true, true, false, false),
    WEIGHT("weight", "Weight Only", true, false, false, false),
    REPS("reps", "Reps Only", false, true, false, false),
    DISTANCE("distance", "Distance Only", false, false, true, false),
    TIME_DURATION("time_duration", "Duration", false, false, false, true),
    TIME_SPEED("time_speed", "Time Trial", false, false, false, true),
    DISTANCE_TIME("distance_time", "Distance & Time", false, false, true, true),
    WEIGHT_TIME("weight_time", "Weight & Time", true, false, false, true),
    REPS_TIME("reps_time", "Reps & Time", false, true, false, true),
    WEIGHT_DISTANCE("weight_distance", "Weight & Distance", true, false, true, false),
    REPS_DISTANCE("reps_distance", "Reps & Distance", false, true, true, false);

    private final String key;
    private final String label;
    private final boolean usesWeight;
    private final boolean usesReps;
    private final boolean usesDistance;
    private final boolean usesTime;

    ExerciseType(String key, String label, boolean usesWeight, boolean usesReps,
                 boolean usesDistance, boolean usesTime) {
        this.key = key;
        this.label = label;
        this.usesWeight = usesWeight;
        this.usesReps = usesReps;
        this.usesDistance = usesDistance;
        this.usesTime = usesTime;
    }

    /**
     * Value stored in the {@code type} column.
     */
    public String getKey() {
        return key;
    }

    /**
     * Human-readable label, e.g. "Weight & Reps".
     */
    public String getLabel() {
        return label;
    }

    public boolean usesWeight() {
        return usesWeight;
    }

    public boolean usesReps() {
        return usesReps;
    }

    public boolean usesDistance() {
        return usesDistance;
    }

    public boolean usesTime() {
        return usesTime;
    }

    /**
     * Resolve a stored key (case-insensitive).
     *
     * @param key the stored type key
     * @return the matching type
     * @throws IllegalArgumentException if the key is unknown
     */
    public static ExerciseType fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Exercise type must not be null");
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.key.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown exercise type: " + key));
    }

    /**
     * Check whether a stored key names a known type.
     */
    public static boolean isKnown(String key) {
        if (key == null) {
            return false;
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).anyMatch(type -> type.key.equals(normalized));
    }
}

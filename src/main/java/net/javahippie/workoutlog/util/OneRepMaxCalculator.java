package net.javahippie.workoutlog.util;

import java.util.OptionalDouble;

/**
 * Estimated one-rep-max using the Epley formula: weight x (1 + reps / 30).
 * Only defined for 1 to 10 reps, where the estimate stays reasonably accurate.
 */
public final class OneRepMaxCalculator {

    private static final int MAX_REPS = 10;

    private OneRepMaxCalculator() {
    }

    public static OptionalDouble estimate(Double weight, Integer reps) {
        if (weight == null || reps == null || weight <= 0 || reps < 1 || reps > MAX_REPS) {
            return OptionalDouble.empty();
        }
        if (reps == 1) {
            return OptionalDouble.of(weight);
        }
        return OptionalDouble.of(weight * (1 + reps / 30.0));
    }
}

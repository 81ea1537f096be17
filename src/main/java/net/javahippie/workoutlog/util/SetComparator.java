package net.javahippie.workoutlog.util;

import net.javahippie.workoutlog.model.entity.ExerciseType;
import net.javahippie.workoutlog.model.entity.WorkoutSet;
import net.javahippie.workoutlog.model.metrics.SetMetrics;

import java.util.Collection;
import java.util.Optional;

/**
 * Ranks sets of the same exercise type.
 *
 * <ul>
 *   <li>Weight, reps, distance and duration holds: higher wins.</li>
 *   <li>Time trials: lower time wins.</li>
 *   <li>Weight &amp; reps, weight &amp; distance, reps &amp; distance: the product wins,
 *       equal products tie.</li>
 *   <li>Distance, weight or reps paired with time: the first metric wins,
 *       lower time breaks a tie.</li>
 * </ul>
 *
 * A set missing a field its type requires is unrankable. It loses to any rankable set
 * and ties with another unrankable set. Missing values are never read as zero.
 */
public final class SetComparator {

    private SetComparator() {
    }

    /**
     * Compare two sets.
     *
     * @return positive if {@code a} is better, negative if {@code b} is better, 0 on a tie
     */
    public static int compare(WorkoutSet a, WorkoutSet b, ExerciseType type) {
        Optional<SetMetrics> left = SetMetrics.of(type, a);
        Optional<SetMetrics> right = SetMetrics.of(type, b);

        if (left.isEmpty() || right.isEmpty()) {
            return Boolean.compare(left.isPresent(), right.isPresent());
        }

        int primary = Double.compare(left.get().primaryScore(), right.get().primaryScore());
        if (primary != 0) {
            return primary;
        }
        return Double.compare(left.get().secondaryScore(), right.get().secondaryScore());
    }

    /**
     * Whether a set carries every field its type requires.
     */
    public static boolean isRankable(WorkoutSet set, ExerciseType type) {
        return SetMetrics.of(type, set).isPresent();
    }

    /**
     * Best set of a collection. On a tie the set found first is kept.
     *
     * @return the best set, or empty if the collection is empty
     */
    public static Optional<WorkoutSet> findBestSet(Collection<WorkoutSet> sets, ExerciseType type) {
        WorkoutSet best = null;
        for (WorkoutSet candidate : sets) {
            if (best == null || compare(candidate, best, type) > 0) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Id of the best set, used to highlight a single set of a session.
     */
    public static Optional<String> findBestSetId(Collection<WorkoutSet> sets, ExerciseType type) {
        return findBestSet(sets, type).map(WorkoutSet::getId);
    }

    /**
     * Whether a candidate beats the current personal best. Ties do not count.
     *
     * @param currentBest the best set so far, null if nothing was recorded yet
     */
    public static boolean isNewPersonalBest(WorkoutSet candidate, WorkoutSet currentBest, ExerciseType type) {
        if (currentBest == null) {
            return isRankable(candidate, type);
        }
        return compare(candidate, currentBest, type) > 0;
    }

    /**
     * One-line explanation of the ranking rule for a type.
     */
    public static String comparisonDescription(ExerciseType type) {
        return switch (type) {
            case WEIGHT_REPS -> "Higher weight x reps is better.";
            case WEIGHT -> "Higher weight is better.";
            case REPS -> "More reps is better.";
            case DISTANCE -> "Longer distance is better.";
            case TIME_DURATION -> "Longer duration is better (holds/planks).";
            case TIME_SPEED -> "Faster time is better (sprints).";
            case DISTANCE_TIME -> "Longer distance is better. If tied, faster time wins.";
            case WEIGHT_TIME -> "Heavier weight is better. If tied, shorter time wins.";
            case REPS_TIME -> "More reps is better. If tied, shorter time wins.";
            case WEIGHT_DISTANCE -> "Higher weight x distance is better.";
            case REPS_DISTANCE -> "Higher reps x distance is better.";
        };
    }
}

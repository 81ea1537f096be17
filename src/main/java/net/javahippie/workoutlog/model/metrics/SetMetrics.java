package net.javahippie.workoutlog.model.metrics;

import net.javahippie.workoutlog.model.entity.ExerciseType;
import net.javahippie.workoutlog.model.entity.WorkoutSet;

import java.util.Optional;

/**
 * The measurements of a set, shaped by its exercise type.
 * Each variant carries exactly the fields its type measures.
 *
 * Ranking is expressed as two scores where higher is always better:
 * the primary score decides, the secondary score breaks ties.
 */
public sealed interface SetMetrics {

    double primaryScore();

    default double secondaryScore() {
        return 0;
    }

    record WeightReps(double weight, int reps) implements SetMetrics {
        @Override
        public double primaryScore() {
            return weight * reps;
        }
    }

    record Weight(double weight) implements SetMetrics {
        @Override
        public double primaryScore() {
            return weight;
        }
    }

    record Reps(int reps) implements SetMetrics {
        @Override
        public double primaryScore() {
            return reps;
        }
    }

    record Distance(double distance) implements SetMetrics {
        @Override
        public double primaryScore() {
            return distance;
        }
    }

    /**
     * Holds and planks: longer is better.
     */
    record TimeDuration(int seconds) implements SetMetrics {
        @Override
        public double primaryScore() {
            return seconds;
        }
    }

    /**
     * Sprints and time trials: shorter is better.
     */
    record TimeSpeed(int seconds) implements SetMetrics {
        @Override
        public double primaryScore() {
            return -seconds;
        }
    }

    record DistanceTime(double distance, int seconds) implements SetMetrics {
        @Override
        public double primaryScore() {
            return distance;
        }

        @Override
        public double secondaryScore() {
            return -seconds;
        }
    }

    record WeightTime(double weight, int seconds) implements SetMetrics {
        @Override
        public double primaryScore() {
            return weight;
        }

        @Override
        public double secondaryScore() {
            return -seconds;
        }
    }

    record RepsTime(int reps, int seconds) implements SetMetrics {
        @Override
        public double primaryScore() {
            return reps;
        }

        @Override
        public double secondaryScore() {
            return -seconds;
        }
    }

    record WeightDistance(double weight, double distance) implements SetMetrics {
        @Override
        public double primaryScore() {
            return weight * distance;
        }
    }

    record RepsDistance(int reps, double distance) implements SetMetrics {
        @Override
        public double primaryScore() {
            return reps * distance;
        }
    }

    /**
     * Extract the metrics a type measures from a stored set.
     *
     * @param type the exercise type
     * @param set  the stored set
     * @return the metrics, or empty if a required field is absent
     */
    static Optional<SetMetrics> of(ExerciseType type, WorkoutSet set) {
        if (set == null || type == null) {
            return Optional.empty();
        }
        Double weight = set.getWeight();
        Integer reps = set.getReps();
        Double distance = set.getDistance();
        Integer time = set.getTime();

        SetMetrics metrics = switch (type) {
            case WEIGHT_REPS -> weight != null && reps != null ? new WeightReps(weight, reps) : null;
            case WEIGHT -> weight != null ? new Weight(weight) : null;
            case REPS -> reps != null ? new Reps(reps) : null;
            case DISTANCE -> distance != null ? new Distance(distance) : null;
            case TIME_DURATION -> time != null ? new TimeDuration(time) : null;
            case TIME_SPEED -> time != null ? new TimeSpeed(time) : null;
            case DISTANCE_TIME -> distance != null && time != null ? new DistanceTime(distance, time) : null;
            case WEIGHT_TIME -> weight != null && time != null ? new WeightTime(weight, time) : null;
            case REPS_TIME -> reps != null && time != null ? new RepsTime(reps, time) : null;
            case WEIGHT_DISTANCE -> weight != null && distance != null ? new WeightDistance(weight, distance) : null;
            case REPS_DISTANCE -> reps != null && distance != null ? new RepsDistance(reps, distance) : null;
        };
        return Optional.ofNullable(metrics);
    }
}

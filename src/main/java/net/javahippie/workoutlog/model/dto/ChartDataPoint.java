package net.javahippie.workoutlog.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Per-day aggregate of one exercise, used for progress charts.
 * Each best value is computed independently of the others.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChartDataPoint {

    private LocalDate date;
    private double bestWeight;
    private int bestReps;
    private double bestDistance;
    private int bestTime;

    /**
     * Sum of weight x reps over sets that carry both.
     */
    private double totalVolume;

    private int setCount;

    /**
     * Highest Epley estimate of the day, null when no set qualifies.
     */
    private Double bestEstimatedOneRepMax;
}

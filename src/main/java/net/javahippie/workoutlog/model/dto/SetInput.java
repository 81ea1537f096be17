package net.javahippie.workoutlog.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Measurements for a new or edited set, already parsed to numbers.
 * Null means "not provided".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SetInput {

    private Double weight;
    private Integer reps;
    private Double distance;
    private Integer time;
    private String note;
}

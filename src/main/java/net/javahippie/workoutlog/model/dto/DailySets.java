package net.javahippie.workoutlog.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import net.javahippie.workoutlog.model.entity.WorkoutSet;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * All sets of one exercise recorded on a single date.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailySets {

    private LocalDate date;

    @Builder.Default
    private List<WorkoutSet> sets = new ArrayList<>();
}

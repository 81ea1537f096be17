package net.javahippie.workoutlog.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import net.javahippie.workoutlog.model.entity.ExerciseType;
import net.javahippie.workoutlog.model.entity.WorkoutSet;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A logged exercise joined with its definition and its sets.
 * Sets are ordered by insertion timestamp ascending.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExerciseWithSets {

    private String id;
    private String definitionId;
    private String name;
    private String category;
    private ExerciseType type;
    private LocalDate date;
    private long createdAt;

    @Builder.Default
    private List<WorkoutSet> sets = new ArrayList<>();
}

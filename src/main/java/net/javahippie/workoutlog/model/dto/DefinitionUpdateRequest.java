package net.javahippie.workoutlog.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import net.javahippie.workoutlog.model.entity.ExerciseType;

/**
 * Partial update of an exercise definition. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DefinitionUpdateRequest {

    private String name;
    private String category;
    private ExerciseType type;
    private String unit;
    private String description;
}

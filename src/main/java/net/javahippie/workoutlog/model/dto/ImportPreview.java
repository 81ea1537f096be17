package net.javahippie.workoutlog.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Diff of an import payload against the current catalog.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportPreview {

    @Builder.Default
    private List<ExerciseDefinitionImport> toAdd = new ArrayList<>();

    /**
     * Records whose name already exists in the store or earlier in the batch.
     */
    @Builder.Default
    private List<ExerciseDefinitionImport> existing = new ArrayList<>();
}

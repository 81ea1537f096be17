package net.javahippie.workoutlog.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One record of a bulk-import payload or of the bundled seed catalog.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExerciseDefinitionImport {

    /**
     * Optional. Generated when absent.
     */
    private String id;

    @NotBlank
    @Size(max = 200)
    private String name;

    @NotBlank
    @Size(max = 100)
    private String category;

    @NotBlank
    private String type;

    @NotBlank
    @Size(max = 20)
    private String unit;

    private String description;
}

package net.javahippie.workoutlog.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result counts of a bulk import.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportSummary {

    private ImportMode mode;
    private int added;
    private int alreadyExisting;
    private int failed;

    @Builder.Default
    private List<String> failedNames = new ArrayList<>();

    /**
     * How an import treats the existing catalog.
     */
    public enum ImportMode {
        /**
         * Add only names not yet present.
         */
        MERGE,
        /**
         * Delete all definitions, exercises and sets, then insert the payload.
         */
        REPLACE
    }
}

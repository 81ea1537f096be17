package net.javahippie.workoutlog.migration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of an advisory schema check.
 * A version mismatch alone does not make the schema invalid.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchemaValidationResult {

    private boolean valid;

    @Builder.Default
    private List<String> missingTables = new ArrayList<>();

    private int storedVersion;

    private int expectedVersion;

    public boolean isUpToDate() {
        return storedVersion == expectedVersion;
    }
}

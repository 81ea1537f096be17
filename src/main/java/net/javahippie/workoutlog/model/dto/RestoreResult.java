package net.javahippie.workoutlog.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

/**
 * Outcome of a successful restore.
 * The store must be reinitialized before further use.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestoreResult {

    /**
     * Copy of the replaced store, null when there was no store to copy
     * or the copy failed.
     */
    private Path safetyCopy;

    @Builder.Default
    private boolean requiresRestart = true;
}

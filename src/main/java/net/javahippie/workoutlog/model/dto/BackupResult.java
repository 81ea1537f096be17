package net.javahippie.workoutlog.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

/**
 * Outcome of a successful backup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackupResult {

    private Path file;
    private String fileName;
    private long fileSize;
}

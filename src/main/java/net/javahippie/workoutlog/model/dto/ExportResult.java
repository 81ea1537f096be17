package net.javahippie.workoutlog.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

/**
 * Outcome of a CSV export written to disk.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportResult {

    private Path file;
    private String fileName;
    private int recordCount;
    private long fileSize;
}

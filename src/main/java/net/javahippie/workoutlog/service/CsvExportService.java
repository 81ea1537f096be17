package net.javahippie.workoutlog.service;

import lombok.extern.slf4j.Slf4j;
import net.javahippie.workoutlog.model.dto.ExerciseWithSets;
import net.javahippie.workoutlog.model.dto.ExportResult;
import net.javahippie.workoutlog.model.entity.WorkoutSet;
import net.javahippie.workoutlog.repository.WorkoutQueryRepository;
import net.javahippie.workoutlog.util.CsvFormatter;
import net.javahippie.workoutlog.util.WorkoutFormatter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Service for exporting every recorded set as CSV, one row per set.
 */
@Service
@Slf4j
public class CsvExportService {

    static final List<String> HEADER = Arrays.asList(
            "Date", "Exercise", "Category", "Type", "Set #",
            "Weight", "Reps", "Distance", "Time (seconds)", "Time (formatted)");

    private final WorkoutQueryRepository queryRepository;
    private final Path exportDir;

    public CsvExportService(WorkoutQueryRepository queryRepository,
                            @Value("${workoutlog.export.dir}") String exportDir) {
        this.queryRepository = queryRepository;
        this.exportDir = Paths.get(exportDir);
    }

    /**
     * Render the whole log as CSV text, header included.
     */
    public String generateCsv() {
        return render(queryRepository.findAllForExport()).csv();
    }

    /**
     * Write the export to the configured export directory.
     */
    public ExportResult exportToFile() {
        return exportToFile(exportDir);
    }

    /**
     * Write the export to {@code workout-export-<date>.csv} in a directory.
     *
     * @throws IllegalStateException if no set was recorded yet
     * @throws UncheckedIOException  if the file cannot be written
     */
    public ExportResult exportToFile(Path directory) {
        Rendered rendered = render(queryRepository.findAllForExport());
        if (rendered.recordCount() == 0) {
            throw new IllegalStateException("No workout data to export");
        }

        String fileName = "workout-export-" + LocalDate.now() + ".csv";
        Path target = directory.resolve(fileName);
        try {
            Files.createDirectories(directory);
            Files.writeString(target, rendered.csv(), StandardCharsets.UTF_8);
            long size = Files.size(target);
            log.info("Exported {} sets to {} ({} bytes)", rendered.recordCount(), target, size);
            return ExportResult.builder()
                    .file(target)
                    .fileName(fileName)
                    .recordCount(rendered.recordCount())
                    .fileSize(size)
                    .build();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write export " + target, e);
        }
    }

    private Rendered render(List<ExerciseWithSets> exercises) {
        StringBuilder csv = new StringBuilder(CsvFormatter.row(HEADER));
        String currentKey = null;
        int setNumber = 0;
        int records = 0;

        for (ExerciseWithSets exercise : exercises) {
            String key = exercise.getDate() + "|" + exercise.getName();
            if (!Objects.equals(key, currentKey)) {
                currentKey = key;
                setNumber = 0;
            }
            for (WorkoutSet set : exercise.getSets()) {
                setNumber++;
                records++;
                csv.append(CsvFormatter.row(Arrays.asList(
                        exercise.getDate().toString(),
                        exercise.getName(),
                        exercise.getCategory(),
                        exercise.getType().getLabel(),
                        String.valueOf(setNumber),
                        WorkoutFormatter.formatNumber(set.getWeight()),
                        WorkoutFormatter.formatNumber(set.getReps()),
                        WorkoutFormatter.formatNumber(set.getDistance()),
                        WorkoutFormatter.formatNumber(set.getTime()),
                        set.getTime() != null ? WorkoutFormatter.formatDuration(set.getTime()) : "")));
            }
        }
        return new Rendered(csv.toString(), records);
    }

    private record Rendered(String csv, int recordCount) {
    }
}

package net.javahippie.workoutlog.util;

import lombok.extern.slf4j.Slf4j;
import net.javahippie.workoutlog.exception.InvalidBackupFileException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;

/**
 * Validates store backups before they replace the live store.
 * Checks presence, size and the SQLite header.
 */
@Component
@Slf4j
public class BackupFileValidator {

    /**
     * One database page. Anything smaller cannot hold the schema.
     */
    static final long MIN_FILE_SIZE = 4096;

    private static final byte[] SQLITE_HEADER = "SQLite format 3\0".getBytes(StandardCharsets.US_ASCII);

    /**
     * Validates a backup file on disk.
     *
     * @param file the candidate backup
     * @throws InvalidBackupFileException if the file is missing, too small or not a SQLite database
     */
    public void validate(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new InvalidBackupFileException("File not found: " + file);
        }

        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new InvalidBackupFileException("Cannot read file size of " + file, e);
        }
        validateFileSize(size);

        byte[] header = new byte[SQLITE_HEADER.length];
        try (InputStream in = Files.newInputStream(file)) {
            int read = in.readNBytes(header, 0, header.length);
            if (read < header.length) {
                throw new InvalidBackupFileException("Insufficient data to validate database header");
            }
        } catch (IOException e) {
            throw new InvalidBackupFileException("Cannot read header of " + file, e);
        }
        validateHeader(header);

        if (!hasValidExtension(file.getFileName().toString())) {
            log.warn("Backup file {} has an unusual extension, restoring anyway", file.getFileName());
        }

        log.debug("Backup file {} validated successfully. Size: {} bytes", file, size);
    }

    private void validateFileSize(long size) {
        if (size < MIN_FILE_SIZE) {
            throw new InvalidBackupFileException(
                String.format("File too small to be a valid database. Size: %d bytes, minimum: %d bytes",
                        size, MIN_FILE_SIZE)
            );
        }
    }

    private void validateHeader(byte[] header) {
        if (!Arrays.equals(header, SQLITE_HEADER)) {
            throw new InvalidBackupFileException("Invalid database signature. Expected 'SQLite format 3' at offset 0");
        }
    }

    /**
     * Checks if a file name carries a database extension.
     *
     * @param filename the filename
     * @return true for .db, .sqlite and .sqlite3
     */
    public boolean hasValidExtension(String filename) {
        if (filename == null || filename.isEmpty()) {
            return false;
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        return lower.endsWith(".db") || lower.endsWith(".sqlite") || lower.endsWith(".sqlite3");
    }
}

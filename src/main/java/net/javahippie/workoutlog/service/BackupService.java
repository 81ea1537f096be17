package net.javahippie.workoutlog.service;

import lombok.extern.slf4j.Slf4j;
import net.javahippie.workoutlog.exception.BackupException;
import net.javahippie.workoutlog.exception.InvalidBackupFileException;
import net.javahippie.workoutlog.migration.SchemaMigrationService;
import net.javahippie.workoutlog.migration.SchemaValidationResult;
import net.javahippie.workoutlog.model.dto.BackupResult;
import net.javahippie.workoutlog.model.dto.RestoreResult;
import net.javahippie.workoutlog.util.BackupFileValidator;
import net.javahippie.workoutlog.util.WorkoutFormatter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Copies the store file to timestamped backups and restores it from them.
 *
 * The store uses an unpooled data source, so no connection holds the file open
 * between operations and a guarded copy sees a consistent file.
 */
@Service
@Slf4j
public class BackupService {

    static final String BACKUP_PREFIX = "workout-backup-";
    static final String SAFETY_COPY_PREFIX = "pre-restore-backup-";
    static final String BACKUP_EXTENSION = ".db";
    static final String RESTORE_SUFFIX = ".restoring";

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss");

    private final SchemaMigrationService schemaMigrationService;
    private final BackupFileValidator backupFileValidator;
    private final StoreAccessGuard guard;
    private final Path storePath;
    private final Path backupDir;

    public BackupService(SchemaMigrationService schemaMigrationService,
                         BackupFileValidator backupFileValidator,
                         StoreAccessGuard guard,
                         @Value("${workoutlog.store.path}") String storePath,
                         @Value("${workoutlog.backup.dir}") String backupDir) {
        this.schemaMigrationService = schemaMigrationService;
        this.backupFileValidator = backupFileValidator;
        this.guard = guard;
        this.storePath = Paths.get(storePath);
        this.backupDir = Paths.get(backupDir);
    }

    /**
     * Copy the store to {@code workout-backup-<timestamp>.db} in the backup directory.
     *
     * @throws BackupException if the store is missing, fails validation or cannot be copied
     */
    public BackupResult createBackup() {
        return guard.exclusive("createBackup", () -> {
            if (!Files.isRegularFile(storePath)) {
                throw new BackupException(BackupException.Reason.SOURCE_MISSING,
                        "Store file does not exist: " + storePath);
            }

            SchemaValidationResult validation = schemaMigrationService.validateSchema();
            if (!validation.isValid()) {
                throw new BackupException(BackupException.Reason.VALIDATION_FAILED,
                        "Store schema is invalid, missing tables: " + validation.getMissingTables());
            }

            String fileName = BACKUP_PREFIX + LocalDateTime.now().format(TIMESTAMP_FORMAT) + BACKUP_EXTENSION;
            Path target = backupDir.resolve(fileName);
            try {
                Files.createDirectories(backupDir);
                Files.copy(storePath, target, StandardCopyOption.REPLACE_EXISTING);
                long size = Files.size(target);
                log.info("Created backup {} ({})", target, WorkoutFormatter.formatFileSize(size));
                return BackupResult.builder()
                        .file(target)
                        .fileName(fileName)
                        .fileSize(size)
                        .build();
            } catch (IOException e) {
                throw new BackupException(BackupException.Reason.COPY_FAILED,
                        "Failed to copy store to " + target, e);
            }
        });
    }

    /**
     * Check that a file can serve as a store backup.
     *
     * @throws InvalidBackupFileException if it cannot
     */
    public void validateBackupFile(Path file) {
        backupFileValidator.validate(file);
    }

    /**
     * Replace the live store with a backup.
     *
     * The current store is copied to {@code pre-restore-backup-<millis>.db} first. After a
     * successful restore every guarded operation fails until the store is reinitialized.
     *
     * @throws BackupException if the backup is missing, invalid or cannot be copied
     */
    public RestoreResult restoreFromBackup(Path source) {
        return guard.exclusive("restoreFromBackup", () -> {
            if (source == null || !Files.exists(source)) {
                throw new BackupException(BackupException.Reason.SOURCE_MISSING,
                        "Backup file does not exist: " + source);
            }
            try {
                backupFileValidator.validate(source);
            } catch (InvalidBackupFileException e) {
                throw new BackupException(BackupException.Reason.VALIDATION_FAILED,
                        "Backup file is not valid: " + e.getMessage(), e);
            }

            Path safetyCopy = createSafetyCopy();

            try {
                replaceStoreFile(source);
            } catch (IOException e) {
                String hint = safetyCopy != null ? " The previous store was saved to " + safetyCopy : "";
                throw new BackupException(BackupException.Reason.COPY_FAILED,
                        "Failed to restore store from " + source + "." + hint, e);
            }

            guard.markRestartRequired();
            log.info("Restored store from {}", source);
            return RestoreResult.builder()
                    .safetyCopy(safetyCopy)
                    .requiresRestart(true)
                    .build();
        });
    }

    /**
     * Copy the source next to the store and move it over the store file, so the store
     * is either the old file or the complete new one.
     */
    void replaceStoreFile(Path source) throws IOException {
        Path parent = storePath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path staged = Files.createTempFile(parent, storePath.getFileName().toString(), RESTORE_SUFFIX);
        try {
            Files.copy(source, staged, StandardCopyOption.REPLACE_EXISTING);
            try {
                Files.move(staged, storePath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported in {}, replacing store file directly", parent);
                Files.move(staged, storePath, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(staged);
        }
    }

    /**
     * Size of the store file in bytes, 0 when it does not exist.
     */
    public long databaseSize() {
        try {
            return Files.isRegularFile(storePath) ? Files.size(storePath) : 0;
        } catch (IOException e) {
            log.warn("Cannot read size of {}", storePath, e);
            return 0;
        }
    }

    public String formatFileSize(long bytes) {
        return WorkoutFormatter.formatFileSize(bytes);
    }

    private Path createSafetyCopy() {
        if (!Files.isRegularFile(storePath)) {
            return null;
        }
        Path safetyCopy = backupDir.resolve(SAFETY_COPY_PREFIX + System.currentTimeMillis() + BACKUP_EXTENSION);
        try {
            Files.createDirectories(backupDir);
            Files.copy(storePath, safetyCopy, StandardCopyOption.REPLACE_EXISTING);
            log.info("Saved current store to {} before restore", safetyCopy);
            return safetyCopy;
        } catch (IOException e) {
            log.error("Failed to save current store before restore, continuing without safety copy", e);
            return null;
        }
    }
}

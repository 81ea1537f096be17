package net.javahippie.workoutlog.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.workoutlog.exception.CatalogImportException;
import net.javahippie.workoutlog.model.dto.ExerciseDefinitionImport;
import net.javahippie.workoutlog.model.dto.ImportPreview;
import net.javahippie.workoutlog.model.dto.ImportSummary;
import net.javahippie.workoutlog.model.dto.ImportSummary.ImportMode;
import net.javahippie.workoutlog.model.entity.ExerciseDefinition;
import net.javahippie.workoutlog.model.entity.ExerciseType;
import net.javahippie.workoutlog.repository.ExerciseDefinitionRepository;
import net.javahippie.workoutlog.repository.LoggedExerciseRepository;
import net.javahippie.workoutlog.repository.WorkoutSetRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Service for bulk-importing exercise definitions from a JSON catalog.
 *
 * The whole payload is parsed and validated before anything is written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExerciseCatalogImportService {

    private static final TypeReference<List<ExerciseDefinitionImport>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final ExerciseDefinitionRepository definitionRepository;
    private final LoggedExerciseRepository exerciseRepository;
    private final WorkoutSetRepository setRepository;
    private final StoreAccessGuard guard;
    private final TransactionTemplate transactionTemplate;

    /**
     * Parse and validate a catalog payload.
     *
     * @param payload JSON array of definitions
     * @return the records in payload order
     * @throws CatalogImportException   if the payload is not a JSON array of definitions
     * @throws IllegalArgumentException if any record is invalid
     */
    public List<ExerciseDefinitionImport> parse(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("Import payload is empty");
        }

        List<ExerciseDefinitionImport> records;
        try {
            records = objectMapper.readValue(payload, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new CatalogImportException("Import payload is not a JSON array of exercise definitions", e);
        }
        if (records == null) {
            throw new IllegalArgumentException("Import payload is empty");
        }

        List<String> problems = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            ExerciseDefinitionImport record = records.get(i);
            if (record == null) {
                problems.add("#" + i + ": null entry");
                continue;
            }
            for (ConstraintViolation<ExerciseDefinitionImport> violation : validator.validate(record)) {
                problems.add("#" + i + " " + violation.getPropertyPath() + ": " + violation.getMessage());
            }
            if (record.getType() != null && !record.getType().isBlank() && !ExerciseType.isKnown(record.getType())) {
                problems.add("#" + i + " type: unknown exercise type '" + record.getType() + "'");
            }
        }
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid import payload: " + String.join("; ", problems));
        }
        return records;
    }

    /**
     * Split a payload into records to add and records whose name already exists,
     * in the store or earlier in the same payload.
     */
    public ImportPreview preview(String payload) {
        return preview(parse(payload), definitionRepository.findAllNames());
    }

    /**
     * Import a payload.
     *
     * MERGE inserts new names one by one and continues past failures. REPLACE deletes all
     * definitions, exercises and sets and inserts the payload in one transaction.
     */
    public ImportSummary importDefinitions(String payload, ImportMode mode) {
        List<ExerciseDefinitionImport> records = parse(payload);
        if (mode == ImportMode.REPLACE) {
            return replace(records);
        }
        return merge(records);
    }

    private ImportSummary merge(List<ExerciseDefinitionImport> records) {
        return guard.exclusive("importDefinitions", () -> {
            ImportPreview preview = preview(records, definitionRepository.findAllNames());
            ImportSummary summary = ImportSummary.builder()
                    .mode(ImportMode.MERGE)
                    .alreadyExisting(preview.getExisting().size())
                    .build();

            for (ExerciseDefinitionImport record : preview.getToAdd()) {
                try {
                    definitionRepository.save(toDefinition(record));
                    summary.setAdded(summary.getAdded() + 1);
                } catch (DataAccessException e) {
                    log.warn("Failed to import exercise definition '{}': {}", record.getName(), e.getMessage());
                    summary.setFailed(summary.getFailed() + 1);
                    summary.getFailedNames().add(record.getName());
                }
            }

            log.info("Merged exercise catalog: {} added, {} already existing, {} failed",
                    summary.getAdded(), summary.getAlreadyExisting(), summary.getFailed());
            return summary;
        });
    }

    private ImportSummary replace(List<ExerciseDefinitionImport> records) {
        return guard.exclusive("importDefinitions", () -> transactionTemplate.execute(status -> {
            int sets = setRepository.deleteAll();
            int exercises = exerciseRepository.deleteAll();
            int definitions = definitionRepository.deleteAll();
            log.info("Replacing exercise catalog, removed {} definitions, {} exercises and {} sets",
                    definitions, exercises, sets);

            ImportPreview preview = preview(records, List.of());
            preview.getToAdd().forEach(record -> definitionRepository.save(toDefinition(record)));

            log.info("Replaced exercise catalog with {} definitions", preview.getToAdd().size());
            return ImportSummary.builder()
                    .mode(ImportMode.REPLACE)
                    .added(preview.getToAdd().size())
                    .alreadyExisting(preview.getExisting().size())
                    .build();
        }));
    }

    /**
     * Insert records into an empty catalog.
     *
     * @return number of definitions inserted
     */
    int insertAll(List<ExerciseDefinitionImport> records) {
        ImportPreview preview = preview(records, definitionRepository.findAllNames());
        preview.getToAdd().forEach(record -> definitionRepository.save(toDefinition(record)));
        return preview.getToAdd().size();
    }

    private static ImportPreview preview(List<ExerciseDefinitionImport> records, Collection<String> existingNames) {
        Set<String> seen = existingNames.stream()
                .map(ExerciseCatalogImportService::normalize)
                .collect(Collectors.toCollection(HashSet::new));

        ImportPreview preview = new ImportPreview();
        for (ExerciseDefinitionImport record : records) {
            if (seen.add(normalize(record.getName()))) {
                preview.getToAdd().add(record);
            } else {
                preview.getExisting().add(record);
            }
        }
        return preview;
    }

    private static ExerciseDefinition toDefinition(ExerciseDefinitionImport record) {
        return ExerciseDefinition.builder()
                .id(record.getId() == null || record.getId().isBlank() ? UUID.randomUUID().toString() : record.getId())
                .name(record.getName().trim())
                .category(record.getCategory().trim())
                .type(ExerciseType.fromKey(record.getType()))
                .unit(record.getUnit().trim())
                .description(record.getDescription() == null || record.getDescription().isBlank()
                        ? null : record.getDescription().trim())
                .createdAt(System.currentTimeMillis())
                .build();
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}

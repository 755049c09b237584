package com.yava.intent.service;

import com.yava.intent.ingestion.IngestionResult;
import com.yava.intent.ingestion.IntentRowNormalizer;
import com.yava.intent.model.IntentRecord;
import com.yava.intent.model.IntentRecordInput;
import com.yava.intent.model.RegistrySnapshot;
import com.yava.intent.model.UpdateResult;
import com.yava.intent.model.ValidationReport;
import com.yava.intent.registry.IntentRegistry;
import com.yava.intent.registry.StagedConfiguration;
import com.yava.intent.store.IntentConfigStore;
import com.yava.intent.store.IntentConfigStoreException;
import com.yava.intent.validation.IntentSetValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Administrative operations on the intent configuration: bulk upload and reload,
 * single-record add/update, and dry-run validation. Every successful publish is
 * written through to the {@link IntentConfigStore}.
 */
@Service
@Slf4j
public class IntentConfigurationService {

    private final IntentRegistry registry;
    private final IntentRowNormalizer normalizer;
    private final IntentSetValidator validator;
    private final IntentConfigStore store;

    public IntentConfigurationService(IntentRegistry registry,
                                      IntentRowNormalizer normalizer,
                                      IntentSetValidator validator,
                                      IntentConfigStore store) {
        this.registry = registry;
        this.normalizer = normalizer;
        this.validator = validator;
        this.store = store;
    }

    /**
     * Normalize and validate an uploaded sheet as a full replacement and stage it.
     * A row that cannot be coerced fails the whole upload and nothing is staged.
     */
    public ValidationReport stageBulk(List<Map<String, Object>> rows) {
        IngestionResult ingestion = normalizer.normalizeRows(rows);
        if (ingestion.hasErrors()) {
            registry.clearStaged();
            return ValidationReport.ofErrors(ingestion.getErrors());
        }
        return registry.stage(ingestion.getRecords());
    }

    /**
     * Publish the staged upload.
     */
    public UpdateResult activateStaged() {
        UpdateResult result = registry.activateStaged();
        if (result.isSuccess()) {
            persistActive();
        }
        return result;
    }

    /**
     * Add or replace one intent, merged into the active configuration.
     */
    public UpdateResult applySingle(IntentRecordInput input) {
        UpdateResult result = registry.applyMerge(normalizer.fromInput(input));
        if (result.isSuccess()) {
            persistActive();
        }
        return result;
    }

    public ValidationReport validateRows(List<Map<String, Object>> rows) {
        IngestionResult ingestion = normalizer.normalizeRows(rows);
        if (ingestion.hasErrors()) {
            return ValidationReport.ofErrors(ingestion.getErrors());
        }
        return validator.validate(ingestion.getRecords(), null);
    }

    public ValidationReport validateSingle(IntentRecordInput input) {
        return validator.validate(List.of(normalizer.fromInput(input)), registry.current());
    }

    public ValidationReport validateActive() {
        return validator.validate(registry.current().getRecords(), null);
    }

    public Optional<ValidationReport> stagedReport() {
        return registry.staged().map(StagedConfiguration::getReport);
    }

    public RegistrySnapshot activeSnapshot() {
        return registry.current();
    }

    public Optional<IntentRecord> findIntent(String intentId) {
        return registry.current().find(intentId);
    }

    /**
     * Writes whatever is active when the lock is taken, so concurrent publishes
     * cannot leave an older version on disk.
     */
    private synchronized void persistActive() {
        RegistrySnapshot snapshot = registry.current();
        List<IntentRecordInput> intents = snapshot.getRecords().stream()
            .map(IntentRecord::toInput)
            .collect(Collectors.toList());
        try {
            store.save(intents);
        } catch (IntentConfigStoreException e) {
            log.error("Version {} is active but could not be persisted: {}", snapshot.getVersion(), e.getMessage(), e);
        }
    }
}

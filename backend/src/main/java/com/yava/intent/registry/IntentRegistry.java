package com.yava.intent.registry;

import com.yava.intent.config.IntentClassifierProperties;
import com.yava.intent.model.IntentRecord;
import com.yava.intent.model.RegistrySnapshot;
import com.yava.intent.model.UpdateResult;
import com.yava.intent.model.ValidationReport;
import com.yava.intent.validation.IntentSetValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active intent snapshot and publishes replacements.
 *
 * <p>Validation always runs outside of any lock against a private candidate set.
 * Publication is a single compare-and-set on the active reference, so readers see
 * either the old or the new snapshot in full. A writer that loses the race sees
 * the version moved and either retries (merge) or reports staleness (staged set).
 */
@Component
@Slf4j
public class IntentRegistry {

    private final IntentSetValidator validator;
    private final IntentClassifierProperties properties;

    private final AtomicReference<RegistrySnapshot> active = new AtomicReference<>();
    private final AtomicReference<StagedConfiguration> staged = new AtomicReference<>();

    public IntentRegistry(IntentSetValidator validator, IntentClassifierProperties properties) {
        this.validator = validator;
        this.properties = properties;
    }

    /**
     * The active snapshot. Never blocks.
     *
     * @throws IllegalStateException if no configuration has been loaded yet
     */
    public RegistrySnapshot current() {
        RegistrySnapshot snapshot = active.get();
        if (snapshot == null) {
            throw new IllegalStateException("Intent registry has not been initialized");
        }
        return snapshot;
    }

    public boolean isInitialized() {
        return active.get() != null;
    }

    /**
     * Publish the startup configuration as version 1. Returns the report; nothing is
     * published when it is invalid.
     */
    public ValidationReport initialize(List<IntentRecord> records) {
        ValidationReport report = validator.validate(records, null);
        if (!report.isValid()) {
            log.error("Initial intent configuration is invalid: {} errors", report.getErrors().size());
            return report;
        }
        if (!active.compareAndSet(null, snapshot(1L, records))) {
            throw new IllegalStateException("Intent registry is already initialized");
        }
        log.info("Intent registry initialized: version 1 with {} intents ({} warnings)",
                records.size(), report.getWarnings().size());
        return report;
    }

    /**
     * Validate {@code records} as a complete replacement set and hold it for
     * {@link #activateStaged()}. Any previously staged set is discarded, also when
     * this one is invalid.
     */
    public ValidationReport stage(List<IntentRecord> records) {
        RegistrySnapshot base = active.get();
        ValidationReport report = validator.validate(records, null);
        if (report.isValid()) {
            long baseVersion = base == null ? 0L : base.getVersion();
            staged.set(new StagedConfiguration(List.copyOf(records), report, baseVersion, Instant.now()));
            log.info("Staged {} intents against version {} ({} warnings)",
                    records.size(), baseVersion, report.getWarnings().size());
        } else {
            staged.set(null);
            log.warn("Staging rejected: {} errors", report.getErrors().size());
        }
        return report;
    }

    /**
     * Drop whatever is staged, e.g. after bulk input failed before validation.
     */
    public void clearStaged() {
        staged.set(null);
    }

    public Optional<StagedConfiguration> staged() {
        return Optional.ofNullable(staged.get());
    }

    /**
     * Publish the staged set as the next version and clear the staged slot.
     * Fails without publishing when nothing is staged or the active version moved
     * since staging; a stale set is discarded and must be staged again.
     */
    public UpdateResult activateStaged() {
        StagedConfiguration pending = staged.get();
        RegistrySnapshot base = current();
        if (pending == null) {
            log.warn("Activation requested but nothing is staged (active version {})", base.getVersion());
            return UpdateResult.rejected(base.getVersion(), UpdateResult.Reason.NOTHING_STAGED, null);
        }
        if (pending.getBaseVersion() != base.getVersion()) {
            staged.compareAndSet(pending, null);
            log.warn("Staged set is stale: staged against version {}, active is {}",
                    pending.getBaseVersion(), base.getVersion());
            return UpdateResult.rejected(base.getVersion(), UpdateResult.Reason.STALE, pending.getReport());
        }

        RegistrySnapshot next = snapshot(base.getVersion() + 1, pending.getRecords());
        if (!active.compareAndSet(base, next)) {
            staged.compareAndSet(pending, null);
            RegistrySnapshot winner = current();
            log.warn("Activation lost to a concurrent publish (version {})", winner.getVersion());
            return UpdateResult.rejected(winner.getVersion(), UpdateResult.Reason.STALE, pending.getReport());
        }
        staged.compareAndSet(pending, null);
        log.info("Activated staged configuration: version {} -> {} ({} intents)",
                base.getVersion(), next.getVersion(), next.size());
        return UpdateResult.published(next.getVersion(), pending.getReport());
    }

    /**
     * Add or replace one intent. The merge is validated against the snapshot it is
     * applied to; when another writer publishes in between, the merge is rebuilt on
     * top of the newer snapshot (last writer wins).
     */
    public UpdateResult applyMerge(IntentRecord candidate) {
        int attempts = Math.max(1, properties.getRegistry().getMaxPublishAttempts());
        ValidationReport report = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            RegistrySnapshot base = current();
            report = validator.validate(List.of(candidate), base);
            if (!report.isValid()) {
                log.warn("Merge of {} rejected: {} errors", candidate.getIntentId(), report.getErrors().size());
                return UpdateResult.rejected(base.getVersion(), UpdateResult.Reason.INVALID, report);
            }
            RegistrySnapshot next = snapshot(base.getVersion() + 1,
                    IntentSetValidator.merge(base, List.of(candidate)));
            if (active.compareAndSet(base, next)) {
                log.info("Merged intent {}: version {} -> {}", candidate.getIntentId(),
                        base.getVersion(), next.getVersion());
                return UpdateResult.published(next.getVersion(), report);
            }
            log.warn("Merge of {} raced with a concurrent publish (attempt {}/{})",
                    candidate.getIntentId(), attempt, attempts);
        }
        return UpdateResult.rejected(current().getVersion(), UpdateResult.Reason.STALE, report);
    }

    private RegistrySnapshot snapshot(long version, Collection<IntentRecord> records) {
        IntentClassifierProperties.Registry settings = properties.getRegistry();
        return new RegistrySnapshot(version, records,
                settings.getDefaultConfidenceThreshold(), settings.toFallbackPolicy());
    }
}

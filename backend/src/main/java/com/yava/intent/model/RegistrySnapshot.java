package com.yava.intent.model;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, versioned set of validated intents together with the registry-wide
 * defaults in force at that version. Never mutated after construction; a newer
 * snapshot supersedes it.
 */
@Getter
@ToString(of = {"version", "publishedAt"})
public final class RegistrySnapshot {

    private final long version;
    private final List<IntentRecord> records;
    private final double defaultConfidenceThreshold;
    private final FallbackPolicy fallbackPolicy;
    private final Instant publishedAt;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, IntentRecord> byId;

    public RegistrySnapshot(long version,
                            Collection<IntentRecord> records,
                            double defaultConfidenceThreshold,
                            FallbackPolicy fallbackPolicy) {
        List<IntentRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(IntentRecord::getIntentId));
        Map<String, IntentRecord> index = new LinkedHashMap<>();
        for (IntentRecord record : sorted) {
            index.put(record.getIntentId(), record);
        }
        this.version = version;
        this.records = Collections.unmodifiableList(sorted);
        this.byId = Collections.unmodifiableMap(index);
        this.defaultConfidenceThreshold = defaultConfidenceThreshold;
        this.fallbackPolicy = fallbackPolicy;
        this.publishedAt = Instant.now();
    }

    public Optional<IntentRecord> find(String intentId) {
        return Optional.ofNullable(byId.get(intentId));
    }

    public int size() {
        return records.size();
    }
}

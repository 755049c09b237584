package com.yava.intent.store;

import com.yava.intent.model.IntentRecordInput;

import java.util.List;

/**
 * Durable backend for the intent configuration.
 */
public interface IntentConfigStore {

    /**
     * @throws IntentConfigStoreException if the configuration cannot be read
     */
    List<IntentRecordInput> load();

    /**
     * Replace the stored configuration with {@code intents}.
     *
     * @throws IntentConfigStoreException if the configuration cannot be written
     */
    void save(List<IntentRecordInput> intents);
}

package com.yava.intent.store;

import com.yava.intent.IntentFixtures;
import com.yava.intent.config.IntentClassifierProperties;
import com.yava.intent.model.IntentRecordInput;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileIntentConfigStoreTest {

    @TempDir
    Path tempDir;

    private JsonFileIntentConfigStore store(Path file, String seed) {
        IntentClassifierProperties properties = IntentFixtures.properties();
        properties.getStore().setPath(file.toString());
        properties.getStore().setSeedResource(seed);
        return new JsonFileIntentConfigStore(properties);
    }

    @Test
    void saveThenLoad() {
        Path file = tempDir.resolve("nested/intents.json");
        JsonFileIntentConfigStore store = store(file, null);

        store.save(List.of(IntentFixtures.pharmacy().toInput(), IntentFixtures.claims().toInput()));
        List<IntentRecordInput> loaded = store.load();

        assertThat(file).exists();
        assertThat(loaded).extracting(IntentRecordInput::getIntentId).containsExactly("INT-PHR-0001", "INT-CLM-0035");
        assertThat(loaded.get(0)).isEqualTo(IntentFixtures.pharmacy().toInput());
    }

    @Test
    void writesSnakeCaseFields() throws Exception {
        Path file = tempDir.resolve("intents.json");

        store(file, null).save(List.of(IntentFixtures.pharmacy().toInput()));

        assertThat(Files.readString(file))
            .contains("\"intents\"")
            .contains("\"intent_id\" : \"INT-PHR-0001\"")
            .contains("\"agent_routing\" : \"PharmacyAgent\"");
    }

    @Test
    void failedSaveLeavesNoTemporaryFile() throws Exception {
        Path target = tempDir.resolve("intents.json");
        Files.createDirectories(target);
        Files.writeString(target.resolve("occupied.txt"), "x");

        assertThatThrownBy(() -> store(target, null).save(List.of(IntentFixtures.pharmacy().toInput())))
            .isInstanceOf(IntentConfigStoreException.class)
            .hasMessageContaining("Cannot write intent configuration");

        try (Stream<Path> entries = Files.list(tempDir)) {
            assertThat(entries.map(p -> p.getFileName().toString())).containsExactly("intents.json");
        }
    }

    @Test
    void fallsBackToClasspathSeed() {
        List<IntentRecordInput> loaded = store(tempDir.resolve("missing.json"), "/intents.json").load();

        assertThat(loaded).hasSize(47);
    }

    @Test
    void failsWithoutFileOrSeed() {
        assertThatThrownBy(() -> store(tempDir.resolve("missing.json"), "/no-such-seed.json").load())
            .isInstanceOf(IntentConfigStoreException.class)
            .hasMessageContaining("no-such-seed.json");
        assertThatThrownBy(() -> store(tempDir.resolve("missing.json"), null).load())
            .isInstanceOf(IntentConfigStoreException.class);
    }

    @Test
    void rejectsFileWithoutIntentsArray() throws Exception {
        Path file = tempDir.resolve("intents.json");
        Files.writeString(file, "{\"records\": []}", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> store(file, null).load())
            .isInstanceOf(IntentConfigStoreException.class)
            .hasMessageContaining("'intents' array not found");
    }

    @Test
    void rejectsMistypedField() throws Exception {
        Path file = tempDir.resolve("intents.json");
        Files.writeString(file, "{\"intents\": [{\"intent_id\": \"INT-PHR-0001\", \"priority\": \"high\"}]}",
            StandardCharsets.UTF_8);

        assertThatThrownBy(() -> store(file, null).load())
            .isInstanceOf(IntentConfigStoreException.class);
    }
}

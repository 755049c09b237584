package com.yava.intent.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yava.intent.config.IntentClassifierProperties;
import com.yava.intent.model.IntentRecordInput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Stores the configuration as {@code {"intents": [...]}} in a JSON file.
 * Until the file has been written once, a classpath seed is served instead.
 */
@Component
@Slf4j
public class JsonFileIntentConfigStore implements IntentConfigStore {

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final Path path;
    private final String seedResource;

    public JsonFileIntentConfigStore(IntentClassifierProperties properties) {
        this.path = Paths.get(properties.getStore().getPath());
        this.seedResource = properties.getStore().getSeedResource();
    }

    @Override
    public List<IntentRecordInput> load() {
        if (Files.exists(path)) {
            try (InputStream is = Files.newInputStream(path)) {
                List<IntentRecordInput> intents = read(is, path.toString());
                log.info("Loaded {} intents from {}", intents.size(), path);
                return intents;
            } catch (IOException e) {
                throw new IntentConfigStoreException("Cannot read intent configuration " + path, e);
            }
        }

        if (seedResource == null || seedResource.isBlank()) {
            throw new IntentConfigStoreException("Intent configuration " + path + " does not exist and no seed is configured");
        }
        try (InputStream is = getClass().getResourceAsStream(seedResource)) {
            if (is == null) {
                throw new IntentConfigStoreException(
                    "Intent configuration " + path + " does not exist and seed " + seedResource + " is not on the classpath");
            }
            List<IntentRecordInput> intents = read(is, seedResource);
            log.info("Loaded {} intents from classpath seed {}", intents.size(), seedResource);
            return intents;
        } catch (IOException e) {
            throw new IntentConfigStoreException("Cannot read seed intent configuration " + seedResource, e);
        }
    }

    @Override
    public void save(List<IntentRecordInput> intents) {
        Path temp = null;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            ObjectNode root = objectMapper.createObjectNode();
            root.set("intents", objectMapper.valueToTree(intents));
            temp = Files.createTempFile(parent, "intents", ".json.tmp");
            objectMapper.writeValue(temp.toFile(), root);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Saved {} intents to {}", intents.size(), path);
        } catch (IOException e) {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw new IntentConfigStoreException("Cannot write intent configuration " + path, e);
        }
    }

    private List<IntentRecordInput> read(InputStream is, String source) throws IOException {
        JsonNode root = objectMapper.readTree(is);
        JsonNode intentsNode = root == null ? null : root.get("intents");
        if (intentsNode == null || !intentsNode.isArray()) {
            throw new IntentConfigStoreException("Invalid intent configuration " + source + ": 'intents' array not found");
        }
        try {
            return objectMapper.convertValue(intentsNode, new TypeReference<List<IntentRecordInput>>() {});
        } catch (IllegalArgumentException e) {
            throw new IntentConfigStoreException("Invalid intent configuration " + source + ": " + e.getMessage(), e);
        }
    }
}

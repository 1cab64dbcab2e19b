package app.ankillm.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent user settings kept as a JSON object in {@code config.json}.
 * The directory defaults to {@code ~/.config/anki-llm}.
 */
@Component
public class UserConfigStore {

    private static final Logger log = LoggerFactory.getLogger(UserConfigStore.class);
    private static final String FILE_NAME = "config.json";

    public static final String MODEL_KEY = "model";

    private final Path configFile;
    private final ObjectMapper objectMapper;

    public UserConfigStore(UserConfigProps props, ObjectMapper objectMapper) {
        Path directory = props.directory() == null || props.directory().isBlank()
                ? Path.of(System.getProperty("user.home"), ".config", "anki-llm")
                : Path.of(props.directory());
        this.configFile = directory.resolve(FILE_NAME);
        this.objectMapper = objectMapper;
    }

    public Path path() {
        return configFile;
    }

    public Optional<String> get(String key) {
        JsonNode value = read().get(key);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        return Optional.of(value.isTextual() ? value.asText() : value.toString());
    }

    public void set(String key, String value) {
        requireKey(key);
        ObjectNode config = read();
        config.put(key, value);
        write(config);
        log.info("User config updated key={}", key);
    }

    /**
     * @return whether the key was present
     */
    public boolean unset(String key) {
        requireKey(key);
        ObjectNode config = read();
        if (config.remove(key) == null) {
            return false;
        }
        write(config);
        log.info("User config key removed key={}", key);
        return true;
    }

    public Map<String, String> list() {
        ObjectNode config = read();
        Map<String, String> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = config.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode value = entry.getValue();
            values.put(entry.getKey(), value.isTextual() ? value.asText() : value.toString());
        }
        return values;
    }

    private ObjectNode read() {
        if (!Files.exists(configFile)) {
            return objectMapper.createObjectNode();
        }
        try {
            String content = Files.readString(configFile, StandardCharsets.UTF_8);
            if (content.isBlank()) {
                return objectMapper.createObjectNode();
            }
            JsonNode node = objectMapper.readTree(content);
            if (!(node instanceof ObjectNode object)) {
                throw new IllegalStateException("Config file must contain a JSON object: " + configFile);
            }
            JsonNode model = object.get(MODEL_KEY);
            if (model != null && !model.isNull() && !model.isTextual()) {
                throw new IllegalStateException("Config \"model\" must be a string when present.");
            }
            return object;
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Config file is not valid JSON: " + configFile + ": " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + configFile, ex);
        }
    }

    private void write(ObjectNode config) {
        try {
            Files.createDirectories(configFile.getParent());
            Files.writeString(configFile, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(config),
                    StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write " + configFile, ex);
        }
    }

    private void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Config key must not be blank");
        }
    }
}

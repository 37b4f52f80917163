package io.palaver.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.palaver.core.config.model.PalaverConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and writes the JSON configuration. Files only need the values they change; everything
 * else comes from {@link PalaverConfig#defaults()}.
 */
public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public PalaverConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return PalaverConfig.defaults();
        }
        JsonNode file = mapper.readTree(Files.readString(configPath));
        if (file == null || file.isMissingNode()) {
            return PalaverConfig.defaults();
        }
        if (!(file instanceof ObjectNode sections)) {
            throw new IOException("Config file " + configPath + " must contain a JSON object");
        }
        ObjectNode effective = mapper.valueToTree(PalaverConfig.defaults());
        overlay(effective, sections);
        return mapper.treeToValue(effective, PalaverConfig.class);
    }

    public void save(Path configPath, PalaverConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(configPath, toPrettyJson(config) + System.lineSeparator());
    }

    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        PalaverConfig config = created || overwrite ? PalaverConfig.defaults() : load(configPath);
        save(configPath, config);
        return new InitResult(configPath, created, !created && overwrite);
    }

    public String toPrettyJson(PalaverConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    /**
     * Writes the non-null values of {@code file} into {@code target}. Sections present on both
     * sides are merged key by key; anything else in the file replaces the default outright.
     */
    private static void overlay(ObjectNode target, ObjectNode file) {
        Iterator<Map.Entry<String, JsonNode>> fields = file.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isNull()) {
                continue;
            }
            if (target.get(field.getKey()) instanceof ObjectNode section && value instanceof ObjectNode fileSection) {
                overlay(section, fileSection);
            } else {
                target.set(field.getKey(), value);
            }
        }
    }
}

package io.mnemo.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.mnemo.core.config.model.MnemoConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public final class ConfigService {
    private static final Map<String, String> SYNONYMS = Map.of(
        "primary", "primaryProvider",
        "fallback", "fallbackProvider",
        "minimum_calls", "probes",
        "api_base", "baseUrl",
        "org_id", "organizationId",
        "burst_capacity", "capacity",
        "sustained_rate", "refillPerSecond",
        "max_requests_per_window", "maxPerWindow",
        "max_concurrent_requests", "maxConcurrent"
    );

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Reads the JSON file deep-merged over the defaults. A missing file yields the defaults.
     */
    public MnemoConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return MnemoConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(MnemoConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, MnemoConfig.class);
    }

    /**
     * File configuration with {@code MEMORY_LLM_*} environment variables applied on top.
     */
    public MnemoConfig loadEffective(Path configPath, Map<String, String> environment) throws IOException {
        return new EnvironmentOverrides(environment).apply(load(configPath));
    }

    public void save(Path configPath, MnemoConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (configPath.getParent() != null) {
            Files.createDirectories(configPath.getParent());
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public String toPrettyJson(MnemoConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = canonicalKey(merged, entry.getKey());
            merged.set(key, deepMerge(merged.get(key), entry.getValue()));
        });
        return merged;
    }

    // snake_case or legacy keys must land on the default's key, a second alias of the same
    // record component fails deserialization
    private static String canonicalKey(ObjectNode base, String key) {
        if (base.has(key)) {
            return key;
        }
        String synonym = SYNONYMS.get(key);
        if (synonym != null && base.has(synonym)) {
            return synonym;
        }
        String folded = fold(key);
        Iterator<String> names = base.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (fold(name).equals(folded)) {
                return name;
            }
        }
        return key;
    }

    private static String fold(String key) {
        return key.replace("_", "").toLowerCase(Locale.ROOT);
    }
}

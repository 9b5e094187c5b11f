package io.cronbot.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.cronbot.core.config.model.CronbotConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.util.Objects;

/**
 * Reads and writes {@code config.json}. Values in the file are deep-merged over {@link CronbotConfig#defaults()},
 * so a partial file only overrides what it names.
 */
public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public CronbotConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return CronbotConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(CronbotConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        CronbotConfig config = mapper.treeToValue(merged, CronbotConfig.class);
        validate(configPath, config);
        return config;
    }

    public void save(Path configPath, CronbotConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        CronbotConfig config;
        if (created || overwrite) {
            config = CronbotConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);

        Path database = ConfigPaths.resolveDatabase(config.store().path());
        return new OnboardResult(configPath, database, created, overwritten);
    }

    public String toPrettyJson(CronbotConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private void validate(Path configPath, CronbotConfig config) throws IOException {
        if (config.scheduler().workerThreads() < 1) {
            throw new IOException("scheduler.workerThreads must be >= 1 in " + configPath);
        }
        try {
            config.scheduler().zoneId();
        } catch (DateTimeException e) {
            throw new IOException("Unknown scheduler.timezone '" + config.scheduler().timezone() + "' in " + configPath, e);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null || override.isNull()) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}

package io.threadkeep.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.threadkeep.core.config.model.StorageConfig;
import io.threadkeep.core.config.model.ThreadkeepConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads the JSON config file, filling anything it omits from {@link ThreadkeepConfig#defaults()}.
 */
public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
    }

    public ThreadkeepConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return ThreadkeepConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(ThreadkeepConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, ThreadkeepConfig.class);
    }

    public void save(Path configPath, ThreadkeepConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    /**
     * Writes the config file, keeping existing values unless {@code overwrite} is set.
     */
    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        ThreadkeepConfig config;
        if (created || overwrite) {
            config = defaultsFor(configPath);
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);
        Path dataDir = config.storage().dataDirectory();
        Files.createDirectories(dataDir);
        return new OnboardResult(configPath, dataDir, created, overwritten);
    }

    // A config outside the home directory keeps its session data next to it.
    private ThreadkeepConfig defaultsFor(Path configPath) {
        ThreadkeepConfig defaults = ThreadkeepConfig.defaults();
        Path directory = configPath.toAbsolutePath().getParent();
        if (directory == null || directory.equals(ConfigPaths.homeDirectory().toAbsolutePath())) {
            return defaults;
        }
        return new ThreadkeepConfig(
            defaults.capture(),
            defaults.summarizer(),
            StorageConfig.under(directory),
            defaults.gateway(),
            defaults.providers()
        );
    }

    public String toPrettyJson(ThreadkeepConfig config) {
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
            String key = camelCase(entry.getKey());
            JsonNode existing = merged.get(key);
            merged.set(key, deepMerge(existing, entry.getValue()));
        });
        return merged;
    }

    // Hand-written files may use snake_case; defaults are serialized in camelCase.
    private static String camelCase(String key) {
        if (key.indexOf('_') < 0) {
            return key;
        }
        StringBuilder out = new StringBuilder(key.length());
        boolean upper = false;
        for (char c : key.toCharArray()) {
            if (c == '_') {
                upper = out.length() > 0;
            } else {
                out.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return out.toString();
    }
}

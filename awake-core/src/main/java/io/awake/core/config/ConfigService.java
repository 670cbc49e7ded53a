package io.awake.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.awake.core.config.model.AwakeConfig;
import io.awake.core.config.model.StorageConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Loads the JSON config file merged over built-in defaults, then applies environment overrides
 * ({@code AWAKE_STORE}, {@code AWAKE_DB_PATH}).
 */
public final class ConfigService {
    public static final String ENV_STORE = "AWAKE_STORE";
    public static final String ENV_DB_PATH = "AWAKE_DB_PATH";

    private final ObjectMapper mapper;
    private final Map<String, String> env;

    public ConfigService() {
        this(System.getenv());
    }

    public ConfigService(Map<String, String> env) {
        this.mapper = new ObjectMapper();
        this.env = env == null ? Map.of() : Map.copyOf(env);
    }

    public AwakeConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        AwakeConfig config;
        if (!Files.exists(configPath)) {
            config = AwakeConfig.defaults();
        } else {
            JsonNode defaultsNode = mapper.valueToTree(AwakeConfig.defaults());
            JsonNode existingNode = mapper.readTree(Files.readString(configPath));
            JsonNode merged = deepMerge(defaultsNode, existingNode);
            config = mapper.treeToValue(merged, AwakeConfig.class);
        }
        return applyEnvironment(config);
    }

    public void save(Path configPath, AwakeConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    /**
     * Writes the defaults when no config exists (or when {@code overwrite} is set), otherwise
     * rewrites the existing file with any newly introduced defaults filled in.
     *
     * @return whether a new file was created
     */
    public boolean onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        AwakeConfig config;
        if (created || overwrite) {
            config = AwakeConfig.defaults();
        } else {
            JsonNode defaultsNode = mapper.valueToTree(AwakeConfig.defaults());
            JsonNode existingNode = mapper.readTree(Files.readString(configPath));
            config = mapper.treeToValue(deepMerge(defaultsNode, existingNode), AwakeConfig.class);
        }
        save(configPath, config);
        return created;
    }

    public String toPrettyJson(AwakeConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private AwakeConfig applyEnvironment(AwakeConfig config) {
        String backend = env.get(ENV_STORE);
        String path = env.get(ENV_DB_PATH);
        if (isBlank(backend) && isBlank(path)) {
            return config;
        }
        StorageConfig storage = new StorageConfig(
            isBlank(backend) ? config.storage().backend() : backend,
            isBlank(path) ? config.storage().path() : path
        );
        return config.withStorage(storage);
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
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
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}

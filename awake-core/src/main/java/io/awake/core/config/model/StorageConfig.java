package io.awake.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Locale;

/**
 * Where jobs live. A blank {@code path} resolves to the backend's default file under
 * {@code ~/.awake}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    String backend,
    String path
) {
    public static final String SQLITE = "sqlite";
    public static final String FILE = "file";

    public StorageConfig {
        backend = backend == null || backend.isBlank() ? SQLITE : backend.trim().toLowerCase(Locale.ROOT);
        path = path == null ? "" : path.trim();
    }

    public static StorageConfig defaults() {
        return new StorageConfig(SQLITE, "");
    }

    public boolean sqlite() {
        return SQLITE.equals(backend);
    }
}

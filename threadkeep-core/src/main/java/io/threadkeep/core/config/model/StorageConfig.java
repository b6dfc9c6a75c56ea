package io.threadkeep.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.threadkeep.core.config.ConfigPaths;
import java.nio.file.Path;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    String backend,
    @JsonAlias({"sqlite_path"}) String sqlitePath,
    @JsonAlias({"file_path"}) String filePath
) {

    public static StorageConfig defaults() {
        return new StorageConfig("sqlite", "~/.threadkeep/sessions.db", "~/.threadkeep/sessions.json");
    }

    public static StorageConfig under(Path directory) {
        return new StorageConfig(
            "sqlite",
            directory.resolve("sessions.db").toString(),
            directory.resolve("sessions.json").toString()
        );
    }

    public boolean usesFileBackend() {
        return "file".equalsIgnoreCase(backend == null ? "" : backend.trim());
    }

    public Path resolvedSqlitePath() {
        return ConfigPaths.resolve(sqlitePath, "sessions.db");
    }

    public Path resolvedFilePath() {
        return ConfigPaths.resolve(filePath, "sessions.json");
    }

    public Path dataDirectory() {
        Path store = usesFileBackend() ? resolvedFilePath() : resolvedSqlitePath();
        Path parent = store.toAbsolutePath().getParent();
        return parent == null ? ConfigPaths.homeDirectory() : parent;
    }
}

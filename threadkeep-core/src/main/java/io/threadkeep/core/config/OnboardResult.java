package io.threadkeep.core.config;

import java.nio.file.Path;

public record OnboardResult(Path configPath, Path dataDirectory, boolean createdConfig, boolean overwrittenConfig) {
}

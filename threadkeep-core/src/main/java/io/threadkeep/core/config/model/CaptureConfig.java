package io.threadkeep.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CaptureConfig(
    boolean enabled,
    @JsonAlias({"poll_interval_ms"}) long pollIntervalMs,
    @JsonAlias({"probe_command"}) List<String> probeCommand,
    @JsonAlias({"probe_timeout_ms"}) long probeTimeoutMs
) {

    public CaptureConfig {
        probeCommand = probeCommand == null ? List.of() : List.copyOf(probeCommand);
    }

    public static CaptureConfig defaults() {
        return new CaptureConfig(true, 3_000, List.of(), 15_000);
    }

    public boolean probeConfigured() {
        return !probeCommand.isEmpty();
    }
}

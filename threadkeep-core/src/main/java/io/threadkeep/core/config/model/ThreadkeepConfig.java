package io.threadkeep.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ThreadkeepConfig(
    CaptureConfig capture,
    SummarizerConfig summarizer,
    StorageConfig storage,
    GatewayConfig gateway,
    ProvidersConfig providers
) {

    public static ThreadkeepConfig defaults() {
        return new ThreadkeepConfig(
            CaptureConfig.defaults(),
            SummarizerConfig.defaults(),
            StorageConfig.defaults(),
            GatewayConfig.defaults(),
            ProvidersConfig.defaults()
        );
    }
}

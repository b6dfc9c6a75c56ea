package io.threadkeep.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidersConfig(ProviderConfig anthropic) {

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(ProviderConfig.defaults());
    }
}

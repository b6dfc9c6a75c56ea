package io.threadkeep.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SummarizerConfig(
    double ratio,
    int iterations,
    double damping,
    @JsonAlias({"max_input_chars"}) int maxInputChars,
    String strategy
) {

    public static SummarizerConfig defaults() {
        return new SummarizerConfig(0.3, 50, 0.85, 50_000, "auto");
    }
}

package io.threadkeep.core.provider;

import io.threadkeep.core.model.Message;
import java.util.List;
import java.util.Map;

/**
 * Provider placeholder used when no API key is configured.
 * Returns a deterministic error so summarizer fallbacks skip it.
 */
public final class DisabledProvider implements LlmProvider {
    private final String name;
    private final String reason;

    public DisabledProvider(String name, String reason) {
        this.name = name;
        this.reason = reason == null || reason.isBlank() ? "provider is disabled" : reason;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<Message> messages) {
        return new LlmResponse(
            ERROR_PREFIX + " provider " + name + " is not configured (" + reason + ")",
            Map.of("provider", name, "disabled", true)
        );
    }
}

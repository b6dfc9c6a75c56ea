package io.threadkeep.core.provider;

import java.util.Map;
import java.util.stream.Collectors;

public record LlmResponse(String content, Map<String, Object> usage) {
    public LlmResponse {
        content = content == null ? "" : content;
        // Usage blocks may carry explicit nulls, which Map.copyOf rejects.
        usage = usage == null ? Map.of() : usage.entrySet().stream()
            .filter(e -> e.getKey() != null && e.getValue() != null)
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    public boolean isError() {
        return content.startsWith(LlmProvider.ERROR_PREFIX);
    }
}

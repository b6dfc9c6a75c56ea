package io.threadkeep.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum MessageRole {
    USER,
    ASSISTANT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup used for stored and probed data. Returns {@code null} for anything that is not
     * a conversation role, callers decide whether that means "skip" or "reject".
     */
    @JsonCreator
    public static MessageRole fromWire(String raw) {
        if (raw == null) {
            return null;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "user" -> USER;
            case "assistant" -> ASSISTANT;
            default -> null;
        };
    }
}

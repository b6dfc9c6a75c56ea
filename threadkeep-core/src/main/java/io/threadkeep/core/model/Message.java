package io.threadkeep.core.model;

import java.util.Objects;

public record Message(MessageRole role, String content) {

    public Message {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
    }

    public static Message user(String content) {
        return new Message(MessageRole.USER, content);
    }

    public static Message assistant(String content) {
        return new Message(MessageRole.ASSISTANT, content);
    }

    public Message withContent(String newContent) {
        return new Message(role, newContent);
    }
}

package io.threadkeep.core.model;

import java.util.List;

public record ConversationSnapshot(List<Message> messages, String digest) {

    public ConversationSnapshot {
        messages = messages == null ? List.of() : List.copyOf(messages);
        digest = digest == null ? "" : digest;
    }

    public boolean hasRolePair() {
        boolean user = false;
        boolean assistant = false;
        for (Message message : messages) {
            if (message.role() == MessageRole.USER) {
                user = true;
            } else if (message.role() == MessageRole.ASSISTANT) {
                assistant = true;
            }
        }
        return user && assistant;
    }
}

package io.threadkeep.core.summarize;

import io.threadkeep.core.model.Message;
import java.util.List;
import java.util.Optional;

public interface ConversationSummarizer {
    String name();

    /**
     * Compressed copy of {@code messages}, or empty when this strategy could not produce one.
     */
    Optional<List<Message>> summarize(List<Message> messages, double ratio);
}

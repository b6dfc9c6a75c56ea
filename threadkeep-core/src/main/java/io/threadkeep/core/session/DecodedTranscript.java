package io.threadkeep.core.session;

import io.threadkeep.core.model.Message;
import java.util.List;

public sealed interface DecodedTranscript permits DecodedTranscript.Parsed, DecodedTranscript.Unreadable {

    List<Message> messages();

    record Parsed(List<Message> messages) implements DecodedTranscript {
        public Parsed {
            messages = List.copyOf(messages);
        }
    }

    /**
     * Stored history that failed validation. Treated as an empty transcript.
     */
    record Unreadable(String reason) implements DecodedTranscript {
        @Override
        public List<Message> messages() {
            return List.of();
        }
    }
}

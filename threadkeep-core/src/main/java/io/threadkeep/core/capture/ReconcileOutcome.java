package io.threadkeep.core.capture;

import io.threadkeep.core.model.ConversationSnapshot;
import io.threadkeep.core.model.Message;
import java.util.List;
import java.util.Objects;

public sealed interface ReconcileOutcome permits ReconcileOutcome.Updated, ReconcileOutcome.NoUpdate {

    boolean updated();

    enum Reason {
        CAPTURE_DISABLED,
        TOO_FEW_FRAGMENTS,
        MISSING_ROLE_PAIR,
        UNCHANGED
    }

    record Updated(List<Message> messages, ConversationSnapshot snapshot) implements ReconcileOutcome {
        public Updated {
            messages = List.copyOf(messages);
            Objects.requireNonNull(snapshot, "snapshot must not be null");
        }

        @Override
        public boolean updated() {
            return true;
        }
    }

    record NoUpdate(Reason reason) implements ReconcileOutcome {
        public NoUpdate {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        @Override
        public boolean updated() {
            return false;
        }
    }
}

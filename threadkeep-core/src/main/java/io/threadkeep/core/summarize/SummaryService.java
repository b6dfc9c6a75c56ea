package io.threadkeep.core.summarize;

import io.threadkeep.core.model.Message;
import io.threadkeep.core.session.CapturedSession;
import io.threadkeep.core.session.SessionStore;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Produces compressed views of stored sessions. Results are returned to the caller and never
 * written back.
 */
public final class SummaryService {
    private final SessionStore store;
    private final FallbackConversationSummarizer summarizer;
    private final ExtractiveSummarizer extractive;

    public SummaryService(SessionStore store, FallbackConversationSummarizer summarizer, ExtractiveSummarizer extractive) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.summarizer = Objects.requireNonNull(summarizer, "summarizer must not be null");
        this.extractive = Objects.requireNonNull(extractive, "extractive must not be null");
    }

    public Optional<Summary> summarizeSession(String sessionId, double ratio, Strategy strategy) throws IOException {
        Optional<CapturedSession> session = store.findById(sessionId);
        if (session.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(summarize(session.get().id(), session.get().messages(), ratio, strategy));
    }

    public Summary summarize(String sessionId, List<Message> messages, double ratio, Strategy strategy) {
        double effectiveRatio = ExtractiveSummarizer.clampRatio(ratio);
        if (strategy == Strategy.EXTRACTIVE) {
            return new Summary(sessionId, extractive.name(), effectiveRatio, extractive.compress(messages, effectiveRatio));
        }
        FallbackConversationSummarizer.Result result = summarizer.summarizeWithStrategy(messages, effectiveRatio);
        return new Summary(sessionId, result.strategy(), effectiveRatio, result.messages());
    }

    public enum Strategy {
        AUTO,
        EXTRACTIVE;

        public static Strategy parse(String raw) {
            if (raw == null || raw.isBlank()) {
                return AUTO;
            }
            return "extractive".equalsIgnoreCase(raw.trim()) ? EXTRACTIVE : AUTO;
        }
    }

    public record Summary(String sessionId, String strategy, double ratio, List<Message> messages) {
    }
}

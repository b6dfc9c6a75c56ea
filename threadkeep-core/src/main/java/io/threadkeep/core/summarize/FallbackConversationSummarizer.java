package io.threadkeep.core.summarize;

import io.threadkeep.core.model.Message;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tries each strategy in order and always ends with the extractive summarizer, so a result is
 * guaranteed.
 */
public final class FallbackConversationSummarizer implements ConversationSummarizer {
    private static final Logger LOG = LoggerFactory.getLogger(FallbackConversationSummarizer.class);

    private final List<ConversationSummarizer> chain;
    private final ExtractiveSummarizer lastResort;

    public FallbackConversationSummarizer(List<ConversationSummarizer> preferred, ExtractiveSummarizer lastResort) {
        this.chain = List.copyOf(preferred);
        this.lastResort = lastResort;
    }

    @Override
    public String name() {
        List<String> names = new ArrayList<>();
        chain.forEach(s -> names.add(s.name()));
        names.add(lastResort.name());
        return String.join(" > ", names);
    }

    @Override
    public Optional<List<Message>> summarize(List<Message> messages, double ratio) {
        return Optional.of(summarizeWithStrategy(messages, ratio).messages());
    }

    public Result summarizeWithStrategy(List<Message> messages, double ratio) {
        for (ConversationSummarizer summarizer : chain) {
            Optional<List<Message>> result = summarizer.summarize(messages, ratio);
            if (result.isPresent()) {
                LOG.debug("Summarizer {} served request", summarizer.name());
                return new Result(summarizer.name(), result.get());
            }
            LOG.info("Summarizer {} produced no result, falling back", summarizer.name());
        }
        return new Result(lastResort.name(), lastResort.compress(messages, ratio));
    }

    public record Result(String strategy, List<Message> messages) {
    }
}

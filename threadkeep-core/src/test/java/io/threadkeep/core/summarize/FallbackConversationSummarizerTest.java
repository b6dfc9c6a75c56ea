package io.threadkeep.core.summarize;

import static org.assertj.core.api.Assertions.assertThat;

import io.threadkeep.core.model.Message;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FallbackConversationSummarizerTest {

    private static final List<Message> CONVERSATION = List.of(
        Message.user("Summarize the sheet"),
        Message.assistant("Sales rose in March. Costs fell in April. Margins improved in May. Hiring paused in June.")
    );

    @Test
    void shouldUseFirstStrategyThatSucceeds() {
        FallbackConversationSummarizer summarizer = new FallbackConversationSummarizer(
            List.of(new FixedSummarizer("remote", Optional.of(List.of(Message.assistant("short"))))),
            new ExtractiveSummarizer()
        );

        FallbackConversationSummarizer.Result result = summarizer.summarizeWithStrategy(CONVERSATION, 0.3);

        assertThat(result.strategy()).isEqualTo("remote");
        assertThat(result.messages()).containsExactly(Message.assistant("short"));
    }

    @Test
    void shouldFallBackToExtractiveWhenEveryStrategyFails() {
        ExtractiveSummarizer extractive = new ExtractiveSummarizer();
        FallbackConversationSummarizer summarizer = new FallbackConversationSummarizer(
            List.of(new FixedSummarizer("first", Optional.empty()), new FixedSummarizer("second", Optional.empty())),
            extractive
        );

        FallbackConversationSummarizer.Result result = summarizer.summarizeWithStrategy(CONVERSATION, 0.3);

        assertThat(result.strategy()).isEqualTo("extractive");
        assertThat(result.messages()).isEqualTo(extractive.compress(CONVERSATION, 0.3));
        assertThat(summarizer.name()).isEqualTo("first > second > extractive");
    }

    private record FixedSummarizer(String name, Optional<List<Message>> result) implements ConversationSummarizer {
        @Override
        public Optional<List<Message>> summarize(List<Message> messages, double ratio) {
            return result;
        }
    }
}

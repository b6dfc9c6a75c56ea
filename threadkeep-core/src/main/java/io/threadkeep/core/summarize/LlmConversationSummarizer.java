package io.threadkeep.core.summarize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.threadkeep.core.model.Message;
import io.threadkeep.core.model.MessageRole;
import io.threadkeep.core.provider.LlmProvider;
import io.threadkeep.core.provider.LlmResponse;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks a remote model to rewrite the whole conversation as a shorter JSON message list. Any
 * transport, format or validation problem yields an empty result so a fallback can take over.
 */
public final class LlmConversationSummarizer implements ConversationSummarizer {
    private static final Logger LOG = LoggerFactory.getLogger(LlmConversationSummarizer.class);
    private static final Pattern JSON_ARRAY = Pattern.compile("\\[[\\s\\S]*\\]");

    private final LlmProvider provider;
    private final String model;
    private final ObjectMapper mapper;

    public LlmConversationSummarizer(LlmProvider provider, String model) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return "llm:" + provider.name();
    }

    @Override
    public Optional<List<Message>> summarize(List<Message> messages, double ratio) {
        if (messages.isEmpty()) {
            return Optional.of(List.of());
        }
        LlmResponse response = provider.chat(model, List.of(Message.user(buildPrompt(messages, ratio))));
        if (response.isError()) {
            LOG.warn("Remote summarization via {} failed: {}", provider.name(), truncate(response.content(), 300));
            return Optional.empty();
        }
        return parse(response.content());
    }

    String buildPrompt(List<Message> messages, double ratio) {
        String conversation = messages.stream()
            .map(m -> "[" + m.role().wireName().toUpperCase(Locale.ROOT) + "]: " + m.content())
            .collect(Collectors.joining("\n\n---\n\n"));
        int targetPercent = (int) Math.round(ExtractiveSummarizer.clampRatio(ratio) * 100);
        return """
            You are summarizing a conversation between a user and an assistant working in a spreadsheet. \
            Your goal is to compress this conversation while preserving all important context, decisions, \
            data insights, and any code or formulas mentioned.

            Rules:
            1. Keep user messages short but preserve their intent
            2. For assistant responses: Keep key findings, conclusions, numbers, and any code/formulas
            3. Remove verbose explanations and filler text
            4. Preserve the conversation structure (alternating user/assistant)
            5. Output format: Return ONLY a JSON array of messages like \
            [{"role": "user", "content": "..."}, {"role": "assistant", "content": "..."}]
            6. Target ~%d%% of the original length while keeping all critical information

            Conversation to summarize:

            %s

            Return ONLY the JSON array, no other text:""".formatted(targetPercent, conversation);
    }

    Optional<List<Message>> parse(String reply) {
        if (reply == null || reply.isBlank()) {
            LOG.warn("Empty reply from remote summarizer");
            return Optional.empty();
        }
        Matcher matcher = JSON_ARRAY.matcher(reply);
        if (!matcher.find()) {
            LOG.warn("No JSON array found in remote summarizer reply");
            return Optional.empty();
        }
        try {
            JsonNode array = mapper.readTree(matcher.group());
            if (!array.isArray()) {
                return Optional.empty();
            }
            List<Message> summarized = new ArrayList<>();
            for (JsonNode row : array) {
                MessageRole role = MessageRole.fromWire(row.path("role").asText(null));
                String content = row.path("content").isTextual() ? row.path("content").asText() : "";
                if (role == null || content.isBlank()) {
                    LOG.warn("Remote summarizer returned an invalid message entry");
                    return Optional.empty();
                }
                summarized.add(new Message(role, content));
            }
            return Optional.of(List.copyOf(summarized));
        } catch (IOException e) {
            LOG.warn("Failed to parse remote summarizer reply: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private String truncate(String value, int max) {
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}

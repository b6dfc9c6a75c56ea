package io.threadkeep.core.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.threadkeep.core.model.Message;
import io.threadkeep.core.model.MessageRole;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

public record CapturedSession(
    String id,
    @JsonProperty("workbook_name") String workbookName,
    @JsonProperty("captured_at") Instant capturedAt,
    String model,
    @JsonProperty("user_prompt") String userPrompt,
    @JsonProperty("assistant_response") String assistantResponse,
    List<Message> messages
) {
    public static final String CAPTURE_MODEL = "claude-for-excel";

    public CapturedSession {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(capturedAt, "capturedAt must not be null");
        messages = messages == null ? List.of() : List.copyOf(messages);
        userPrompt = userPrompt == null ? "" : userPrompt;
        assistantResponse = assistantResponse == null ? "" : assistantResponse;
    }

    public static CapturedSession create(String workbookName, Instant capturedAt, List<Message> messages) {
        return new CapturedSession(
            UUID.randomUUID().toString(),
            workbookName,
            capturedAt,
            CAPTURE_MODEL,
            firstUserPrompt(messages),
            joinedAssistantResponse(messages),
            messages
        );
    }

    /**
     * Copy carrying a new transcript; display fields are recomputed, identity is kept.
     */
    public CapturedSession withMessages(Instant updatedAt, List<Message> updated) {
        return new CapturedSession(
            id,
            workbookName,
            updatedAt,
            model,
            firstUserPrompt(updated),
            joinedAssistantResponse(updated),
            updated
        );
    }

    public SessionSummary toSummary() {
        return new SessionSummary(id, workbookName, capturedAt, model, SessionSummary.preview(userPrompt));
    }

    private static String firstUserPrompt(List<Message> messages) {
        return messages.stream()
            .filter(m -> m.role() == MessageRole.USER)
            .map(Message::content)
            .findFirst()
            .orElse("");
    }

    private static String joinedAssistantResponse(List<Message> messages) {
        return messages.stream()
            .filter(m -> m.role() == MessageRole.ASSISTANT)
            .map(Message::content)
            .collect(Collectors.joining("\n\n"));
    }
}

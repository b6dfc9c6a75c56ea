package io.threadkeep.core.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record SessionSummary(
    String id,
    @JsonProperty("workbook_name") String workbookName,
    @JsonProperty("captured_at") Instant capturedAt,
    String model,
    @JsonProperty("user_prompt_preview") String userPromptPreview
) {
    static final int PREVIEW_LENGTH = 200;

    static String preview(String prompt) {
        if (prompt == null) {
            return "";
        }
        return prompt.length() <= PREVIEW_LENGTH ? prompt : prompt.substring(0, PREVIEW_LENGTH);
    }
}

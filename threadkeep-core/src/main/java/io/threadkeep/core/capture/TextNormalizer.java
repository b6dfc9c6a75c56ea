package io.threadkeep.core.capture;

import java.util.Optional;
import java.util.regex.Pattern;

public final class TextNormalizer {
    // "<newlines>B12 selected" or "<newlines>A1:C9 selected", appended by the host when a cell is focused.
    private static final Pattern SELECTION_SUFFIX = Pattern.compile("\\n+[A-Z]+\\d+(?::[A-Z]+\\d+)? selected\\z");

    /**
     * Returns the cleaned text, or empty when nothing meaningful is left. Rejection is a normal
     * outcome and is not reported anywhere.
     */
    public Optional<String> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String cleaned = SELECTION_SUFFIX.matcher(raw).replaceAll("").trim();
        return cleaned.isEmpty() ? Optional.empty() : Optional.of(cleaned);
    }
}

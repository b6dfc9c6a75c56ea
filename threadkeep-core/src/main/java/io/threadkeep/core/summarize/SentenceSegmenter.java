package io.threadkeep.core.summarize;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits prose into sentence-like units. Fenced code blocks are lifted out before splitting and
 * come back as standalone code units in their original place.
 */
public final class SentenceSegmenter {
    static final int MIN_SENTENCE_LENGTH = 11;

    private static final String FENCE = "```";
    private static final Pattern CODE_FENCE = Pattern.compile("```[\\s\\S]*?```");
    private static final Pattern PLACEHOLDER = Pattern.compile("__CODE_BLOCK_(\\d+)__");
    private static final Pattern BOUNDARY = Pattern.compile("(?<=[.!?])\\s+|\\n\\n+");

    public List<TextUnit> segment(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<String> codeBlocks = new ArrayList<>();
        Matcher fences = CODE_FENCE.matcher(text);
        StringBuilder masked = new StringBuilder();
        while (fences.find()) {
            codeBlocks.add(fences.group());
            fences.appendReplacement(masked, Matcher.quoteReplacement("__CODE_BLOCK_" + (codeBlocks.size() - 1) + "__"));
        }
        fences.appendTail(masked);

        List<TextUnit> units = new ArrayList<>();
        for (String piece : BOUNDARY.split(masked)) {
            restore(piece, codeBlocks, units);
        }
        return List.copyOf(units);
    }

    // A piece may hold prose around a placeholder; the code block is emitted on its own either way.
    private void restore(String piece, List<String> codeBlocks, List<TextUnit> units) {
        Matcher placeholder = PLACEHOLDER.matcher(piece);
        int cursor = 0;
        while (placeholder.find()) {
            addSentence(piece.substring(cursor, placeholder.start()), units);
            int block = Integer.parseInt(placeholder.group(1));
            if (block < codeBlocks.size()) {
                units.add(new TextUnit(units.size(), codeBlocks.get(block), true));
            } else {
                addSentence(placeholder.group(), units);
            }
            cursor = placeholder.end();
        }
        addSentence(piece.substring(cursor), units);
    }

    // An unclosed fence (a capture cut off mid-block) still opens a code unit.
    private void addSentence(String raw, List<TextUnit> units) {
        String sentence = raw.trim();
        if (sentence.length() >= MIN_SENTENCE_LENGTH) {
            units.add(new TextUnit(units.size(), sentence, sentence.startsWith(FENCE)));
        }
    }
}

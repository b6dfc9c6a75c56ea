package io.threadkeep.core.summarize;

/**
 * A sentence, or a whole fenced code block, at its position in the source text.
 */
public record TextUnit(int index, String text, boolean code) {
}

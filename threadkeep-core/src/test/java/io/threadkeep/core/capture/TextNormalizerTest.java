package io.threadkeep.core.capture;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    @Test
    void shouldStripCellSelectionSuffix() {
        assertThat(normalizer.normalize("Sum column B\n\nB12 selected")).contains("Sum column B");
        assertThat(normalizer.normalize("Format the table\nA1:C9 selected")).contains("Format the table");
    }

    @Test
    void shouldTrimSurroundingWhitespace() {
        assertThat(normalizer.normalize("   hello there  \n")).contains("hello there");
    }

    @Test
    void shouldRejectBlankOrSelectionOnlyText() {
        assertThat(normalizer.normalize(null)).isEmpty();
        assertThat(normalizer.normalize("   \n\t ")).isEmpty();
        assertThat(normalizer.normalize("\nB2 selected")).isEmpty();
    }

    @Test
    void shouldKeepSelectionTextThatIsNotASuffix() {
        assertThat(normalizer.normalize("B12 selected is what the footer says"))
            .contains("B12 selected is what the footer says");
        assertThat(normalizer.normalize("Total\nb12 selected")).contains("Total\nb12 selected");
    }

    @Test
    void shouldOnlyStripSuffixAtVeryEndOfText() {
        assertThat(normalizer.normalize("Sum column B\nB2 selected\n")).contains("Sum column B\nB2 selected");
    }
}

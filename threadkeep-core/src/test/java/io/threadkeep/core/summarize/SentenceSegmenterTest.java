package io.threadkeep.core.summarize;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class SentenceSegmenterTest {

    private final SentenceSegmenter segmenter = new SentenceSegmenter();

    @Test
    void shouldSplitOnTerminatorsAndBlankLines() {
        List<TextUnit> units = segmenter.segment(
            "First sentence here. Second one is here!\n\nShort.\n\nThird sentence?"
        );

        assertThat(units).extracting(TextUnit::text)
            .containsExactly("First sentence here.", "Second one is here!", "Third sentence?");
        assertThat(units).extracting(TextUnit::index).containsExactly(0, 1, 2);
        assertThat(units).noneMatch(TextUnit::code);
    }

    @Test
    void shouldDropUnitsShorterThanElevenCharacters() {
        assertThat(segmenter.segment("Tiny one. Also tiny. This one is long enough."))
            .extracting(TextUnit::text)
            .containsExactly("This one is long enough.");
    }

    @Test
    void shouldKeepCodeBlocksWholeAndSeparate() {
        String code = "```python\nx = 1. y = 2.\n\nprint(x)\n```";
        List<TextUnit> units = segmenter.segment(
            "Run this code now:\n" + code + "\nThen check the output carefully."
        );

        assertThat(units).extracting(TextUnit::text)
            .containsExactly("Run this code now:", code, "Then check the output carefully.");
        assertThat(units).extracting(TextUnit::code).containsExactly(false, true, false);
    }

    @Test
    void shouldKeepShortCodeBlocks() {
        List<TextUnit> units = segmenter.segment("Use this formula below.\n\n```=A1```");

        assertThat(units).extracting(TextUnit::text).containsExactly("Use this formula below.", "```=A1```");
    }

    @Test
    void shouldTreatUnclosedFenceAsCode() {
        List<TextUnit> units = segmenter.segment(
            "Load the sheet with pandas first!\n\n```python\nimport pandas as pd\ndf = pd.read_excel(path)"
        );

        assertThat(units).extracting(TextUnit::text)
            .containsExactly("Load the sheet with pandas first!", "```python\nimport pandas as pd\ndf = pd.read_excel(path)");
        assertThat(units).extracting(TextUnit::code).containsExactly(false, true);
    }

    @Test
    void shouldReturnNothingForBlankText() {
        assertThat(segmenter.segment("  \n ")).isEmpty();
        assertThat(segmenter.segment(null)).isEmpty();
    }
}

package io.threadkeep.core.capture;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FingerprintsTest {

    @Test
    void shouldMatchJavaStringHashForShortText() {
        assertThat(Fingerprints.rollingHash("hello")).isEqualTo(Integer.toString("hello".hashCode(), 16));
        assertThat(Fingerprints.rollingHash("")).isEqualTo("0");
    }

    @Test
    void shouldRenderOverflowedHashAsSignedHex() {
        String text = "a fairly long sentence that overflows a 32 bit accumulator";
        int hash = text.hashCode();

        assertThat(Fingerprints.rollingHash(text)).isEqualTo(Integer.toString(hash, 16));
        if (hash < 0) {
            assertThat(Fingerprints.rollingHash(text)).startsWith("-");
        }
    }

    @Test
    void shouldIgnoreCaseAndSurroundingWhitespace() {
        assertThat(Fingerprints.ofContent("  Hello World ")).isEqualTo(Fingerprints.ofContent("hello world"));
    }

    @Test
    void shouldOnlyLookAtFirstHundredCharacters() {
        String prefix = "x".repeat(100);

        assertThat(Fingerprints.ofContent(prefix + " first tail"))
            .isEqualTo(Fingerprints.ofContent(prefix + " a completely different and longer tail"));
        assertThat(Fingerprints.ofContent("x".repeat(99) + "a"))
            .isNotEqualTo(Fingerprints.ofContent("x".repeat(99) + "b"));
    }
}

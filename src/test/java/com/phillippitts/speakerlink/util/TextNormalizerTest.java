package com.phillippitts.speakerlink.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @Test
    void shouldLowerCaseAndStripEdgePunctuation() {
        assertThat(TextNormalizer.normalizeTerm("  \"Ph.D.\" ")).isEqualTo("ph.d.");
        assertThat(TextNormalizer.normalizeTerm("(C++)")).isEqualTo("c++");
        assertThat(TextNormalizer.normalizeTerm("Machine   Learning")).isEqualTo("machine learning");
    }

    @Test
    void shouldReturnEmptyForNullTerm() {
        assertThat(TextNormalizer.normalizeTerm(null)).isEmpty();
        assertThat(TextNormalizer.collapseWhitespace(null)).isEmpty();
    }

    @Test
    void shouldSplitIntoAlphanumericTokens() {
        assertThat(TextNormalizer.tokens("Machine-Learning & AI")).containsExactly("machine", "learning", "ai");
        assertThat(TextNormalizer.tokens("  ")).isEmpty();
    }

    @Test
    void shouldRespectTokenBoundaries() {
        assertThat(TextNormalizer.containsAtTokenBoundary("machine learning", "learning")).isTrue();
        assertThat(TextNormalizer.containsAtTokenBoundary("elearning", "learning")).isFalse();
        assertThat(TextNormalizer.findAtTokenBoundary("ai and ai", "ai")).containsExactly(0, 7);
    }

    @Test
    void shouldStripDiacritics() {
        assertThat(TextNormalizer.stripDiacritics("Zoë Müller")).isEqualTo("Zoe Muller");
    }
}

package com.phillippitts.speakerlink.util;

import com.phillippitts.speakerlink.domain.LanguageProficiency;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LanguageParserTest {

    @Test
    void shouldParseMixedLevelNotations() {
        assertThat(LanguageParser.parseList("English (Native), Spanish - Fluent, French: B2"))
                .containsExactly(
                        new LanguageEntry("English", LanguageProficiency.NATIVE),
                        new LanguageEntry("Spanish", LanguageProficiency.FLUENT),
                        new LanguageEntry("French", LanguageProficiency.CONVERSATIONAL));
    }

    @Test
    void shouldKeepLanguageWithoutLevel() {
        assertThat(LanguageParser.parseEntry("German")).isEqualTo(new LanguageEntry("German", null));
    }

    @Test
    void shouldKeepWholeTextWhenLevelUnknown() {
        assertThat(LanguageParser.parseEntry("Mandarin (some)")).isEqualTo(new LanguageEntry("Mandarin (some)", null));
    }

    @Test
    void shouldIgnoreBlankInput() {
        assertThat(LanguageParser.parseEntry("  ")).isNull();
        assertThat(LanguageParser.parseList(null)).isEmpty();
    }
}

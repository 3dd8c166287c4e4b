package com.phillippitts.speakerlink.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LanguageProficiencyTest {

    @Test
    void shouldMapWordsAndCefrLevels() {
        assertThat(LanguageProficiency.fromText("Native Speaker")).contains(LanguageProficiency.NATIVE);
        assertThat(LanguageProficiency.fromText("C1")).contains(LanguageProficiency.FLUENT);
        assertThat(LanguageProficiency.fromText(" intermediate ")).contains(LanguageProficiency.CONVERSATIONAL);
        assertThat(LanguageProficiency.fromText("A2")).contains(LanguageProficiency.BASIC);
    }

    @Test
    void shouldReturnEmptyForUnknownText() {
        assertThat(LanguageProficiency.fromText("somewhat")).isEmpty();
        assertThat(LanguageProficiency.fromText(null)).isEmpty();
    }

    @Test
    void shouldOrderByFluency() {
        assertThat(LanguageProficiency.NATIVE.isMoreFluentThan(LanguageProficiency.FLUENT)).isTrue();
        assertThat(LanguageProficiency.BASIC.isMoreFluentThan(LanguageProficiency.CONVERSATIONAL)).isFalse();
        assertThat(LanguageProficiency.BASIC.isMoreFluentThan(null)).isTrue();
    }
}

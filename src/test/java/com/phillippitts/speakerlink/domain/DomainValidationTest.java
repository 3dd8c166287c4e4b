package com.phillippitts.speakerlink.domain;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainValidationTest {

    private static ProfileMetadata metadata() {
        return new ProfileMetadata(new TreeSet<>(Set.of("bigspeak")), DataQualityTier.SILVER, 0, 0, 0, 1.0, "2024.1", null);
    }

    @Test
    void shouldRejectProfileWithoutSourceIds() {
        assertThatThrownBy(() -> new CanonicalProfile("p1", new TreeMap<>(), null, null, null, null, null, null,
                null, null, null, null, null, metadata()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one source id");
    }

    @Test
    void shouldDefaultMissingFieldGroups() {
        CanonicalProfile profile = new CanonicalProfile("p1", new TreeMap<>(Map.of("bigspeak", "bs-1")),
                null, null, null, null, null, null, null, null, null, null, null, metadata());

        assertThat(profile.identity()).isEqualTo(Identity.EMPTY);
        assertThat(profile.categories(TaxonomyDomain.LANGUAGE)).isEqualTo(CategoryResult.empty());
        assertThat(profile.speaking()).isEqualTo(Speaking.EMPTY);
    }

    @Test
    void shouldReplaceMergeConfidence() {
        CanonicalProfile profile = new CanonicalProfile("p1", new TreeMap<>(Map.of("bigspeak", "bs-1")),
                null, null, null, null, null, null, null, null, null, null, null, metadata());

        assertThat(profile.withMergeConfidence(0.9).metadata().mergeConfidence()).isEqualTo(0.9);
    }

    @Test
    void shouldRejectOutOfRangeScoresAndConfidence() {
        assertThatThrownBy(() -> metadata().withScores(101, 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> metadata().withMergeConfidence(1.5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectInvalidFees() {
        assertThatThrownBy(() -> new FeeRange(20_000, 10_000, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exceeds maximum");
        assertThatThrownBy(() -> new FeeRange(-1, null, null, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectInvalidSpeakingFacts() {
        assertThatThrownBy(() -> new SpeakingFacts(-2, null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SpeakingFacts(null, null, 5.5, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldJoinBiographyAndLocationParts() {
        assertThat(new Biography("Speaker", null, "Long bio").freeText()).isEqualTo("Speaker\nLong bio");
        assertThat(new Location("Austin", "TX", "United States", "US", "North America").display())
                .isEqualTo("Austin, TX, United States");
    }

    @Test
    void shouldExposeAllContactUrls() {
        Contact contact = new Contact(null, "https://jane.dev", new TreeMap<>(Map.of("linkedin", "https://linkedin.com/in/jane")),
                new TreeSet<>(Set.of("https://bigspeak.com/jane")));

        assertThat(contact.allUrls()).containsExactly(
                "https://bigspeak.com/jane", "https://jane.dev", "https://linkedin.com/in/jane");
    }

    @Test
    void shouldExposeTableIdentifiers() {
        assertThat(TaxonomyDomain.SPEAKING_FORMAT.id()).isEqualTo("speaking_format");
        assertThat(TaxonomyDomain.EXPERTISE.resourceName()).isEqualTo("expertise.json");
    }
}

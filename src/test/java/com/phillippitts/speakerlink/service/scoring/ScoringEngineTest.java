package com.phillippitts.speakerlink.service.scoring;

import com.phillippitts.speakerlink.domain.Biography;
import com.phillippitts.speakerlink.domain.CanonicalProfile;
import com.phillippitts.speakerlink.domain.CategoryResult;
import com.phillippitts.speakerlink.domain.Contact;
import com.phillippitts.speakerlink.domain.DataQualityTier;
import com.phillippitts.speakerlink.domain.Demographics;
import com.phillippitts.speakerlink.domain.Identity;
import com.phillippitts.speakerlink.domain.LanguageProficiency;
import com.phillippitts.speakerlink.domain.Languages;
import com.phillippitts.speakerlink.domain.Location;
import com.phillippitts.speakerlink.domain.Media;
import com.phillippitts.speakerlink.domain.ProfileMetadata;
import com.phillippitts.speakerlink.domain.Speaking;
import com.phillippitts.speakerlink.domain.SpeakingFacts;
import com.phillippitts.speakerlink.util.LocationParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

class ScoringEngineTest {

    private ScoringEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ScoringEngine();
    }

    private static CanonicalProfile profile(Identity identity, Biography biography, Location location,
                                            Speaking speaking) {
        ProfileMetadata metadata = new ProfileMetadata(new TreeSet<>(Set.of("bigspeak")), DataQualityTier.SILVER,
                0, 0, 0, 1.0, "2024.1", null);
        return new CanonicalProfile("p1", new TreeMap<>(Map.of("bigspeak", "bs-1")), identity, biography, location,
                null, null, null, null, speaking, null, null, null, metadata);
    }

    private static Speaking speaking(SpeakingFacts facts, String... formats) {
        CategoryResult categories = new CategoryResult(new TreeSet<>(Set.of(formats)), null, null, null, null, null);
        return new Speaking(categories, null, false, facts);
    }

    private static CategoryResult categories(String primary, String parent) {
        return new CategoryResult(new TreeSet<>(Set.of(primary)), null, new TreeSet<>(Set.of(parent)), null, null, null);
    }

    /**
     * Returns a copy of {@code p} with the leaves of {@code group} populated.
     */
    private static CanonicalProfile populate(CanonicalProfile p, FieldGroup group) {
        Identity identity = p.identity();
        Biography biography = p.biography();
        Location location = p.location();
        CategoryResult expertise = p.expertise();
        CategoryResult credentials = p.credentials();
        Languages languages = p.languages();
        Speaking speaking = p.speaking();
        Demographics demographics = p.demographics();
        Media media = p.media();
        Contact contact = p.contact();
        switch (group) {
            case IDENTITY -> identity = new Identity("Jane Smith", "Jane", "Smith", "Dr", "CEO", "Acme");
            case BIOGRAPHY -> biography = new Biography("Futurist", "Jane speaks on AI.", "Jane builds things.");
            case LOCATION -> location = LocationParser.parse("Austin, TX");
            case EXPERTISE -> expertise = categories("artificial_intelligence", "technology");
            case CREDENTIALS -> credentials = categories("PhD", "degree");
            case LANGUAGES -> languages = new Languages(categories("en", "european"),
                    new TreeMap<>(Map.of("en", LanguageProficiency.NATIVE)));
            case MEDIA -> media = new Media("https://img.example.com/jane.jpg", null, null);
            case CONTACT -> contact = new Contact("jane@example.com", "https://janesmith.com", null, null);
            case SPEAKING -> speaking = speaking(new SpeakingFacts(12, 250, 4.9, 40, 6000, null), "keynote");
            case DEMOGRAPHICS -> demographics = new Demographics(CategoryResult.empty(), "she/her");
        }
        return new CanonicalProfile(p.profileId(), p.sourceIds(), identity, biography, location, expertise,
                p.industry(), credentials, languages, speaking, demographics, media, contact, p.metadata());
    }

    @Test
    void shouldAwardPointsOnlyForGroupsMeetingThreshold() {
        CanonicalProfile profile = profile(
                new Identity("Jane Smith", "Jane", "Smith", null, "CEO", "Acme"),
                new Biography(null, null, "Jane builds things."),
                LocationParser.parse("Austin, TX"),
                null);

        ProfileScores scores = engine.score(profile);

        assertThat(scores.profileScore()).isEqualTo(40);
        assertThat(scores.experienceScore()).isZero();
        // 10 of 43 leaves populated
        assertThat(scores.completenessScore()).isEqualTo(23);
    }

    @Test
    void shouldWithholdIdentityPointsBelowFourLeaves() {
        CanonicalProfile profile = profile(new Identity("Jane Smith", "Jane", "Smith", null, null, null),
                null, null, null);

        assertThat(engine.score(profile).profileScore()).isZero();
    }

    @Test
    void shouldScoreExperienceFromFactsAndFormats() {
        SpeakingFacts facts = new SpeakingFacts(12, 250, 4.9, 40, 6000, null);
        CanonicalProfile profile = profile(null, null, null, speaking(facts, "keynote", "workshop", "panel"));

        assertThat(engine.score(profile).experienceScore()).isEqualTo(15 + 15 + 20 + 12 + 20);
    }

    @Test
    void shouldCapExperienceComponents() {
        SpeakingFacts facts = new SpeakingFacts(25, 600, 5.0, null, 10_000, null);
        CanonicalProfile profile = profile(null, null, null,
                speaking(facts, "keynote", "workshop", "panel", "fireside", "webinar", "emcee"));

        assertThat(engine.score(profile).experienceScore()).isEqualTo(100);
    }

    @Test
    void shouldUseLowerBandsAtBoundaries() {
        SpeakingFacts facts = new SpeakingFacts(2, 50, 3.5, null, 500, null);
        CanonicalProfile profile = profile(null, null, null, speaking(facts));

        assertThat(engine.score(profile).experienceScore()).isEqualTo(5 + 5 + 5);
    }

    @Test
    void shouldWriteScoresIntoMetadata() {
        CanonicalProfile profile = profile(
                new Identity("Jane Smith", "Jane", "Smith", null, "CEO", "Acme"), null, null, null);

        CanonicalProfile scored = engine.applyScores(profile);

        assertThat(scored.metadata().profileScore()).isEqualTo(15);
        assertThat(scored.metadata().completenessScore()).isEqualTo(engine.score(profile).completenessScore());
        assertThat(scored.metadata().mergeConfidence()).isEqualTo(1.0);
        assertThat(scored.identity()).isEqualTo(profile.identity());
    }

    @Test
    void shouldCountEveryLeaf() {
        assertThat(FieldGroup.totalLeafCount()).isEqualTo(43);
        assertThat(FieldGroup.SPEAKING.points()).isZero();
    }

    @Test
    void shouldNeverLowerScoresWhenAddingFieldGroups() {
        CanonicalProfile profile = profile(null, null, null, null);
        ProfileScores previous = engine.score(profile);
        assertThat(previous.profileScore()).isZero();
        assertThat(previous.completenessScore()).isZero();

        for (FieldGroup group : FieldGroup.values()) {
            profile = populate(profile, group);
            ProfileScores current = engine.score(profile);

            assertThat(current.profileScore()).as("profile score after %s", group)
                    .isGreaterThanOrEqualTo(previous.profileScore());
            assertThat(current.completenessScore()).as("completeness after %s", group)
                    .isGreaterThanOrEqualTo(previous.completenessScore());
            previous = current;
        }
        assertThat(previous.profileScore()).isEqualTo(100);
    }
}

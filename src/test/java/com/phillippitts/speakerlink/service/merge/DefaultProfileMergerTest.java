package com.phillippitts.speakerlink.service.merge;

import com.phillippitts.speakerlink.domain.CanonicalProfile;
import com.phillippitts.speakerlink.domain.CategoryResult;
import com.phillippitts.speakerlink.domain.DataQualityTier;
import com.phillippitts.speakerlink.domain.LanguageProficiency;
import com.phillippitts.speakerlink.domain.SourceRecord;
import com.phillippitts.speakerlink.domain.TaxonomyDomain;
import com.phillippitts.speakerlink.service.adapter.SourceCatalog;
import com.phillippitts.speakerlink.service.scoring.ScoringEngine;
import com.phillippitts.speakerlink.service.taxonomy.ClassifiedRecord;
import com.phillippitts.speakerlink.service.taxonomy.RecordClassifier;
import com.phillippitts.speakerlink.testutil.TestTaxonomy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class DefaultProfileMergerTest {

    private RecordClassifier classifier;
    private DefaultProfileMerger merger;

    @BeforeEach
    void setUp() {
        classifier = TestTaxonomy.recordClassifier();
        merger = new DefaultProfileMerger(classifier, SourceCatalog.defaults(), new ScoringEngine());
    }

    private static SourceRecord.Builder jane(String source, String localId) {
        return SourceRecord.builder(source, localId).name("Jane Smith", "Jane", "Smith", null);
    }

    private ClassifiedRecord classify(SourceRecord record) {
        return classifier.classify(record);
    }

    private static CategoryResult formats(String... codes) {
        return new CategoryResult(new TreeSet<>(Set.of(codes)), null, null, null, null, null);
    }

    @Test
    void shouldCreateProfileFromSingleRecord() {
        SourceRecord record = jane("bigspeak", "bs-1")
                .jobTitle("CEO")
                .language("Spanish", LanguageProficiency.FLUENT)
                .terms(TaxonomyDomain.SPEAKING_FORMAT, List.of("Webinar", "Keynote"))
                .build();

        CanonicalProfile profile = merger.create(classify(record), "jane-smith");

        assertThat(profile.profileId()).isEqualTo("jane-smith");
        assertThat(profile.sourceIds()).containsExactly(entry("bigspeak", "bs-1"));
        assertThat(profile.identity().jobTitle()).isEqualTo("CEO");
        assertThat(profile.languages().proficiency()).containsExactly(entry("es", LanguageProficiency.FLUENT));
        assertThat(profile.speaking().primaryFormat()).isEqualTo("keynote");
        assertThat(profile.speaking().virtualCapable()).isTrue();
        assertThat(profile.metadata().sources()).containsExactly("bigspeak");
        assertThat(profile.metadata().dataQualityTier()).isEqualTo(DataQualityTier.SILVER);
        assertThat(profile.metadata().mergeConfidence()).isEqualTo(1.0);
        assertThat(profile.metadata().taxonomyVersion()).isEqualTo(TestTaxonomy.VERSION);
        assertThat(profile.metadata().fieldSources()).containsEntry("identity.job_title", "bigspeak");
        assertThat(profile.metadata().profileScore()).isPositive();
    }

    @Test
    void shouldFillEmptyFieldsFromLessTrustedSource() {
        CanonicalProfile existing = merger.create(classify(jane("bigspeak", "bs-1").jobTitle("CEO").build()), "p1");

        CanonicalProfile merged = merger.merge(existing,
                classify(jane("sessionize", "s-9").jobTitle("Founder").company("Acme").build()));

        assertThat(merged.identity().jobTitle()).isEqualTo("CEO");
        assertThat(merged.identity().company()).isEqualTo("Acme");
        assertThat(merged.metadata().fieldSources())
                .containsEntry("identity.job_title", "bigspeak")
                .containsEntry("identity.company", "sessionize");
        assertThat(merged.metadata().sources()).containsExactly("bigspeak", "sessionize");
        assertThat(merged.metadata().dataQualityTier()).isEqualTo(DataQualityTier.SILVER);
        assertThat(merged.sourceIds()).containsOnlyKeys("bigspeak", "sessionize");
        assertThat(merged.profileId()).isEqualTo("p1");
    }

    @Test
    void shouldOverwriteFromStrictlyMoreTrustedSource() {
        CanonicalProfile existing = merger.create(classify(jane("sessionize", "s-9").jobTitle("Founder").build()), "p1");

        CanonicalProfile merged = merger.merge(existing,
                classify(jane("llm_parsed_db", "llm-1").jobTitle("CEO").build()));

        assertThat(merged.identity().jobTitle()).isEqualTo("CEO");
        assertThat(merged.metadata().fieldSources()).containsEntry("identity.job_title", "llm_parsed_db");
        assertThat(merged.metadata().dataQualityTier()).isEqualTo(DataQualityTier.GOLD);
    }

    @Test
    void shouldKeepHeldValueFromSameTier() {
        CanonicalProfile existing = merger.create(classify(jane("bigspeak", "bs-1").jobTitle("CEO").build()), "p1");

        CanonicalProfile merged = merger.merge(existing,
                classify(jane("leading_authorities", "la-3").jobTitle("Chair").build()));

        assertThat(merged.identity().jobTitle()).isEqualTo("CEO");
    }

    @Test
    void shouldBeIdempotentForRepeatedRecord() {
        SourceRecord record = jane("bigspeak", "bs-1")
                .jobTitle("CEO")
                .fullBio("Jane holds a PhD and studies public health.")
                .terms(TaxonomyDomain.EXPERTISE, List.of("Artificial Intelligence"))
                .language("English", LanguageProficiency.NATIVE)
                .socialLink("linkedin", "https://linkedin.com/in/janesmith")
                .build();
        ClassifiedRecord classified = classify(record);
        CanonicalProfile created = merger.create(classified, "p1");

        assertThat(merger.merge(created, classified)).isEqualTo(created);
    }

    @Test
    void shouldKeepMostFluentProficiency() {
        CanonicalProfile existing = merger.create(classify(jane("bigspeak", "bs-1")
                .language("Spanish", LanguageProficiency.CONVERSATIONAL).build()), "p1");

        CanonicalProfile merged = merger.merge(existing, classify(jane("sessionize", "s-9")
                .language("Spanish", LanguageProficiency.NATIVE)
                .language("English", LanguageProficiency.FLUENT).build()));

        assertThat(merged.languages().proficiency())
                .containsExactly(entry("en", LanguageProficiency.FLUENT), entry("es", LanguageProficiency.NATIVE));
        assertThat(merged.languages().categories().primaryCategories()).containsExactly("en", "es");
    }

    @Test
    void shouldReclassifyFromUnionOfTermsAndMergedBiography() {
        CanonicalProfile existing = merger.create(classify(jane("bigspeak", "bs-1")
                .terms(TaxonomyDomain.SPEAKING_FORMAT, List.of("Workshop")).build()), "p1");

        CanonicalProfile merged = merger.merge(existing, classify(jane("sessionize", "s-9")
                .terms(TaxonomyDomain.SPEAKING_FORMAT, List.of("Keynote"))
                .fullBio("She studies public health.")
                .build()));

        assertThat(merged.speaking().formats().primaryCategories()).containsExactly("keynote", "workshop");
        assertThat(merged.speaking().formats().originalTerms()).containsExactly("Keynote", "Workshop");
        assertThat(merged.speaking().primaryFormat()).isEqualTo("keynote");
        assertThat(merged.speaking().virtualCapable()).isFalse();
        assertThat(merged.expertise().researchAreas()).containsExactly("public_health");
    }

    @Test
    void shouldUnionCollectionsAndMergeSocialLinksPerPlatform() {
        CanonicalProfile existing = merger.create(classify(jane("bigspeak", "bs-1")
                .socialLink("linkedin", "https://linkedin.com/in/janesmith")
                .videoUrls(List.of("https://youtu.be/a"))
                .profileUrl("https://bigspeak.com/jane")
                .build()), "p1");

        CanonicalProfile merged = merger.merge(existing, classify(jane("sessionize", "s-9")
                .socialLink("linkedin", "https://linkedin.com/in/jane-other")
                .socialLink("twitter", "https://twitter.com/jane")
                .videoUrls(List.of("https://youtu.be/b", "https://youtu.be/a"))
                .profileUrl("https://sessionize.com/jane")
                .build()));

        assertThat(merged.contact().socialLinks()).containsExactly(
                entry("linkedin", "https://linkedin.com/in/janesmith"),
                entry("twitter", "https://twitter.com/jane"));
        assertThat(merged.media().videoUrls()).containsExactly("https://youtu.be/a", "https://youtu.be/b");
        assertThat(merged.contact().profileUrls())
                .containsExactly("https://bigspeak.com/jane", "https://sessionize.com/jane");
    }

    @Test
    void shouldCreateWhenNoExistingProfile() {
        ClassifiedRecord classified = classify(jane("bigspeak", "bs-1").build());

        assertThat(merger.mergeOrCreate(null, classified, "p1")).isEqualTo(merger.create(classified, "p1"));
    }

    @Test
    void shouldPickPrimaryFormatByProminence() {
        assertThat(DefaultProfileMerger.primaryFormat(formats("panel", "webinar"))).isEqualTo("panel");
        assertThat(DefaultProfileMerger.primaryFormat(formats("emcee", "demonstration"))).isEqualTo("demonstration");
        assertThat(DefaultProfileMerger.primaryFormat(CategoryResult.empty())).isNull();
    }

    @Test
    void shouldDetectVirtualCapability() {
        CategoryResult virtualParent = new CategoryResult(null, null, new TreeSet<>(Set.of("virtual")), null, null, null);

        assertThat(DefaultProfileMerger.isVirtualCapable(virtualParent)).isTrue();
        assertThat(DefaultProfileMerger.isVirtualCapable(formats("webinar"))).isTrue();
        assertThat(DefaultProfileMerger.isVirtualCapable(formats("keynote"))).isFalse();
    }
}

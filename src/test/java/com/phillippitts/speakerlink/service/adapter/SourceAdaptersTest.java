package com.phillippitts.speakerlink.service.adapter;

import com.phillippitts.speakerlink.domain.LanguageProficiency;
import com.phillippitts.speakerlink.domain.SourceRecord;
import com.phillippitts.speakerlink.domain.TaxonomyDomain;
import com.phillippitts.speakerlink.exception.MalformedRecordException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceAdaptersTest {

    @Test
    void shouldRejectPlaceholderName() {
        SourceAdapter adapter = new LlmParsedAdapter();

        assertThatThrownBy(() -> adapter.adapt(Map.of("_id", "llm-003", "speaker_name", "N/A")))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessage("Malformed llm_parsed_db document (id: llm-003): no usable name");
    }

    @Test
    void shouldRejectMissingNameWithoutId() {
        SourceAdapter adapter = new SessionizeAdapter();

        assertThatThrownBy(() -> adapter.adapt(Map.of("tagline", "Speaker")))
                .isInstanceOf(MalformedRecordException.class)
                .extracting(e -> ((MalformedRecordException) e).getSourceLocalId())
                .isEqualTo("unknown");
    }

    @Test
    void shouldKeyDocumentWithoutIdByName() {
        SourceRecord record = new BigSpeakAdapter().adapt(Map.of("name", "José Smith"));

        assertThat(record.sourceLocalId()).isEqualTo("name:jose smith");
    }

    @Test
    void shouldMapLlmParsedDocument() {
        SourceRecord record = new LlmParsedAdapter().adapt(Map.of(
                "_id", Map.of("$oid", "65a1"),
                "speaker_name", "Dr. Jane Smith, PhD",
                "job_title", "Chief Scientist",
                "bio", "Jane researches machine learning.",
                "location", "Austin, TX",
                "field_of_expertise", List.of("AI", "Leadership"),
                "education", List.of("Ph.D. in Computer Science"),
                "event_types", List.of("Keynote")));

        assertThat(record.source()).isEqualTo(SourceNames.LLM_PARSED_DB);
        assertThat(record.sourceLocalId()).isEqualTo("65a1");
        assertThat(record.identity().fullName()).isEqualTo("Jane Smith");
        assertThat(record.identity().honorific()).isEqualTo("Dr");
        assertThat(record.identity().jobTitle()).isEqualTo("Chief Scientist");
        assertThat(record.biography().fullBio()).isEqualTo("Jane researches machine learning.");
        assertThat(record.location().state()).isEqualTo("TX");
        assertThat(record.terms(TaxonomyDomain.EXPERTISE)).containsExactly("AI", "Leadership");
        assertThat(record.terms(TaxonomyDomain.CREDENTIAL)).containsExactly("PhD", "Ph.D. in Computer Science");
        assertThat(record.terms(TaxonomyDomain.SPEAKING_FORMAT)).containsExactly("Keynote");
    }

    @Test
    void shouldMapBigSpeakDocument() {
        SourceRecord record = new BigSpeakAdapter().adapt(Map.of(
                "speaker_id", "bs-17",
                "name", "Jane Smith",
                "description", "AI strategist and keynote speaker",
                "topics", List.of("Artificial Intelligence"),
                "keynote_topics", List.of("Digital Transformation"),
                "fee_range", "$10,000 - $20,000",
                "languages", List.of("English (Native)", "Spanish - Fluent"),
                "social_media", Map.of("linkedin", "https://linkedin.com/in/janesmith"),
                "books", List.of("The AI Playbook"),
                "profile_url", "https://bigspeak.com/speakers/jane-smith"));

        assertThat(record.sourceLocalId()).isEqualTo("bs-17");
        assertThat(record.biography().tagline()).isEqualTo("AI strategist and keynote speaker");
        assertThat(record.biography().summary()).isEqualTo("AI strategist and keynote speaker");
        assertThat(record.terms(TaxonomyDomain.EXPERTISE))
                .containsExactly("Artificial Intelligence", "Digital Transformation");
        assertThat(record.speakingFacts().fee().bucket()).isEqualTo("10k-20k");
        assertThat(record.terms(TaxonomyDomain.LANGUAGE)).containsExactly("English", "Spanish");
        assertThat(record.languageProficiency())
                .containsEntry("English", LanguageProficiency.NATIVE)
                .containsEntry("Spanish", LanguageProficiency.FLUENT);
        assertThat(record.contact().socialLinks()).containsKey("linkedin");
        assertThat(record.media().books()).containsExactly("The AI Playbook");
        assertThat(record.contact().profileUrls()).containsExactly("https://bigspeak.com/speakers/jane-smith");
    }

    @Test
    void shouldMapSessionizeDocument() {
        SourceRecord record = new SessionizeAdapter().adapt(Map.of(
                "username", "jane-smith",
                "name", "Jane Smith",
                "tagline", "Speaker",
                "location", "Austin, TX",
                "categories", List.of("Machine Learning"),
                "events_count", "42 events",
                "url", "https://sessionize.com/jane-smith"));

        assertThat(record.sourceLocalId()).isEqualTo("jane-smith");
        assertThat(record.biography().tagline()).isEqualTo("Speaker");
        assertThat(record.location().country()).isEqualTo("United States");
        assertThat(record.terms(TaxonomyDomain.EXPERTISE)).containsExactly("Machine Learning");
        assertThat(record.speakingFacts().talkCount()).isEqualTo(42);
        assertThat(record.contact().profileUrls()).containsExactly("https://sessionize.com/jane-smith");
    }

    @Test
    void shouldMapEventRaptorDocument() {
        SourceRecord record = new EventRaptorAdapter().adapt(Map.of(
                "speaker_id", "er-9",
                "name", "Sam Rivera, CSP",
                "credentials", List.of("MBA"),
                "business_areas", List.of("Sales"),
                "email", "sam@example.com",
                "events", List.of(Map.of("title", "A"), Map.of("title", "B"), Map.of("title", "C")),
                "social_media", List.of("https://twitter.com/samr", "https://www.linkedin.com/in/samr")));

        assertThat(record.identity().fullName()).isEqualTo("Sam Rivera");
        assertThat(record.terms(TaxonomyDomain.CREDENTIAL)).containsExactly("CSP", "MBA");
        assertThat(record.terms(TaxonomyDomain.EXPERTISE)).containsExactly("Sales");
        assertThat(record.contact().email()).isEqualTo("sam@example.com");
        assertThat(record.speakingFacts().talkCount()).isEqualTo(3);
        assertThat(record.contact().socialLinks()).containsOnlyKeys("linkedin", "twitter");
    }

    @Test
    void shouldMapSpeakerHubDocument() {
        SourceRecord record = new SpeakerHubAdapter().adapt(Map.of(
                "uid", "sh-5",
                "first_name", "Alex",
                "last_name", "Doe",
                "company", "Acme",
                "bio_summary", "Security researcher",
                "city", "Toronto",
                "country", "Canada",
                "event_types", "Keynote, Workshop",
                "languages", List.of(Map.of("language", "French", "proficiency", "Fluent"))));

        assertThat(record.identity().fullName()).isEqualTo("Alex Doe");
        assertThat(record.identity().company()).isEqualTo("Acme");
        assertThat(record.biography().tagline()).isEqualTo("Security researcher");
        assertThat(record.location().countryCode()).isEqualTo("CA");
        assertThat(record.location().city()).isEqualTo("Toronto");
        assertThat(record.terms(TaxonomyDomain.SPEAKING_FORMAT)).containsExactly("Keynote", "Workshop");
        assertThat(record.languageProficiency()).containsEntry("French", LanguageProficiency.FLUENT);
    }

    @Test
    void shouldMapSpeakerHandbookDocument() {
        SourceRecord record = new SpeakerHandbookAdapter().adapt(Map.of(
                "speaker_id", "tsh-1",
                "display_name", "Priya Patel",
                "strapline", "Futurist",
                "home_country", "UK",
                "gender", "Female",
                "event_type", List.of("Keynote"),
                "engagement_types", List.of("Virtual")));

        assertThat(record.source()).isEqualTo(SourceNames.SPEAKER_HANDBOOK);
        assertThat(record.biography().tagline()).isEqualTo("Futurist");
        assertThat(record.location().country()).isEqualTo("United Kingdom");
        assertThat(record.terms(TaxonomyDomain.DEMOGRAPHICS)).containsExactly("Female");
        assertThat(record.terms(TaxonomyDomain.SPEAKING_FORMAT)).containsExactly("Keynote", "Virtual");
    }

    @Test
    void shouldMapLeadingAuthoritiesFees() {
        SourceRecord record = new LeadingAuthoritiesAdapter().adapt(Map.of(
                "speaker_page_url", "https://leadingauthorities.com/speakers/jane-smith",
                "name", "Jane Smith",
                "description", "Keynote speaker on AI",
                "speaker_website", "https://janesmith.dev",
                "videos", List.of(Map.of("url", "https://youtu.be/jane")),
                "speaker_fees", Map.of("min", 20_000, "max", 10_000, "display", "$10k - $20k")));

        assertThat(record.sourceLocalId()).isEqualTo("https://leadingauthorities.com/speakers/jane-smith");
        assertThat(record.biography().fullBio()).isEqualTo("Keynote speaker on AI");
        assertThat(record.contact().website()).isEqualTo("https://janesmith.dev");
        assertThat(record.media().videoUrls()).containsExactly("https://youtu.be/jane");
        assertThat(record.speakingFacts().fee().min()).isEqualTo(10_000);
        assertThat(record.speakingFacts().fee().max()).isEqualTo(20_000);
        assertThat(record.speakingFacts().fee().display()).isEqualTo("$10k - $20k");
    }

    @Test
    void shouldMapAllAmericanSpeakersDocument() {
        SourceRecord record = new AllAmericanSpeakersAdapter().adapt(Map.of(
                "speaker_id", "aas-3",
                "name", "Jane Smith",
                "speaking_topics", List.of("Leadership"),
                "categories", List.of("Healthcare"),
                "audience_types", List.of("Government"),
                "presentation_types", List.of("Panel"),
                "awards", List.of("TEDx Speaker"),
                "fee_range", "$5,000 - $10,000",
                "reviews", List.of(Map.of("text", "Great"), Map.of("text", "Superb"))));

        assertThat(record.terms(TaxonomyDomain.INDUSTRY)).containsExactly("Healthcare", "Government");
        assertThat(record.terms(TaxonomyDomain.SPEAKING_FORMAT)).containsExactly("Panel");
        assertThat(record.terms(TaxonomyDomain.CREDENTIAL)).containsExactly("TEDx Speaker");
        assertThat(record.speakingFacts().fee().bucket()).isEqualTo("5k-10k");
        assertThat(record.speakingFacts().reviewCount()).isEqualTo(2);
    }

    @Test
    void shouldReadStructuredAllAmericanFee() {
        SourceRecord record = new AllAmericanSpeakersAdapter().adapt(Map.of(
                "speaker_id", "aas-4",
                "name", "Sam Rivera",
                "fee_range", Map.of("min", 30_000, "text", "$30,000+"),
                "reviews", "15"));

        assertThat(record.speakingFacts().fee().min()).isEqualTo(30_000);
        assertThat(record.speakingFacts().fee().bucket()).isEqualTo("30k-50k");
        assertThat(record.speakingFacts().reviewCount()).isEqualTo(15);
    }

    @Test
    void shouldDeriveYearsSpeakingFromStartYear() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);
        FreeSpeakerBureauAdapter adapter = new FreeSpeakerBureauAdapter(clock);

        SourceRecord record = adapter.adapt(Map.of(
                "speaker_id", "fsb-1",
                "name", "Jane Smith",
                "role", "Founder",
                "city", "Austin",
                "state", "Texas",
                "contact_info", Map.of("email", "jane@example.com", "website", "https://janesmith.dev"),
                "speaker_since", 2010));

        assertThat(record.speakingFacts().yearsSpeaking()).isEqualTo(14);
        assertThat(record.identity().jobTitle()).isEqualTo("Founder");
        assertThat(record.location().state()).isEqualTo("TX");
        assertThat(record.contact().email()).isEqualTo("jane@example.com");
        assertThat(record.contact().website()).isEqualTo("https://janesmith.dev");

        SourceRecord implausible = adapter.adapt(Map.of("speaker_id", "fsb-2", "name", "Sam Rivera",
                "speaker_since", 1850));
        assertThat(implausible.speakingFacts().yearsSpeaking()).isNull();
    }

    @Test
    void shouldMapASpeakersRatings() {
        SourceRecord record = new ASpeakersAdapter().adapt(Map.of(
                "url", "https://a-speakers.com/speakers/jane-smith",
                "name", "Jane Smith",
                "description", "Innovation speaker",
                "full_bio", "Jane has spoken in 40 countries.",
                "average_rating", 4.7,
                "total_reviews", "120 reviews"));

        assertThat(record.sourceLocalId()).isEqualTo("https://a-speakers.com/speakers/jane-smith");
        assertThat(record.biography().summary()).isEqualTo("Innovation speaker");
        assertThat(record.speakingFacts().averageRating()).isEqualTo(4.7);
        assertThat(record.speakingFacts().reviewCount()).isEqualTo(120);
    }
}

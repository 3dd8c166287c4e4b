package com.phillippitts.speakerlink.service.adapter;

import com.phillippitts.speakerlink.domain.SourceRecord;
import com.phillippitts.speakerlink.domain.TaxonomyDomain;
import com.phillippitts.speakerlink.util.LocationParser;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Year;
import java.util.Map;
import java.util.Objects;

/**
 * Adapter for freespeakerbureau profiles. Location comes in separate city/state/country fields
 * and speaking experience as the year the speaker started ({@code speaker_since}).
 */
@Component
public class FreeSpeakerBureauAdapter extends AbstractSourceAdapter {

    private final Clock clock;

    public FreeSpeakerBureauAdapter() {
        this(Clock.systemUTC());
    }

    public FreeSpeakerBureauAdapter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String sourceName() {
        return SourceNames.FREE_SPEAKER_BUREAU;
    }

    @Override
    protected String extractName(Map<String, Object> document) {
        return DocumentFields.text(document, "name");
    }

    @Override
    protected String extractLocalId(Map<String, Object> document) {
        return DocumentFields.text(document, "speaker_id", "profile_url", "_id");
    }

    @Override
    protected void populate(Map<String, Object> document, SourceRecord.Builder builder) {
        Map<String, Object> contact = DocumentFields.nested(document, "contact_info");
        builder.jobTitle(DocumentFields.text(document, "role"))
                .company(DocumentFields.text(document, "company"))
                .location(LocationParser.of(
                        DocumentFields.text(document, "city"),
                        DocumentFields.text(document, "state"),
                        DocumentFields.text(document, "country")))
                .fullBio(DocumentFields.text(document, "biography"))
                .terms(TaxonomyDomain.EXPERTISE, DocumentFields.texts(document, "speaking_topics"))
                .terms(TaxonomyDomain.INDUSTRY, DocumentFields.texts(document, "areas_of_expertise"))
                .terms(TaxonomyDomain.CREDENTIAL, DocumentFields.texts(document, "awards"))
                .email(DocumentFields.text(contact, "email"))
                .website(DocumentFields.text(contact, "website"))
                .profileUrl(DocumentFields.text(document, "profile_url"));
        DocumentFields.socialLinks(document, "social_media", builder);

        Integer since = DocumentFields.count(document, "speaker_since");
        int currentYear = Year.now(clock).getValue();
        if (since != null && since > 1900 && since <= currentYear) {
            builder.yearsSpeaking(currentYear - since);
        }
    }
}

package com.phillippitts.speakerlink.service.adapter;

import com.phillippitts.speakerlink.domain.SourceRecord;
import com.phillippitts.speakerlink.domain.TaxonomyDomain;
import com.phillippitts.speakerlink.util.LocationParser;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Adapter for thespeakerhandbook profiles. Home country is an ISO 3166 alpha-2 code and
 * gender is an explicit field, the only demographic input besides pronouns.
 */
@Component
public class SpeakerHandbookAdapter extends AbstractSourceAdapter {

    @Override
    public String sourceName() {
        return SourceNames.SPEAKER_HANDBOOK;
    }

    @Override
    protected String extractName(Map<String, Object> document) {
        String name = DocumentFields.text(document, "display_name", "name");
        if (name != null) {
            return name;
        }
        String first = DocumentFields.text(document, "first_name");
        String last = DocumentFields.text(document, "last_name");
        if (first == null) {
            return last;
        }
        return last == null ? first : first + " " + last;
    }

    @Override
    protected String extractLocalId(Map<String, Object> document) {
        return DocumentFields.text(document, "speaker_id", "profile_url", "_id");
    }

    @Override
    protected void populate(Map<String, Object> document, SourceRecord.Builder builder) {
        builder.tagline(DocumentFields.text(document, "strapline"))
                .location(LocationParser.of(null, null, DocumentFields.text(document, "home_country")))
                .term(TaxonomyDomain.DEMOGRAPHICS, DocumentFields.text(document, "gender"))
                .terms(TaxonomyDomain.EXPERTISE, DocumentFields.texts(document, "topics"))
                .terms(TaxonomyDomain.SPEAKING_FORMAT, DocumentFields.texts(document, "event_type"))
                .terms(TaxonomyDomain.SPEAKING_FORMAT, DocumentFields.texts(document, "engagement_types"))
                .imageUrl(DocumentFields.text(document, "image_url"))
                .profileUrl(DocumentFields.text(document, "profile_url"));
        DocumentFields.languages(document, "languages", builder);
    }
}

package com.phillippitts.speakerlink.service.adapter;

import com.phillippitts.speakerlink.domain.SourceRecord;
import com.phillippitts.speakerlink.domain.TaxonomyDomain;
import com.phillippitts.speakerlink.util.FeeParser;
import com.phillippitts.speakerlink.util.LocationParser;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;

/**
 * Adapter for allamericanspeakers listings. Fees arrive as {@code {min, max, text}} objects,
 * categories describe the industries the speaker serves.
 */
@Component
public class AllAmericanSpeakersAdapter extends AbstractSourceAdapter {

    @Override
    public String sourceName() {
        return SourceNames.ALL_AMERICAN_SPEAKERS;
    }

    @Override
    protected String extractName(Map<String, Object> document) {
        return DocumentFields.text(document, "name");
    }

    @Override
    protected String extractLocalId(Map<String, Object> document) {
        return DocumentFields.text(document, "speaker_id", "url", "_id");
    }

    @Override
    protected void populate(Map<String, Object> document, SourceRecord.Builder builder) {
        builder.jobTitle(DocumentFields.text(document, "job_title"))
                .fullBio(DocumentFields.text(document, "biography"))
                .location(LocationParser.parse(DocumentFields.text(document, "location")))
                .terms(TaxonomyDomain.EXPERTISE, DocumentFields.texts(document, "speaking_topics"))
                .terms(TaxonomyDomain.INDUSTRY, DocumentFields.texts(document, "categories"))
                .terms(TaxonomyDomain.INDUSTRY, DocumentFields.texts(document, "audience_types"))
                .terms(TaxonomyDomain.SPEAKING_FORMAT, DocumentFields.texts(document, "event_types"))
                .terms(TaxonomyDomain.SPEAKING_FORMAT, DocumentFields.texts(document, "presentation_types"))
                .terms(TaxonomyDomain.CREDENTIAL, DocumentFields.texts(document, "awards"))
                .videoUrls(DocumentFields.urls(document, "videos"))
                .profileUrl(DocumentFields.text(document, "url"));
        DocumentFields.languages(document, "languages", builder);

        Map<String, Object> fee = DocumentFields.nested(document, "fee_range");
        if (!fee.isEmpty()) {
            builder.fee(FeeParser.fromRange(DocumentFields.count(fee, "min"), DocumentFields.count(fee, "max"),
                    DocumentFields.text(fee, "text")));
        } else {
            builder.fee(FeeParser.parse(DocumentFields.text(document, "fee_range")));
        }

        Object reviews = document.get("reviews");
        if (reviews instanceof Collection<?> list) {
            builder.reviewCount(list.size());
        } else {
            builder.reviewCount(DocumentFields.count(document, "reviews"));
        }
    }
}

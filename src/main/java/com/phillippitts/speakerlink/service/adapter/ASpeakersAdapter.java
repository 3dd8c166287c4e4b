package com.phillippitts.speakerlink.service.adapter;

import com.phillippitts.speakerlink.domain.SourceRecord;
import com.phillippitts.speakerlink.domain.TaxonomyDomain;
import com.phillippitts.speakerlink.util.FeeParser;
import com.phillippitts.speakerlink.util.LocationParser;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Adapter for a_speakers listings. Documents are keyed by their profile URL and carry a
 * free-text fee such as "$10,000 - $20,000".
 */
@Component
public class ASpeakersAdapter extends AbstractSourceAdapter {

    @Override
    public String sourceName() {
        return SourceNames.A_SPEAKERS;
    }

    @Override
    protected String extractName(Map<String, Object> document) {
        return DocumentFields.text(document, "name");
    }

    @Override
    protected String extractLocalId(Map<String, Object> document) {
        return DocumentFields.text(document, "url", "_id");
    }

    @Override
    protected void populate(Map<String, Object> document, SourceRecord.Builder builder) {
        String description = DocumentFields.text(document, "description");
        builder.jobTitle(DocumentFields.text(document, "job_title"))
                .tagline(description)
                .summary(description)
                .fullBio(DocumentFields.text(document, "full_bio"))
                .location(LocationParser.parse(DocumentFields.text(document, "location")))
                .terms(TaxonomyDomain.EXPERTISE, DocumentFields.texts(document, "topics"))
                .fee(FeeParser.parse(DocumentFields.text(document, "fee_range")))
                .imageUrl(DocumentFields.text(document, "image_url"))
                .videoUrls(DocumentFields.urls(document, "videos"))
                .averageRating(DocumentFields.rating(document, "average_rating"))
                .reviewCount(DocumentFields.count(document, "total_reviews"))
                .profileUrl(DocumentFields.text(document, "url"));
    }
}

package com.phillippitts.speakerlink.service.adapter;

import com.phillippitts.speakerlink.domain.SourceRecord;
import com.phillippitts.speakerlink.domain.TaxonomyDomain;
import com.phillippitts.speakerlink.util.FeeParser;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Adapter for leading_authorities speaker pages. Fees arrive as {@code {min, max, display}}
 * objects; pages keyed by {@code speaker_page_url}.
 */
@Component
public class LeadingAuthoritiesAdapter extends AbstractSourceAdapter {

    @Override
    public String sourceName() {
        return SourceNames.LEADING_AUTHORITIES;
    }

    @Override
    protected String extractName(Map<String, Object> document) {
        return DocumentFields.text(document, "name");
    }

    @Override
    protected String extractLocalId(Map<String, Object> document) {
        return DocumentFields.text(document, "speaker_page_url", "_id");
    }

    @Override
    protected void populate(Map<String, Object> document, SourceRecord.Builder builder) {
        String description = DocumentFields.text(document, "description");
        builder.jobTitle(DocumentFields.text(document, "job_title"))
                .tagline(description)
                .fullBio(description)
                .terms(TaxonomyDomain.EXPERTISE, DocumentFields.texts(document, "topics"))
                .imageUrl(DocumentFields.text(document, "speaker_image_url"))
                .videoUrls(DocumentFields.urls(document, "videos"))
                .books(DocumentFields.texts(document, "books_and_publications"))
                .website(DocumentFields.text(document, "speaker_website"))
                .profileUrl(DocumentFields.text(document, "speaker_page_url"));
        DocumentFields.socialLinks(document, "social_media", builder);

        Map<String, Object> fees = DocumentFields.nested(document, "speaker_fees");
        if (!fees.isEmpty()) {
            builder.fee(FeeParser.fromRange(DocumentFields.count(fees, "min"), DocumentFields.count(fees, "max"),
                    DocumentFields.text(fees, "display")));
        }
    }
}

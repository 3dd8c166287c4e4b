package com.phillippitts.speakerlink.service.adapter;

import com.phillippitts.speakerlink.domain.SourceRecord;
import com.phillippitts.speakerlink.domain.TaxonomyDomain;
import com.phillippitts.speakerlink.util.FeeParser;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Adapter for bigspeak listings merged with their detail pages.
 */
@Component
public class BigSpeakAdapter extends AbstractSourceAdapter {

    @Override
    public String sourceName() {
        return SourceNames.BIGSPEAK;
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
        String description = DocumentFields.text(document, "description");
        builder.tagline(description)
                .summary(description)
                .fullBio(DocumentFields.text(document, "biography"))
                .terms(TaxonomyDomain.EXPERTISE, DocumentFields.texts(document, "topics"))
                .terms(TaxonomyDomain.EXPERTISE, DocumentFields.texts(document, "keynote_topics"))
                .terms(TaxonomyDomain.CREDENTIAL, DocumentFields.texts(document, "awards"))
                .fee(FeeParser.parse(DocumentFields.text(document, "fee_range")))
                .imageUrl(DocumentFields.text(document, "image_url"))
                .videoUrls(DocumentFields.urls(document, "videos"))
                .books(DocumentFields.texts(document, "books"))
                .profileUrl(DocumentFields.text(document, "profile_url"));
        DocumentFields.languages(document, "languages", builder);
        DocumentFields.socialLinks(document, "social_media", builder);
    }
}

package com.phillippitts.speakerlink.service.adapter;

import com.phillippitts.speakerlink.domain.SourceRecord;
import com.phillippitts.speakerlink.domain.TaxonomyDomain;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;

/**
 * Adapter for eventraptor speaker pages. Names often carry pronouns ("Sam Lee (they/them)"),
 * credentials arrive as one comma-separated string and the talk count is the number of listed events.
 */
@Component
public class EventRaptorAdapter extends AbstractSourceAdapter {

    @Override
    public String sourceName() {
        return SourceNames.EVENTRAPTOR;
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
        builder.tagline(DocumentFields.text(document, "tagline"))
                .fullBio(DocumentFields.text(document, "biography"))
                .terms(TaxonomyDomain.CREDENTIAL, DocumentFields.texts(document, "credentials"))
                .terms(TaxonomyDomain.EXPERTISE, DocumentFields.texts(document, "business_areas"))
                .email(DocumentFields.text(document, "email"))
                .imageUrl(DocumentFields.text(document, "profile_image"))
                .profileUrl(DocumentFields.text(document, "url"));
        DocumentFields.socialLinks(document, "social_media", builder);

        if (document.get("events") instanceof Collection<?> events && !events.isEmpty()) {
            builder.talkCount(events.size());
        }
    }
}

package com.phillippitts.speakerlink.service.adapter;

import com.phillippitts.speakerlink.domain.SourceRecord;
import com.phillippitts.speakerlink.domain.TaxonomyDomain;
import com.phillippitts.speakerlink.util.LocationParser;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Adapter for sessionize speaker profiles. The event count is published as text ("12 events").
 */
@Component
public class SessionizeAdapter extends AbstractSourceAdapter {

    @Override
    public String sourceName() {
        return SourceNames.SESSIONIZE;
    }

    @Override
    protected String extractName(Map<String, Object> document) {
        return DocumentFields.text(document, "name");
    }

    @Override
    protected String extractLocalId(Map<String, Object> document) {
        return DocumentFields.text(document, "username", "url", "_id");
    }

    @Override
    protected void populate(Map<String, Object> document, SourceRecord.Builder builder) {
        builder.tagline(DocumentFields.text(document, "tagline"))
                .location(LocationParser.parse(DocumentFields.text(document, "location")))
                .terms(TaxonomyDomain.EXPERTISE, DocumentFields.texts(document, "categories"))
                .talkCount(DocumentFields.count(document, "events_count"))
                .profileUrl(DocumentFields.text(document, "url"));
    }
}

package com.phillippitts.speakerlink.service.adapter;

import com.phillippitts.speakerlink.domain.SourceRecord;
import com.phillippitts.speakerlink.domain.TaxonomyDomain;
import com.phillippitts.speakerlink.util.LocationParser;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Adapter for speakerhub profiles. The name may be given only as separate first/last fields.
 */
@Component
public class SpeakerHubAdapter extends AbstractSourceAdapter {

    @Override
    public String sourceName() {
        return SourceNames.SPEAKERHUB;
    }

    @Override
    protected String extractName(Map<String, Object> document) {
        String name = DocumentFields.text(document, "name");
        return name != null ? name : joinName(document);
    }

    @Override
    protected String extractLocalId(Map<String, Object> document) {
        return DocumentFields.text(document, "uid", "profile_url", "_id");
    }

    @Override
    protected void populate(Map<String, Object> document, SourceRecord.Builder builder) {
        String summary = DocumentFields.text(document, "bio_summary");
        builder.jobTitle(DocumentFields.text(document, "job_title"))
                .company(DocumentFields.text(document, "company"))
                .tagline(summary)
                .summary(summary)
                .location(LocationParser.of(
                        DocumentFields.text(document, "city"),
                        DocumentFields.text(document, "state"),
                        DocumentFields.text(document, "country")))
                .terms(TaxonomyDomain.EXPERTISE, DocumentFields.texts(document, "topics"))
                .terms(TaxonomyDomain.SPEAKING_FORMAT, DocumentFields.texts(document, "event_types"))
                .imageUrl(DocumentFields.text(document, "profile_picture"))
                .profileUrl(DocumentFields.text(document, "profile_url"));
        DocumentFields.languages(document, "languages", builder);
    }

    private static String joinName(Map<String, Object> document) {
        String first = DocumentFields.text(document, "first_name");
        String last = DocumentFields.text(document, "last_name");
        if (first == null) {
            return last;
        }
        return last == null ? first : first + " " + last;
    }
}

package com.phillippitts.speakerlink.service.adapter;

import com.phillippitts.speakerlink.domain.SourceRecord;
import com.phillippitts.speakerlink.domain.TaxonomyDomain;
import com.phillippitts.speakerlink.util.LocationParser;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Adapter for llm_parsed_db documents: speaker biographies extracted by a language model,
 * the most trusted source. Education entries are raw credential terms.
 */
@Component
public class LlmParsedAdapter extends AbstractSourceAdapter {

    @Override
    public String sourceName() {
        return SourceNames.LLM_PARSED_DB;
    }

    @Override
    protected String extractName(Map<String, Object> document) {
        return DocumentFields.text(document, "speaker_name");
    }

    @Override
    protected String extractLocalId(Map<String, Object> document) {
        return DocumentFields.text(document, "_id", "id");
    }

    @Override
    protected void populate(Map<String, Object> document, SourceRecord.Builder builder) {
        builder.jobTitle(DocumentFields.text(document, "job_title"))
                .fullBio(DocumentFields.text(document, "bio"))
                .location(LocationParser.parse(DocumentFields.text(document, "location")))
                .terms(TaxonomyDomain.EXPERTISE, DocumentFields.texts(document, "field_of_expertise"))
                .terms(TaxonomyDomain.CREDENTIAL, DocumentFields.texts(document, "education"))
                .terms(TaxonomyDomain.SPEAKING_FORMAT, DocumentFields.texts(document, "event_types"));
    }
}

package com.phillippitts.speakerlink.service.adapter;

import com.phillippitts.speakerlink.domain.SourceRecord;

import java.util.Map;

/**
 * Translates one raw document of one source into a {@link SourceRecord}.
 *
 * <p>Adapters are pure mappings: they never merge, deduplicate or classify. Every source has
 * exactly one adapter.
 *
 * @since 1.0
 */
public interface SourceAdapter {

    /**
     * @return the source this adapter reads, one of {@link SourceNames}
     */
    String sourceName();

    /**
     * Maps a raw document onto the common record slots.
     *
     * @param document untyped key/value document as read from the source
     * @return the adapted record
     * @throws com.phillippitts.speakerlink.exception.MalformedRecordException if the document has
     *         no usable name
     */
    SourceRecord adapt(Map<String, Object> document);
}

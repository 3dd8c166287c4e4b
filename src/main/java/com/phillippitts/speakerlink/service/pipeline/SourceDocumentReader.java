package com.phillippitts.speakerlink.service.pipeline;

import java.util.Map;
import java.util.stream.Stream;

/**
 * Input collaborator: an ordered, resumable sequence of raw documents per source.
 *
 * <p>Callers must close the returned stream.
 */
public interface SourceDocumentReader {

    /**
     * @param sourceName source to read
     * @param offset     number of leading documents to skip, for resuming an interrupted source
     * @return the documents in source order, empty when the source has none
     * @throws com.phillippitts.speakerlink.exception.PipelineException if the source cannot be opened
     */
    Stream<Map<String, Object>> read(String sourceName, long offset);

    default Stream<Map<String, Object>> read(String sourceName) {
        return read(sourceName, 0);
    }
}

package com.phillippitts.speakerlink.service.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Source reader over documents held in memory, for tests and embedding.
 */
public class InMemorySourceDocumentReader implements SourceDocumentReader {

    private final Map<String, List<Map<String, Object>>> documents = new ConcurrentHashMap<>();

    public InMemorySourceDocumentReader add(String sourceName, Map<String, Object> document) {
        documents.computeIfAbsent(sourceName, s -> new ArrayList<>()).add(Map.copyOf(document));
        return this;
    }

    @Override
    public Stream<Map<String, Object>> read(String sourceName, long offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative, got: " + offset);
        }
        return List.copyOf(documents.getOrDefault(sourceName, List.of())).stream().skip(offset);
    }
}

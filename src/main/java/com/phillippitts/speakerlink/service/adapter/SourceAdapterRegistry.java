package com.phillippitts.speakerlink.service.adapter;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Looks up the adapter of a source by name.
 */
@Component
public class SourceAdapterRegistry {

    private final Map<String, SourceAdapter> adapters;

    public SourceAdapterRegistry(List<SourceAdapter> adapters) {
        Map<String, SourceAdapter> byName = new TreeMap<>();
        for (SourceAdapter adapter : adapters) {
            SourceAdapter previous = byName.putIfAbsent(adapter.sourceName(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two adapters registered for source '" + adapter.sourceName()
                        + "': " + previous.getClass().getSimpleName() + " and " + adapter.getClass().getSimpleName());
            }
        }
        this.adapters = Collections.unmodifiableMap(byName);
    }

    public Optional<SourceAdapter> forSource(String sourceName) {
        return Optional.ofNullable(adapters.get(sourceName));
    }

    public Map<String, SourceAdapter> adapters() {
        return adapters;
    }
}

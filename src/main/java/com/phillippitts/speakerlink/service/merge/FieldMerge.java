package com.phillippitts.speakerlink.service.merge;

import com.phillippitts.speakerlink.domain.DataQualityTier;
import com.phillippitts.speakerlink.service.adapter.SourceCatalog;

import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Tier-aware scalar merge for one incoming record.
 *
 * <p>Tracks which source holds each scalar field. An incoming value fills an empty field and
 * replaces a held value only when the incoming source's tier is strictly more trusted than
 * the holder's. Not thread-safe; one instance per merge.
 */
final class FieldMerge {

    private final SourceCatalog catalog;
    private final String incomingSource;
    private final DataQualityTier incomingTier;
    private final TreeMap<String, String> fieldSources;

    FieldMerge(SourceCatalog catalog, String incomingSource, Map<String, String> fieldSources) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.incomingSource = Objects.requireNonNull(incomingSource, "incomingSource must not be null");
        this.incomingTier = catalog.tierOf(incomingSource);
        this.fieldSources = new TreeMap<>(fieldSources == null ? Map.of() : fieldSources);
    }

    String text(String path, String current, String incoming) {
        return pick(path, current, incoming, value -> value == null || value.isBlank());
    }

    <T> T value(String path, T current, T incoming) {
        return pick(path, current, incoming, Objects::isNull);
    }

    /**
     * @param isEmpty decides whether a value counts as absent
     * @return the value the merged profile holds for {@code path}
     */
    <T> T pick(String path, T current, T incoming, Predicate<T> isEmpty) {
        if (incoming == null || isEmpty.test(incoming)) {
            return current;
        }
        if (current == null || isEmpty.test(current)) {
            fieldSources.put(path, incomingSource);
            return incoming;
        }
        String holder = fieldSources.get(path);
        DataQualityTier holderTier = holder == null ? null : catalog.tierOf(holder);
        if (incomingTier.isMoreTrustedThan(holderTier)) {
            fieldSources.put(path, incomingSource);
            return incoming;
        }
        return current;
    }

    SortedMap<String, String> fieldSources() {
        return new TreeMap<>(fieldSources);
    }
}

package com.phillippitts.speakerlink.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/** Copy helpers keeping every collection in the domain model sorted and unmodifiable. */
final class DomainValues {

    private DomainValues() {
        // Prevent instantiation
    }

    static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }

    static SortedSet<String> sortedSet(Collection<String> values) {
        TreeSet<String> copy = new TreeSet<>();
        if (values != null) {
            for (String value : values) {
                String trimmed = trimToNull(value);
                if (trimmed != null) {
                    copy.add(trimmed);
                }
            }
        }
        return Collections.unmodifiableSortedSet(copy);
    }

    static List<String> sortedDistinctList(Collection<String> values) {
        return List.copyOf(sortedSet(values));
    }

    static <V> SortedMap<String, V> sortedMap(Map<String, V> values) {
        TreeMap<String, V> copy = new TreeMap<>();
        if (values != null) {
            values.forEach((key, value) -> {
                String trimmed = trimToNull(key);
                if (trimmed != null && value != null) {
                    copy.put(trimmed, value);
                }
            });
        }
        return Collections.unmodifiableSortedMap(copy);
    }
}

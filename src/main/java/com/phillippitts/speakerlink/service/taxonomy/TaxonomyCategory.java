package com.phillippitts.speakerlink.service.taxonomy;

import java.util.List;
import java.util.Objects;

/**
 * One category of a taxonomy table.
 *
 * @param code        canonical category code, unique within its table
 * @param displayName human-readable name
 * @param parent      parent code, or {@code null} for a category without a parent
 * @param aliases     recognised spellings in declared order, already normalized
 */
public record TaxonomyCategory(String code, String displayName, String parent, List<String> aliases) {

    public TaxonomyCategory {
        Objects.requireNonNull(code, "code must not be null");
        if (code.isBlank()) {
            throw new IllegalArgumentException("code must not be blank");
        }
        displayName = displayName == null || displayName.isBlank() ? code : displayName;
        parent = parent == null || parent.isBlank() ? null : parent;
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }
}

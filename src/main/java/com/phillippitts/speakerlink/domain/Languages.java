package com.phillippitts.speakerlink.domain;

import java.util.Objects;
import java.util.SortedMap;

/**
 * Language field group: classified language codes plus the best known proficiency per code.
 */
public record Languages(CategoryResult categories, SortedMap<String, LanguageProficiency> proficiency) {

    public static final Languages EMPTY = new Languages(CategoryResult.empty(), null);

    public Languages {
        Objects.requireNonNull(categories, "categories must not be null");
        proficiency = DomainValues.sortedMap(proficiency);
    }
}

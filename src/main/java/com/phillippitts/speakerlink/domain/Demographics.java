package com.phillippitts.speakerlink.domain;

import java.util.Objects;

/**
 * Self-identified demographics. Only explicit fields and self-identification statements ever
 * populate this group.
 */
public record Demographics(CategoryResult categories, String pronouns) {

    public static final Demographics EMPTY = new Demographics(CategoryResult.empty(), null);

    public Demographics {
        Objects.requireNonNull(categories, "categories must not be null");
        pronouns = DomainValues.trimToNull(pronouns);
    }
}

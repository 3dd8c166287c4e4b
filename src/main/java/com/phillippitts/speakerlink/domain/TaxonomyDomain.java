package com.phillippitts.speakerlink.domain;

import java.util.Locale;

/**
 * The six independent taxonomy domains. Each domain has its own closed table of category
 * codes and one classifier instance.
 */
public enum TaxonomyDomain {
    EXPERTISE,
    INDUSTRY,
    LANGUAGE,
    CREDENTIAL,
    SPEAKING_FORMAT,
    DEMOGRAPHICS;

    /**
     * Returns the identifier used in table files and logs, e.g. {@code speaking_format}.
     */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String resourceName() {
        return id() + ".json";
    }
}

package com.phillippitts.speakerlink.domain;

import java.util.StringJoiner;

/**
 * Biography field group.
 *
 * @param tagline one-line strapline
 * @param summary short description
 * @param fullBio long-form biography
 */
public record Biography(String tagline, String summary, String fullBio) {

    public static final Biography EMPTY = new Biography(null, null, null);

    public Biography {
        tagline = DomainValues.trimToNull(tagline);
        summary = DomainValues.trimToNull(summary);
        fullBio = DomainValues.trimToNull(fullBio);
    }

    /**
     * Joins all populated texts, used as free text for classification.
     *
     * @return combined text, or {@code null} when no field is populated
     */
    public String freeText() {
        StringJoiner joiner = new StringJoiner("\n");
        if (tagline != null) {
            joiner.add(tagline);
        }
        if (summary != null) {
            joiner.add(summary);
        }
        if (fullBio != null) {
            joiner.add(fullBio);
        }
        return joiner.length() == 0 ? null : joiner.toString();
    }
}

package com.phillippitts.speakerlink.domain;

import java.util.Objects;

/**
 * Speaking field group of a canonical profile.
 *
 * @param formats        classified speaking formats
 * @param primaryFormat  most prominent format by the fixed format priority, or {@code null}
 * @param virtualCapable true when any virtual format is present
 * @param facts          merged speaking-history scalars
 */
public record Speaking(CategoryResult formats, String primaryFormat, boolean virtualCapable, SpeakingFacts facts) {

    public static final Speaking EMPTY = new Speaking(CategoryResult.empty(), null, false, SpeakingFacts.EMPTY);

    public Speaking {
        Objects.requireNonNull(formats, "formats must not be null");
        primaryFormat = DomainValues.trimToNull(primaryFormat);
        facts = facts == null ? SpeakingFacts.EMPTY : facts;
    }
}

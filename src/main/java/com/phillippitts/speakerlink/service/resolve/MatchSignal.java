package com.phillippitts.speakerlink.service.resolve;

/**
 * Evidence a match candidate agreed on.
 */
public enum MatchSignal {
    NAME,
    LOCATION,
    SOCIAL_LINK
}

package com.phillippitts.speakerlink.service.resolve;

/**
 * Decision outcome of duplicate resolution.
 */
public enum MatchDecision {

    /** Best candidate reached the accept threshold; the record merges into it. */
    ACCEPTED,

    /**
     * Best candidate fell between the ambiguous and accept thresholds. Treated as no match:
     * a duplicate profile is cheaper to fix later than two strangers merged together.
     */
    AMBIGUOUS,

    /** No candidate, or every candidate below the ambiguous threshold. */
    NO_MATCH
}

package com.phillippitts.speakerlink.service.taxonomy;

/**
 * Domain-specific behaviour switched on for a classifier instance. All domains share the
 * same staged matching algorithm; capabilities only add free-text handling on top of it.
 */
public enum ClassifierCapability {

    /** Alias hits in free text populate {@code researchAreas}; never promoted to categories. */
    RESEARCH_AREA_SCAN,

    /** Alias hits in free text are appended to the original terms and classified with them. */
    FREE_TEXT_TERMS,

    /** Free text is only read inside self-identification clauses such as "I am a ...". */
    SELF_IDENTIFIED_TEXT,

    /** Raw terms are never written to the log. */
    SENSITIVE
}

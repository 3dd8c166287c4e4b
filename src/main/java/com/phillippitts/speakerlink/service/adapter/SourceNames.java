package com.phillippitts.speakerlink.service.adapter;

/**
 * Centralized constants for source name identifiers.
 *
 * <p>Source names key the input files, the {@code sourceIds} of a profile and the tier
 * configuration, so every adapter and configuration default refers to these constants.
 *
 * @since 1.0
 */
public final class SourceNames {

    /** Biographies extracted by a language model from conference programmes. */
    public static final String LLM_PARSED_DB = "llm_parsed_db";

    public static final String LEADING_AUTHORITIES = "leading_authorities";
    public static final String BIGSPEAK = "bigspeak";
    public static final String ALL_AMERICAN_SPEAKERS = "allamericanspeakers";
    public static final String A_SPEAKERS = "a_speakers";
    public static final String SPEAKERHUB = "speakerhub";
    public static final String SPEAKER_HANDBOOK = "thespeakerhandbook";
    public static final String FREE_SPEAKER_BUREAU = "freespeakerbureau";
    public static final String EVENTRAPTOR = "eventraptor";
    public static final String SESSIONIZE = "sessionize";

    private SourceNames() {
        // Utility class - prevent instantiation
    }
}

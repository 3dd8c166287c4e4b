package com.phillippitts.speakerlink.util;

import com.phillippitts.speakerlink.domain.LanguageProficiency;

/**
 * One language mention with its optional proficiency.
 *
 * @param term        language as written by the source, e.g. "Spanish"
 * @param proficiency stated level, or {@code null} when the source gives none
 */
public record LanguageEntry(String term, LanguageProficiency proficiency) {
}

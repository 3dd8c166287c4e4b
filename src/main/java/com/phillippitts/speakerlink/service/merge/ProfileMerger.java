package com.phillippitts.speakerlink.service.merge;

import com.phillippitts.speakerlink.domain.CanonicalProfile;
import com.phillippitts.speakerlink.service.taxonomy.ClassifiedRecord;

/**
 * Combines classified source records into canonical profiles.
 *
 * <p>Implementations must be deterministic and idempotent: merging a record into a profile it
 * already contributed to yields the same profile.
 */
public interface ProfileMerger {

    /**
     * Promotes a record to a new profile.
     *
     * @param profileId identifier the new profile keeps for its lifetime
     */
    CanonicalProfile create(ClassifiedRecord record, String profileId);

    /**
     * Merges a record into a matched profile. Scores are recomputed; the merge confidence is
     * left to the caller.
     */
    CanonicalProfile merge(CanonicalProfile existing, ClassifiedRecord record);

    /**
     * Merges into {@code existing}, or creates a profile when there is none.
     */
    default CanonicalProfile mergeOrCreate(CanonicalProfile existing, ClassifiedRecord record, String profileId) {
        return existing == null ? create(record, profileId) : merge(existing, record);
    }
}

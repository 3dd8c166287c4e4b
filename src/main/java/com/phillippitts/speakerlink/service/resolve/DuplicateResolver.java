package com.phillippitts.speakerlink.service.resolve;

import com.phillippitts.speakerlink.domain.SourceRecord;

import java.util.Optional;

/**
 * Decides whether an incoming record describes a person already in the index.
 *
 * @since 1.0
 */
public interface DuplicateResolver {

    /**
     * Scores the record against the candidates sharing its blocking key.
     *
     * @param record incoming record
     * @param index  accepted profiles of the run
     * @return the decision and the best candidate
     */
    MatchResult resolve(SourceRecord record, ProfileIndex index);

    /**
     * @return the profile to merge into, or empty when a new profile must be created
     */
    default Optional<MatchCandidate> findMatch(SourceRecord record, ProfileIndex index) {
        return resolve(record, index).acceptedCandidate();
    }
}

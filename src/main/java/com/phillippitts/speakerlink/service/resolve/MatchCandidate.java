package com.phillippitts.speakerlink.service.resolve;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A scored existing profile. Ephemeral: consumed by the merge step, never persisted.
 *
 * @param existingProfileId id of the compared profile
 * @param similarityScore   combined score in [0, 1]
 * @param matchedOn         signals that agreed
 */
public record MatchCandidate(String existingProfileId, double similarityScore, Set<MatchSignal> matchedOn) {

    public MatchCandidate {
        Objects.requireNonNull(existingProfileId, "existingProfileId must not be null");
        if (similarityScore < 0.0 || similarityScore > 1.0) {
            throw new IllegalArgumentException("similarityScore must be in [0,1], got: " + similarityScore);
        }
        matchedOn = matchedOn == null || matchedOn.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(matchedOn));
    }
}

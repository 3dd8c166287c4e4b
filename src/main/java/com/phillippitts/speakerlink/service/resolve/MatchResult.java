package com.phillippitts.speakerlink.service.resolve;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of resolving one record against the profile index.
 *
 * @param decision  accept, ambiguous or no match
 * @param candidate the best-scoring candidate, {@code null} when no candidate was found
 */
public record MatchResult(MatchDecision decision, MatchCandidate candidate) {

    private static final MatchResult NONE = new MatchResult(MatchDecision.NO_MATCH, null);

    public MatchResult {
        Objects.requireNonNull(decision, "decision must not be null");
        if (decision != MatchDecision.NO_MATCH && candidate == null) {
            throw new IllegalArgumentException(decision + " requires a candidate");
        }
    }

    public static MatchResult noCandidates() {
        return NONE;
    }

    public boolean isAccepted() {
        return decision == MatchDecision.ACCEPTED;
    }

    /**
     * @return the candidate to merge into, present only for an accepted match
     */
    public Optional<MatchCandidate> acceptedCandidate() {
        return isAccepted() ? Optional.of(candidate) : Optional.empty();
    }
}

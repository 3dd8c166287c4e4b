package com.phillippitts.speakerlink.service.resolve;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchResultTest {

    private final MatchCandidate candidate = new MatchCandidate("p1", 0.9, Set.of(MatchSignal.NAME));

    @Test
    void acceptedWithoutCandidateShouldThrow() {
        assertThatThrownBy(() -> new MatchResult(MatchDecision.ACCEPTED, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ACCEPTED");
    }

    @Test
    void candidateScoreOutOfRangeShouldThrow() {
        assertThatThrownBy(() -> new MatchCandidate("p1", 1.5, Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldExposeOnlyAcceptedCandidate() {
        assertThat(new MatchResult(MatchDecision.ACCEPTED, candidate).acceptedCandidate()).contains(candidate);
        assertThat(new MatchResult(MatchDecision.AMBIGUOUS, candidate).acceptedCandidate()).isEmpty();
        assertThat(MatchResult.noCandidates().isAccepted()).isFalse();
    }
}

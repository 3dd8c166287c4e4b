package com.phillippitts.speakerlink.service.metrics;

import com.phillippitts.speakerlink.service.resolve.MatchDecision;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineMetricsTest {

    private SimpleMeterRegistry registry;
    private PipelineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PipelineMetrics(registry);
    }

    @Test
    void shouldCountOutcomesPerSource() {
        metrics.recordOutcome("bigspeak", PipelineMetrics.CREATED);
        metrics.recordOutcome("bigspeak", PipelineMetrics.CREATED);
        metrics.recordOutcome("sessionize", PipelineMetrics.SKIPPED);

        assertThat(registry.get("speakerlink.pipeline.records")
                .tag("source", "bigspeak").tag("outcome", "created").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("speakerlink.pipeline.records")
                .tag("source", "sessionize").tag("outcome", "skipped").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldTagMatchDecisions() {
        metrics.recordMatch(MatchDecision.ACCEPTED);
        metrics.recordMatch(MatchDecision.NO_MATCH);
        metrics.recordMatch(MatchDecision.NO_MATCH);

        assertThat(registry.get("speakerlink.pipeline.match").tag("decision", "accepted").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("speakerlink.pipeline.match").tag("decision", "none").counter().count())
                .isEqualTo(2.0);
        assertThat(PipelineMetrics.decisionTag(MatchDecision.AMBIGUOUS)).isEqualTo("ambiguous");
    }

    @Test
    void shouldRecordSourceDuration() {
        metrics.recordSourceDuration("bigspeak", TimeUnit.MILLISECONDS.toNanos(250));

        var timer = registry.get("speakerlink.pipeline.source.duration").tag("source", "bigspeak").timer();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250.0);
    }
}

package com.phillippitts.speakerlink.service.metrics;

import com.phillippitts.speakerlink.service.resolve.MatchDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for pipeline runs.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Record outcomes per source (created, merged, skipped, failed)</li>
 *   <li>Duplicate resolution decisions (accepted, ambiguous, none)</li>
 *   <li>Processing time per source</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "speakerlink.pipeline";

    public static final String CREATED = "created";
    public static final String MERGED = "merged";
    public static final String SKIPPED = "skipped";
    public static final String FAILED = "failed";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Increments the record counter for a source and outcome.
     *
     * @param source  source name
     * @param outcome one of created, merged, skipped, failed
     */
    public void recordOutcome(String source, String outcome) {
        Counter.builder(METRIC_PREFIX + ".records")
                .description("Number of source records by outcome")
                .tag("source", source)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records a duplicate resolution decision.
     *
     * @param decision resolver decision; NO_MATCH is tagged "none"
     */
    public void recordMatch(MatchDecision decision) {
        Counter.builder(METRIC_PREFIX + ".match")
                .description("Number of duplicate resolution decisions")
                .tag("decision", decisionTag(decision))
                .register(registry)
                .increment();
    }

    /**
     * Records the time taken to process one source.
     *
     * @param source        source name
     * @param durationNanos duration in nanoseconds
     */
    public void recordSourceDuration(String source, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".source.duration")
                .description("Time taken to process one source")
                .tag("source", source)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    static String decisionTag(MatchDecision decision) {
        return decision == MatchDecision.NO_MATCH ? "none" : decision.name().toLowerCase(Locale.ROOT);
    }
}

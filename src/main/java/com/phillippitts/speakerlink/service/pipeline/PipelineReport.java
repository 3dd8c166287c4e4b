package com.phillippitts.speakerlink.service.pipeline;

import java.util.List;
import java.util.Objects;
import java.util.function.ToIntFunction;

/**
 * Outcome of one pipeline run.
 *
 * @param runId        correlation id found in the run's log lines
 * @param sources      per-source counts in processing order
 * @param profileCount profiles held after the run
 */
public record PipelineReport(String runId, List<SourceReport> sources, int profileCount) {

    public PipelineReport {
        Objects.requireNonNull(runId, "runId must not be null");
        sources = List.copyOf(sources);
    }

    public int totalRead() {
        return sum(SourceReport::read);
    }

    public int totalCreated() {
        return sum(SourceReport::created);
    }

    public int totalMerged() {
        return sum(SourceReport::merged);
    }

    public int totalSkipped() {
        return sum(SourceReport::skipped);
    }

    public int totalFailed() {
        return sum(SourceReport::failed);
    }

    private int sum(ToIntFunction<SourceReport> count) {
        return sources.stream().mapToInt(count).sum();
    }
}

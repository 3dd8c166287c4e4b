package com.phillippitts.speakerlink.service.pipeline.event;

import com.phillippitts.speakerlink.service.pipeline.PipelineReport;

import java.time.Instant;

/** Published once a pipeline run has written its profiles. */
public record PipelineCompletedEvent(PipelineReport report, Instant at) { }

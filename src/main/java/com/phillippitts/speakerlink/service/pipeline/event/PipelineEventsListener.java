package com.phillippitts.speakerlink.service.pipeline.event;

import com.phillippitts.speakerlink.service.pipeline.PipelineReport;
import com.phillippitts.speakerlink.service.pipeline.SourceReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Logs the run report succinctly (counts only, no profile content). */
@Component
class PipelineEventsListener {
    private static final Logger LOG = LogManager.getLogger(PipelineEventsListener.class);

    @EventListener
    void onCompleted(PipelineCompletedEvent e) {
        PipelineReport report = e.report();
        for (SourceReport source : report.sources()) {
            LOG.info("Source {}: read={}, created={}, merged={}, skipped={}, failed={}, ambiguous={}",
                    source.source(), source.read(), source.created(), source.merged(),
                    source.skipped(), source.failed(), source.ambiguous());
        }
        LOG.info("Run {} finished: profiles={}, read={}, created={}, merged={}, skipped={}, failed={}",
                report.runId(), report.profileCount(), report.totalRead(), report.totalCreated(),
                report.totalMerged(), report.totalSkipped(), report.totalFailed());
    }
}

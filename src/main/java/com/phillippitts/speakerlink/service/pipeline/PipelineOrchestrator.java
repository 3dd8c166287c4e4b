package com.phillippitts.speakerlink.service.pipeline;

import com.phillippitts.speakerlink.config.properties.PipelineProperties;
import com.phillippitts.speakerlink.domain.CanonicalProfile;
import com.phillippitts.speakerlink.domain.SourceRecord;
import com.phillippitts.speakerlink.exception.MalformedRecordException;
import com.phillippitts.speakerlink.exception.PipelineExceptionBuilder;
import com.phillippitts.speakerlink.service.adapter.SourceAdapter;
import com.phillippitts.speakerlink.service.adapter.SourceAdapterRegistry;
import com.phillippitts.speakerlink.service.adapter.SourceCatalog;
import com.phillippitts.speakerlink.service.merge.ProfileMerger;
import com.phillippitts.speakerlink.service.metrics.PipelineMetrics;
import com.phillippitts.speakerlink.service.pipeline.event.PipelineCompletedEvent;
import com.phillippitts.speakerlink.service.resolve.BlockingIndex;
import com.phillippitts.speakerlink.service.resolve.DuplicateResolver;
import com.phillippitts.speakerlink.service.resolve.MatchDecision;
import com.phillippitts.speakerlink.service.resolve.MatchResult;
import com.phillippitts.speakerlink.service.taxonomy.ClassifiedRecord;
import com.phillippitts.speakerlink.service.taxonomy.RecordClassifier;
import com.phillippitts.speakerlink.util.ProfileIds;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Stream;

/**
 * Drives adapt, classify, resolve and merge across all sources in catalog order.
 *
 * <p><b>Thread Model:</b> documents are read in batches. Adaptation and classification of a
 * batch fan out on {@code classifyExecutor}; results are then applied one by one, in document
 * order, on the calling thread. That single writer owns the {@link BlockingIndex}, so resolve
 * and merge never race and the output does not depend on worker timing.
 *
 * <p><b>Reprocessing:</b> a record whose source and local id already contributed to a profile
 * (from an earlier run, re-opened from the sink) goes straight back into that profile. Merge
 * is idempotent, so re-running a source never duplicates profiles.
 *
 * <p><b>Error Handling:</b> malformed documents are logged at WARN and counted as skipped;
 * any other record-level exception is logged at ERROR and counted as failed. Neither stops
 * the run. Only collaborator I/O failures surface, as
 * {@link com.phillippitts.speakerlink.exception.PipelineException}.
 *
 * @since 1.0
 */
@Service
public class PipelineOrchestrator {
    private static final Logger LOG = LogManager.getLogger(PipelineOrchestrator.class);

    static final String RUN_ID_KEY = "runId";
    static final String SOURCE_KEY = "source";

    private final SourceCatalog catalog;
    private final SourceAdapterRegistry adapters;
    private final RecordClassifier classifier;
    private final DuplicateResolver resolver;
    private final ProfileMerger merger;
    private final SourceDocumentReader reader;
    private final ProfileSink sink;
    private final PipelineMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Executor executor;
    private final PipelineProperties properties;

    public PipelineOrchestrator(SourceCatalog catalog,
                                SourceAdapterRegistry adapters,
                                RecordClassifier classifier,
                                DuplicateResolver resolver,
                                ProfileMerger merger,
                                SourceDocumentReader reader,
                                ProfileSink sink,
                                PipelineMetrics metrics,
                                ApplicationEventPublisher publisher,
                                @Qualifier("classifyExecutor") Executor executor,
                                PipelineProperties properties) {
        this.catalog = Objects.requireNonNull(catalog);
        this.adapters = Objects.requireNonNull(adapters);
        this.classifier = Objects.requireNonNull(classifier);
        this.resolver = Objects.requireNonNull(resolver);
        this.merger = Objects.requireNonNull(merger);
        this.reader = Objects.requireNonNull(reader);
        this.sink = Objects.requireNonNull(sink);
        this.metrics = Objects.requireNonNull(metrics);
        this.publisher = Objects.requireNonNull(publisher);
        this.executor = Objects.requireNonNull(executor);
        this.properties = Objects.requireNonNull(properties);
    }

    /**
     * Runs every source of the catalog, writes all profiles to the sink and publishes a
     * {@link PipelineCompletedEvent}.
     *
     * @return per-source counts of the run
     * @throws com.phillippitts.speakerlink.exception.PipelineException if a source cannot be read
     *         or the sink cannot be written
     */
    public synchronized PipelineReport run() {
        String runId = UUID.randomUUID().toString();
        ThreadContext.put(RUN_ID_KEY, runId);
        try {
            RunState state = new RunState(properties.isReopenExisting()
                    ? new BlockingIndex(sink.loadAll())
                    : new BlockingIndex());
            LOG.info("Pipeline run started: sources={}, existing profiles={}",
                    catalog.orderedSourceNames(), state.index.size());

            List<SourceReport> reports = new ArrayList<>();
            for (SourceCatalog.SourceDefinition source : catalog.sources()) {
                ThreadContext.put(SOURCE_KEY, source.name());
                try {
                    reports.add(processSource(source, state));
                } finally {
                    ThreadContext.remove(SOURCE_KEY);
                }
            }

            state.index.all().forEach(sink::upsert);
            sink.flush();

            PipelineReport report = new PipelineReport(runId, reports, state.index.size());
            publisher.publishEvent(new PipelineCompletedEvent(report, Instant.now()));
            return report;
        } finally {
            ThreadContext.remove(RUN_ID_KEY);
        }
    }

    private SourceReport processSource(SourceCatalog.SourceDefinition source, RunState state) {
        Optional<SourceAdapter> adapter = adapters.forSource(source.name());
        if (adapter.isEmpty()) {
            LOG.warn("No adapter registered for source {}; skipping it", source.name());
            return SourceReport.empty(source.name());
        }
        LOG.info("Processing source {} (tier {})", source.name(), source.tier());
        long start = System.nanoTime();
        Tally tally = new Tally(source.name());
        int batchSize = Math.max(1, properties.getBatchSize());

        try (Stream<Map<String, Object>> documents = reader.read(source.name())) {
            Iterator<Map<String, Object>> it = documents.iterator();
            List<Map<String, Object>> batch = new ArrayList<>(batchSize);
            while (it.hasNext()) {
                batch.add(it.next());
                if (batch.size() == batchSize) {
                    processBatch(adapter.get(), batch, state, tally);
                    batch.clear();
                }
            }
            if (!batch.isEmpty()) {
                processBatch(adapter.get(), batch, state, tally);
            }
        } catch (UncheckedIOException e) {
            throw PipelineExceptionBuilder.create("Failed reading source documents")
                    .source(source.name())
                    .cause(e)
                    .metadata("read", tally.read)
                    .build();
        }

        long elapsed = System.nanoTime() - start;
        metrics.recordSourceDuration(source.name(), elapsed);
        LOG.info("Finished source {} in {} ms ({} documents)", source.name(), elapsed / 1_000_000, tally.read);
        return tally.toReport();
    }

    private void processBatch(SourceAdapter adapter, List<Map<String, Object>> batch, RunState state, Tally tally) {
        List<CompletableFuture<Prepared>> futures = new ArrayList<>(batch.size());
        for (Map<String, Object> document : batch) {
            futures.add(CompletableFuture.supplyAsync(() -> prepare(adapter, document), executor));
        }
        for (CompletableFuture<Prepared> future : futures) {
            tally.read++;
            Prepared prepared = future.join();
            if (prepared.classified() == null) {
                tally.count(prepared.outcome(), metrics);
                continue;
            }
            try {
                apply(prepared.classified(), state, tally);
            } catch (RuntimeException e) {
                SourceRecord record = prepared.classified().record();
                LOG.error("Failed to merge {} record {}", record.source(), record.sourceLocalId(), e);
                tally.count(PipelineMetrics.FAILED, metrics);
            }
        }
    }

    /**
     * Adapts and classifies one document on a worker thread. Never throws.
     */
    private Prepared prepare(SourceAdapter adapter, Map<String, Object> document) {
        try {
            return new Prepared(classifier.classify(adapter.adapt(document)), null);
        } catch (MalformedRecordException e) {
            LOG.warn("Skipping malformed {} document {}: {}",
                    e.getSourceName(), e.getSourceLocalId(), e.getMessage());
            return new Prepared(null, PipelineMetrics.SKIPPED);
        } catch (RuntimeException e) {
            LOG.error("Failed to adapt {} document", adapter.sourceName(), e);
            return new Prepared(null, PipelineMetrics.FAILED);
        }
    }

    private void apply(ClassifiedRecord classified, RunState state, Tally tally) {
        SourceRecord record = classified.record();
        String contribution = contributionKey(record.source(), record.sourceLocalId());

        Optional<CanonicalProfile> previous = Optional.ofNullable(state.contributions.get(contribution))
                .flatMap(state.index::get);
        if (previous.isPresent()) {
            LOG.debug("Reprocessing {} record {} into profile {}",
                    record.source(), record.sourceLocalId(), previous.get().profileId());
            state.upsert(merger.merge(previous.get(), classified));
            tally.count(PipelineMetrics.MERGED, metrics);
            return;
        }

        MatchResult match = resolver.resolve(record, state.index);
        metrics.recordMatch(match.decision());
        if (match.isAccepted()) {
            CanonicalProfile existing = state.index.get(match.candidate().existingProfileId())
                    .orElseThrow(() -> new IllegalStateException(
                            "Matched profile " + match.candidate().existingProfileId() + " is not indexed"));
            state.upsert(merger.merge(existing, classified)
                    .withMergeConfidence(match.candidate().similarityScore()));
            tally.count(PipelineMetrics.MERGED, metrics);
            return;
        }

        if (match.decision() == MatchDecision.AMBIGUOUS) {
            tally.ambiguous++;
        }
        state.upsert(merger.create(classified, newProfileId(record, state.index)));
        tally.count(PipelineMetrics.CREATED, metrics);
    }

    /**
     * Profile id for a new profile, suffixed {@code #2}, {@code #3}, ... when two different
     * people share a normalized name within the same source.
     */
    static String newProfileId(SourceRecord record, BlockingIndex index) {
        String base = ProfileIds.generate(record.identity().fullName(), record.source());
        String candidate = base;
        for (int n = 2; index.contains(candidate); n++) {
            candidate = base + "#" + n;
        }
        return candidate;
    }

    static String contributionKey(String source, String localId) {
        return source + "\u0000" + localId;
    }

    private record Prepared(ClassifiedRecord classified, String outcome) {
    }

    /** Index and contribution lookup owned by the writer for one run. */
    private static final class RunState {
        private final BlockingIndex index;
        private final Map<String, String> contributions = new HashMap<>();

        RunState(BlockingIndex index) {
            this.index = index;
            for (CanonicalProfile profile : index.all()) {
                remember(profile);
            }
        }

        void upsert(CanonicalProfile profile) {
            index.upsert(profile);
            remember(profile);
        }

        private void remember(CanonicalProfile profile) {
            profile.sourceIds().forEach((source, localId) ->
                    contributions.put(contributionKey(source, localId), profile.profileId()));
        }
    }

    /** Per-source counters, touched only by the writer thread. */
    private static final class Tally {
        private final String source;
        private int read;
        private int created;
        private int merged;
        private int skipped;
        private int failed;
        private int ambiguous;

        Tally(String source) {
            this.source = source;
        }

        void count(String outcome, PipelineMetrics metrics) {
            switch (outcome) {
                case PipelineMetrics.CREATED -> created++;
                case PipelineMetrics.MERGED -> merged++;
                case PipelineMetrics.SKIPPED -> skipped++;
                default -> failed++;
            }
            metrics.recordOutcome(source, outcome);
        }

        SourceReport toReport() {
            return new SourceReport(source, read, created, merged, skipped, failed, ambiguous);
        }
    }
}

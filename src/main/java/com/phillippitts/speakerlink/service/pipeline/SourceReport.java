package com.phillippitts.speakerlink.service.pipeline;

/**
 * Counts of one source's pass through the pipeline.
 *
 * @param read      documents read
 * @param created   records that became new profiles
 * @param merged    records merged into existing profiles
 * @param skipped   malformed documents
 * @param failed    records dropped by an unexpected error
 * @param ambiguous created records whose best candidate fell in the ambiguous band
 */
public record SourceReport(String source, int read, int created, int merged, int skipped, int failed, int ambiguous) {

    public SourceReport {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source must not be blank");
        }
    }

    public static SourceReport empty(String source) {
        return new SourceReport(source, 0, 0, 0, 0, 0, 0);
    }
}

package com.phillippitts.speakerlink.config.properties;

import com.phillippitts.speakerlink.domain.DataQualityTier;
import com.phillippitts.speakerlink.service.adapter.SourceCatalog;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the ingestion pipeline.
 *
 * <p>When no {@code sources} are configured the default order applies: llm_parsed_db (GOLD),
 * the SILVER directories, then the BRONZE directories.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "speakerlink.pipeline")
public class PipelineProperties {

    private List<Source> sources = new ArrayList<>();

    /** Directory holding one {@code <source>.jsonl} file per source. */
    @NotBlank
    private String inputDir = "data/sources";

    /** JSON-lines file the canonical profiles are written to. */
    @NotBlank
    private String outputFile = "data/profiles.jsonl";

    /** Number of documents classified concurrently before the single writer drains them. */
    @Min(1)
    private int batchSize = 64;

    /** Run the pipeline once when the application starts. */
    private boolean runOnStartup = false;

    /** Load the profiles already in the output file before processing (incremental re-run). */
    private boolean reopenExisting = true;

    public List<Source> getSources() {
        return sources;
    }

    public void setSources(List<Source> sources) {
        this.sources = sources;
    }

    public String getInputDir() {
        return inputDir;
    }

    public void setInputDir(String inputDir) {
        this.inputDir = inputDir;
    }

    public String getOutputFile() {
        return outputFile;
    }

    public void setOutputFile(String outputFile) {
        this.outputFile = outputFile;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }

    public boolean isReopenExisting() {
        return reopenExisting;
    }

    public void setReopenExisting(boolean reopenExisting) {
        this.reopenExisting = reopenExisting;
    }

    /**
     * Builds the source catalog, falling back to the default source order.
     *
     * @throws IllegalArgumentException if the configured sources are not ordered by tier
     */
    public SourceCatalog toCatalog() {
        if (sources == null || sources.isEmpty()) {
            return SourceCatalog.defaults();
        }
        List<SourceCatalog.SourceDefinition> definitions = new ArrayList<>();
        for (Source source : sources) {
            definitions.add(new SourceCatalog.SourceDefinition(source.getName(),
                    source.getTier() == null ? DataQualityTier.UNRATED : source.getTier()));
        }
        return new SourceCatalog(definitions);
    }

    /**
     * One configured source.
     */
    public static class Source {
        private String name;
        private DataQualityTier tier;

        public Source() {
        }

        public Source(String name, DataQualityTier tier) {
            this.name = name;
            this.tier = tier;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public DataQualityTier getTier() {
            return tier;
        }

        public void setTier(DataQualityTier tier) {
            this.tier = tier;
        }
    }
}

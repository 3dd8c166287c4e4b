package com.phillippitts.speakerlink.config;

import com.phillippitts.speakerlink.config.properties.PipelineProperties;
import com.phillippitts.speakerlink.service.adapter.SourceCatalog;
import com.phillippitts.speakerlink.service.pipeline.JsonLinesProfileSink;
import com.phillippitts.speakerlink.service.pipeline.JsonLinesSourceDocumentReader;
import com.phillippitts.speakerlink.service.pipeline.ProfileJsonCodec;
import com.phillippitts.speakerlink.service.pipeline.ProfileSink;
import com.phillippitts.speakerlink.service.pipeline.SourceDocumentReader;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Source catalog and the file-backed pipeline collaborators.
 *
 * <p>Reader and sink back off when another bean of the same type is defined, so embedders
 * and tests can plug in their own stores.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public SourceCatalog sourceCatalog(PipelineProperties properties) {
        return properties.toCatalog();
    }

    @Bean
    public ProfileJsonCodec profileJsonCodec() {
        return new ProfileJsonCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public SourceDocumentReader sourceDocumentReader(PipelineProperties properties) {
        return new JsonLinesSourceDocumentReader(Path.of(properties.getInputDir()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ProfileSink profileSink(PipelineProperties properties, ProfileJsonCodec codec) {
        return new JsonLinesProfileSink(Path.of(properties.getOutputFile()), codec);
    }
}

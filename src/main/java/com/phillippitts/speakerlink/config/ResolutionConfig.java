package com.phillippitts.speakerlink.config;

import com.phillippitts.speakerlink.config.properties.ResolutionProperties;
import com.phillippitts.speakerlink.service.adapter.SourceCatalog;
import com.phillippitts.speakerlink.service.merge.DefaultProfileMerger;
import com.phillippitts.speakerlink.service.merge.ProfileMerger;
import com.phillippitts.speakerlink.service.resolve.DuplicateResolver;
import com.phillippitts.speakerlink.service.resolve.LevenshteinSimilarity;
import com.phillippitts.speakerlink.service.resolve.SimilarityAlgorithm;
import com.phillippitts.speakerlink.service.resolve.WeightedDuplicateResolver;
import com.phillippitts.speakerlink.service.scoring.ScoringEngine;
import com.phillippitts.speakerlink.service.taxonomy.RecordClassifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires duplicate resolution and the merge policy.
 */
@Configuration
public class ResolutionConfig {

    @Bean
    public SimilarityAlgorithm nameSimilarity() {
        return new LevenshteinSimilarity();
    }

    @Bean
    public DuplicateResolver duplicateResolver(ResolutionProperties properties, SimilarityAlgorithm nameSimilarity) {
        return new WeightedDuplicateResolver(properties, nameSimilarity);
    }

    @Bean
    public ProfileMerger profileMerger(RecordClassifier classifier, SourceCatalog catalog, ScoringEngine scoring) {
        return new DefaultProfileMerger(classifier, catalog, scoring);
    }
}

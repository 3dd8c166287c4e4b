package com.phillippitts.speakerlink.config;

import com.phillippitts.speakerlink.config.properties.TaxonomyProperties;
import com.phillippitts.speakerlink.service.taxonomy.RecordClassifier;
import com.phillippitts.speakerlink.service.taxonomy.TaxonomyClassifiers;
import com.phillippitts.speakerlink.service.taxonomy.TaxonomyRegistry;
import com.phillippitts.speakerlink.service.taxonomy.TaxonomyTableLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Loads the taxonomy tables once at startup and builds the classifiers over them.
 *
 * <p>A missing or invalid table fails context startup with a
 * {@link com.phillippitts.speakerlink.exception.TaxonomyLoadException}.
 */
@Configuration
public class TaxonomyConfig {

    @Bean
    public TaxonomyRegistry taxonomyRegistry(TaxonomyProperties properties) {
        TaxonomyTableLoader loader = new TaxonomyTableLoader(properties.getLocation(), properties.getVersion());
        return TaxonomyRegistry.load(loader, properties.getVersion());
    }

    @Bean
    public TaxonomyClassifiers taxonomyClassifiers(TaxonomyRegistry registry) {
        return TaxonomyClassifiers.from(registry);
    }

    @Bean
    public RecordClassifier recordClassifier(TaxonomyClassifiers classifiers) {
        return new RecordClassifier(classifiers);
    }
}

package com.phillippitts.speakerlink.service.taxonomy;

import com.phillippitts.speakerlink.domain.TaxonomyDomain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * One classifier per taxonomy domain, all built from the same registry.
 */
public final class TaxonomyClassifiers {

    private final String taxonomyVersion;
    private final Map<TaxonomyDomain, TaxonomyClassifier> classifiers;

    public TaxonomyClassifiers(String taxonomyVersion, Map<TaxonomyDomain, TaxonomyClassifier> classifiers) {
        this.taxonomyVersion = Objects.requireNonNull(taxonomyVersion, "taxonomyVersion must not be null");
        Objects.requireNonNull(classifiers, "classifiers must not be null");
        EnumMap<TaxonomyDomain, TaxonomyClassifier> copy = new EnumMap<>(TaxonomyDomain.class);
        for (TaxonomyDomain domain : TaxonomyDomain.values()) {
            TaxonomyClassifier classifier = classifiers.get(domain);
            if (classifier == null) {
                throw new IllegalArgumentException("Missing classifier for domain " + domain.id());
            }
            copy.put(domain, classifier);
        }
        this.classifiers = Collections.unmodifiableMap(copy);
    }

    /**
     * Builds a {@link DefaultTaxonomyClassifier} with default settings for every table.
     */
    public static TaxonomyClassifiers from(TaxonomyRegistry registry) {
        Map<TaxonomyDomain, TaxonomyClassifier> classifiers = new EnumMap<>(TaxonomyDomain.class);
        registry.tables().forEach((domain, table) ->
                classifiers.put(domain, new DefaultTaxonomyClassifier(table, ClassifierSettings.forDomain(domain))));
        return new TaxonomyClassifiers(registry.version(), classifiers);
    }

    public TaxonomyClassifier forDomain(TaxonomyDomain domain) {
        return classifiers.get(domain);
    }

    public String taxonomyVersion() {
        return taxonomyVersion;
    }
}

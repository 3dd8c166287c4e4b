package com.phillippitts.speakerlink.service.taxonomy;

import com.phillippitts.speakerlink.domain.Biography;
import com.phillippitts.speakerlink.domain.CategoryResult;
import com.phillippitts.speakerlink.domain.SourceRecord;
import com.phillippitts.speakerlink.domain.TaxonomyDomain;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Classifies all taxonomy slots of a record.
 *
 * <p>The biography is offered as free text to the expertise, credential and demographics
 * classifiers; what each does with it depends on its capabilities. Safe to call from
 * classification workers concurrently.
 */
public class RecordClassifier {

    private final TaxonomyClassifiers classifiers;

    public RecordClassifier(TaxonomyClassifiers classifiers) {
        this.classifiers = Objects.requireNonNull(classifiers, "classifiers must not be null");
    }

    public ClassifiedRecord classify(SourceRecord record) {
        Map<TaxonomyDomain, CategoryResult> results = new EnumMap<>(TaxonomyDomain.class);
        for (TaxonomyDomain domain : TaxonomyDomain.values()) {
            results.put(domain, classify(domain, record.terms(domain), record.biography()));
        }
        return new ClassifiedRecord(record, results);
    }

    /**
     * Classifies terms of one domain with the biography as free text where the domain reads it.
     */
    public CategoryResult classify(TaxonomyDomain domain, List<String> terms, Biography biography) {
        return classifiers.forDomain(domain).classify(terms, freeTextFor(domain, biography));
    }

    public String taxonomyVersion() {
        return classifiers.taxonomyVersion();
    }

    static String freeTextFor(TaxonomyDomain domain, Biography biography) {
        if (biography == null) {
            return null;
        }
        return switch (domain) {
            case EXPERTISE, CREDENTIAL, DEMOGRAPHICS -> biography.freeText();
            case INDUSTRY, LANGUAGE, SPEAKING_FORMAT -> null;
        };
    }
}

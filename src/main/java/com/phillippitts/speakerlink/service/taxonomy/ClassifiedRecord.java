package com.phillippitts.speakerlink.service.taxonomy;

import com.phillippitts.speakerlink.domain.CategoryResult;
import com.phillippitts.speakerlink.domain.SourceRecord;
import com.phillippitts.speakerlink.domain.TaxonomyDomain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * A source record together with its classification in every taxonomy domain.
 */
public record ClassifiedRecord(SourceRecord record, Map<TaxonomyDomain, CategoryResult> categories) {

    public ClassifiedRecord {
        Objects.requireNonNull(record, "record must not be null");
        EnumMap<TaxonomyDomain, CategoryResult> copy = new EnumMap<>(TaxonomyDomain.class);
        for (TaxonomyDomain domain : TaxonomyDomain.values()) {
            CategoryResult result = categories == null ? null : categories.get(domain);
            copy.put(domain, result == null ? CategoryResult.empty() : result);
        }
        categories = Collections.unmodifiableMap(copy);
    }

    public CategoryResult categories(TaxonomyDomain domain) {
        return categories.get(domain);
    }
}

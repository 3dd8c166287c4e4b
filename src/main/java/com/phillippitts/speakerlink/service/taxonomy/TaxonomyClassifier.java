package com.phillippitts.speakerlink.service.taxonomy;

import com.phillippitts.speakerlink.domain.CategoryResult;
import com.phillippitts.speakerlink.domain.TaxonomyDomain;

import java.util.List;

/**
 * Maps raw terms onto the closed category codes of one taxonomy domain.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li>Order-independent: any permutation of {@code rawTerms} yields an equal result</li>
 *   <li>Idempotent: classifying {@code result.originalTerms()} with the same free text yields
 *       {@code result} again</li>
 *   <li>Thread-safe: classifiers are shared across classification workers</li>
 * </ul>
 *
 * @since 1.0
 */
public interface TaxonomyClassifier {

    TaxonomyDomain domain();

    /**
     * @return version of the table this classifier was built from
     */
    String taxonomyVersion();

    /**
     * Classifies raw terms and, where the domain supports it, a free-text biography.
     *
     * @param rawTerms raw terms (may be empty; null entries are ignored)
     * @param freeText biography text, or {@code null}
     * @return classification result, all-empty for an empty term list without free text
     */
    CategoryResult classify(List<String> rawTerms, String freeText);

    default CategoryResult classify(List<String> rawTerms) {
        return classify(rawTerms, null);
    }
}

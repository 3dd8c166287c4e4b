package com.phillippitts.speakerlink.service.taxonomy;

import com.phillippitts.speakerlink.domain.TaxonomyDomain;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Capability-tagged configuration of a {@link DefaultTaxonomyClassifier}.
 *
 * @param capabilities          enabled free-text behaviours
 * @param freeTextParents       when non-empty, free-text hits are limited to categories under these parents
 * @param minFreeTextAliasLength shortest alias considered in free text
 */
public record ClassifierSettings(
        Set<ClassifierCapability> capabilities,
        Set<String> freeTextParents,
        int minFreeTextAliasLength
) {

    public ClassifierSettings {
        Objects.requireNonNull(capabilities, "capabilities must not be null");
        capabilities = capabilities.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(capabilities));
        freeTextParents = freeTextParents == null ? Set.of() : Set.copyOf(freeTextParents);
        if (minFreeTextAliasLength < 1) {
            throw new IllegalArgumentException("minFreeTextAliasLength must be >= 1, got: " + minFreeTextAliasLength);
        }
    }

    public static ClassifierSettings none() {
        return new ClassifierSettings(Set.of(), Set.of(), 4);
    }

    /**
     * Returns the default settings of each domain.
     */
    public static ClassifierSettings forDomain(TaxonomyDomain domain) {
        return switch (domain) {
            case EXPERTISE -> new ClassifierSettings(
                    Set.of(ClassifierCapability.RESEARCH_AREA_SCAN), Set.of(), 4);
            case CREDENTIAL -> new ClassifierSettings(
                    Set.of(ClassifierCapability.FREE_TEXT_TERMS), Set.of("degree", "certification"), 3);
            case DEMOGRAPHICS -> new ClassifierSettings(
                    Set.of(ClassifierCapability.FREE_TEXT_TERMS,
                            ClassifierCapability.SELF_IDENTIFIED_TEXT,
                            ClassifierCapability.SENSITIVE),
                    Set.of(), 3);
            case INDUSTRY, LANGUAGE, SPEAKING_FORMAT -> none();
        };
    }

    public boolean has(ClassifierCapability capability) {
        return capabilities.contains(capability);
    }

    public boolean scansFreeText() {
        return has(ClassifierCapability.RESEARCH_AREA_SCAN) || has(ClassifierCapability.FREE_TEXT_TERMS);
    }
}

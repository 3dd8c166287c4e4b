package com.phillippitts.speakerlink.domain;

import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;

/**
 * Provenance and score block of a canonical profile.
 *
 * @param sources           names of all contributing sources
 * @param dataQualityTier   most trusted tier among the contributing sources
 * @param profileScore      field-group allocation score, 0-100
 * @param experienceScore   speaking experience score, 0-100
 * @param completenessScore percentage of populated leaf fields, 0-100
 * @param mergeConfidence   strength of the last accepted match (1.0 for a freshly created profile)
 * @param taxonomyVersion   version of the taxonomy tables the categories were derived with
 * @param fieldSources      scalar field path to the source whose value is currently held
 */
public record ProfileMetadata(
        SortedSet<String> sources,
        DataQualityTier dataQualityTier,
        int profileScore,
        int experienceScore,
        int completenessScore,
        double mergeConfidence,
        String taxonomyVersion,
        SortedMap<String, String> fieldSources
) {

    public ProfileMetadata {
        sources = DomainValues.sortedSet(sources);
        Objects.requireNonNull(dataQualityTier, "dataQualityTier must not be null");
        requireScore("profileScore", profileScore);
        requireScore("experienceScore", experienceScore);
        requireScore("completenessScore", completenessScore);
        if (mergeConfidence < 0.0 || mergeConfidence > 1.0) {
            throw new IllegalArgumentException("Merge confidence must be between 0.0 and 1.0, got: " + mergeConfidence);
        }
        Objects.requireNonNull(taxonomyVersion, "taxonomyVersion must not be null");
        fieldSources = DomainValues.sortedMap(fieldSources);
    }

    private static void requireScore(String name, int score) {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException(name + " must be between 0 and 100, got: " + score);
        }
    }

    public ProfileMetadata withScores(int profile, int experience, int completeness) {
        return new ProfileMetadata(sources, dataQualityTier, profile, experience, completeness,
                mergeConfidence, taxonomyVersion, fieldSources);
    }

    public ProfileMetadata withMergeConfidence(double confidence) {
        return new ProfileMetadata(sources, dataQualityTier, profileScore, experienceScore, completenessScore,
                confidence, taxonomyVersion, fieldSources);
    }
}

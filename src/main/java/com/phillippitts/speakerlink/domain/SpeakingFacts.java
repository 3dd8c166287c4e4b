package com.phillippitts.speakerlink.domain;

/**
 * Numeric speaking-history scalars reported by a source.
 */
public record SpeakingFacts(
        Integer yearsSpeaking,
        Integer talkCount,
        Double averageRating,
        Integer reviewCount,
        Integer maxAudienceSize,
        FeeRange fee
) {

    public static final SpeakingFacts EMPTY = new SpeakingFacts(null, null, null, null, null, FeeRange.EMPTY);

    public SpeakingFacts {
        requireNonNegative("yearsSpeaking", yearsSpeaking);
        requireNonNegative("talkCount", talkCount);
        requireNonNegative("reviewCount", reviewCount);
        requireNonNegative("maxAudienceSize", maxAudienceSize);
        if (averageRating != null && (averageRating < 0.0 || averageRating > 5.0)) {
            throw new IllegalArgumentException("Average rating must be between 0.0 and 5.0, got: " + averageRating);
        }
        fee = fee == null ? FeeRange.EMPTY : fee;
    }

    private static void requireNonNegative(String field, Integer value) {
        if (value != null && value < 0) {
            throw new IllegalArgumentException(field + " must not be negative, got: " + value);
        }
    }
}

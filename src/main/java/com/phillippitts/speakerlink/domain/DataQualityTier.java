package com.phillippitts.speakerlink.domain;

/**
 * Totally ordered trust ranking declared per source. Scalar fields populated by a source of
 * one tier are only overwritten by a source of a strictly more trusted tier.
 */
public enum DataQualityTier {
    GOLD(1),
    SILVER(2),
    BRONZE(3),
    UNRATED(4);

    private final int rank;

    DataQualityTier(int rank) {
        this.rank = rank;
    }

    /**
     * @param other tier to compare with; {@code null} means no tier has contributed yet
     * @return true if this tier is strictly more trusted than {@code other}
     */
    public boolean isMoreTrustedThan(DataQualityTier other) {
        return other == null || rank < other.rank;
    }

    public static DataQualityTier mostTrusted(DataQualityTier a, DataQualityTier b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return b.isMoreTrustedThan(a) ? b : a;
    }
}

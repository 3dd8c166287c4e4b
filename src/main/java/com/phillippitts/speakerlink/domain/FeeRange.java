package com.phillippitts.speakerlink.domain;

/**
 * Speaking fee in US dollars. Either bound may be open; {@code bucket} is one of the fixed
 * fee buckets ("under-5k" .. "over-100k") or "inquire" when the source publishes no figure.
 */
public record FeeRange(Integer min, Integer max, String display, String bucket) {

    public static final FeeRange EMPTY = new FeeRange(null, null, null, null);

    public FeeRange {
        if (min != null && min < 0) {
            throw new IllegalArgumentException("Fee minimum must not be negative, got: " + min);
        }
        if (max != null && max < 0) {
            throw new IllegalArgumentException("Fee maximum must not be negative, got: " + max);
        }
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("Fee minimum " + min + " exceeds maximum " + max);
        }
        display = DomainValues.trimToNull(display);
        bucket = DomainValues.trimToNull(bucket);
    }

    public boolean isEmpty() {
        return min == null && max == null && bucket == null;
    }
}

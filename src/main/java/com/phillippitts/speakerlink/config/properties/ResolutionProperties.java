package com.phillippitts.speakerlink.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "speakerlink.resolution")
public class ResolutionProperties {

    private static final double WEIGHT_TOLERANCE = 1e-6;

    /** Combined score at or above which a candidate is the same person (0..1). */
    @Min(0)
    @Max(1)
    private final double acceptThreshold;

    /**
     * Combined score at or above which a rejected candidate is logged as ambiguous (0..1).
     * Ambiguous candidates are still treated as distinct people.
     */
    @Min(0)
    @Max(1)
    private final double ambiguousThreshold;

    /** Weight of full-name similarity. */
    private final double nameWeight;

    /** Weight of location agreement. */
    private final double locationWeight;

    /** Weight of identity URL agreement. */
    private final double urlWeight;

    @ConstructorBinding
    public ResolutionProperties(Double acceptThreshold, Double ambiguousThreshold,
                                Double nameWeight, Double locationWeight, Double urlWeight) {
        this.acceptThreshold = unit("accept-threshold", acceptThreshold, 0.85);
        this.ambiguousThreshold = unit("ambiguous-threshold", ambiguousThreshold, 0.70);
        if (this.ambiguousThreshold > this.acceptThreshold) {
            throw new IllegalArgumentException(
                    "speakerlink.resolution.ambiguous-threshold must not exceed accept-threshold");
        }
        this.nameWeight = unit("name-weight", nameWeight, 0.6);
        this.locationWeight = unit("location-weight", locationWeight, 0.2);
        this.urlWeight = unit("url-weight", urlWeight, 0.2);
        double sum = this.nameWeight + this.locationWeight + this.urlWeight;
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException("speakerlink.resolution weights must sum to 1, got " + sum);
        }
        if (this.nameWeight <= 0.0) {
            throw new IllegalArgumentException("speakerlink.resolution.name-weight must be positive");
        }
    }

    public static ResolutionProperties defaults() {
        return new ResolutionProperties(null, null, null, null, null);
    }

    private static double unit(String name, Double value, double defaultValue) {
        double v = value == null ? defaultValue : value;
        if (v < 0.0 || v > 1.0) {
            throw new IllegalArgumentException("speakerlink.resolution." + name + " must be in [0,1]");
        }
        return v;
    }

    public double getAcceptThreshold() {
        return acceptThreshold;
    }

    public double getAmbiguousThreshold() {
        return ambiguousThreshold;
    }

    public double getNameWeight() {
        return nameWeight;
    }

    public double getLocationWeight() {
        return locationWeight;
    }

    public double getUrlWeight() {
        return urlWeight;
    }
}

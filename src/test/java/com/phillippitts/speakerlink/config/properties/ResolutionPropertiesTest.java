package com.phillippitts.speakerlink.config.properties;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResolutionPropertiesTest {

    @Test
    void shouldApplyDefaults() {
        ResolutionProperties properties = ResolutionProperties.defaults();

        assertThat(properties.getAcceptThreshold()).isEqualTo(0.85);
        assertThat(properties.getAmbiguousThreshold()).isEqualTo(0.70);
        assertThat(properties.getNameWeight()).isEqualTo(0.6);
        assertThat(properties.getLocationWeight()).isEqualTo(0.2);
        assertThat(properties.getUrlWeight()).isEqualTo(0.2);
    }

    @Test
    void shouldAcceptCustomWeights() {
        ResolutionProperties properties = new ResolutionProperties(0.9, 0.8, 0.5, 0.25, 0.25);

        assertThat(properties.getAcceptThreshold()).isEqualTo(0.9);
        assertThat(properties.getNameWeight()).isEqualTo(0.5);
    }

    @Test
    void thresholdOutsideUnitRangeShouldThrow() {
        assertThatThrownBy(() -> new ResolutionProperties(1.2, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("accept-threshold");
    }

    @Test
    void ambiguousAboveAcceptShouldThrow() {
        assertThatThrownBy(() -> new ResolutionProperties(0.6, 0.7, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must not exceed");
    }

    @Test
    void weightsNotSummingToOneShouldThrow() {
        assertThatThrownBy(() -> new ResolutionProperties(null, null, 0.5, 0.2, 0.2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sum to 1");
    }

    @Test
    void zeroNameWeightShouldThrow() {
        assertThatThrownBy(() -> new ResolutionProperties(null, null, 0.0, 0.5, 0.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("name-weight");
    }
}

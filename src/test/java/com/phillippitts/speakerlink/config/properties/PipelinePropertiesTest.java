package com.phillippitts.speakerlink.config.properties;

import com.phillippitts.speakerlink.domain.DataQualityTier;
import com.phillippitts.speakerlink.service.adapter.SourceCatalog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelinePropertiesTest {

    @Test
    void shouldFallBackToDefaultCatalog() {
        PipelineProperties properties = new PipelineProperties();

        assertThat(properties.toCatalog().orderedSourceNames())
                .isEqualTo(SourceCatalog.defaults().orderedSourceNames());
        assertThat(properties.getBatchSize()).isEqualTo(64);
        assertThat(properties.isReopenExisting()).isTrue();
        assertThat(properties.isRunOnStartup()).isFalse();
    }

    @Test
    void shouldBuildCatalogFromConfiguredSources() {
        PipelineProperties properties = new PipelineProperties();
        properties.setSources(List.of(
                new PipelineProperties.Source("bigspeak", DataQualityTier.SILVER),
                new PipelineProperties.Source("meetup", null)));

        SourceCatalog catalog = properties.toCatalog();

        assertThat(catalog.orderedSourceNames()).containsExactly("bigspeak", "meetup");
        assertThat(catalog.tierOf("meetup")).isEqualTo(DataQualityTier.UNRATED);
    }

    @Test
    void sourcesOutOfTierOrderShouldThrow() {
        PipelineProperties properties = new PipelineProperties();
        properties.setSources(List.of(
                new PipelineProperties.Source("sessionize", DataQualityTier.BRONZE),
                new PipelineProperties.Source("llm_parsed_db", DataQualityTier.GOLD)));

        assertThatThrownBy(properties::toCatalog)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("less trusted");
    }
}

package com.phillippitts.speakerlink.service.adapter;

import com.phillippitts.speakerlink.domain.DataQualityTier;
import com.phillippitts.speakerlink.service.adapter.SourceCatalog.SourceDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceCatalogTest {

    @Test
    void shouldListDefaultSourcesMostTrustedFirst() {
        SourceCatalog catalog = SourceCatalog.defaults();

        assertThat(catalog.orderedSourceNames()).hasSize(10).startsWith(SourceNames.LLM_PARSED_DB)
                .endsWith(SourceNames.SESSIONIZE);
        assertThat(catalog.tierOf(SourceNames.LLM_PARSED_DB)).isEqualTo(DataQualityTier.GOLD);
        assertThat(catalog.tierOf(SourceNames.BIGSPEAK)).isEqualTo(DataQualityTier.SILVER);
        assertThat(catalog.tierOf(SourceNames.SESSIONIZE)).isEqualTo(DataQualityTier.BRONZE);
    }

    @Test
    void shouldRateUnknownSourceAsUnrated() {
        assertThat(SourceCatalog.defaults().tierOf("myspace")).isEqualTo(DataQualityTier.UNRATED);
    }

    @Test
    void shouldRejectSourceListedAfterLessTrustedSource() {
        List<SourceDefinition> sources = List.of(
                new SourceDefinition(SourceNames.SESSIONIZE, DataQualityTier.BRONZE),
                new SourceDefinition(SourceNames.BIGSPEAK, DataQualityTier.SILVER));

        assertThatThrownBy(() -> new SourceCatalog(sources))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("listed after less trusted source 'sessionize'");
    }

    @Test
    void shouldRejectDuplicateSource() {
        List<SourceDefinition> sources = List.of(
                new SourceDefinition(SourceNames.BIGSPEAK, DataQualityTier.SILVER),
                new SourceDefinition(SourceNames.BIGSPEAK, DataQualityTier.SILVER));

        assertThatThrownBy(() -> new SourceCatalog(sources))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("listed twice");
    }

    @Test
    void shouldAcceptEqualTiersInAnyOrder() {
        SourceCatalog catalog = new SourceCatalog(List.of(
                new SourceDefinition(SourceNames.SESSIONIZE, DataQualityTier.BRONZE),
                new SourceDefinition(SourceNames.SPEAKERHUB, DataQualityTier.BRONZE)));

        assertThat(catalog.orderedSourceNames()).containsExactly(SourceNames.SESSIONIZE, SourceNames.SPEAKERHUB);
    }
}

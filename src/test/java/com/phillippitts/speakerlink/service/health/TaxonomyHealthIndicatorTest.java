package com.phillippitts.speakerlink.service.health;

import com.phillippitts.speakerlink.domain.TaxonomyDomain;
import com.phillippitts.speakerlink.service.taxonomy.TaxonomyRegistry;
import com.phillippitts.speakerlink.service.taxonomy.TaxonomyTable;
import com.phillippitts.speakerlink.testutil.TestTaxonomy;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TaxonomyHealthIndicatorTest {

    @Test
    void shouldReportUpWhenAllTablesLoaded() {
        Health health = new TaxonomyHealthIndicator(TestTaxonomy.registry()).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("version", TestTaxonomy.VERSION);
        @SuppressWarnings("unchecked")
        Map<String, Integer> counts = (Map<String, Integer>) health.getDetails().get("categories");
        assertThat(counts).hasSize(TaxonomyDomain.values().length);
        assertThat(counts.values()).allSatisfy(count -> assertThat(count).isPositive());
    }

    @Test
    void shouldReportDownWhenTableIsEmpty() {
        TaxonomyTable loaded = mock(TaxonomyTable.class);
        when(loaded.size()).thenReturn(5);
        TaxonomyTable empty = mock(TaxonomyTable.class);
        when(empty.size()).thenReturn(0);
        TaxonomyRegistry registry = mock(TaxonomyRegistry.class);
        when(registry.version()).thenReturn("2024.1");
        when(registry.table(any())).thenReturn(loaded);
        when(registry.table(TaxonomyDomain.LANGUAGE)).thenReturn(empty);

        Health health = new TaxonomyHealthIndicator(registry).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "Empty or missing taxonomy tables");
    }
}

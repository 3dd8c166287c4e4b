package com.phillippitts.speakerlink.service.health;

import com.phillippitts.speakerlink.domain.TaxonomyDomain;
import com.phillippitts.speakerlink.service.taxonomy.TaxonomyRegistry;
import com.phillippitts.speakerlink.service.taxonomy.TaxonomyTable;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;

/**
 * Health indicator for the taxonomy tables.
 *
 * <p>Reports UP when every domain's table holds at least one category, with the taxonomy
 * version and per-domain category counts as details. An empty table means no term of that
 * domain can ever be classified, so it reports DOWN.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class TaxonomyHealthIndicator implements HealthIndicator {

    private final TaxonomyRegistry registry;

    public TaxonomyHealthIndicator(TaxonomyRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        Map<String, Integer> counts = new TreeMap<>();
        boolean allLoaded = true;
        for (TaxonomyDomain domain : TaxonomyDomain.values()) {
            TaxonomyTable table = registry.table(domain);
            int size = table == null ? 0 : table.size();
            counts.put(domain.id(), size);
            allLoaded &= size > 0;
        }

        Health.Builder builder = allLoaded ? Health.up() : Health.down();
        return builder
                .withDetail("status", allLoaded ? "All taxonomy tables loaded" : "Empty or missing taxonomy tables")
                .withDetail("version", registry.version())
                .withDetail("categories", counts)
                .build();
    }
}

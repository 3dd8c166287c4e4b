package com.phillippitts.speakerlink.service.taxonomy;

import com.phillippitts.speakerlink.domain.TaxonomyDomain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The six loaded taxonomy tables of one taxonomy version.
 */
public final class TaxonomyRegistry {

    private final String version;
    private final Map<TaxonomyDomain, TaxonomyTable> tables;

    public TaxonomyRegistry(String version, Map<TaxonomyDomain, TaxonomyTable> tables) {
        this.version = Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(tables, "tables must not be null");
        EnumMap<TaxonomyDomain, TaxonomyTable> copy = new EnumMap<>(TaxonomyDomain.class);
        for (TaxonomyDomain domain : TaxonomyDomain.values()) {
            TaxonomyTable table = tables.get(domain);
            if (table == null) {
                throw new IllegalArgumentException("Missing taxonomy table for domain " + domain.id());
            }
            if (!version.equals(table.version())) {
                throw new IllegalArgumentException("Taxonomy table " + domain.id() + " has version "
                        + table.version() + ", expected " + version);
            }
            copy.put(domain, table);
        }
        this.tables = Collections.unmodifiableMap(copy);
    }

    /**
     * Loads all six tables through {@code loader}.
     *
     * @throws com.phillippitts.speakerlink.exception.TaxonomyLoadException if any table fails to load
     */
    public static TaxonomyRegistry load(TaxonomyTableLoader loader, String version) {
        Map<TaxonomyDomain, TaxonomyTable> tables = new EnumMap<>(TaxonomyDomain.class);
        for (TaxonomyDomain domain : TaxonomyDomain.values()) {
            tables.put(domain, loader.load(domain));
        }
        return new TaxonomyRegistry(version, tables);
    }

    public String version() {
        return version;
    }

    public TaxonomyTable table(TaxonomyDomain domain) {
        return tables.get(domain);
    }

    public Map<TaxonomyDomain, TaxonomyTable> tables() {
        return tables;
    }
}

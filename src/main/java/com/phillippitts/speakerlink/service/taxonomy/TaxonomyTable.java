package com.phillippitts.speakerlink.service.taxonomy;

import com.phillippitts.speakerlink.domain.TaxonomyDomain;
import com.phillippitts.speakerlink.util.TextNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Closed, read-only mapping from alias to category code for one taxonomy domain.
 *
 * <p>Every category code and its own code in lower case are implicit aliases. When two
 * categories declare the same alias, the category declared first keeps it.
 *
 * <p>Thread-safe: immutable after construction.
 */
public final class TaxonomyTable {

    /**
     * An alias and the category it resolves to.
     */
    public record AliasEntry(String alias, String code) {
    }

    private static final Comparator<AliasEntry> LONGEST_FIRST =
            Comparator.comparingInt((AliasEntry e) -> e.alias().length()).reversed()
                    .thenComparing(AliasEntry::alias);

    private final TaxonomyDomain domain;
    private final String version;
    private final Map<String, TaxonomyCategory> categories;
    private final Map<String, String> parentNames;
    private final Map<String, String> aliasIndex;
    private final List<AliasEntry> aliasesLongestFirst;

    public TaxonomyTable(TaxonomyDomain domain,
                         String version,
                         List<TaxonomyCategory> categories,
                         Map<String, String> parentNames) {
        this.domain = Objects.requireNonNull(domain, "domain must not be null");
        this.version = Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(categories, "categories must not be null");
        this.parentNames = Collections.unmodifiableMap(
                new LinkedHashMap<>(parentNames == null ? Map.of() : parentNames));

        Map<String, TaxonomyCategory> byCode = new LinkedHashMap<>();
        for (TaxonomyCategory category : categories) {
            if (byCode.putIfAbsent(category.code(), category) != null) {
                throw new IllegalArgumentException(
                        "Duplicate category code '" + category.code() + "' in " + domain.id() + " taxonomy");
            }
            if (category.parent() != null && !this.parentNames.containsKey(category.parent())) {
                throw new IllegalArgumentException("Category '" + category.code() + "' references unknown parent '"
                        + category.parent() + "' in " + domain.id() + " taxonomy");
            }
        }
        this.categories = Collections.unmodifiableMap(byCode);

        Map<String, String> index = new HashMap<>();
        for (TaxonomyCategory category : byCode.values()) {
            index.putIfAbsent(TextNormalizer.normalizeTerm(category.code()), category.code());
            for (String alias : category.aliases()) {
                String normalized = TextNormalizer.normalizeTerm(alias);
                if (!normalized.isEmpty()) {
                    index.putIfAbsent(normalized, category.code());
                }
            }
        }
        this.aliasIndex = Collections.unmodifiableMap(index);

        List<AliasEntry> entries = new ArrayList<>();
        index.forEach((alias, code) -> entries.add(new AliasEntry(alias, code)));
        entries.sort(LONGEST_FIRST);
        this.aliasesLongestFirst = List.copyOf(entries);
    }

    public TaxonomyDomain domain() {
        return domain;
    }

    public String version() {
        return version;
    }

    public int size() {
        return categories.size();
    }

    public boolean isEmpty() {
        return categories.isEmpty();
    }

    public List<TaxonomyCategory> categories() {
        return List.copyOf(categories.values());
    }

    public Optional<TaxonomyCategory> category(String code) {
        return Optional.ofNullable(categories.get(code));
    }

    /**
     * @return the declared parent of {@code code}, or {@code null}
     */
    public String parentOf(String code) {
        TaxonomyCategory category = categories.get(code);
        return category == null ? null : category.parent();
    }

    public Map<String, String> parentNames() {
        return parentNames;
    }

    /**
     * @param normalizedTerm term already passed through {@link TextNormalizer#normalizeTerm(String)}
     * @return the category whose alias equals the term
     */
    public Optional<String> exactMatch(String normalizedTerm) {
        return Optional.ofNullable(aliasIndex.get(normalizedTerm));
    }

    /**
     * Returns all aliases ordered longest first, ties alphabetical.
     */
    public List<AliasEntry> aliasesLongestFirst() {
        return aliasesLongestFirst;
    }
}

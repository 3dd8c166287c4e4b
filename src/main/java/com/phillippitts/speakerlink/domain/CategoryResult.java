package com.phillippitts.speakerlink.domain;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Outcome of classifying a list of raw terms against one taxonomy table.
 *
 * <p>Category sets only ever contain codes from the closed table. Raw strings live in
 * {@code originalTerms} (sorted, distinct) and, lower-cased and tokenized, in {@code keywords}.
 * All collections are sorted so two results built from the same terms in any order are equal.
 *
 * @param primaryCategories   the single best category of every resolved term
 * @param secondaryCategories every other resolved category, never overlapping the primaries
 * @param parentCategories    declared parents of all primary and secondary categories
 * @param keywords            matched aliases plus the tokens of unresolved terms
 * @param originalTerms       raw terms as supplied (trimmed), the input of any re-classification
 * @param researchAreas       categories spotted in free text; never promoted to primary/secondary
 */
public record CategoryResult(
        SortedSet<String> primaryCategories,
        SortedSet<String> secondaryCategories,
        SortedSet<String> parentCategories,
        SortedSet<String> keywords,
        List<String> originalTerms,
        SortedSet<String> researchAreas
) {

    private static final CategoryResult EMPTY = new CategoryResult(null, null, null, null, null, null);

    public CategoryResult {
        primaryCategories = DomainValues.sortedSet(primaryCategories);
        secondaryCategories = DomainValues.sortedSet(secondaryCategories);
        parentCategories = DomainValues.sortedSet(parentCategories);
        keywords = DomainValues.sortedSet(keywords);
        originalTerms = DomainValues.sortedDistinctList(originalTerms);
        researchAreas = DomainValues.sortedSet(researchAreas);
    }

    public static CategoryResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return primaryCategories.isEmpty() && secondaryCategories.isEmpty() && parentCategories.isEmpty()
                && keywords.isEmpty() && originalTerms.isEmpty() && researchAreas.isEmpty();
    }

    /**
     * @return primary and secondary categories combined
     */
    public SortedSet<String> allCategories() {
        TreeSet<String> all = new TreeSet<>(primaryCategories);
        all.addAll(secondaryCategories);
        return all;
    }
}

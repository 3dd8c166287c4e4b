package com.phillippitts.speakerlink.service.taxonomy;

import com.phillippitts.speakerlink.domain.CategoryResult;
import com.phillippitts.speakerlink.domain.TaxonomyDomain;
import com.phillippitts.speakerlink.service.taxonomy.TaxonomyTable.AliasEntry;
import com.phillippitts.speakerlink.util.LogSanitizer;
import com.phillippitts.speakerlink.util.TextNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Staged alias classifier shared by all six taxonomy domains.
 *
 * <p>Each distinct raw term runs through the stages below and stops at the first that resolves it:
 * <ol>
 *   <li><b>Exact</b> - the normalized term equals an alias; that category becomes primary.</li>
 *   <li><b>Containment</b> - the term contains an alias at token boundaries (or, failing that,
 *       an alias contains the term). The category with the longest alias becomes primary, every
 *       other matched category secondary.</li>
 *   <li><b>Decomposition</b> - a term of two or more words whose words resolve, as single-word
 *       aliases, to the same category for at least half of the words. Such categories are
 *       secondary only.</li>
 * </ol>
 * Unresolved terms contribute their tokens to {@code keywords}. Declared parents of every
 * primary and secondary category are added to {@code parentCategories}.
 *
 * <p>Free text is handled according to the {@link ClassifierCapability capabilities} in the
 * {@link ClassifierSettings}: research-area scan, free-text terms and self-identified text.
 *
 * <p>Thread-safe: holds only the immutable table and settings.
 *
 * @since 1.0
 */
public final class DefaultTaxonomyClassifier implements TaxonomyClassifier {

    private static final Logger LOG = LogManager.getLogger(DefaultTaxonomyClassifier.class);

    /** Shorter aliases ("ai", "ml", "hr") only ever match exactly or as whole words. */
    static final int MIN_CONTAINMENT_ALIAS_LENGTH = 4;

    private static final int SELF_IDENTIFIED_WINDOW_WORDS = 4;

    private static final Set<String> PLACEHOLDERS = Set.of("none", "n/a", "na", "null", "tbd", "-");

    private static final Pattern SELF_IDENTIFICATION = Pattern.compile(
            "\\b(?:(?:i am|i'm|i’m)(?:\\s+an?)?|as\\s+an?)\\s+([^.!?;\\n]+)",
            Pattern.CASE_INSENSITIVE);

    private final TaxonomyTable table;
    private final ClassifierSettings settings;

    public DefaultTaxonomyClassifier(TaxonomyTable table, ClassifierSettings settings) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    @Override
    public TaxonomyDomain domain() {
        return table.domain();
    }

    @Override
    public String taxonomyVersion() {
        return table.version();
    }

    @Override
    public CategoryResult classify(List<String> rawTerms, String freeText) {
        SortedSet<String> originalTerms = cleanTerms(rawTerms);
        SortedSet<String> researchAreas = new TreeSet<>();

        if (freeText != null && !freeText.isBlank() && settings.scansFreeText()) {
            List<AliasEntry> hits = scanFreeText(freeText);
            if (settings.has(ClassifierCapability.RESEARCH_AREA_SCAN)) {
                hits.forEach(hit -> researchAreas.add(hit.code()));
            }
            if (settings.has(ClassifierCapability.FREE_TEXT_TERMS)) {
                hits.forEach(hit -> originalTerms.add(hit.alias()));
            }
        }

        if (originalTerms.isEmpty() && researchAreas.isEmpty()) {
            return CategoryResult.empty();
        }

        SortedSet<String> primary = new TreeSet<>();
        SortedSet<String> secondary = new TreeSet<>();
        SortedSet<String> keywords = new TreeSet<>();
        List<String> unresolved = new ArrayList<>();

        for (String term : originalTerms) {
            String normalized = TextNormalizer.normalizeTerm(term);
            if (normalized.isEmpty()) {
                continue;
            }

            Optional<String> exact = table.exactMatch(normalized);
            if (exact.isPresent()) {
                primary.add(exact.get());
                keywords.add(normalized);
                continue;
            }

            ContainmentMatch containment = containmentMatch(normalized);
            if (containment != null) {
                primary.add(containment.primary());
                secondary.addAll(containment.others());
                keywords.addAll(containment.aliases());
                continue;
            }

            Map<String, List<String>> decomposed = decompose(normalized);
            if (!decomposed.isEmpty()) {
                decomposed.forEach((code, words) -> {
                    secondary.add(code);
                    keywords.addAll(words);
                });
                continue;
            }

            keywords.addAll(TextNormalizer.tokens(normalized));
            unresolved.add(term);
        }

        secondary.removeAll(primary);
        SortedSet<String> parents = new TreeSet<>();
        for (String code : primary) {
            addParent(code, parents);
        }
        for (String code : secondary) {
            addParent(code, parents);
        }

        logOutcome(originalTerms.size(), primary.size(), secondary.size(), unresolved);
        return new CategoryResult(primary, secondary, parents, keywords,
                new ArrayList<>(originalTerms), researchAreas);
    }

    private SortedSet<String> cleanTerms(List<String> rawTerms) {
        SortedSet<String> cleaned = new TreeSet<>();
        if (rawTerms == null) {
            return cleaned;
        }
        for (String raw : rawTerms) {
            String term = TextNormalizer.collapseWhitespace(raw);
            if (term.isEmpty() || PLACEHOLDERS.contains(TextNormalizer.normalizeTerm(term))
                    || TextNormalizer.normalizeTerm(term).isEmpty()) {
                continue;
            }
            cleaned.add(term);
        }
        return cleaned;
    }

    private record ContainmentMatch(String primary, SortedSet<String> others, SortedSet<String> aliases) {
    }

    private ContainmentMatch containmentMatch(String term) {
        Map<String, Integer> longestByCode = new TreeMap<>();
        SortedSet<String> aliases = new TreeSet<>();
        for (AliasEntry entry : table.aliasesLongestFirst()) {
            String alias = entry.alias();
            if (alias.length() >= MIN_CONTAINMENT_ALIAS_LENGTH
                    && TextNormalizer.containsAtTokenBoundary(term, alias)) {
                longestByCode.merge(entry.code(), alias.length(), Math::max);
                aliases.add(alias);
            }
        }
        if (longestByCode.isEmpty() && term.length() >= MIN_CONTAINMENT_ALIAS_LENGTH) {
            for (AliasEntry entry : table.aliasesLongestFirst()) {
                if (TextNormalizer.containsAtTokenBoundary(entry.alias(), term)) {
                    longestByCode.merge(entry.code(), entry.alias().length(), Math::max);
                    aliases.add(term);
                }
            }
        }
        if (longestByCode.isEmpty()) {
            return null;
        }

        // TreeMap iterates codes alphabetically, so ties on length keep the smallest code
        String best = null;
        int bestLength = -1;
        for (Map.Entry<String, Integer> e : longestByCode.entrySet()) {
            if (e.getValue() > bestLength) {
                best = e.getKey();
                bestLength = e.getValue();
            }
        }
        SortedSet<String> others = new TreeSet<>(longestByCode.keySet());
        others.remove(best);
        return new ContainmentMatch(best, others, aliases);
    }

    private Map<String, List<String>> decompose(String term) {
        List<String> words = TextNormalizer.tokens(term);
        Map<String, List<String>> accepted = new TreeMap<>();
        if (words.size() < 2) {
            return accepted;
        }
        Map<String, List<String>> wordsByCode = new TreeMap<>();
        for (String word : words) {
            table.exactMatch(word).ifPresent(code ->
                    wordsByCode.computeIfAbsent(code, c -> new ArrayList<>()).add(word));
        }
        wordsByCode.forEach((code, matched) -> {
            if (matched.size() * 2 >= words.size()) {
                accepted.put(code, matched);
            }
        });
        return accepted;
    }

    /**
     * Finds alias occurrences in free text, longest alias first; an occurrence overlapping
     * text already claimed by a longer alias is ignored.
     */
    private List<AliasEntry> scanFreeText(String freeText) {
        String text = TextNormalizer.collapseWhitespace(scanScope(freeText)).toLowerCase(Locale.ROOT);
        List<AliasEntry> hits = new ArrayList<>();
        if (text.isEmpty()) {
            return hits;
        }
        boolean[] claimed = new boolean[text.length()];
        for (AliasEntry entry : table.aliasesLongestFirst()) {
            String alias = entry.alias();
            if (alias.length() < settings.minFreeTextAliasLength() || !inFreeTextScope(entry.code())) {
                continue;
            }
            boolean hit = false;
            for (int start : TextNormalizer.findAtTokenBoundary(text, alias)) {
                if (isFree(claimed, start, start + alias.length())) {
                    for (int i = start; i < start + alias.length(); i++) {
                        claimed[i] = true;
                    }
                    hit = true;
                }
            }
            if (hit) {
                hits.add(entry);
            }
        }
        return hits;
    }

    private String scanScope(String freeText) {
        if (!settings.has(ClassifierCapability.SELF_IDENTIFIED_TEXT)) {
            return freeText;
        }
        StringBuilder windows = new StringBuilder();
        Matcher m = SELF_IDENTIFICATION.matcher(freeText);
        while (m.find()) {
            String[] words = m.group(1).strip().split("\\s+");
            int count = Math.min(words.length, SELF_IDENTIFIED_WINDOW_WORDS);
            if (windows.length() > 0) {
                windows.append(" | ");
            }
            windows.append(String.join(" ", List.of(words).subList(0, count)));
        }
        return windows.toString();
    }

    private boolean inFreeTextScope(String code) {
        return settings.freeTextParents().isEmpty() || settings.freeTextParents().contains(table.parentOf(code));
    }

    private static boolean isFree(boolean[] claimed, int start, int end) {
        for (int i = start; i < end; i++) {
            if (claimed[i]) {
                return false;
            }
        }
        return true;
    }

    private void addParent(String code, SortedSet<String> parents) {
        String parent = table.parentOf(code);
        if (parent != null) {
            parents.add(parent);
        }
    }

    private void logOutcome(int termCount, int primaryCount, int secondaryCount, List<String> unresolved) {
        if (!LOG.isDebugEnabled()) {
            return;
        }
        LOG.debug("Classified {} {} terms: {} primary, {} secondary, {} unresolved",
                termCount, table.domain().id(), primaryCount, secondaryCount, unresolved.size());
        if (!unresolved.isEmpty() && LOG.isTraceEnabled()) {
            String detail = settings.has(ClassifierCapability.SENSITIVE)
                    ? LogSanitizer.redactTerms(unresolved)
                    : LogSanitizer.truncate(String.join(", ", unresolved), 200);
            LOG.trace("Unresolved {} terms: {}", table.domain().id(), detail);
        }
    }
}

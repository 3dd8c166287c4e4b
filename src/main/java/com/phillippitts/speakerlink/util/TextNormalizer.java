package com.phillippitts.speakerlink.util;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text normalization shared by the classifiers, the name parser and the duplicate resolver.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final String EDGE_PUNCTUATION = "\"'`,;:!?()[]{}*|-/•";

    private TextNormalizer() {
        // Prevent instantiation
    }

    /**
     * Lower-cases a raw term, collapses whitespace and strips surrounding quotes, brackets and
     * separators. Inner punctuation is kept, so "Ph.D." becomes "ph.d." and "C++" stays "c++".
     *
     * @param raw raw term (may be null)
     * @return normalized term, empty for null or blank input
     */
    public static String normalizeTerm(String raw) {
        if (raw == null) {
            return "";
        }
        String s = WHITESPACE.matcher(raw.strip()).replaceAll(" ").toLowerCase(Locale.ROOT);
        int start = 0;
        int end = s.length();
        while (start < end && isEdge(s.charAt(start))) {
            start++;
        }
        while (end > start && isEdge(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(start, end).strip();
    }

    private static boolean isEdge(char c) {
        return EDGE_PUNCTUATION.indexOf(c) >= 0 || Character.isWhitespace(c);
    }

    /**
     * Collapses inner whitespace and trims; case is preserved.
     */
    public static String collapseWhitespace(String raw) {
        if (raw == null) {
            return "";
        }
        return WHITESPACE.matcher(raw.strip()).replaceAll(" ");
    }

    public static String stripDiacritics(String text) {
        if (text == null) {
            return "";
        }
        return COMBINING_MARKS.matcher(Normalizer.normalize(text, Normalizer.Form.NFD)).replaceAll("");
    }

    /**
     * Splits text into lower-case letter/digit tokens.
     *
     * @param text input text (may be null)
     * @return immutable list of tokens, empty for null or blank input
     */
    public static List<String> tokens(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String part : NON_ALPHANUMERIC.split(text.toLowerCase(Locale.ROOT))) {
            if (!part.isEmpty()) {
                out.add(part);
            }
        }
        return List.copyOf(out);
    }

    /**
     * Lower-case, diacritic-free form with only letters, digits and single spaces.
     * "José  O'Brien" becomes "jose o brien".
     */
    public static String comparisonForm(String text) {
        return String.join(" ", tokens(stripDiacritics(text)));
    }

    /**
     * Finds every occurrence of {@code needle} in {@code haystack} that is not glued to a
     * letter or digit on either side.
     *
     * @return start offsets, in ascending order
     */
    public static List<Integer> findAtTokenBoundary(String haystack, String needle) {
        if (haystack == null || needle == null || needle.isEmpty()) {
            return List.of();
        }
        List<Integer> starts = new ArrayList<>();
        int from = 0;
        while (from <= haystack.length() - needle.length()) {
            int idx = haystack.indexOf(needle, from);
            if (idx < 0) {
                break;
            }
            int end = idx + needle.length();
            boolean leftOk = idx == 0 || !Character.isLetterOrDigit(haystack.charAt(idx - 1));
            boolean rightOk = end == haystack.length() || !Character.isLetterOrDigit(haystack.charAt(end));
            if (leftOk && rightOk) {
                starts.add(idx);
            }
            from = idx + 1;
        }
        return starts;
    }

    public static boolean containsAtTokenBoundary(String haystack, String needle) {
        return !findAtTokenBoundary(haystack, needle).isEmpty();
    }
}

package com.phillippitts.speakerlink.service.resolve;

/**
 * Edit-distance similarity: {@code 1 - distance / max(length)}.
 *
 * <p>Two empty strings are not considered similar; there is nothing to compare.
 */
public final class LevenshteinSimilarity implements SimilarityAlgorithm {

    public static final String NAME = "levenshtein";

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        int maxLength = Math.max(s1.length(), s2.length());
        return 1.0 - (double) distance(s1, s2) / maxLength;
    }

    @Override
    public String getName() {
        return NAME;
    }

    static int distance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int substitution = previous[j - 1] + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(substitution, Math.min(previous[j] + 1, current[j - 1] + 1));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}

package com.phillippitts.speakerlink.util;

import com.phillippitts.speakerlink.domain.FeeRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses published speaking fees ("$10,000 - $20,000", "Under $5K", "$50k+", "Please inquire")
 * into {@link FeeRange} with a fixed fee bucket.
 */
public final class FeeParser {

    public static final String INQUIRE = "inquire";

    private static final Pattern AMOUNT = Pattern.compile("\\$?\\s*(\\d[\\d,]*(?:\\.\\d+)?)\\s*([km])?\\b",
            Pattern.CASE_INSENSITIVE);
    private static final String[] INQUIRE_WORDS = {"inquire", "contact", "request", "call", "tbd"};

    private FeeParser() {
        // Prevent instantiation
    }

    /**
     * @param raw fee text (may be null)
     * @return parsed fee, {@link FeeRange#EMPTY} when the text carries neither a figure nor an
     *         "inquire" marker
     */
    public static FeeRange parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return FeeRange.EMPTY;
        }
        String display = TextNormalizer.collapseWhitespace(raw);
        String lower = display.toLowerCase(Locale.ROOT);
        for (String word : INQUIRE_WORDS) {
            if (lower.contains(word)) {
                return new FeeRange(null, null, display, INQUIRE);
            }
        }

        List<Integer> amounts = new ArrayList<>();
        Matcher m = AMOUNT.matcher(display);
        while (m.find()) {
            Integer amount = toDollars(m.group(1), m.group(2));
            if (amount != null) {
                amounts.add(amount);
            }
        }
        if (amounts.isEmpty()) {
            return FeeRange.EMPTY;
        }

        int first = amounts.get(0);
        if (lower.contains("under") || lower.contains("less than") || lower.contains("up to")) {
            return new FeeRange(null, first, display, bucket(Math.max(0, first - 1)));
        }
        if (lower.contains("over") || lower.contains("+") || lower.contains("more than")) {
            return new FeeRange(first, null, display, bucket(first));
        }
        if (amounts.size() >= 2) {
            int low = Math.min(first, amounts.get(1));
            int high = Math.max(first, amounts.get(1));
            return new FeeRange(low, high, display, bucket(low));
        }
        return new FeeRange(first, first, display, bucket(first));
    }

    /**
     * Builds a fee from structured bounds, either of which may be null.
     */
    public static FeeRange fromRange(Integer min, Integer max, String display) {
        if (min == null && max == null) {
            return display == null ? FeeRange.EMPTY : parse(display);
        }
        if (min != null && max != null && max < min) {
            return new FeeRange(max, min, display, bucket(max));
        }
        return new FeeRange(min, max, display, bucket(min != null ? min : max));
    }

    /**
     * Buckets a fee on its lower bound, or on the upper bound for "under" fees.
     */
    public static String bucket(int amount) {
        if (amount < 5_000) {
            return "under-5k";
        } else if (amount < 10_000) {
            return "5k-10k";
        } else if (amount < 20_000) {
            return "10k-20k";
        } else if (amount < 30_000) {
            return "20k-30k";
        } else if (amount < 50_000) {
            return "30k-50k";
        } else if (amount < 75_000) {
            return "50k-75k";
        } else if (amount < 100_000) {
            return "75k-100k";
        }
        return "over-100k";
    }

    private static Integer toDollars(String digits, String multiplier) {
        try {
            double value = Double.parseDouble(digits.replace(",", ""));
            if (multiplier != null) {
                value *= multiplier.equalsIgnoreCase("k") ? 1_000 : 1_000_000;
            }
            if (value > Integer.MAX_VALUE) {
                return null;
            }
            return (int) Math.round(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

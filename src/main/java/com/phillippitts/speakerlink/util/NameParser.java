package com.phillippitts.speakerlink.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits raw speaker names into honorific, name parts, post-nominal credentials and pronouns.
 *
 * <pre>
 * "Dr. Jane Smith, PhD"          -> fullName "Jane Smith", honorific "Dr", postNominals ["PhD"]
 * "Alex Doe (they/them)"         -> fullName "Alex Doe", pronouns "they/them"
 * "John Q. Public Jr., MBA, CSP" -> fullName "John Q. Public", postNominals ["MBA", "CSP"]
 * </pre>
 */
public final class NameParser {

    private static final Pattern PARENTHESISED = Pattern.compile("\\(([^)]*)\\)");
    private static final Pattern PRONOUNS = Pattern.compile(
            "\\b(she|he|they|ze|xe)\\s*/\\s*(her|him|them|hers|his|theirs|zir|xem)(\\s*/\\s*\\w+)?\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Set<String> HONORIFICS = Set.of(
            "dr", "prof", "professor", "mr", "mrs", "ms", "miss", "mx", "sir", "dame", "rev", "hon");
    private static final Set<String> GENERATIONAL = Set.of("jr", "sr", "ii", "iii", "iv");
    private static final Set<String> TRAILING_POST_NOMINALS = Set.of(
            "phd", "md", "mba", "jd", "edd", "psyd", "dba", "csp", "cpae", "cpa", "cfa", "pmp", "cissp");

    private NameParser() {
        // Prevent instantiation
    }

    public static ParsedName parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return new ParsedName("", null, null, null, List.of(), null);
        }
        String working = TextNormalizer.collapseWhitespace(raw);

        String pronouns = null;
        Matcher paren = PARENTHESISED.matcher(working);
        StringBuilder withoutParens = new StringBuilder();
        while (paren.find()) {
            Matcher p = PRONOUNS.matcher(paren.group(1));
            if (pronouns == null && p.find()) {
                pronouns = p.group().replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
            }
            paren.appendReplacement(withoutParens, " ");
        }
        paren.appendTail(withoutParens);
        working = withoutParens.toString();

        // Unparenthesised trailing pronouns, e.g. "Sam Lee - she/her"
        Matcher bare = PRONOUNS.matcher(working);
        if (bare.find() && bare.start() > 0) {
            if (pronouns == null) {
                pronouns = bare.group().replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
            }
            working = working.substring(0, bare.start());
        }

        List<String> postNominals = new ArrayList<>();
        String[] commaParts = working.split(",");
        String namePart = commaParts[0];
        for (int i = 1; i < commaParts.length; i++) {
            String piece = commaParts[i].strip();
            if (piece.isEmpty() || GENERATIONAL.contains(bareToken(piece))) {
                continue;
            }
            postNominals.add(piece);
        }

        List<String> tokens = new ArrayList<>(Arrays.asList(
                TextNormalizer.collapseWhitespace(namePart.replaceAll("[\"“”]", "")).split(" ")));
        tokens.removeIf(t -> t.isBlank() || t.equals("-"));

        String honorific = null;
        while (tokens.size() > 1 && HONORIFICS.contains(bareToken(tokens.get(0)))) {
            String title = tokens.remove(0).replace(".", "");
            if (honorific == null) {
                honorific = title;
            }
        }
        while (tokens.size() > 2) {
            String last = bareToken(tokens.get(tokens.size() - 1));
            if (GENERATIONAL.contains(last)) {
                tokens.remove(tokens.size() - 1);
            } else if (TRAILING_POST_NOMINALS.contains(last)) {
                postNominals.add(0, tokens.remove(tokens.size() - 1));
            } else {
                break;
            }
        }

        if (tokens.isEmpty()) {
            return new ParsedName("", null, null, honorific, postNominals, pronouns);
        }
        String fullName = String.join(" ", tokens);
        String firstName = tokens.get(0);
        String lastName = tokens.get(tokens.size() - 1);
        return new ParsedName(fullName, firstName, lastName, honorific, postNominals, pronouns);
    }

    /**
     * Normalized name used for similarity scoring and profile ids: lower-case, no diacritics,
     * no punctuation, honorifics and post-nominals removed.
     */
    public static String comparisonName(String fullName) {
        return TextNormalizer.comparisonForm(fullName);
    }

    private static String bareToken(String token) {
        return token.replace(".", "").strip().toLowerCase(Locale.ROOT);
    }
}

package com.phillippitts.speakerlink.util;

import com.phillippitts.speakerlink.domain.LanguageProficiency;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits language listings such as "English (Native), Spanish - Fluent, French: B2" into
 * {@link LanguageEntry} values.
 */
public final class LanguageParser {

    private static final Pattern PARENTHESISED_LEVEL = Pattern.compile("^(.+?)\\s*\\((.+)\\)\\s*$");
    private static final Pattern SEPARATED_LEVEL = Pattern.compile("^(.+?)\\s*(?:\\s-\\s|:|–)\\s*(.+)$");

    private LanguageParser() {
        // Prevent instantiation
    }

    /**
     * Parses a comma, semicolon or slash separated listing.
     */
    public static List<LanguageEntry> parseList(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        List<LanguageEntry> entries = new ArrayList<>();
        for (String piece : raw.split("[,;/]|\\band\\b")) {
            LanguageEntry entry = parseEntry(piece);
            if (entry != null) {
                entries.add(entry);
            }
        }
        return List.copyOf(entries);
    }

    /**
     * Parses one language mention, with or without a level.
     *
     * @return the entry, or {@code null} for blank input
     */
    public static LanguageEntry parseEntry(String raw) {
        String text = TextNormalizer.collapseWhitespace(raw);
        if (text.isEmpty()) {
            return null;
        }
        Matcher m = PARENTHESISED_LEVEL.matcher(text);
        if (!m.matches()) {
            m = SEPARATED_LEVEL.matcher(text);
        }
        if (m.matches()) {
            Optional<LanguageProficiency> level = LanguageProficiency.fromText(m.group(2));
            if (level.isPresent()) {
                return new LanguageEntry(m.group(1).strip(), level.get());
            }
        }
        return new LanguageEntry(text, null);
    }
}

package com.phillippitts.speakerlink.domain;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Spoken language proficiency, most fluent first. CEFR levels map onto the four levels.
 */
public enum LanguageProficiency {
    NATIVE,
    FLUENT,
    CONVERSATIONAL,
    BASIC;

    private static final Map<String, LanguageProficiency> ALIASES = Map.ofEntries(
            Map.entry("native", NATIVE),
            Map.entry("native speaker", NATIVE),
            Map.entry("native proficiency", NATIVE),
            Map.entry("mother tongue", NATIVE),
            Map.entry("first language", NATIVE),
            Map.entry("l1", NATIVE),
            Map.entry("fluent", FLUENT),
            Map.entry("proficient", FLUENT),
            Map.entry("advanced", FLUENT),
            Map.entry("professional", FLUENT),
            Map.entry("full professional", FLUENT),
            Map.entry("bilingual", FLUENT),
            Map.entry("c1", FLUENT),
            Map.entry("c2", FLUENT),
            Map.entry("conversational", CONVERSATIONAL),
            Map.entry("intermediate", CONVERSATIONAL),
            Map.entry("working knowledge", CONVERSATIONAL),
            Map.entry("limited working", CONVERSATIONAL),
            Map.entry("functional", CONVERSATIONAL),
            Map.entry("b1", CONVERSATIONAL),
            Map.entry("b2", CONVERSATIONAL),
            Map.entry("basic", BASIC),
            Map.entry("beginner", BASIC),
            Map.entry("elementary", BASIC),
            Map.entry("limited", BASIC),
            Map.entry("a1", BASIC),
            Map.entry("a2", BASIC)
    );

    public static Optional<LanguageProficiency> fromText(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String key = text.strip().toLowerCase(Locale.ROOT);
        return Optional.ofNullable(ALIASES.get(key));
    }

    public boolean isMoreFluentThan(LanguageProficiency other) {
        return other == null || ordinal() < other.ordinal();
    }
}

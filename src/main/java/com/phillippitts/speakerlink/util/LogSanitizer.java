package com.phillippitts.speakerlink.util;

import java.util.Collection;

/** Utility for privacy-safe logging of record content. */
public final class LogSanitizer {

    private static final String REDACTED = "<redacted>";

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    /**
     * Describes terms without revealing them, for self-identified attributes that must not
     * reach the log.
     */
    public static String redactTerms(Collection<String> terms) {
        int count = terms == null ? 0 : terms.size();
        return REDACTED + "(" + count + " terms)";
    }
}

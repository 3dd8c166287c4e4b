package com.phillippitts.speakerlink.util;

import java.util.Locale;

/** Canonical form of profile and social URLs for equality checks. */
public final class UrlNormalizer {

    private UrlNormalizer() {
        // Prevent instantiation
    }

    /**
     * Lower-cases the URL and drops the scheme, a leading "www.", any query or fragment, and
     * trailing slashes: "https://www.LinkedIn.com/in/jane/?trk=x" becomes "linkedin.com/in/jane".
     *
     * @param url raw URL (may be null)
     * @return canonical form, empty for null or blank input
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String s = url.strip().toLowerCase(Locale.ROOT);
        int scheme = s.indexOf("://");
        if (scheme >= 0) {
            s = s.substring(scheme + 3);
        }
        if (s.startsWith("www.")) {
            s = s.substring(4);
        }
        int cut = indexOfAny(s, '?', '#');
        if (cut >= 0) {
            s = s.substring(0, cut);
        }
        while (s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }

    private static int indexOfAny(String s, char a, char b) {
        int ia = s.indexOf(a);
        int ib = s.indexOf(b);
        if (ia < 0) {
            return ib;
        }
        return ib < 0 ? ia : Math.min(ia, ib);
    }
}

package com.phillippitts.speakerlink.service.adapter;

import com.phillippitts.speakerlink.domain.LanguageProficiency;
import com.phillippitts.speakerlink.domain.SourceRecord;
import com.phillippitts.speakerlink.util.LanguageEntry;
import com.phillippitts.speakerlink.util.LanguageParser;
import com.phillippitts.speakerlink.util.UrlNormalizer;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient readers for untyped source documents. Every reader returns {@code null} or an empty
 * list for absent, blank or unusable values instead of throwing.
 */
final class DocumentFields {

    private static final String[] ITEM_TEXT_KEYS = {"name", "title", "topic", "text", "label", "value"};
    private static final String[] ITEM_URL_KEYS = {"url", "link", "href"};
    private static final Pattern LEADING_NUMBER = Pattern.compile("(\\d[\\d,]*(?:\\.\\d+)?)");
    private static final Map<String, String> PLATFORM_HOSTS = Map.of(
            "linkedin.com", "linkedin",
            "twitter.com", "twitter",
            "x.com", "twitter",
            "facebook.com", "facebook",
            "instagram.com", "instagram",
            "youtube.com", "youtube",
            "tiktok.com", "tiktok",
            "github.com", "github");

    private DocumentFields() {
        // Prevent instantiation
    }

    /**
     * Returns the first non-blank scalar among {@code keys}. Numbers are rendered as text and
     * export wrappers such as {@code {"$oid": "..."}} are unwrapped.
     */
    static String text(Map<String, Object> doc, String... keys) {
        for (String key : keys) {
            String value = scalar(doc.get(key));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * Reads a list field. Items may be strings, numbers or objects carrying a name/title/topic;
     * a plain string is split on commas.
     */
    static List<String> texts(Map<String, Object> doc, String key) {
        Object value = doc.get(key);
        List<String> out = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                String text = item instanceof Map<?, ?> map ? firstOf(map, ITEM_TEXT_KEYS) : scalar(item);
                if (text != null) {
                    out.add(text);
                }
            }
        } else if (value instanceof String s) {
            for (String part : s.split(",")) {
                if (!part.isBlank()) {
                    out.add(part.strip());
                }
            }
        }
        return out;
    }

    /**
     * Reads a list of URLs; object items contribute their url/link field.
     */
    static List<String> urls(Map<String, Object> doc, String key) {
        Object value = doc.get(key);
        List<String> out = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                String url = item instanceof Map<?, ?> map ? firstOf(map, ITEM_URL_KEYS) : scalar(item);
                if (url != null) {
                    out.add(url);
                }
            }
        } else {
            String single = scalar(value);
            if (single != null) {
                out.add(single);
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> nested(Map<String, Object> doc, String key) {
        Object value = doc.get(key);
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : Map.of();
    }

    /**
     * Reads a non-negative whole number; text such as "42 events" yields 42.
     */
    static Integer count(Map<String, Object> doc, String key) {
        Double value = number(doc.get(key));
        if (value == null || value < 0 || value > Integer.MAX_VALUE) {
            return null;
        }
        return (int) Math.round(value);
    }

    /**
     * Reads a rating on a 0-5 scale; anything outside the scale is dropped.
     */
    static Double rating(Map<String, Object> doc, String key) {
        Double value = number(doc.get(key));
        if (value == null || value < 0.0 || value > 5.0) {
            return null;
        }
        return value;
    }

    /**
     * Copies social links into the builder. Accepts a platform-to-URL object, or a list of URLs
     * or {platform, url} objects whose platform is derived from the host when missing.
     */
    static void socialLinks(Map<String, Object> doc, String key, SourceRecord.Builder builder) {
        Object value = doc.get(key);
        if (value instanceof Map<?, ?> map) {
            map.forEach((platform, url) -> {
                String link = scalar(url);
                if (platform != null && link != null && link.contains(".")) {
                    builder.socialLink(platform.toString(), link);
                }
            });
        } else if (value instanceof Collection<?> items) {
            for (Object item : items) {
                if (item instanceof Map<?, ?> map) {
                    String url = firstOf(map, ITEM_URL_KEYS);
                    String platform = scalar(map.get("platform"));
                    if (url != null) {
                        builder.socialLink(platform != null ? platform : platformOf(url), url);
                    }
                } else {
                    String url = scalar(item);
                    if (url != null) {
                        builder.socialLink(platformOf(url), url);
                    }
                }
            }
        }
    }

    /**
     * Copies languages into the builder. Items may be "English (Native)" strings or
     * {language, proficiency} objects; a plain string is a comma-separated listing.
     */
    static void languages(Map<String, Object> doc, String key, SourceRecord.Builder builder) {
        Object value = doc.get(key);
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                if (item instanceof Map<?, ?> map) {
                    String language = firstOf(map, new String[] {"language", "name"});
                    String level = firstOf(map, new String[] {"proficiency", "level", "fluency"});
                    builder.language(language, LanguageProficiency.fromText(level).orElse(null));
                } else {
                    LanguageEntry entry = LanguageParser.parseEntry(scalar(item));
                    if (entry != null) {
                        builder.language(entry.term(), entry.proficiency());
                    }
                }
            }
        } else if (value instanceof String s) {
            for (LanguageEntry entry : LanguageParser.parseList(s)) {
                builder.language(entry.term(), entry.proficiency());
            }
        }
    }

    static String platformOf(String url) {
        String normalized = UrlNormalizer.normalize(url);
        int slash = normalized.indexOf('/');
        String host = slash < 0 ? normalized : normalized.substring(0, slash);
        for (Map.Entry<String, String> e : PLATFORM_HOSTS.entrySet()) {
            if (host.equals(e.getKey()) || host.endsWith("." + e.getKey())) {
                return e.getValue();
            }
        }
        return "website";
    }

    private static String firstOf(Map<?, ?> map, String[] keys) {
        for (String key : keys) {
            String value = scalar(map.get(key));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String scalar(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map && map.get("$oid") != null) {
            return scalar(map.get("$oid"));
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof String s) {
            String trimmed = s.strip();
            return trimmed.isEmpty() || trimmed.equalsIgnoreCase("none") || trimmed.equalsIgnoreCase("null")
                    ? null : trimmed;
        }
        return null;
    }

    private static Double number(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            Matcher m = LEADING_NUMBER.matcher(s.toLowerCase(Locale.ROOT));
            if (m.find()) {
                try {
                    return Double.parseDouble(m.group(1).replace(",", ""));
                } catch (NumberFormatException e) {
                    return null;
                }
            }
        }
        return null;
    }
}

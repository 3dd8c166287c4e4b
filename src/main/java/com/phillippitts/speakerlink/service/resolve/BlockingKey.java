package com.phillippitts.speakerlink.service.resolve;

import com.phillippitts.speakerlink.domain.Location;
import com.phillippitts.speakerlink.util.TextNormalizer;

import java.util.Locale;
import java.util.Objects;

/**
 * Coarse fingerprint restricting duplicate search to a small bucket: the normalized last
 * name plus a country token.
 *
 * @param lastName lower-case last name without diacritics or punctuation
 * @param country  lower-case country code or name, {@link #UNKNOWN_COUNTRY} when absent
 */
public record BlockingKey(String lastName, String country) {

    public static final String UNKNOWN_COUNTRY = "unknown";

    public BlockingKey {
        Objects.requireNonNull(lastName, "lastName must not be null");
        Objects.requireNonNull(country, "country must not be null");
    }

    public static BlockingKey of(String lastName, Location location) {
        return new BlockingKey(normalizeLastName(lastName), countryToken(location));
    }

    public boolean hasKnownCountry() {
        return !UNKNOWN_COUNTRY.equals(country);
    }

    /**
     * @return {@code lastName|country}
     */
    public String value() {
        return lastName + "|" + country;
    }

    static String normalizeLastName(String lastName) {
        if (lastName == null) {
            return "";
        }
        return TextNormalizer.stripDiacritics(lastName).toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}]", "");
    }

    static String countryToken(Location location) {
        if (location == null) {
            return UNKNOWN_COUNTRY;
        }
        String raw = location.countryCode() != null ? location.countryCode() : location.country();
        if (raw == null) {
            return UNKNOWN_COUNTRY;
        }
        String token = TextNormalizer.stripDiacritics(raw).toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}]", "");
        return token.isEmpty() ? UNKNOWN_COUNTRY : token;
    }
}

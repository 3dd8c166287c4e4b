package com.phillippitts.speakerlink.domain;

import java.util.StringJoiner;

/**
 * Parsed location. Countries use canonical English names ("United States"), US states
 * their two-letter code.
 */
public record Location(
        String city,
        String state,
        String country,
        String countryCode,
        String region
) {

    public static final Location EMPTY = new Location(null, null, null, null, null);

    public Location {
        city = DomainValues.trimToNull(city);
        state = DomainValues.trimToNull(state);
        country = DomainValues.trimToNull(country);
        countryCode = DomainValues.trimToNull(countryCode);
        region = DomainValues.trimToNull(region);
    }

    public boolean isEmpty() {
        return city == null && state == null && country == null;
    }

    public String display() {
        StringJoiner joiner = new StringJoiner(", ");
        if (city != null) {
            joiner.add(city);
        }
        if (state != null) {
            joiner.add(state);
        }
        if (country != null) {
            joiner.add(country);
        }
        return joiner.toString();
    }
}

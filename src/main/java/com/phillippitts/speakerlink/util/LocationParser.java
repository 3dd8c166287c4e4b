package com.phillippitts.speakerlink.util;

import com.phillippitts.speakerlink.domain.Location;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses free-form and structured locations into {@link Location}.
 *
 * <p>Country names are canonicalised ("USA", "U.S." and "United States of America" all become
 * "United States") and enriched with an ISO 3166 alpha-2 code and a region. US states are
 * stored as their two-letter code.
 */
public final class LocationParser {

    private static final String UNITED_STATES = "United States";

    private record CountryInfo(String name, String code, String region) {
    }

    private static final Map<String, CountryInfo> COUNTRIES = new HashMap<>();
    private static final Map<String, String> US_STATES = new HashMap<>();
    private static final Map<String, String[]> CITY_ALIASES = new HashMap<>();

    static {
        country("United States", "US", "North America", "usa", "us", "u.s.", "u.s.a.", "united states of america", "america");
        country("Canada", "CA", "North America");
        country("Mexico", "MX", "North America");
        country("United Kingdom", "GB", "Europe", "uk", "u.k.", "gb", "great britain", "england", "scotland", "wales");
        country("Ireland", "IE", "Europe");
        country("Germany", "DE", "Europe", "deutschland");
        country("France", "FR", "Europe");
        country("Spain", "ES", "Europe", "españa");
        country("Portugal", "PT", "Europe");
        country("Italy", "IT", "Europe", "italia");
        country("Netherlands", "NL", "Europe", "the netherlands", "holland");
        country("Belgium", "BE", "Europe");
        country("Switzerland", "CH", "Europe");
        country("Austria", "AT", "Europe");
        country("Sweden", "SE", "Europe");
        country("Norway", "NO", "Europe");
        country("Denmark", "DK", "Europe");
        country("Finland", "FI", "Europe");
        country("Poland", "PL", "Europe");
        country("Greece", "GR", "Europe");
        country("Australia", "AU", "Oceania");
        country("New Zealand", "NZ", "Oceania");
        country("Japan", "JP", "Asia");
        country("China", "CN", "Asia", "prc");
        country("Hong Kong", "HK", "Asia");
        country("Singapore", "SG", "Asia");
        country("India", "IN", "Asia");
        country("South Korea", "KR", "Asia", "korea", "republic of korea");
        country("Philippines", "PH", "Asia");
        country("Malaysia", "MY", "Asia");
        country("Indonesia", "ID", "Asia");
        country("Brazil", "BR", "South America", "brasil");
        country("Argentina", "AR", "South America");
        country("Chile", "CL", "South America");
        country("Colombia", "CO", "South America");
        country("Peru", "PE", "South America");
        country("South Africa", "ZA", "Africa");
        country("Nigeria", "NG", "Africa");
        country("Kenya", "KE", "Africa");
        country("Egypt", "EG", "Africa");
        country("Israel", "IL", "Middle East");
        country("United Arab Emirates", "AE", "Middle East", "uae", "u.a.e.");
        country("Saudi Arabia", "SA", "Middle East");
        country("Turkey", "TR", "Middle East", "türkiye");

        state("AL", "Alabama"); state("AK", "Alaska"); state("AZ", "Arizona"); state("AR", "Arkansas");
        state("CA", "California"); state("CO", "Colorado"); state("CT", "Connecticut"); state("DE", "Delaware");
        state("FL", "Florida"); state("GA", "Georgia"); state("HI", "Hawaii"); state("ID", "Idaho");
        state("IL", "Illinois"); state("IN", "Indiana"); state("IA", "Iowa"); state("KS", "Kansas");
        state("KY", "Kentucky"); state("LA", "Louisiana"); state("ME", "Maine"); state("MD", "Maryland");
        state("MA", "Massachusetts"); state("MI", "Michigan"); state("MN", "Minnesota"); state("MS", "Mississippi");
        state("MO", "Missouri"); state("MT", "Montana"); state("NE", "Nebraska"); state("NV", "Nevada");
        state("NH", "New Hampshire"); state("NJ", "New Jersey"); state("NM", "New Mexico"); state("NY", "New York");
        state("NC", "North Carolina"); state("ND", "North Dakota"); state("OH", "Ohio"); state("OK", "Oklahoma");
        state("OR", "Oregon"); state("PA", "Pennsylvania"); state("RI", "Rhode Island"); state("SC", "South Carolina");
        state("SD", "South Dakota"); state("TN", "Tennessee"); state("TX", "Texas"); state("UT", "Utah");
        state("VT", "Vermont"); state("VA", "Virginia"); state("WA", "Washington"); state("WV", "West Virginia");
        state("WI", "Wisconsin"); state("WY", "Wyoming"); state("DC", "District of Columbia");

        CITY_ALIASES.put("nyc", new String[] {"New York", "NY"});
        CITY_ALIASES.put("new york city", new String[] {"New York", "NY"});
        CITY_ALIASES.put("sf", new String[] {"San Francisco", "CA"});
        CITY_ALIASES.put("la", new String[] {"Los Angeles", "CA"});
        CITY_ALIASES.put("washington dc", new String[] {"Washington", "DC"});
        CITY_ALIASES.put("washington d.c.", new String[] {"Washington", "DC"});
    }

    private static void country(String name, String code, String region, String... synonyms) {
        CountryInfo info = new CountryInfo(name, code, region);
        COUNTRIES.put(name.toLowerCase(Locale.ROOT), info);
        COUNTRIES.put(code.toLowerCase(Locale.ROOT), info);
        for (String synonym : synonyms) {
            COUNTRIES.put(synonym, info);
        }
    }

    private static void state(String code, String name) {
        US_STATES.put(code.toLowerCase(Locale.ROOT), code);
        US_STATES.put(name.toLowerCase(Locale.ROOT), code);
    }

    private LocationParser() {
        // Prevent instantiation
    }

    /**
     * Parses "City", "City, ST", "City, Country" or "City, State, Country".
     *
     * <p>A single part is read as a country, then a city alias ("NYC"), then a US state, and
     * otherwise as a city with unknown country.
     *
     * @param raw free-form location (may be null)
     * @return parsed location, {@link Location#EMPTY} for null or blank input
     */
    public static Location parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Location.EMPTY;
        }
        List<String> parts = new ArrayList<>();
        for (String part : raw.split("[,;|]")) {
            String trimmed = TextNormalizer.collapseWhitespace(part);
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        if (parts.isEmpty()) {
            return Location.EMPTY;
        }
        if (parts.size() == 1) {
            return parseSingle(parts.get(0));
        }
        if (parts.size() == 2) {
            return of(parts.get(0), parts.get(1), null);
        }
        return of(parts.get(0), parts.get(1), parts.get(parts.size() - 1));
    }

    /**
     * Builds a location from separate components, any of which may be null.
     */
    public static Location of(String city, String state, String country) {
        String cityValue = blankToNull(city);
        String stateValue = blankToNull(state);
        CountryInfo info = lookupCountry(country);

        if (cityValue != null) {
            String[] alias = CITY_ALIASES.get(cityValue.toLowerCase(Locale.ROOT));
            if (alias != null) {
                cityValue = alias[0];
                if (stateValue == null) {
                    stateValue = alias[1];
                }
            }
        }

        String stateCode = stateValue == null ? null : US_STATES.get(stateValue.toLowerCase(Locale.ROOT).replace(".", ""));
        if (info == null && country == null && stateValue != null && stateCode == null) {
            // "City, Country" arrives as city + state when only two parts were given
            CountryInfo asCountry = lookupCountry(stateValue);
            if (asCountry != null) {
                return build(cityValue, null, asCountry, null);
            }
        }
        if (stateCode != null && (info == null || UNITED_STATES.equals(info.name()))) {
            return build(cityValue, stateCode, COUNTRIES.get("us"), null);
        }
        return build(cityValue, stateValue, info, country);
    }

    private static Location parseSingle(String part) {
        CountryInfo info = lookupCountry(part);
        if (info != null) {
            return build(null, null, info, null);
        }
        String key = part.toLowerCase(Locale.ROOT);
        String[] alias = CITY_ALIASES.get(key);
        if (alias != null) {
            return build(alias[0], alias[1], COUNTRIES.get("us"), null);
        }
        String stateCode = US_STATES.get(key.replace(".", ""));
        if (stateCode != null && part.length() > 2) {
            return build(null, stateCode, COUNTRIES.get("us"), null);
        }
        return new Location(part, null, null, null, null);
    }

    private static Location build(String city, String state, CountryInfo info, String rawCountry) {
        if (info != null) {
            return new Location(city, state, info.name(), info.code(), info.region());
        }
        String country = blankToNull(rawCountry);
        return new Location(city, state, country, null, country == null ? null : "Other");
    }

    private static CountryInfo lookupCountry(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return COUNTRIES.get(TextNormalizer.collapseWhitespace(raw).toLowerCase(Locale.ROOT));
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = TextNormalizer.collapseWhitespace(value);
        return trimmed.isEmpty() ? null : trimmed;
    }
}

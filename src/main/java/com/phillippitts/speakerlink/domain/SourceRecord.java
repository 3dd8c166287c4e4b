package com.phillippitts.speakerlink.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * One document of one source after schema adaptation: source-specific field names are mapped
 * onto common slots, but no taxonomy classification has happened yet.
 *
 * <p>Immutable once built; never mutated by downstream stages.
 *
 * @param source              source name, e.g. {@code bigspeak}
 * @param sourceLocalId       the source's own id or URL for this document
 * @param rawTerms            unclassified terms per taxonomy domain
 * @param languageProficiency raw language term to stated proficiency
 * @param pronouns            self-declared pronouns, e.g. "she/her"
 */
public record SourceRecord(
        String source,
        String sourceLocalId,
        Identity identity,
        Biography biography,
        Location location,
        Map<TaxonomyDomain, List<String>> rawTerms,
        SortedMap<String, LanguageProficiency> languageProficiency,
        String pronouns,
        SpeakingFacts speakingFacts,
        Media media,
        Contact contact
) {

    public SourceRecord {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(sourceLocalId, "sourceLocalId must not be null");
        Objects.requireNonNull(identity, "identity must not be null");
        if (identity.fullName() == null) {
            throw new IllegalArgumentException("Source record from " + source + " must carry a name");
        }
        biography = biography == null ? Biography.EMPTY : biography;
        location = location == null ? Location.EMPTY : location;
        EnumMap<TaxonomyDomain, List<String>> terms = new EnumMap<>(TaxonomyDomain.class);
        if (rawTerms != null) {
            rawTerms.forEach((domain, list) -> terms.put(domain, List.copyOf(list)));
        }
        rawTerms = Collections.unmodifiableMap(terms);
        languageProficiency = DomainValues.sortedMap(languageProficiency);
        pronouns = DomainValues.trimToNull(pronouns);
        speakingFacts = speakingFacts == null ? SpeakingFacts.EMPTY : speakingFacts;
        media = media == null ? Media.EMPTY : media;
        contact = contact == null ? Contact.EMPTY : contact;
    }

    /**
     * @return raw terms of the domain, empty when the source supplied none
     */
    public List<String> terms(TaxonomyDomain domain) {
        return rawTerms.getOrDefault(domain, List.of());
    }

    public static Builder builder(String source, String sourceLocalId) {
        return new Builder(source, sourceLocalId);
    }

    /**
     * Mutable builder used by source adapters. Term and URL adders ignore null or blank values.
     */
    public static final class Builder {
        private final String source;
        private final String sourceLocalId;
        private String fullName;
        private String firstName;
        private String lastName;
        private String honorific;
        private String jobTitle;
        private String company;
        private String tagline;
        private String summary;
        private String fullBio;
        private Location location = Location.EMPTY;
        private final Map<TaxonomyDomain, List<String>> terms = new EnumMap<>(TaxonomyDomain.class);
        private final Map<String, LanguageProficiency> proficiency = new TreeMap<>();
        private String pronouns;
        private Integer yearsSpeaking;
        private Integer talkCount;
        private Double averageRating;
        private Integer reviewCount;
        private Integer maxAudienceSize;
        private FeeRange fee = FeeRange.EMPTY;
        private String imageUrl;
        private final List<String> videoUrls = new ArrayList<>();
        private final List<String> books = new ArrayList<>();
        private String email;
        private String website;
        private final Map<String, String> socialLinks = new LinkedHashMap<>();
        private final List<String> profileUrls = new ArrayList<>();

        private Builder(String source, String sourceLocalId) {
            this.source = source;
            this.sourceLocalId = sourceLocalId;
        }

        public Builder name(String fullName, String firstName, String lastName, String honorific) {
            this.fullName = fullName;
            this.firstName = firstName;
            this.lastName = lastName;
            this.honorific = honorific;
            return this;
        }

        public Builder jobTitle(String jobTitle) {
            this.jobTitle = jobTitle;
            return this;
        }

        public Builder company(String company) {
            this.company = company;
            return this;
        }

        public Builder tagline(String tagline) {
            this.tagline = tagline;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder fullBio(String fullBio) {
            this.fullBio = fullBio;
            return this;
        }

        public Builder location(Location location) {
            this.location = location == null ? Location.EMPTY : location;
            return this;
        }

        public Builder terms(TaxonomyDomain domain, List<String> values) {
            if (values != null) {
                values.forEach(value -> term(domain, value));
            }
            return this;
        }

        public Builder term(TaxonomyDomain domain, String value) {
            if (value != null && !value.isBlank()) {
                terms.computeIfAbsent(domain, d -> new ArrayList<>()).add(value.strip());
            }
            return this;
        }

        public Builder language(String language, LanguageProficiency level) {
            term(TaxonomyDomain.LANGUAGE, language);
            if (language != null && !language.isBlank() && level != null) {
                proficiency.merge(language.strip(), level, (a, b) -> b.isMoreFluentThan(a) ? b : a);
            }
            return this;
        }

        public Builder pronouns(String pronouns) {
            this.pronouns = pronouns;
            return this;
        }

        public Builder yearsSpeaking(Integer yearsSpeaking) {
            this.yearsSpeaking = yearsSpeaking;
            return this;
        }

        public Builder talkCount(Integer talkCount) {
            this.talkCount = talkCount;
            return this;
        }

        public Builder averageRating(Double averageRating) {
            this.averageRating = averageRating;
            return this;
        }

        public Builder reviewCount(Integer reviewCount) {
            this.reviewCount = reviewCount;
            return this;
        }

        public Builder maxAudienceSize(Integer maxAudienceSize) {
            this.maxAudienceSize = maxAudienceSize;
            return this;
        }

        public Builder fee(FeeRange fee) {
            this.fee = fee == null ? FeeRange.EMPTY : fee;
            return this;
        }

        public Builder imageUrl(String imageUrl) {
            this.imageUrl = imageUrl;
            return this;
        }

        public Builder videoUrls(List<String> urls) {
            if (urls != null) {
                urls.stream().filter(u -> u != null && !u.isBlank()).forEach(videoUrls::add);
            }
            return this;
        }

        public Builder books(List<String> titles) {
            if (titles != null) {
                titles.stream().filter(t -> t != null && !t.isBlank()).forEach(books::add);
            }
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder website(String website) {
            this.website = website;
            return this;
        }

        public Builder socialLink(String platform, String url) {
            if (platform != null && !platform.isBlank() && url != null && !url.isBlank()) {
                socialLinks.putIfAbsent(platform.strip().toLowerCase(Locale.ROOT), url.strip());
            }
            return this;
        }

        public Builder profileUrl(String url) {
            if (url != null && !url.isBlank()) {
                profileUrls.add(url.strip());
            }
            return this;
        }

        public SourceRecord build() {
            return new SourceRecord(
                    source,
                    sourceLocalId,
                    new Identity(fullName, firstName, lastName, honorific, jobTitle, company),
                    new Biography(tagline, summary, fullBio),
                    location,
                    terms,
                    new TreeMap<>(proficiency),
                    pronouns,
                    new SpeakingFacts(yearsSpeaking, talkCount, averageRating, reviewCount, maxAudienceSize, fee),
                    new Media(imageUrl, new TreeSet<>(videoUrls), new TreeSet<>(books)),
                    new Contact(email, website, new TreeMap<>(socialLinks), new TreeSet<>(profileUrls))
            );
        }
    }
}

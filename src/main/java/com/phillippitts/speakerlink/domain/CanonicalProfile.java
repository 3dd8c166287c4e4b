package com.phillippitts.speakerlink.domain;

import java.util.Objects;
import java.util.SortedMap;

/**
 * The single merged, de-duplicated representation of one real person.
 *
 * <p>A profile always has at least one {@code sourceIds} entry, and its {@code profileId}
 * never changes once assigned. Instances are immutable: a merge produces a new profile.
 *
 * @param profileId stable identifier derived from the first contributing record
 * @param sourceIds source name to that source's local id, one entry per contributing source
 */
public record CanonicalProfile(
        String profileId,
        SortedMap<String, String> sourceIds,
        Identity identity,
        Biography biography,
        Location location,
        CategoryResult expertise,
        CategoryResult industry,
        CategoryResult credentials,
        Languages languages,
        Speaking speaking,
        Demographics demographics,
        Media media,
        Contact contact,
        ProfileMetadata metadata
) {

    public CanonicalProfile {
        Objects.requireNonNull(profileId, "profileId must not be null");
        if (profileId.isBlank()) {
            throw new IllegalArgumentException("profileId must not be blank");
        }
        sourceIds = DomainValues.sortedMap(sourceIds);
        if (sourceIds.isEmpty()) {
            throw new IllegalArgumentException("Profile " + profileId + " must have at least one source id");
        }
        identity = identity == null ? Identity.EMPTY : identity;
        biography = biography == null ? Biography.EMPTY : biography;
        location = location == null ? Location.EMPTY : location;
        expertise = expertise == null ? CategoryResult.empty() : expertise;
        industry = industry == null ? CategoryResult.empty() : industry;
        credentials = credentials == null ? CategoryResult.empty() : credentials;
        languages = languages == null ? Languages.EMPTY : languages;
        speaking = speaking == null ? Speaking.EMPTY : speaking;
        demographics = demographics == null ? Demographics.EMPTY : demographics;
        media = media == null ? Media.EMPTY : media;
        contact = contact == null ? Contact.EMPTY : contact;
        Objects.requireNonNull(metadata, "metadata must not be null");
    }

    /**
     * Returns the taxonomy-backed field of the given domain.
     */
    public CategoryResult categories(TaxonomyDomain domain) {
        return switch (domain) {
            case EXPERTISE -> expertise;
            case INDUSTRY -> industry;
            case LANGUAGE -> languages.categories();
            case CREDENTIAL -> credentials;
            case SPEAKING_FORMAT -> speaking.formats();
            case DEMOGRAPHICS -> demographics.categories();
        };
    }

    public CanonicalProfile withMetadata(ProfileMetadata newMetadata) {
        return new CanonicalProfile(profileId, sourceIds, identity, biography, location, expertise, industry,
                credentials, languages, speaking, demographics, media, contact, newMetadata);
    }

    public CanonicalProfile withMergeConfidence(double confidence) {
        return withMetadata(metadata.withMergeConfidence(confidence));
    }
}

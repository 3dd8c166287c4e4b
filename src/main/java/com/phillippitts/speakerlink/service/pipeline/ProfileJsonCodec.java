package com.phillippitts.speakerlink.service.pipeline;

import com.phillippitts.speakerlink.domain.Biography;
import com.phillippitts.speakerlink.domain.CanonicalProfile;
import com.phillippitts.speakerlink.domain.CategoryResult;
import com.phillippitts.speakerlink.domain.Contact;
import com.phillippitts.speakerlink.domain.DataQualityTier;
import com.phillippitts.speakerlink.domain.Demographics;
import com.phillippitts.speakerlink.domain.FeeRange;
import com.phillippitts.speakerlink.domain.Identity;
import com.phillippitts.speakerlink.domain.LanguageProficiency;
import com.phillippitts.speakerlink.domain.Languages;
import com.phillippitts.speakerlink.domain.Location;
import com.phillippitts.speakerlink.domain.Media;
import com.phillippitts.speakerlink.domain.ProfileMetadata;
import com.phillippitts.speakerlink.domain.Speaking;
import com.phillippitts.speakerlink.domain.SpeakingFacts;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Single-line JSON form of a canonical profile.
 *
 * <p>Encoding is deterministic: object keys are written in sorted order, set members are
 * already sorted by the domain model, and absent values (nulls, empty sets and maps) are
 * omitted. Encoding the same profile always yields the same bytes.
 */
public class ProfileJsonCodec {

    public String encode(CanonicalProfile profile) {
        TreeMap<String, Object> root = new TreeMap<>();
        put(root, "profile_id", profile.profileId());
        put(root, "source_ids", profile.sourceIds());
        put(root, "identity", identity(profile.identity()));
        put(root, "biography", biography(profile.biography()));
        put(root, "location", location(profile.location()));
        put(root, "expertise", categories(profile.expertise()));
        put(root, "industry", categories(profile.industry()));
        put(root, "credentials", categories(profile.credentials()));
        put(root, "languages", languages(profile.languages()));
        put(root, "speaking", speaking(profile.speaking()));
        put(root, "demographics", demographics(profile.demographics()));
        put(root, "media", media(profile.media()));
        put(root, "contact", contact(profile.contact()));
        put(root, "metadata", metadata(profile.metadata()));
        StringBuilder out = new StringBuilder(512);
        write(out, root);
        return out.toString();
    }

    /**
     * @throws IllegalArgumentException if the line is not a valid encoded profile
     */
    public CanonicalProfile decode(String line) {
        try {
            JSONObject root = new JSONObject(line);
            JSONObject speaking = object(root, "speaking");
            JSONObject languages = object(root, "languages");
            JSONObject demographics = object(root, "demographics");
            return new CanonicalProfile(
                    root.getString("profile_id"),
                    stringMap(object(root, "source_ids")),
                    readIdentity(object(root, "identity")),
                    readBiography(object(root, "biography")),
                    readLocation(object(root, "location")),
                    readCategories(object(root, "expertise")),
                    readCategories(object(root, "industry")),
                    readCategories(object(root, "credentials")),
                    new Languages(readCategories(object(languages, "categories")),
                            map(object(languages, "proficiency"),
                                    v -> LanguageProficiency.valueOf(v.toUpperCase(Locale.ROOT)))),
                    readSpeaking(speaking),
                    new Demographics(readCategories(object(demographics, "categories")),
                            text(demographics, "pronouns")),
                    readMedia(object(root, "media")),
                    readContact(object(root, "contact")),
                    readMetadata(root.getJSONObject("metadata")));
        } catch (JSONException e) {
            throw new IllegalArgumentException("Not an encoded profile: " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> identity(Identity identity) {
        TreeMap<String, Object> node = new TreeMap<>();
        put(node, "full_name", identity.fullName());
        put(node, "first_name", identity.firstName());
        put(node, "last_name", identity.lastName());
        put(node, "honorific", identity.honorific());
        put(node, "job_title", identity.jobTitle());
        put(node, "company", identity.company());
        return node;
    }

    private static Map<String, Object> biography(Biography biography) {
        TreeMap<String, Object> node = new TreeMap<>();
        put(node, "tagline", biography.tagline());
        put(node, "summary", biography.summary());
        put(node, "full_bio", biography.fullBio());
        return node;
    }

    private static Map<String, Object> location(Location location) {
        TreeMap<String, Object> node = new TreeMap<>();
        put(node, "city", location.city());
        put(node, "state", location.state());
        put(node, "country", location.country());
        put(node, "country_code", location.countryCode());
        put(node, "region", location.region());
        return node;
    }

    private static Map<String, Object> categories(CategoryResult result) {
        TreeMap<String, Object> node = new TreeMap<>();
        put(node, "primary_categories", result.primaryCategories());
        put(node, "secondary_categories", result.secondaryCategories());
        put(node, "parent_categories", result.parentCategories());
        put(node, "keywords", result.keywords());
        put(node, "original_terms", result.originalTerms());
        put(node, "research_areas", result.researchAreas());
        return node;
    }

    private static Map<String, Object> languages(Languages languages) {
        TreeMap<String, Object> proficiency = new TreeMap<>();
        languages.proficiency().forEach((code, level) -> proficiency.put(code, level.name().toLowerCase(Locale.ROOT)));
        TreeMap<String, Object> node = new TreeMap<>();
        put(node, "categories", categories(languages.categories()));
        put(node, "proficiency", proficiency);
        return node;
    }

    private static Map<String, Object> speaking(Speaking speaking) {
        SpeakingFacts facts = speaking.facts();
        TreeMap<String, Object> fee = new TreeMap<>();
        put(fee, "min", facts.fee().min());
        put(fee, "max", facts.fee().max());
        put(fee, "display", facts.fee().display());
        put(fee, "bucket", facts.fee().bucket());

        TreeMap<String, Object> node = new TreeMap<>();
        put(node, "formats", categories(speaking.formats()));
        put(node, "primary_format", speaking.primaryFormat());
        put(node, "virtual_capable", speaking.virtualCapable());
        put(node, "years_speaking", facts.yearsSpeaking());
        put(node, "talk_count", facts.talkCount());
        put(node, "average_rating", facts.averageRating());
        put(node, "review_count", facts.reviewCount());
        put(node, "max_audience_size", facts.maxAudienceSize());
        put(node, "fee", fee);
        return node;
    }

    private static Map<String, Object> demographics(Demographics demographics) {
        TreeMap<String, Object> node = new TreeMap<>();
        put(node, "categories", categories(demographics.categories()));
        put(node, "pronouns", demographics.pronouns());
        return node;
    }

    private static Map<String, Object> media(Media media) {
        TreeMap<String, Object> node = new TreeMap<>();
        put(node, "image_url", media.imageUrl());
        put(node, "video_urls", media.videoUrls());
        put(node, "books", media.books());
        return node;
    }

    private static Map<String, Object> contact(Contact contact) {
        TreeMap<String, Object> node = new TreeMap<>();
        put(node, "email", contact.email());
        put(node, "website", contact.website());
        put(node, "social_links", contact.socialLinks());
        put(node, "profile_urls", contact.profileUrls());
        return node;
    }

    private static Map<String, Object> metadata(ProfileMetadata metadata) {
        TreeMap<String, Object> node = new TreeMap<>();
        put(node, "sources", metadata.sources());
        put(node, "data_quality_tier", metadata.dataQualityTier().name().toLowerCase(Locale.ROOT));
        put(node, "profile_score", metadata.profileScore());
        put(node, "experience_score", metadata.experienceScore());
        put(node, "completeness_score", metadata.completenessScore());
        put(node, "merge_confidence", metadata.mergeConfidence());
        put(node, "taxonomy_version", metadata.taxonomyVersion());
        put(node, "field_sources", metadata.fieldSources());
        return node;
    }

    private static void put(Map<String, Object> node, String key, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof Collection<?> collection && collection.isEmpty()) {
            return;
        }
        if (value instanceof Map<?, ?> map && map.isEmpty()) {
            return;
        }
        node.put(key, value);
    }

    private static void write(StringBuilder out, Object value) {
        if (value instanceof Map<?, ?> map) {
            out.append('{');
            boolean first = true;
            for (Map.Entry<?, ?> entry : new TreeMap<>(map).entrySet()) {
                if (!first) {
                    out.append(',');
                }
                out.append(JSONObject.quote(String.valueOf(entry.getKey()))).append(':');
                write(out, entry.getValue());
                first = false;
            }
            out.append('}');
        } else if (value instanceof Collection<?> collection) {
            out.append('[');
            boolean first = true;
            for (Object item : collection) {
                if (!first) {
                    out.append(',');
                }
                write(out, item);
                first = false;
            }
            out.append(']');
        } else if (value instanceof Number number) {
            out.append(JSONObject.numberToString(number));
        } else if (value instanceof Boolean bool) {
            out.append(bool);
        } else {
            out.append(JSONObject.quote(String.valueOf(value)));
        }
    }

    private static Identity readIdentity(JSONObject node) {
        return new Identity(text(node, "full_name"), text(node, "first_name"), text(node, "last_name"),
                text(node, "honorific"), text(node, "job_title"), text(node, "company"));
    }

    private static Biography readBiography(JSONObject node) {
        return new Biography(text(node, "tagline"), text(node, "summary"), text(node, "full_bio"));
    }

    private static Location readLocation(JSONObject node) {
        return new Location(text(node, "city"), text(node, "state"), text(node, "country"),
                text(node, "country_code"), text(node, "region"));
    }

    private static CategoryResult readCategories(JSONObject node) {
        return new CategoryResult(strings(node, "primary_categories"), strings(node, "secondary_categories"),
                strings(node, "parent_categories"), strings(node, "keywords"), List.copyOf(strings(node, "original_terms")),
                strings(node, "research_areas"));
    }

    private static Speaking readSpeaking(JSONObject node) {
        JSONObject fee = object(node, "fee");
        SpeakingFacts facts = new SpeakingFacts(
                integer(node, "years_speaking"),
                integer(node, "talk_count"),
                decimal(node, "average_rating"),
                integer(node, "review_count"),
                integer(node, "max_audience_size"),
                new FeeRange(integer(fee, "min"), integer(fee, "max"), text(fee, "display"), text(fee, "bucket")));
        return new Speaking(readCategories(object(node, "formats")), text(node, "primary_format"),
                node.optBoolean("virtual_capable", false), facts);
    }

    private static Media readMedia(JSONObject node) {
        return new Media(text(node, "image_url"), strings(node, "video_urls"), strings(node, "books"));
    }

    private static Contact readContact(JSONObject node) {
        return new Contact(text(node, "email"), text(node, "website"), stringMap(object(node, "social_links")),
                strings(node, "profile_urls"));
    }

    private static ProfileMetadata readMetadata(JSONObject node) {
        return new ProfileMetadata(
                strings(node, "sources"),
                DataQualityTier.valueOf(node.getString("data_quality_tier").toUpperCase(Locale.ROOT)),
                node.optInt("profile_score", 0),
                node.optInt("experience_score", 0),
                node.optInt("completeness_score", 0),
                node.optDouble("merge_confidence", 1.0),
                node.getString("taxonomy_version"),
                stringMap(object(node, "field_sources")));
    }

    private static JSONObject object(JSONObject node, String key) {
        JSONObject child = node.optJSONObject(key);
        return child == null ? new JSONObject() : child;
    }

    private static String text(JSONObject node, String key) {
        return node.has(key) ? node.getString(key) : null;
    }

    private static Integer integer(JSONObject node, String key) {
        return node.has(key) ? node.getInt(key) : null;
    }

    private static Double decimal(JSONObject node, String key) {
        return node.has(key) ? node.getDouble(key) : null;
    }

    private static SortedSet<String> strings(JSONObject node, String key) {
        JSONArray array = node.optJSONArray(key);
        TreeSet<String> values = new TreeSet<>();
        if (array != null) {
            for (int i = 0; i < array.length(); i++) {
                values.add(array.getString(i));
            }
        }
        return values;
    }

    private static SortedMap<String, String> stringMap(JSONObject node) {
        return map(node, Function.identity());
    }

    private static <V> SortedMap<String, V> map(JSONObject node, Function<String, V> valueMapper) {
        TreeMap<String, V> values = new TreeMap<>();
        for (String key : node.keySet()) {
            values.put(key, valueMapper.apply(node.getString(key)));
        }
        return values;
    }
}

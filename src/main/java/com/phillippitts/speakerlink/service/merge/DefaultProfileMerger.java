package com.phillippitts.speakerlink.service.merge;

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
import com.phillippitts.speakerlink.domain.SourceRecord;
import com.phillippitts.speakerlink.domain.Speaking;
import com.phillippitts.speakerlink.domain.SpeakingFacts;
import com.phillippitts.speakerlink.domain.TaxonomyDomain;
import com.phillippitts.speakerlink.service.adapter.SourceCatalog;
import com.phillippitts.speakerlink.service.scoring.ScoringEngine;
import com.phillippitts.speakerlink.service.taxonomy.ClassifiedRecord;
import com.phillippitts.speakerlink.service.taxonomy.RecordClassifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Field-group merge policy.
 *
 * <ul>
 *   <li>Scalars go through {@link FieldMerge}: fill when empty, replace only from a strictly
 *       more trusted tier. Location and fee are merged as whole units, social links per platform.</li>
 *   <li>URL, video, book and source sets are unioned.</li>
 *   <li>Taxonomy fields are re-derived from the union of all original terms, with the merged
 *       biography as free text.</li>
 *   <li>Language proficiency keeps the most fluent level per language code.</li>
 * </ul>
 *
 * <p>Scores are recomputed by the {@link ScoringEngine} after every create or merge.
 */
public class DefaultProfileMerger implements ProfileMerger {

    private static final Logger LOG = LogManager.getLogger(DefaultProfileMerger.class);

    /** Most prominent first. */
    static final List<String> FORMAT_PRIORITY =
            List.of("keynote", "workshop", "panel", "fireside", "webinar", "presentation");

    private static final String VIRTUAL_PARENT = "virtual";
    private static final String WEBINAR = "webinar";

    private final RecordClassifier classifier;
    private final SourceCatalog catalog;
    private final ScoringEngine scoring;

    public DefaultProfileMerger(RecordClassifier classifier, SourceCatalog catalog, ScoringEngine scoring) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.scoring = Objects.requireNonNull(scoring, "scoring must not be null");
    }

    @Override
    public CanonicalProfile create(ClassifiedRecord classified, String profileId) {
        Objects.requireNonNull(classified, "classified must not be null");
        Objects.requireNonNull(profileId, "profileId must not be null");
        CanonicalProfile created = combine(profileId, null, classified, classified.categories());
        LOG.debug("Created profile {} from {} record {}",
                profileId, classified.record().source(), classified.record().sourceLocalId());
        return created;
    }

    @Override
    public CanonicalProfile merge(CanonicalProfile existing, ClassifiedRecord classified) {
        Objects.requireNonNull(existing, "existing must not be null");
        Objects.requireNonNull(classified, "classified must not be null");
        // Categories are computed inside combine once the biography is merged
        CanonicalProfile merged = combine(existing.profileId(), existing, classified, null);
        LOG.debug("Merged {} record {} into profile {}",
                classified.record().source(), classified.record().sourceLocalId(), existing.profileId());
        return merged;
    }

    /**
     * @param categories pre-computed categories for a new profile, {@code null} to re-derive them
     */
    private CanonicalProfile combine(String profileId, CanonicalProfile base, ClassifiedRecord classified,
                                     Map<TaxonomyDomain, CategoryResult> categories) {
        SourceRecord record = classified.record();
        FieldMerge fields = new FieldMerge(catalog, record.source(),
                base == null ? Map.of() : base.metadata().fieldSources());

        Identity identity = mergeIdentity(fields, base == null ? Identity.EMPTY : base.identity(), record.identity());
        Biography biography = mergeBiography(fields, base == null ? Biography.EMPTY : base.biography(),
                record.biography());
        Location location = fields.pick("location", base == null ? Location.EMPTY : base.location(),
                record.location(), Location::isEmpty);

        Map<TaxonomyDomain, CategoryResult> resolved = categories != null
                ? categories
                : reclassify(base, classified, biography);

        Languages languages = mergeLanguages(base == null ? Languages.EMPTY : base.languages(),
                resolved.get(TaxonomyDomain.LANGUAGE), record);
        Speaking speaking = mergeSpeaking(fields, base == null ? Speaking.EMPTY : base.speaking(),
                resolved.get(TaxonomyDomain.SPEAKING_FORMAT), record.speakingFacts());
        Demographics demographics = new Demographics(resolved.get(TaxonomyDomain.DEMOGRAPHICS),
                fields.text("demographics.pronouns",
                        base == null ? null : base.demographics().pronouns(), record.pronouns()));
        Media media = mergeMedia(fields, base == null ? Media.EMPTY : base.media(), record.media());
        Contact contact = mergeContact(fields, base == null ? Contact.EMPTY : base.contact(), record.contact());

        TreeMap<String, String> sourceIds = new TreeMap<>(base == null ? Map.of() : base.sourceIds());
        sourceIds.put(record.source(), record.sourceLocalId());

        ProfileMetadata metadata = mergeMetadata(base, record.source(), fields.fieldSources());

        CanonicalProfile profile = new CanonicalProfile(
                profileId,
                sourceIds,
                identity,
                biography,
                location,
                resolved.get(TaxonomyDomain.EXPERTISE),
                resolved.get(TaxonomyDomain.INDUSTRY),
                resolved.get(TaxonomyDomain.CREDENTIAL),
                languages,
                speaking,
                demographics,
                media,
                contact,
                metadata);
        return scoring.applyScores(profile);
    }

    private static Identity mergeIdentity(FieldMerge fields, Identity current, Identity incoming) {
        return new Identity(
                fields.text("identity.full_name", current.fullName(), incoming.fullName()),
                fields.text("identity.first_name", current.firstName(), incoming.firstName()),
                fields.text("identity.last_name", current.lastName(), incoming.lastName()),
                fields.text("identity.honorific", current.honorific(), incoming.honorific()),
                fields.text("identity.job_title", current.jobTitle(), incoming.jobTitle()),
                fields.text("identity.company", current.company(), incoming.company()));
    }

    private static Biography mergeBiography(FieldMerge fields, Biography current, Biography incoming) {
        return new Biography(
                fields.text("biography.tagline", current.tagline(), incoming.tagline()),
                fields.text("biography.summary", current.summary(), incoming.summary()),
                fields.text("biography.full_bio", current.fullBio(), incoming.fullBio()));
    }

    private Map<TaxonomyDomain, CategoryResult> reclassify(CanonicalProfile existing, ClassifiedRecord classified,
                                                           Biography biography) {
        Map<TaxonomyDomain, CategoryResult> results = new EnumMap<>(TaxonomyDomain.class);
        for (TaxonomyDomain domain : TaxonomyDomain.values()) {
            TreeSet<String> terms = new TreeSet<>(existing.categories(domain).originalTerms());
            terms.addAll(classified.categories(domain).originalTerms());
            results.put(domain, classifier.classify(domain, List.copyOf(terms), biography));
        }
        return results;
    }

    private Languages mergeLanguages(Languages current, CategoryResult categories, SourceRecord record) {
        TreeMap<String, LanguageProficiency> proficiency = new TreeMap<>(current.proficiency());
        record.languageProficiency().forEach((term, level) -> {
            CategoryResult codes = classifier.classify(TaxonomyDomain.LANGUAGE, List.of(term), null);
            for (String code : codes.primaryCategories()) {
                proficiency.merge(code, level, (held, offered) -> offered.isMoreFluentThan(held) ? offered : held);
            }
        });
        proficiency.keySet().retainAll(categories.allCategories());
        return new Languages(categories, proficiency);
    }

    private static Speaking mergeSpeaking(FieldMerge fields, Speaking current, CategoryResult formats,
                                          SpeakingFacts incoming) {
        SpeakingFacts held = current.facts();
        SpeakingFacts facts = new SpeakingFacts(
                fields.value("speaking.years_speaking", held.yearsSpeaking(), incoming.yearsSpeaking()),
                fields.value("speaking.talk_count", held.talkCount(), incoming.talkCount()),
                fields.value("speaking.average_rating", held.averageRating(), incoming.averageRating()),
                fields.value("speaking.review_count", held.reviewCount(), incoming.reviewCount()),
                fields.value("speaking.max_audience_size", held.maxAudienceSize(), incoming.maxAudienceSize()),
                fields.pick("speaking.fee", held.fee(), incoming.fee(), FeeRange::isEmpty));
        return new Speaking(formats, primaryFormat(formats), isVirtualCapable(formats), facts);
    }

    static String primaryFormat(CategoryResult formats) {
        TreeSet<String> all = new TreeSet<>(formats.allCategories());
        for (String format : FORMAT_PRIORITY) {
            if (all.contains(format)) {
                return format;
            }
        }
        return all.isEmpty() ? null : all.first();
    }

    static boolean isVirtualCapable(CategoryResult formats) {
        return formats.parentCategories().contains(VIRTUAL_PARENT) || formats.allCategories().contains(WEBINAR);
    }

    private static Media mergeMedia(FieldMerge fields, Media current, Media incoming) {
        TreeSet<String> videos = new TreeSet<>(current.videoUrls());
        videos.addAll(incoming.videoUrls());
        TreeSet<String> books = new TreeSet<>(current.books());
        books.addAll(incoming.books());
        return new Media(fields.text("media.image_url", current.imageUrl(), incoming.imageUrl()), videos, books);
    }

    private static Contact mergeContact(FieldMerge fields, Contact current, Contact incoming) {
        SortedMap<String, String> social = new TreeMap<>(current.socialLinks());
        incoming.socialLinks().forEach((platform, url) -> {
            String kept = fields.text("contact.social." + platform, social.get(platform), url);
            if (kept != null) {
                social.put(platform, kept);
            }
        });
        TreeSet<String> profileUrls = new TreeSet<>(current.profileUrls());
        profileUrls.addAll(incoming.profileUrls());
        return new Contact(
                fields.text("contact.email", current.email(), incoming.email()),
                fields.text("contact.website", current.website(), incoming.website()),
                social,
                profileUrls);
    }

    private ProfileMetadata mergeMetadata(CanonicalProfile existing, String source,
                                          SortedMap<String, String> fieldSources) {
        TreeSet<String> sources = new TreeSet<>(existing == null ? List.of() : existing.metadata().sources());
        sources.add(source);
        DataQualityTier tier = existing == null ? null : existing.metadata().dataQualityTier();
        tier = DataQualityTier.mostTrusted(tier, catalog.tierOf(source));
        double confidence = existing == null ? 1.0 : existing.metadata().mergeConfidence();
        return new ProfileMetadata(sources, tier, 0, 0, 0, confidence, classifier.taxonomyVersion(), fieldSources);
    }
}

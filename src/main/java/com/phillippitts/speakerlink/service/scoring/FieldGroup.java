package com.phillippitts.speakerlink.service.scoring;

import com.phillippitts.speakerlink.domain.CanonicalProfile;
import com.phillippitts.speakerlink.domain.CategoryResult;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Field groups of a canonical profile with their profile-score allocation.
 *
 * <p>A group earns its full points once at least {@code minimumPopulated} of its leaves are
 * populated, and nothing otherwise. Groups with zero points still count towards completeness.
 */
public enum FieldGroup {

    IDENTITY(15, 4, List.of(
            p -> has(p.identity().fullName()),
            p -> has(p.identity().firstName()),
            p -> has(p.identity().lastName()),
            p -> has(p.identity().jobTitle()),
            p -> has(p.identity().company()))),

    BIOGRAPHY(15, 1, List.of(
            p -> has(p.biography().tagline()),
            p -> has(p.biography().summary()),
            p -> has(p.biography().fullBio()))),

    LOCATION(10, 2, List.of(
            p -> has(p.location().city()),
            p -> has(p.location().state()),
            p -> has(p.location().country()),
            p -> has(p.location().region()))),

    EXPERTISE(20, 2, List.of(
            p -> has(p.expertise().primaryCategories()),
            p -> has(p.expertise().secondaryCategories()),
            p -> has(p.expertise().parentCategories()),
            p -> has(p.expertise().keywords()),
            p -> has(p.expertise().researchAreas()),
            p -> has(p.industry().primaryCategories()),
            p -> has(p.industry().secondaryCategories()),
            p -> has(p.industry().parentCategories()))),

    CREDENTIALS(10, 1, List.of(
            p -> has(p.credentials().primaryCategories()),
            p -> has(p.credentials().secondaryCategories()),
            p -> has(p.credentials().parentCategories()))),

    LANGUAGES(10, 1, List.of(
            p -> has(p.languages().categories().primaryCategories()),
            p -> has(p.languages().proficiency()))),

    MEDIA(10, 1, List.of(
            p -> has(p.media().imageUrl()),
            p -> has(p.media().videoUrls()),
            p -> has(p.media().books()))),

    CONTACT(10, 1, List.of(
            p -> has(p.contact().email()),
            p -> has(p.contact().website()),
            p -> has(p.contact().socialLinks()),
            p -> has(p.contact().profileUrls()))),

    SPEAKING(0, 0, List.of(
            p -> has(formats(p).primaryCategories()),
            p -> has(formats(p).secondaryCategories()),
            p -> has(p.speaking().primaryFormat()),
            p -> p.speaking().facts().yearsSpeaking() != null,
            p -> p.speaking().facts().talkCount() != null,
            p -> p.speaking().facts().averageRating() != null,
            p -> p.speaking().facts().reviewCount() != null,
            p -> p.speaking().facts().maxAudienceSize() != null,
            p -> !p.speaking().facts().fee().isEmpty())),

    DEMOGRAPHICS(0, 0, List.of(
            p -> has(p.demographics().categories().primaryCategories()),
            p -> has(p.demographics().pronouns())));

    private final int points;
    private final int minimumPopulated;
    private final List<Predicate<CanonicalProfile>> leaves;

    FieldGroup(int points, int minimumPopulated, List<Predicate<CanonicalProfile>> leaves) {
        this.points = points;
        this.minimumPopulated = minimumPopulated;
        this.leaves = leaves;
    }

    public int points() {
        return points;
    }

    public int minimumPopulated() {
        return minimumPopulated;
    }

    public int leafCount() {
        return leaves.size();
    }

    public int populatedLeaves(CanonicalProfile profile) {
        int count = 0;
        for (Predicate<CanonicalProfile> leaf : leaves) {
            if (leaf.test(profile)) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return {@link #points()} when the population threshold is met, otherwise 0
     */
    public int earnedPoints(CanonicalProfile profile) {
        if (points == 0) {
            return 0;
        }
        return populatedLeaves(profile) >= Math.max(1, minimumPopulated) ? points : 0;
    }

    public static int totalLeafCount() {
        int total = 0;
        for (FieldGroup group : values()) {
            total += group.leafCount();
        }
        return total;
    }

    private static CategoryResult formats(CanonicalProfile p) {
        return p.speaking().formats();
    }

    private static boolean has(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean has(Collection<?> values) {
        return values != null && !values.isEmpty();
    }

    private static boolean has(Map<?, ?> values) {
        return values != null && !values.isEmpty();
    }
}

package com.phillippitts.speakerlink.service.resolve;

import com.phillippitts.speakerlink.config.properties.ResolutionProperties;
import com.phillippitts.speakerlink.domain.CanonicalProfile;
import com.phillippitts.speakerlink.domain.Location;
import com.phillippitts.speakerlink.domain.SourceRecord;
import com.phillippitts.speakerlink.util.NameParser;
import com.phillippitts.speakerlink.util.TextNormalizer;
import com.phillippitts.speakerlink.util.UrlNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Blocking-index duplicate resolver with a weighted similarity score.
 *
 * <p><b>Scoring</b> (per candidate sharing the record's blocking key):
 * <ol>
 *   <li>Any shared URL (website, social link or source profile page) forces a score of 1.0.</li>
 *   <li>Otherwise the score is the weighted average of the signals both sides can be compared on:
 *       full-name edit similarity (always) and location agreement (when both sides have a country,
 *       else a state, else a city). Non-overlapping URLs leave the score unchanged.</li>
 * </ol>
 *
 * <p><b>Decision:</b> the best candidate is the highest score, then the highest
 * {@code profileScore}, then the smallest profile id. It is accepted at or above the accept
 * threshold and reported as ambiguous between the ambiguous and accept thresholds.
 *
 * <p>Thread-safe: stateless apart from immutable configuration.
 *
 * @since 1.0
 */
public final class WeightedDuplicateResolver implements DuplicateResolver {

    private static final Logger LOG = LogManager.getLogger(WeightedDuplicateResolver.class);

    private static final Comparator<Scored> BEST_FIRST = Comparator
            .comparingDouble((Scored s) -> s.candidate().similarityScore()).reversed()
            .thenComparing(Comparator.comparingInt((Scored s) -> s.profile().metadata().profileScore()).reversed())
            .thenComparing(s -> s.profile().profileId());

    private enum Agreement { AGREE, DISAGREE, NOT_COMPARABLE }

    private record Scored(CanonicalProfile profile, MatchCandidate candidate) {
    }

    private final ResolutionProperties properties;
    private final SimilarityAlgorithm nameSimilarity;

    public WeightedDuplicateResolver(ResolutionProperties properties, SimilarityAlgorithm nameSimilarity) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.nameSimilarity = Objects.requireNonNull(nameSimilarity, "nameSimilarity must not be null");
    }

    @Override
    public MatchResult resolve(SourceRecord record, ProfileIndex index) {
        Objects.requireNonNull(record, "record must not be null");
        Objects.requireNonNull(index, "index must not be null");

        BlockingKey key = BlockingKey.of(record.identity().lastName(), record.location());
        if (key.lastName().isEmpty()) {
            return MatchResult.noCandidates();
        }
        List<CanonicalProfile> candidates = index.candidatesFor(key);
        if (candidates.isEmpty()) {
            return MatchResult.noCandidates();
        }

        Scored best = null;
        for (CanonicalProfile profile : candidates) {
            Scored scored = new Scored(profile, score(record, profile));
            if (best == null || BEST_FIRST.compare(scored, best) < 0) {
                best = scored;
            }
        }

        MatchCandidate candidate = best.candidate();
        if (candidate.similarityScore() >= properties.getAcceptThreshold()) {
            return new MatchResult(MatchDecision.ACCEPTED, candidate);
        }
        if (candidate.similarityScore() >= properties.getAmbiguousThreshold()) {
            LOG.debug("Ambiguous match for {} record {}: profile {} scored {} on {}; creating a new profile",
                    record.source(), record.sourceLocalId(), candidate.existingProfileId(),
                    String.format("%.3f", candidate.similarityScore()), candidate.matchedOn());
            return new MatchResult(MatchDecision.AMBIGUOUS, candidate);
        }
        return new MatchResult(MatchDecision.NO_MATCH, candidate);
    }

    /**
     * Scores one candidate profile against the record.
     */
    MatchCandidate score(SourceRecord record, CanonicalProfile profile) {
        double nameScore = nameSimilarity.compute(
                NameParser.comparisonName(record.identity().fullName()),
                NameParser.comparisonName(profile.identity().fullName()));
        Agreement location = compareLocations(record.location(), profile.location());

        Set<MatchSignal> signals = EnumSet.noneOf(MatchSignal.class);
        if (nameScore >= properties.getAcceptThreshold()) {
            signals.add(MatchSignal.NAME);
        }
        if (location == Agreement.AGREE) {
            signals.add(MatchSignal.LOCATION);
        }

        if (overlaps(normalizedUrls(record.contact().allUrls()), normalizedUrls(profile.contact().allUrls()))) {
            signals.add(MatchSignal.SOCIAL_LINK);
            return new MatchCandidate(profile.profileId(), 1.0, signals);
        }

        double weighted = properties.getNameWeight() * nameScore;
        double total = properties.getNameWeight();
        if (location != Agreement.NOT_COMPARABLE) {
            total += properties.getLocationWeight();
            if (location == Agreement.AGREE) {
                weighted += properties.getLocationWeight();
            }
        }
        double score = Math.max(0.0, Math.min(1.0, weighted / total));
        return new MatchCandidate(profile.profileId(), score, signals);
    }

    /**
     * Compares at the coarsest level both sides populate: country, then state, then city.
     */
    private static Agreement compareLocations(Location a, Location b) {
        if (a.country() != null && b.country() != null) {
            return same(a.country(), b.country());
        }
        if (a.state() != null && b.state() != null) {
            return same(a.state(), b.state());
        }
        if (a.city() != null && b.city() != null) {
            return same(a.city(), b.city());
        }
        return Agreement.NOT_COMPARABLE;
    }

    private static Agreement same(String a, String b) {
        return TextNormalizer.comparisonForm(a).equals(TextNormalizer.comparisonForm(b))
                ? Agreement.AGREE : Agreement.DISAGREE;
    }

    private static Set<String> normalizedUrls(Collection<String> raw) {
        Set<String> urls = new TreeSet<>();
        raw.forEach(url -> urls.add(UrlNormalizer.normalize(url)));
        urls.remove("");
        return urls;
    }

    private static boolean overlaps(Set<String> a, Set<String> b) {
        for (String url : a) {
            if (b.contains(url)) {
                return true;
            }
        }
        return false;
    }
}

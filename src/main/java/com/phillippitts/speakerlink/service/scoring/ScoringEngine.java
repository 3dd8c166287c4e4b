package com.phillippitts.speakerlink.service.scoring;

import com.phillippitts.speakerlink.domain.CanonicalProfile;
import com.phillippitts.speakerlink.domain.SpeakingFacts;
import org.springframework.stereotype.Component;

/**
 * Computes profile, experience and completeness scores.
 *
 * <p>All scores are pure functions of the profile's current fields, so recomputing them after
 * any merge is safe and independent of merge order.
 *
 * <p><b>Experience score</b> (five components, 20 points each):
 * <ul>
 *   <li>Years speaking: 20+ years 20, 10+ 15, 5+ 10, 2+ 5</li>
 *   <li>Talk count: 500+ 20, 200+ 15, 100+ 10, 50+ 5</li>
 *   <li>Average rating: 4.8+ 20, 4.5+ 15, 4.0+ 10, 3.5+ 5</li>
 *   <li>Format diversity: 4 points per distinct speaking format, up to 20</li>
 *   <li>Audience reach: above 5000 attendees 20, above 500 10</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
public class ScoringEngine {

    private static final int COMPONENT_CAP = 20;
    private static final int POINTS_PER_FORMAT = 4;

    public ProfileScores score(CanonicalProfile profile) {
        return new ProfileScores(profileScore(profile), experienceScore(profile), completenessScore(profile));
    }

    /**
     * Returns the profile with freshly computed scores in its metadata.
     */
    public CanonicalProfile applyScores(CanonicalProfile profile) {
        ProfileScores scores = score(profile);
        return profile.withMetadata(profile.metadata().withScores(
                scores.profileScore(), scores.experienceScore(), scores.completenessScore()));
    }

    int profileScore(CanonicalProfile profile) {
        int score = 0;
        for (FieldGroup group : FieldGroup.values()) {
            score += group.earnedPoints(profile);
        }
        return Math.min(100, score);
    }

    int completenessScore(CanonicalProfile profile) {
        int populated = 0;
        for (FieldGroup group : FieldGroup.values()) {
            populated += group.populatedLeaves(profile);
        }
        return (int) Math.round(populated * 100.0 / FieldGroup.totalLeafCount());
    }

    int experienceScore(CanonicalProfile profile) {
        SpeakingFacts facts = profile.speaking().facts();
        int score = yearsPoints(facts.yearsSpeaking())
                + talkPoints(facts.talkCount())
                + ratingPoints(facts.averageRating())
                + Math.min(COMPONENT_CAP, profile.speaking().formats().allCategories().size() * POINTS_PER_FORMAT)
                + audiencePoints(facts.maxAudienceSize());
        return Math.min(100, score);
    }

    private static int yearsPoints(Integer years) {
        if (years == null) {
            return 0;
        }
        if (years >= 20) {
            return 20;
        } else if (years >= 10) {
            return 15;
        } else if (years >= 5) {
            return 10;
        } else if (years >= 2) {
            return 5;
        }
        return 0;
    }

    private static int talkPoints(Integer talks) {
        if (talks == null) {
            return 0;
        }
        if (talks >= 500) {
            return 20;
        } else if (talks >= 200) {
            return 15;
        } else if (talks >= 100) {
            return 10;
        } else if (talks >= 50) {
            return 5;
        }
        return 0;
    }

    private static int ratingPoints(Double rating) {
        if (rating == null) {
            return 0;
        }
        if (rating >= 4.8) {
            return 20;
        } else if (rating >= 4.5) {
            return 15;
        } else if (rating >= 4.0) {
            return 10;
        } else if (rating >= 3.5) {
            return 5;
        }
        return 0;
    }

    private static int audiencePoints(Integer audience) {
        if (audience == null) {
            return 0;
        }
        if (audience > 5000) {
            return 20;
        } else if (audience > 500) {
            return 10;
        }
        return 0;
    }
}

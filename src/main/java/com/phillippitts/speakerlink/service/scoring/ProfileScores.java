package com.phillippitts.speakerlink.service.scoring;

/**
 * The three derived scores of a profile, each 0-100.
 */
public record ProfileScores(int profileScore, int experienceScore, int completenessScore) {
}

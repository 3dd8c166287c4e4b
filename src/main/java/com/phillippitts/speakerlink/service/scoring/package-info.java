/**
 * Profile, experience and completeness scoring. All scores are pure functions of a profile.
 */
package com.phillippitts.speakerlink.service.scoring;

package com.phillippitts.speakerlink.service.pipeline;

import com.phillippitts.speakerlink.domain.CanonicalProfile;

import java.util.Collection;

/**
 * Output collaborator: keyed upsert of profiles plus a re-open of the current full set.
 */
public interface ProfileSink {

    /**
     * Inserts the profile or replaces the one with the same profile id.
     */
    void upsert(CanonicalProfile profile);

    /**
     * @return every stored profile, ordered by profile id
     */
    Collection<CanonicalProfile> loadAll();

    /**
     * Makes all upserts durable. A no-op for sinks that write through.
     */
    default void flush() {
    }
}

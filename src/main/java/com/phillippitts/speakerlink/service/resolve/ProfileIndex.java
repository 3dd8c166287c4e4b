package com.phillippitts.speakerlink.service.resolve;

import com.phillippitts.speakerlink.domain.CanonicalProfile;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * The set of accepted profiles of a run, searchable by blocking key.
 *
 * <p>Not thread-safe: all mutations happen on the single resolve-and-merge writer.
 */
public interface ProfileIndex {

    Optional<CanonicalProfile> get(String profileId);

    boolean contains(String profileId);

    /**
     * Inserts a profile or replaces the one with the same id, re-bucketing it when its
     * blocking key changed.
     */
    void upsert(CanonicalProfile profile);

    /**
     * Returns the profiles that may describe the same person as a record with {@code key},
     * ordered by profile id.
     */
    List<CanonicalProfile> candidatesFor(BlockingKey key);

    /**
     * @return all profiles ordered by profile id
     */
    Collection<CanonicalProfile> all();

    int size();
}

package com.phillippitts.speakerlink.service.pipeline;

import com.phillippitts.speakerlink.domain.CanonicalProfile;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Profile sink held in memory, for tests and embedding.
 */
public class InMemoryProfileSink implements ProfileSink {

    private final Map<String, CanonicalProfile> profiles = new ConcurrentSkipListMap<>();

    @Override
    public void upsert(CanonicalProfile profile) {
        profiles.put(profile.profileId(), profile);
    }

    @Override
    public Collection<CanonicalProfile> loadAll() {
        return List.copyOf(profiles.values());
    }
}

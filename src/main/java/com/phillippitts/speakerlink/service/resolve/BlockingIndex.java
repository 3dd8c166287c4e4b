package com.phillippitts.speakerlink.service.resolve;

import com.phillippitts.speakerlink.domain.CanonicalProfile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * {@link ProfileIndex} bucketing profiles by last name, then by country token.
 *
 * <p>Lookup for a key with a known country reads that country's bucket plus the bucket of
 * profiles whose country is unknown; a key with unknown country reads every bucket of the
 * last name. Profiles never leave their last-name group, so a lookup costs the size of one
 * group rather than the whole index.
 */
public final class BlockingIndex implements ProfileIndex {

    private final TreeMap<String, CanonicalProfile> profiles = new TreeMap<>();
    private final Map<String, Map<String, Set<String>>> buckets = new HashMap<>();
    private final Map<String, BlockingKey> keys = new HashMap<>();

    public BlockingIndex() {
    }

    public BlockingIndex(Collection<CanonicalProfile> initial) {
        initial.forEach(this::upsert);
    }

    public static BlockingKey keyOf(CanonicalProfile profile) {
        return BlockingKey.of(profile.identity().lastName(), profile.location());
    }

    @Override
    public Optional<CanonicalProfile> get(String profileId) {
        return Optional.ofNullable(profiles.get(profileId));
    }

    @Override
    public boolean contains(String profileId) {
        return profiles.containsKey(profileId);
    }

    @Override
    public void upsert(CanonicalProfile profile) {
        Objects.requireNonNull(profile, "profile must not be null");
        String id = profile.profileId();
        BlockingKey key = keyOf(profile);
        BlockingKey previous = keys.put(id, key);
        if (previous != null && !previous.equals(key)) {
            Map<String, Set<String>> byCountry = buckets.get(previous.lastName());
            if (byCountry != null) {
                Set<String> bucket = byCountry.get(previous.country());
                if (bucket != null) {
                    bucket.remove(id);
                }
            }
        }
        buckets.computeIfAbsent(key.lastName(), k -> new HashMap<>())
                .computeIfAbsent(key.country(), k -> new TreeSet<>())
                .add(id);
        profiles.put(id, profile);
    }

    @Override
    public List<CanonicalProfile> candidatesFor(BlockingKey key) {
        Map<String, Set<String>> byCountry = buckets.get(key.lastName());
        if (byCountry == null) {
            return List.of();
        }
        TreeSet<String> ids = new TreeSet<>();
        if (key.hasKnownCountry()) {
            ids.addAll(byCountry.getOrDefault(key.country(), Set.of()));
            ids.addAll(byCountry.getOrDefault(BlockingKey.UNKNOWN_COUNTRY, Set.of()));
        } else {
            byCountry.values().forEach(ids::addAll);
        }
        List<CanonicalProfile> candidates = new ArrayList<>(ids.size());
        for (String id : ids) {
            candidates.add(profiles.get(id));
        }
        return candidates;
    }

    @Override
    public Collection<CanonicalProfile> all() {
        return Collections.unmodifiableCollection(profiles.values());
    }

    @Override
    public int size() {
        return profiles.size();
    }
}

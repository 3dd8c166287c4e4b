package com.phillippitts.speakerlink.service.resolve;

import com.phillippitts.speakerlink.domain.CanonicalProfile;
import com.phillippitts.speakerlink.domain.Location;
import com.phillippitts.speakerlink.util.LocationParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.phillippitts.speakerlink.service.resolve.ResolverFixtures.profile;
import static org.assertj.core.api.Assertions.assertThat;

class BlockingIndexTest {

    private static final Location AUSTIN = LocationParser.parse("Austin, TX");
    private static final Location LONDON = LocationParser.parse("London, UK");

    private BlockingIndex index;

    @BeforeEach
    void setUp() {
        index = new BlockingIndex();
    }

    private static List<String> ids(List<CanonicalProfile> profiles) {
        return profiles.stream().map(CanonicalProfile::profileId).toList();
    }

    @Test
    void shouldNormalizeBlockingKey() {
        BlockingKey key = BlockingKey.of("O'Brien-Núñez", AUSTIN);

        assertThat(key.lastName()).isEqualTo("obriennunez");
        assertThat(key.country()).isEqualTo("us");
        assertThat(key.value()).isEqualTo("obriennunez|us");
        assertThat(key.hasKnownCountry()).isTrue();
    }

    @Test
    void shouldUseUnknownCountryWithoutLocation() {
        BlockingKey key = BlockingKey.of("Smith", Location.EMPTY);

        assertThat(key.country()).isEqualTo(BlockingKey.UNKNOWN_COUNTRY);
        assertThat(key.hasKnownCountry()).isFalse();
    }

    @Test
    void shouldReadOwnCountryAndUnknownBucket() {
        index.upsert(profile("us", "Jane", "Smith", AUSTIN));
        index.upsert(profile("gb", "Jane", "Smith", LONDON));
        index.upsert(profile("none", "Jane", "Smith", Location.EMPTY));

        assertThat(ids(index.candidatesFor(BlockingKey.of("Smith", AUSTIN)))).containsExactly("none", "us");
    }

    @Test
    void shouldReadEveryBucketForUnknownCountry() {
        index.upsert(profile("us", "Jane", "Smith", AUSTIN));
        index.upsert(profile("gb", "Jane", "Smith", LONDON));
        index.upsert(profile("other", "Jane", "Jones", AUSTIN));

        assertThat(ids(index.candidatesFor(BlockingKey.of("smith", Location.EMPTY)))).containsExactly("gb", "us");
    }

    @Test
    void shouldRebucketProfileWhenLocationChanges() {
        index.upsert(profile("p1", "Jane", "Smith", Location.EMPTY));
        BlockingKey london = BlockingKey.of("Smith", LONDON);
        assertThat(ids(index.candidatesFor(london))).containsExactly("p1");

        index.upsert(profile("p1", "Jane", "Smith", AUSTIN));

        assertThat(index.candidatesFor(london)).isEmpty();
        assertThat(ids(index.candidatesFor(BlockingKey.of("Smith", AUSTIN)))).containsExactly("p1");
        assertThat(index.size()).isEqualTo(1);
    }

    @Test
    void shouldReturnEmptyForUnknownLastName() {
        index.upsert(profile("p1", "Jane", "Smith", AUSTIN));

        assertThat(index.candidatesFor(BlockingKey.of("Jones", AUSTIN))).isEmpty();
    }

    @Test
    void shouldExposeProfilesById() {
        BlockingIndex seeded = new BlockingIndex(List.of(
                profile("b", "Ann", "Lee", Location.EMPTY),
                profile("a", "Bo", "Kim", AUSTIN)));

        assertThat(seeded.contains("a")).isTrue();
        assertThat(seeded.get("b")).map(p -> p.identity().lastName()).contains("Lee");
        assertThat(seeded.get("zzz")).isEmpty();
        assertThat(seeded.all()).extracting(CanonicalProfile::profileId).containsExactly("a", "b");
    }
}

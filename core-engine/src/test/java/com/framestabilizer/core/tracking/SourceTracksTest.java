package com.framestabilizer.core.tracking;

import com.framestabilizer.core.model.BoundingBox;
import com.framestabilizer.core.model.Detection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SourceTracks} and {@link TrackRegistry}.
 */
class SourceTracksTest {

    @Test
    @DisplayName("Tracks are listed in creation order across classes")
    void shouldListTracksInCreationOrder() {
        SourceTracks source = new TrackRegistry().acquire("cam-1");
        Track person = newTrack(source, "person");
        Track car = newTrack(source, "car");
        Track person2 = newTrack(source, "person");

        assertThat(source.tracks()).containsExactly(person, car, person2);
        assertThat(source.trackCountsByClass()).containsEntry("person", 2).containsEntry("car", 1);
        assertThat(source.activeTrackCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Expired tracks and empty class buckets are removed")
    void shouldRemoveExpiredTracks() {
        SourceTracks source = new TrackRegistry().acquire("cam-1");
        Track person = newTrack(source, "person");
        Track car = newTrack(source, "car");
        person.markMissed();
        person.markMissed();
        car.markMissed();
        car.markMissed();
        car.markMissed();

        int removed = source.removeExpired(2);

        assertThat(removed).isEqualTo(1);
        assertThat(source.tracks()).containsExactly(person);
        assertThat(source.trackCountsByClass()).containsOnlyKeys("person");
    }

    @Test
    @DisplayName("Clearing tracks never rewinds the id counter")
    void shouldNotReuseIdsAfterClear() {
        SourceTracks source = new TrackRegistry().acquire("cam-1");
        newTrack(source, "person");
        newTrack(source, "person");

        assertThat(source.clearTracks()).isEqualTo(2);
        assertThat(source.activeTrackCount()).isZero();
        assertThat(source.nextTrackId()).isEqualTo(3);
    }

    @Test
    @DisplayName("Counter reset leaves tracks alone")
    void shouldResetCountersOnly() {
        SourceTracks source = new TrackRegistry().acquire("cam-1");
        newTrack(source, "person");
        source.recordDetected(4);
        source.recordIgnored();
        source.recordInvalid(2);

        source.resetCounters();

        assertThat(source.getTotalDetected()).isZero();
        assertThat(source.getTotalIgnored()).isZero();
        assertThat(source.getTotalInvalid()).isZero();
        assertThat(source.activeTrackCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Registry creates lazily on acquire, never on find")
    void shouldCreateSourcesOnlyOnAcquire() {
        TrackRegistry registry = new TrackRegistry();

        assertThat(registry.find("cam-9")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
        assertThat(registry.sourceIds()).isEmpty();

        SourceTracks source = registry.acquire("cam-9");

        assertThat(registry.acquire("cam-9")).isSameAs(source);
        assertThat(registry.find("cam-9")).containsSame(source);
        assertThat(registry.sourceIds()).containsExactly("cam-9");
    }

    @Test
    @DisplayName("Sources have independent id sequences")
    void shouldIsolateSources() {
        TrackRegistry registry = new TrackRegistry();
        SourceTracks a = registry.acquire("a");
        SourceTracks b = registry.acquire("b");

        newTrack(a, "person");
        newTrack(a, "person");

        assertThat(b.nextTrackId()).isEqualTo(1);
        assertThat(b.activeTrackCount()).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Track newTrack(SourceTracks source, String className) {
        Track track = new Track(source.nextTrackId(),
                Detection.of(className, 0.8, new BoundingBox(10, 10, 5, 5)));
        source.add(track);
        return track;
    }
}

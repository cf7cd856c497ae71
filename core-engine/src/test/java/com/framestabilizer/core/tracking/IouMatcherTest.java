package com.framestabilizer.core.tracking;

import com.framestabilizer.core.model.BoundingBox;
import com.framestabilizer.core.model.Detection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link IouMatcher}.
 */
class IouMatcherTest {

    private final IouMatcher matcher = new IouMatcher(0.3);

    @Test
    @DisplayName("Overlapping detection of the same class matches its track")
    void shouldMatchOverlappingSameClass() {
        Track track = track(1, "person", 0.7, new BoundingBox(100, 100, 20, 40));
        Detection detection = detection("person", 0.6, new BoundingBox(102, 101, 20, 40));

        MatchResult result = matcher.match(List.of(detection), List.of(track));

        assertThat(result.assignments()).hasSize(1);
        assertThat(result.assignments().get(0).isMatched()).isTrue();
        assertThat(result.assignments().get(0).track()).isSameAs(track);
        assertThat(result.unmatchedTracks()).isEmpty();
    }

    @Test
    @DisplayName("Different classes never match, whatever the overlap")
    void shouldNotMatchAcrossClasses() {
        BoundingBox box = new BoundingBox(100, 100, 20, 40);
        Track track = track(1, "person", 0.7, box);

        MatchResult result = matcher.match(List.of(detection("car", 0.9, box)), List.of(track));

        assertThat(result.assignments().get(0).isMatched()).isFalse();
        assertThat(result.unmatchedTracks()).containsExactly(track);
    }

    @Test
    @DisplayName("IoU exactly at the threshold does not match")
    void shouldRequireStrictlyGreaterIou() {
        // IoU of these two boxes is exactly 1/3
        IouMatcher third = new IouMatcher(1.0 / 3.0);
        Track track = track(1, "person", 0.7, new BoundingBox(0, 0, 2, 2));
        Detection detection = detection("person", 0.7, new BoundingBox(1, 0, 2, 2));

        MatchResult result = third.match(List.of(detection), List.of(track));

        assertThat(result.assignments().get(0).isMatched()).isFalse();
    }

    @Test
    @DisplayName("Higher-confidence detection claims a contested track first")
    void shouldVisitDetectionsByDescendingConfidence() {
        Track track = track(1, "person", 0.7, new BoundingBox(100, 100, 20, 40));
        Detection weak = detection("person", 0.55, new BoundingBox(100, 100, 20, 40));
        Detection strong = detection("person", 0.9, new BoundingBox(104, 100, 20, 40));

        MatchResult result = matcher.match(List.of(weak, strong), List.of(track));

        assertThat(result.assignments()).extracting(MatchResult.Assignment::detection)
                .containsExactly(strong, weak);
        assertThat(result.assignments().get(0).track()).isSameAs(track);
        assertThat(result.assignments().get(1).isMatched()).isFalse();
    }

    @Test
    @DisplayName("Equal confidences keep input order")
    void shouldKeepInputOrderForEqualConfidence() {
        Detection first = detection("person", 0.6, new BoundingBox(10, 10, 5, 5));
        Detection second = detection("person", 0.6, new BoundingBox(90, 90, 5, 5));

        MatchResult result = matcher.match(List.of(first, second), List.of());

        assertThat(result.assignments()).extracting(MatchResult.Assignment::detection)
                .containsExactly(first, second);
    }

    @Test
    @DisplayName("Equal IoU with two tracks goes to the earlier-created track")
    void shouldBreakTiesByCreationOrder() {
        BoundingBox box = new BoundingBox(50, 50, 10, 10);
        Track older = track(1, "person", 0.7, box);
        Track newer = track(2, "person", 0.7, box);

        MatchResult result = matcher.match(List.of(detection("person", 0.8, box)), List.of(older, newer));

        assertThat(result.assignments().get(0).track()).isSameAs(older);
        assertThat(result.unmatchedTracks()).containsExactly(newer);
    }

    @Test
    @DisplayName("A detection picks the track with the highest IoU")
    void shouldPickBestOverlap() {
        Track far = track(1, "person", 0.7, new BoundingBox(108, 100, 20, 40));
        Track near = track(2, "person", 0.7, new BoundingBox(101, 100, 20, 40));

        MatchResult result = matcher.match(
                List.of(detection("person", 0.8, new BoundingBox(100, 100, 20, 40))), List.of(far, near));

        assertThat(result.assignments().get(0).track()).isSameAs(near);
        assertThat(result.assignments().get(0).iou()).isGreaterThan(0.9);
    }

    @Test
    @DisplayName("Each track is assigned at most once")
    void shouldAssignEachTrackOnce() {
        BoundingBox box = new BoundingBox(50, 50, 10, 10);
        Track track = track(1, "person", 0.7, box);

        MatchResult result = matcher.match(
                List.of(detection("person", 0.9, box), detection("person", 0.8, box)), List.of(track));

        assertThat(result.assignments()).filteredOn(MatchResult.Assignment::isMatched).hasSize(1);
    }

    @Test
    @DisplayName("Threshold outside [0, 1] is rejected")
    void shouldRejectIllegalThreshold() {
        assertThatThrownBy(() -> new IouMatcher(1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new IouMatcher(-0.1)).isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Detection detection(String className, double confidence, BoundingBox box) {
        return Detection.of(className, confidence, box);
    }

    private static Track track(long id, String className, double confidence, BoundingBox box) {
        return new Track(id, detection(className, confidence, box));
    }
}

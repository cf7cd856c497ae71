package com.framestabilizer.core.tracking;

import com.framestabilizer.core.model.Detection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of matching one frame's detections against a source's tracks.
 *
 * <p>
 * Each track appears in at most one {@link Assignment}; tracks that received
 * none are listed in {@link #unmatchedTracks()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MatchResult {

    private final List<Assignment> assignments;
    private final List<Track> unmatchedTracks;

    public MatchResult(List<Assignment> assignments, List<Track> unmatchedTracks) {
        this.assignments = Collections.unmodifiableList(new ArrayList<>(assignments));
        this.unmatchedTracks = Collections.unmodifiableList(new ArrayList<>(unmatchedTracks));
    }

    /**
     * @return one entry per detection, in the order the matcher visited them
     */
    public List<Assignment> assignments() {
        return assignments;
    }

    /**
     * @return tracks with no detection this frame, in creation order
     */
    public List<Track> unmatchedTracks() {
        return unmatchedTracks;
    }

    /**
     * A detection paired with the track it matched, or with nothing.
     */
    public static final class Assignment {

        private final Detection detection;
        private final Track track;
        private final double iou;

        private Assignment(Detection detection, Track track, double iou) {
            this.detection = Objects.requireNonNull(detection, "detection must not be null");
            this.track = track;
            this.iou = iou;
        }

        public static Assignment matched(Detection detection, Track track, double iou) {
            return new Assignment(detection, Objects.requireNonNull(track, "track must not be null"), iou);
        }

        public static Assignment unmatched(Detection detection) {
            return new Assignment(detection, null, 0.0);
        }

        public Detection detection() {
            return detection;
        }

        /**
         * @return the matched track, or {@code null} for a new candidate
         */
        public Track track() {
            return track;
        }

        public double iou() {
            return iou;
        }

        public boolean isMatched() {
            return track != null;
        }

        @Override
        public String toString() {
            return isMatched()
                    ? "Assignment{" + detection.getClassName() + " -> track " + track.getId() + ", iou=" + iou + '}'
                    : "Assignment{" + detection.getClassName() + " -> new}";
        }
    }
}

package com.framestabilizer.core.tracking;

import com.framestabilizer.core.model.Detection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Greedy Intersection-over-Union matcher.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Visit detections in descending confidence (stable: equal confidences
 * keep their input order).</li>
 * <li>For each, compute IoU against every not-yet-matched track of the same
 * class.</li>
 * <li>Take the track with the highest IoU; on equal IoU the earliest-created
 * track wins.</li>
 * <li>Accept the pair only if that IoU is strictly greater than the
 * threshold.</li>
 * </ol>
 *
 * <p>
 * This is a deterministic approximation, not an optimal bipartite
 * assignment: a high-confidence detection may claim a track that a later
 * detection overlaps more.
 * </p>
 *
 * @since 1.0.0
 */
public class IouMatcher implements SpatialMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(IouMatcher.class);

    private static final Comparator<Detection> BY_CONFIDENCE_DESC =
            Comparator.comparingDouble((Detection d) -> d.getConfidence()).reversed();

    private final double iouThreshold;

    /**
     * @param iouThreshold minimum IoU (exclusive) for a match, in [0, 1]
     * @throws IllegalArgumentException if the threshold is out of range
     */
    public IouMatcher(double iouThreshold) {
        if (!Double.isFinite(iouThreshold) || iouThreshold < 0.0 || iouThreshold > 1.0) {
            throw new IllegalArgumentException("iouThreshold must be in [0, 1], got: " + iouThreshold);
        }
        this.iouThreshold = iouThreshold;
    }

    @Override
    public MatchResult match(List<Detection> detections, List<Track> tracks) {
        Objects.requireNonNull(detections, "detections must not be null");
        Objects.requireNonNull(tracks, "tracks must not be null");

        List<Detection> ordered = new ArrayList<>(detections);
        ordered.sort(BY_CONFIDENCE_DESC);

        Set<Long> claimed = new HashSet<>();
        List<MatchResult.Assignment> assignments = new ArrayList<>(ordered.size());

        for (Detection detection : ordered) {
            Track best = null;
            double bestIou = iouThreshold;

            for (Track track : tracks) {
                if (claimed.contains(track.getId())
                        || !track.getClassName().equals(detection.getClassName())) {
                    continue;
                }
                double iou = detection.getBoundingBox().iou(track.getBoundingBox());
                // strict: ties keep the earlier track
                if (iou > bestIou) {
                    bestIou = iou;
                    best = track;
                }
            }

            if (best != null) {
                claimed.add(best.getId());
                assignments.add(MatchResult.Assignment.matched(detection, best, bestIou));
                LOG.trace("Matched {} (conf={}) to track {} with IoU {}",
                        detection.getClassName(), detection.getConfidence(), best.getId(), bestIou);
            } else {
                assignments.add(MatchResult.Assignment.unmatched(detection));
            }
        }

        List<Track> unmatched = new ArrayList<>();
        for (Track track : tracks) {
            if (!claimed.contains(track.getId())) {
                unmatched.add(track);
            }
        }
        return new MatchResult(assignments, unmatched);
    }

    public double getIouThreshold() {
        return iouThreshold;
    }
}

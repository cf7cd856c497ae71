package com.framestabilizer.core.tracking;

import com.framestabilizer.core.model.Detection;

import java.util.List;

/**
 * Strategy that pairs a frame's raw detections with existing tracks.
 *
 * <p>
 * Implementations must assign each track at most one detection and each
 * detection at most one track, and must only pair a detection with a track
 * of the same class label. They must not mutate the tracks.
 * </p>
 *
 * @since 1.0.0
 */
public interface SpatialMatcher {

    /**
     * @param detections validated detections of one frame, unordered
     * @param tracks     the source's tracks in creation order
     * @return the assignment for this frame
     */
    MatchResult match(List<Detection> detections, List<Track> tracks);
}

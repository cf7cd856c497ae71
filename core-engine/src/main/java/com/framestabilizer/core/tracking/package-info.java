/**
 * Multi-object tracking primitives.
 *
 * <p>
 * {@link com.framestabilizer.core.tracking.TrackRegistry} owns every
 * {@link com.framestabilizer.core.tracking.Track}, partitioned per source.
 * Each frame a {@link com.framestabilizer.core.tracking.SpatialMatcher}
 * (by default {@link com.framestabilizer.core.tracking.IouMatcher}) pairs
 * detections with tracks, and the
 * {@link com.framestabilizer.core.tracking.TrackStateMachine} advances or
 * decays each track according to the
 * {@link com.framestabilizer.core.tracking.HysteresisPolicy}.
 * </p>
 *
 * <h3>Extending</h3>
 * <p>
 * Alternative matching strategies implement {@code SpatialMatcher} and are
 * passed to the stabilizer; the state machine is unaffected.
 * </p>
 *
 * @since 1.0.0
 */
package com.framestabilizer.core.tracking;

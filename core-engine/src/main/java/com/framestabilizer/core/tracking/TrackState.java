package com.framestabilizer.core.tracking;

/**
 * Lifecycle state of a {@link Track} while it is held in the registry.
 * Removal is not a state: a removed track simply leaves the registry.
 *
 * @since 1.0.0
 */
public enum TrackState {

    /** Accumulating consecutive matches, not yet emitted. */
    PROVISIONAL,

    /** Reached {@code minFrames}; emitted whenever matched. */
    CONFIRMED
}

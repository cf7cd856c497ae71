package com.framestabilizer.core.tracking;

/**
 * What happened to an existing track in one frame.
 *
 * @since 1.0.0
 */
public enum TrackOutcome {

    /** Matched and accepted; still provisional or already confirmed. */
    ADVANCED,

    /** Matched and accepted, and this match confirmed the track. */
    CONFIRMED,

    /** Matched but below the hysteresis threshold; treated as a miss. */
    REJECTED,

    /** No detection assigned this frame. */
    MISSED
}

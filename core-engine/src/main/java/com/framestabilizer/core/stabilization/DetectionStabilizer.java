package com.framestabilizer.core.stabilization;

import com.framestabilizer.core.config.StabilizationMode;
import com.framestabilizer.core.model.Detection;

import java.util.List;
import java.util.Set;

/**
 * Contract for detection stabilizers.
 *
 * <p>
 * Two callers use a stabilizer concurrently:
 * </p>
 * <ul>
 * <li>the frame path calls {@link #process(List, String)} once per frame and
 * never runs two frames of the same source at once;</li>
 * <li>the control path calls the toggle, reset and stats operations at any
 * time.</li>
 * </ul>
 * <p>
 * Implementations must be thread-safe for that usage. Composition with a
 * downstream sink is the caller's concern.
 * </p>
 *
 * @since 1.0.0
 */
public interface DetectionStabilizer {

    /**
     * Stabilize one frame of raw detections.
     *
     * <p>
     * While disabled this returns {@code detections} unchanged and touches no
     * state. Invalid detections are skipped and counted, never thrown.
     * </p>
     *
     * @param detections raw detections of the frame, in any order
     * @param sourceId   identifier of the stream the frame came from
     * @return stabilized detections; never more than the input size
     */
    List<Detection> process(List<Detection> detections, String sourceId);

    /** Resume stabilization with the tracks preserved from before. */
    void enable();

    /** Switch to pass-through without discarding any track. */
    void disable();

    /**
     * Flip the enabled flag.
     *
     * @return the new state, {@code true} if now enabled
     */
    boolean toggle();

    boolean isEnabled();

    /**
     * Discard every track of {@code sourceId}. Cumulative counters are kept;
     * see {@link #resetStats(String)}.
     */
    void reset(String sourceId);

    /** Discard every track of every source. Counters are kept. */
    void resetAll();

    /** Zero the cumulative counters of {@code sourceId}; tracks are kept. */
    void resetStats(String sourceId);

    /**
     * Snapshot the counters of {@code sourceId}. Never throws; unknown
     * sources report zeroes.
     */
    StabilizationStats getStats(String sourceId);

    /**
     * @return ids of every source seen so far
     */
    Set<String> knownSources();

    StabilizationMode mode();
}

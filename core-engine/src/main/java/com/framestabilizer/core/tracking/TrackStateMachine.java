package com.framestabilizer.core.tracking;

import com.framestabilizer.core.model.Detection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Applies one frame's match outcome to a track.
 *
 * <pre>
 *   (none) --conf &gt;= appear--&gt; PROVISIONAL --consecutive &gt;= minFrames--&gt; CONFIRMED
 *   any state --gap &gt; maxGap--&gt; removed (by the registry sweep)
 * </pre>
 *
 * <p>
 * A miss, or a match rejected by the {@link HysteresisPolicy}, increments the
 * gap only; {@code consecutiveFrames} is never reset, so a track that recovers
 * within the gap tolerance resumes where it left off.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrackStateMachine {

    private static final Logger LOG = LoggerFactory.getLogger(TrackStateMachine.class);

    private final int minFrames;
    private final HysteresisPolicy policy;

    /**
     * @param minFrames accepted matches needed to confirm; must be &gt;= 1
     * @param policy    confidence thresholds; must not be {@code null}
     */
    public TrackStateMachine(int minFrames, HysteresisPolicy policy) {
        if (minFrames < 1) {
            throw new IllegalArgumentException("minFrames must be >= 1, got: " + minFrames);
        }
        this.minFrames = minFrames;
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    /**
     * A detection was assigned to {@code track}.
     */
    public TrackOutcome onMatched(Track track, Detection detection) {
        double threshold = policy.threshold(track);
        if (detection.getConfidence() < threshold) {
            track.markMissed();
            LOG.debug("Track {} ({}) rejected match: conf={} < {} (gap={})",
                    track.getId(), track.getClassName(), detection.getConfidence(), threshold,
                    track.getGapFrames());
            return TrackOutcome.REJECTED;
        }

        track.absorb(detection);
        if (!track.isConfirmed() && track.getConsecutiveFrames() >= minFrames) {
            track.confirm();
            LOG.debug("Track {} ({}) confirmed after {} frames (avg_conf={})",
                    track.getId(), track.getClassName(), track.getConsecutiveFrames(),
                    track.averageConfidence());
            return TrackOutcome.CONFIRMED;
        }
        return TrackOutcome.ADVANCED;
    }

    /**
     * No detection was assigned to {@code track} this frame.
     */
    public TrackOutcome onMissed(Track track) {
        track.markMissed();
        return TrackOutcome.MISSED;
    }

    /**
     * A detection matched no track. Creates a provisional track if the
     * detection clears the appear threshold; with {@code minFrames == 1} the
     * new track is confirmed immediately.
     *
     * @param detection   the unmatched detection
     * @param idSupplier  source of the new track's id
     * @return the new track, or empty if the detection is discarded
     */
    public Optional<Track> spawn(Detection detection, LongSupplier idSupplier) {
        if (detection.getConfidence() < policy.appearThreshold()) {
            LOG.debug("Ignored detection: {} conf={} < {}",
                    detection.getClassName(), detection.getConfidence(), policy.appearThreshold());
            return Optional.empty();
        }

        Track track = new Track(idSupplier.getAsLong(), detection);
        if (track.getConsecutiveFrames() >= minFrames) {
            track.confirm();
        }
        LOG.debug("New track {}: {} conf={} state={} (needs {} frames)",
                track.getId(), track.getClassName(), track.getConfidence(), track.getState(), minFrames);
        return Optional.of(track);
    }

    public int getMinFrames() {
        return minFrames;
    }

    public HysteresisPolicy getPolicy() {
        return policy;
    }
}

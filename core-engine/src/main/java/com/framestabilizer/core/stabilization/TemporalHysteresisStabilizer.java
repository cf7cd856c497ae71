package com.framestabilizer.core.stabilization;

import com.framestabilizer.core.config.StabilizationConfig;
import com.framestabilizer.core.config.StabilizationMode;
import com.framestabilizer.core.model.Detection;
import com.framestabilizer.core.model.InvalidDetectionException;
import com.framestabilizer.core.tracking.HysteresisPolicy;
import com.framestabilizer.core.tracking.IouMatcher;
import com.framestabilizer.core.tracking.MatchResult;
import com.framestabilizer.core.tracking.SourceTracks;
import com.framestabilizer.core.tracking.SpatialMatcher;
import com.framestabilizer.core.tracking.Track;
import com.framestabilizer.core.tracking.TrackOutcome;
import com.framestabilizer.core.tracking.TrackRegistry;
import com.framestabilizer.core.tracking.TrackStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stabilizer combining temporal confirmation, confidence hysteresis and IoU
 * tracking.
 *
 * <h3>Per-frame algorithm</h3>
 * <ol>
 * <li>Skip (and count) detections that fail validation.</li>
 * <li>Match the remaining detections to the source's tracks with the
 * {@link SpatialMatcher}.</li>
 * <li>Matched tracks advance if the detection clears the hysteresis
 * threshold, otherwise they are treated as missed. Unmatched tracks are
 * missed.</li>
 * <li>Unmatched detections at or above {@code appearConfidence} open a new
 * provisional track; the rest are ignored.</li>
 * <li>Tracks whose gap exceeds {@code maxGap} are removed.</li>
 * <li>Confirmed tracks matched in this frame are emitted, in creation
 * order.</li>
 * </ol>
 *
 * <p>
 * Example ({@code minFrames=3, maxGap=2, appear=0.5, persist=0.3}):
 * </p>
 *
 * <pre>
 * frame 1: person 0.45 → ignored (&lt; appear)
 * frame 2: person 0.55 → provisional, 1/3
 * frame 3: person 0.52 → provisional, 2/3
 * frame 4: person 0.58 → confirmed, emitted
 * frame 5: person 0.35 → emitted (&gt;= persist)
 * frame 6-7: nothing  → gap 1, 2; kept, not emitted
 * frame 8: nothing    → gap 3 &gt; 2, removed
 * </pre>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The enabled flag is an {@link AtomicBoolean} read once at the top of
 * {@link #process(List, String)}, so a disabled stabilizer never takes a
 * lock. Each source's tracks and counters are guarded by that source's lock;
 * one frame, one reset or one stats snapshot is a single critical section.
 * Different sources never contend.
 * </p>
 *
 * @since 1.0.0
 */
public class TemporalHysteresisStabilizer implements DetectionStabilizer {

    private static final Logger LOG = LoggerFactory.getLogger(TemporalHysteresisStabilizer.class);

    private final StabilizationConfig config;
    private final SpatialMatcher matcher;
    private final TrackStateMachine stateMachine;
    private final TrackRegistry registry = new TrackRegistry();
    private final AtomicBoolean enabled = new AtomicBoolean(true);

    /**
     * Create a stabilizer with the default {@link IouMatcher}.
     *
     * @param config stabilization parameters; must not be {@code null}
     * @throws com.framestabilizer.core.config.InvalidConfigException if the
     *                                                               config is
     *                                                               invalid
     */
    public TemporalHysteresisStabilizer(StabilizationConfig config) {
        this(config, null);
    }

    /**
     * @param config  stabilization parameters; must not be {@code null}
     * @param matcher matching strategy, or {@code null} for an
     *                {@link IouMatcher} built from the config
     * @throws com.framestabilizer.core.config.InvalidConfigException if the
     *                                                               config is
     *                                                               invalid
     */
    public TemporalHysteresisStabilizer(StabilizationConfig config, SpatialMatcher matcher) {
        Objects.requireNonNull(config, "StabilizationConfig must not be null");
        config.validate();

        this.config = config;
        this.matcher = matcher != null ? matcher : new IouMatcher(config.getIouThreshold());
        this.stateMachine = new TrackStateMachine(config.getMinFrames(),
                new HysteresisPolicy(config.getAppearConfidence(), config.getPersistConfidence()));

        LOG.info("TemporalHysteresisStabilizer initialized: minFrames={}, maxGap={}, "
                        + "appearConfidence={}, persistConfidence={}, iouThreshold={}, matcher={}",
                config.getMinFrames(), config.getMaxGap(), config.getAppearConfidence(),
                config.getPersistConfidence(), config.getIouThreshold(),
                this.matcher.getClass().getSimpleName());
    }

    // ---------------------------------------------------------------
    // Frame path
    // ---------------------------------------------------------------

    @Override
    public List<Detection> process(List<Detection> detections, String sourceId) {
        if (!enabled.get()) {
            return detections;
        }
        Objects.requireNonNull(detections, "detections must not be null");
        Objects.requireNonNull(sourceId, "sourceId must not be null");

        List<Detection> valid = new ArrayList<>(detections.size());
        int invalid = 0;
        for (Detection detection : detections) {
            try {
                if (detection == null) {
                    throw new InvalidDetectionException("Detection is null");
                }
                detection.validate();
                valid.add(detection);
            } catch (InvalidDetectionException e) {
                invalid++;
                LOG.warn("Source [{}]: skipping invalid detection – {}", sourceId, e.getMessage());
            }
        }

        SourceTracks source = registry.acquire(sourceId);
        source.lock().lock();
        try {
            return processFrame(source, valid, invalid);
        } finally {
            source.lock().unlock();
        }
    }

    private List<Detection> processFrame(SourceTracks source, List<Detection> valid, int invalid) {
        source.recordInvalid(invalid);
        source.recordDetected(valid.size());

        List<Track> tracks = source.tracks();
        for (Track track : tracks) {
            track.beginFrame();
        }

        MatchResult result = matcher.match(valid, tracks);

        for (MatchResult.Assignment assignment : result.assignments()) {
            if (assignment.isMatched()) {
                TrackOutcome outcome = stateMachine.onMatched(assignment.track(), assignment.detection());
                if (outcome == TrackOutcome.CONFIRMED) {
                    source.recordConfirmed();
                } else if (outcome == TrackOutcome.REJECTED) {
                    source.recordIgnored();
                }
            } else {
                Optional<Track> spawned = stateMachine.spawn(assignment.detection(), source::nextTrackId);
                if (spawned.isPresent()) {
                    source.add(spawned.get());
                    if (spawned.get().isConfirmed()) {
                        source.recordConfirmed();
                    }
                } else {
                    source.recordIgnored();
                }
            }
        }

        for (Track track : result.unmatchedTracks()) {
            stateMachine.onMissed(track);
        }

        int removed = source.removeExpired(config.getMaxGap());
        if (removed > 0) {
            source.recordRemoved(removed);
            LOG.debug("Source [{}]: removed {} expired track(s) (gap > {})",
                    source.getSourceId(), removed, config.getMaxGap());
        }

        List<Detection> stabilized = new ArrayList<>();
        for (Track track : source.tracks()) {
            if (track.isEmittable()) {
                stabilized.add(track.toDetection());
            }
        }

        LOG.debug("Source [{}]: {} raw ({} invalid) → {} stabilized (active_tracks={})",
                source.getSourceId(), valid.size() + invalid, invalid, stabilized.size(),
                source.activeTrackCount());
        return stabilized;
    }

    // ---------------------------------------------------------------
    // Control path
    // ---------------------------------------------------------------

    @Override
    public void enable() {
        if (enabled.compareAndSet(false, true)) {
            LOG.info("Detection stabilization enabled");
        }
    }

    @Override
    public void disable() {
        if (enabled.compareAndSet(true, false)) {
            LOG.info("Detection stabilization disabled (pass-through, tracks preserved)");
        }
    }

    @Override
    public boolean toggle() {
        boolean previous;
        do {
            previous = enabled.get();
        } while (!enabled.compareAndSet(previous, !previous));
        LOG.info("Detection stabilization toggled: {}", !previous ? "enabled" : "disabled");
        return !previous;
    }

    @Override
    public boolean isEnabled() {
        return enabled.get();
    }

    @Override
    public void reset(String sourceId) {
        registry.find(sourceId).ifPresent(source -> {
            source.lock().lock();
            try {
                int cleared = source.clearTracks();
                LOG.info("Stabilization tracks reset for source [{}] ({} track(s) discarded)",
                        sourceId, cleared);
            } finally {
                source.lock().unlock();
            }
        });
    }

    @Override
    public void resetAll() {
        for (String sourceId : registry.sourceIds()) {
            reset(sourceId);
        }
        LOG.info("All stabilization tracks reset");
    }

    @Override
    public void resetStats(String sourceId) {
        registry.find(sourceId).ifPresent(source -> {
            source.lock().lock();
            try {
                source.resetCounters();
                LOG.info("Stabilization stats reset for source [{}]", sourceId);
            } finally {
                source.lock().unlock();
            }
        });
    }

    @Override
    public StabilizationStats getStats(String sourceId) {
        Optional<SourceTracks> found = registry.find(sourceId);
        if (found.isEmpty()) {
            return StabilizationStats.empty(sourceId, mode(), enabled.get());
        }

        SourceTracks source = found.get();
        source.lock().lock();
        try {
            return StabilizationStats.builder()
                    .sourceId(sourceId)
                    .mode(mode())
                    .enabled(enabled.get())
                    .totalDetected(source.getTotalDetected())
                    .totalConfirmed(source.getTotalConfirmed())
                    .totalIgnored(source.getTotalIgnored())
                    .totalRemoved(source.getTotalRemoved())
                    .totalInvalid(source.getTotalInvalid())
                    .activeTracks(source.activeTrackCount())
                    .tracksByClass(source.trackCountsByClass())
                    .build();
        } finally {
            source.lock().unlock();
        }
    }

    @Override
    public Set<String> knownSources() {
        return registry.sourceIds();
    }

    @Override
    public StabilizationMode mode() {
        return StabilizationMode.TEMPORAL;
    }

    public StabilizationConfig getConfig() {
        return config;
    }
}

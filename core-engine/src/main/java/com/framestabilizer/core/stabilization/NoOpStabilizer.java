package com.framestabilizer.core.stabilization;

import com.framestabilizer.core.config.StabilizationMode;
import com.framestabilizer.core.model.Detection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pass-through stabilizer used when the configured mode is
 * {@link StabilizationMode#NONE}.
 *
 * <p>
 * Every frame is returned unchanged. The enabled flag is tracked so the
 * control path reports a consistent state, but it has no effect on output.
 * Stats are always zero.
 * </p>
 *
 * @since 1.0.0
 */
public class NoOpStabilizer implements DetectionStabilizer {

    private static final Logger LOG = LoggerFactory.getLogger(NoOpStabilizer.class);

    private final AtomicBoolean enabled = new AtomicBoolean(true);

    @Override
    public List<Detection> process(List<Detection> detections, String sourceId) {
        return detections;
    }

    @Override
    public void enable() {
        enabled.set(true);
    }

    @Override
    public void disable() {
        enabled.set(false);
    }

    @Override
    public boolean toggle() {
        boolean previous;
        do {
            previous = enabled.get();
        } while (!enabled.compareAndSet(previous, !previous));
        LOG.info("Stabilization mode is NONE; toggle has no effect on output (enabled={})", !previous);
        return !previous;
    }

    @Override
    public boolean isEnabled() {
        return enabled.get();
    }

    @Override
    public void reset(String sourceId) {
        // nothing tracked
    }

    @Override
    public void resetAll() {
        // nothing tracked
    }

    @Override
    public void resetStats(String sourceId) {
        // nothing counted
    }

    @Override
    public StabilizationStats getStats(String sourceId) {
        return StabilizationStats.empty(sourceId, StabilizationMode.NONE, enabled.get());
    }

    @Override
    public Set<String> knownSources() {
        return Collections.emptySet();
    }

    @Override
    public StabilizationMode mode() {
        return StabilizationMode.NONE;
    }
}

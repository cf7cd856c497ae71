package com.framestabilizer.core.stabilization;

import com.framestabilizer.core.config.StabilizationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Factory that creates the {@link DetectionStabilizer} matching a
 * {@link StabilizationConfig}'s mode.
 *
 * <p>
 * This is the single point of extension when adding new stabilization modes:
 * add the constant to {@link com.framestabilizer.core.config.StabilizationMode}
 * and map it to an implementation here.
 * </p>
 *
 * @since 1.0.0
 */
public final class StabilizerFactory {

    private static final Logger LOG = LoggerFactory.getLogger(StabilizerFactory.class);

    private StabilizerFactory() {
        // utility class — not instantiable
    }

    /**
     * Create a stabilizer for the given configuration.
     *
     * @param config stabilization parameters; must not be {@code null}
     * @return a new, enabled stabilizer
     * @throws NullPointerException if {@code config} is {@code null}
     * @throws com.framestabilizer.core.config.InvalidConfigException if the
     *                                                               config is
     *                                                               invalid
     */
    public static DetectionStabilizer create(StabilizationConfig config) {
        Objects.requireNonNull(config, "StabilizationConfig must not be null");
        config.validate();

        LOG.info("Creating detection stabilizer for mode={}", config.getMode());
        return switch (config.getMode()) {
            case NONE -> new NoOpStabilizer();
            case TEMPORAL -> new TemporalHysteresisStabilizer(config);
        };
    }
}

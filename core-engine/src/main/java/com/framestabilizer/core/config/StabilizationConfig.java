package com.framestabilizer.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable tuning parameters of the stabilization engine.
 *
 * <ul>
 * <li>{@code minFrames} — consecutive accepted matches required before a
 * track is confirmed (&ge; 1)</li>
 * <li>{@code maxGap} — consecutive missed frames a track survives; it is
 * removed once its gap exceeds this value (&ge; 0)</li>
 * <li>{@code appearConfidence} — confidence needed to create a track or to
 * advance a provisional one</li>
 * <li>{@code persistConfidence} — confidence needed to keep a confirmed track
 * alive; must not exceed {@code appearConfidence}</li>
 * <li>{@code iouThreshold} — an IoU strictly above this value counts as the
 * same object</li>
 * </ul>
 *
 * <h3>Construction</h3>
 * <p>
 * The {@link Builder} does not validate, so that callers can represent and
 * reject bad input. Consumers call {@link #validate()}; the config loader and
 * the stabilizer constructor both do.
 * </p>
 *
 * @since 1.0.0
 */
public final class StabilizationConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_MIN_FRAMES = 3;
    public static final int DEFAULT_MAX_GAP = 2;
    public static final double DEFAULT_APPEAR_CONFIDENCE = 0.5;
    public static final double DEFAULT_PERSIST_CONFIDENCE = 0.3;
    public static final double DEFAULT_IOU_THRESHOLD = 0.3;

    private final StabilizationMode mode;
    private final int minFrames;
    private final int maxGap;
    private final double appearConfidence;
    private final double persistConfidence;
    private final double iouThreshold;

    private StabilizationConfig(Builder b) {
        this.mode = b.mode;
        this.minFrames = b.minFrames;
        this.maxGap = b.maxGap;
        this.appearConfidence = b.appearConfidence;
        this.persistConfidence = b.persistConfidence;
        this.iouThreshold = b.iouThreshold;
    }

    /**
     * @return a temporal configuration with all defaults
     */
    public static StabilizationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Check every constraint and report all violations at once.
     *
     * @throws InvalidConfigException if any constraint is violated
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (mode == null) {
            errors.add("'mode' is required");
        }
        if (minFrames < 1) {
            errors.add("'minFrames' must be >= 1, got: " + minFrames);
        }
        if (maxGap < 0) {
            errors.add("'maxGap' must be >= 0, got: " + maxGap);
        }
        checkUnitInterval(errors, "appearConfidence", appearConfidence);
        checkUnitInterval(errors, "persistConfidence", persistConfidence);
        checkUnitInterval(errors, "iouThreshold", iouThreshold);
        if (persistConfidence > appearConfidence) {
            errors.add("'persistConfidence' (" + persistConfidence
                    + ") must be <= 'appearConfidence' (" + appearConfidence + ")");
        }

        if (!errors.isEmpty()) {
            throw new InvalidConfigException(
                    "Invalid StabilizationConfig: " + String.join("; ", errors));
        }
    }

    private static void checkUnitInterval(List<String> errors, String name, double value) {
        if (!Double.isFinite(value) || value < 0.0 || value > 1.0) {
            errors.add("'" + name + "' must be in [0.0, 1.0], got: " + value);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public StabilizationMode getMode() {
        return mode;
    }

    public int getMinFrames() {
        return minFrames;
    }

    public int getMaxGap() {
        return maxGap;
    }

    public double getAppearConfidence() {
        return appearConfidence;
    }

    public double getPersistConfidence() {
        return persistConfidence;
    }

    public double getIouThreshold() {
        return iouThreshold;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder pre-populated with the defaults.
     */
    public static class Builder {
        private StabilizationMode mode = StabilizationMode.TEMPORAL;
        private int minFrames = DEFAULT_MIN_FRAMES;
        private int maxGap = DEFAULT_MAX_GAP;
        private double appearConfidence = DEFAULT_APPEAR_CONFIDENCE;
        private double persistConfidence = DEFAULT_PERSIST_CONFIDENCE;
        private double iouThreshold = DEFAULT_IOU_THRESHOLD;

        public Builder mode(StabilizationMode v) {
            this.mode = v;
            return this;
        }

        public Builder minFrames(int v) {
            this.minFrames = v;
            return this;
        }

        public Builder maxGap(int v) {
            this.maxGap = v;
            return this;
        }

        public Builder appearConfidence(double v) {
            this.appearConfidence = v;
            return this;
        }

        public Builder persistConfidence(double v) {
            this.persistConfidence = v;
            return this;
        }

        public Builder iouThreshold(double v) {
            this.iouThreshold = v;
            return this;
        }

        public StabilizationConfig build() {
            return new StabilizationConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StabilizationConfig that))
            return false;
        return mode == that.mode
                && minFrames == that.minFrames
                && maxGap == that.maxGap
                && Double.compare(appearConfidence, that.appearConfidence) == 0
                && Double.compare(persistConfidence, that.persistConfidence) == 0
                && Double.compare(iouThreshold, that.iouThreshold) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, minFrames, maxGap, appearConfidence, persistConfidence, iouThreshold);
    }

    @Override
    public String toString() {
        return "StabilizationConfig{" +
                "mode=" + mode +
                ", minFrames=" + minFrames +
                ", maxGap=" + maxGap +
                ", appearConfidence=" + appearConfidence +
                ", persistConfidence=" + persistConfidence +
                ", iouThreshold=" + iouThreshold +
                '}';
    }
}

package com.framestabilizer.core.config;

import java.io.Serializable;

/**
 * Top-level POJO for the stabilization YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * mode: temporal
 * temporal:
 *   minFrames: 3
 *   maxGap: 2
 * hysteresis:
 *   appearConfidence: 0.5
 *   persistConfidence: 0.3
 * iou:
 *   threshold: 0.3
 * </pre>
 *
 * <p>
 * Omitted sections keep their defaults. Call {@link #toConfig()} to obtain
 * the validated, immutable {@link StabilizationConfig}.
 * </p>
 *
 * @since 1.0.0
 */
public class StabilizationSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private String mode = "temporal";
    private Temporal temporal = new Temporal();
    private Hysteresis hysteresis = new Hysteresis();
    private Iou iou = new Iou();

    /**
     * Convert to an immutable configuration and validate it.
     *
     * @return validated configuration
     * @throws InvalidConfigException if the mode is unknown or any value is
     *                                out of range
     */
    public StabilizationConfig toConfig() {
        StabilizationConfig config = StabilizationConfig.builder()
                .mode(StabilizationMode.fromString(mode))
                .minFrames(temporal.getMinFrames())
                .maxGap(temporal.getMaxGap())
                .appearConfidence(hysteresis.getAppearConfidence())
                .persistConfidence(hysteresis.getPersistConfidence())
                .iouThreshold(iou.getThreshold())
                .build();
        config.validate();
        return config;
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public Temporal getTemporal() {
        return temporal;
    }

    public void setTemporal(Temporal temporal) {
        this.temporal = temporal != null ? temporal : new Temporal();
    }

    public Hysteresis getHysteresis() {
        return hysteresis;
    }

    public void setHysteresis(Hysteresis hysteresis) {
        this.hysteresis = hysteresis != null ? hysteresis : new Hysteresis();
    }

    public Iou getIou() {
        return iou;
    }

    public void setIou(Iou iou) {
        this.iou = iou != null ? iou : new Iou();
    }

    @Override
    public String toString() {
        return "StabilizationSettings{mode='" + mode + "', temporal=" + temporal
                + ", hysteresis=" + hysteresis + ", iou=" + iou + '}';
    }

    // ---------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------

    /** Temporal filtering parameters. */
    public static class Temporal implements Serializable {

        private static final long serialVersionUID = 1L;

        private int minFrames = StabilizationConfig.DEFAULT_MIN_FRAMES;
        private int maxGap = StabilizationConfig.DEFAULT_MAX_GAP;

        public int getMinFrames() {
            return minFrames;
        }

        public void setMinFrames(int minFrames) {
            this.minFrames = minFrames;
        }

        public int getMaxGap() {
            return maxGap;
        }

        public void setMaxGap(int maxGap) {
            this.maxGap = maxGap;
        }

        @Override
        public String toString() {
            return "{minFrames=" + minFrames + ", maxGap=" + maxGap + '}';
        }
    }

    /** Confidence hysteresis parameters. */
    public static class Hysteresis implements Serializable {

        private static final long serialVersionUID = 1L;

        private double appearConfidence = StabilizationConfig.DEFAULT_APPEAR_CONFIDENCE;
        private double persistConfidence = StabilizationConfig.DEFAULT_PERSIST_CONFIDENCE;

        public double getAppearConfidence() {
            return appearConfidence;
        }

        public void setAppearConfidence(double appearConfidence) {
            this.appearConfidence = appearConfidence;
        }

        public double getPersistConfidence() {
            return persistConfidence;
        }

        public void setPersistConfidence(double persistConfidence) {
            this.persistConfidence = persistConfidence;
        }

        @Override
        public String toString() {
            return "{appearConfidence=" + appearConfidence + ", persistConfidence=" + persistConfidence + '}';
        }
    }

    /** Spatial matching parameters. */
    public static class Iou implements Serializable {

        private static final long serialVersionUID = 1L;

        private double threshold = StabilizationConfig.DEFAULT_IOU_THRESHOLD;

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        @Override
        public String toString() {
            return "{threshold=" + threshold + '}';
        }
    }
}

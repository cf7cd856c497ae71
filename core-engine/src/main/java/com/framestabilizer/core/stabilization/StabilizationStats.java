package com.framestabilizer.core.stabilization;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.framestabilizer.core.config.StabilizationMode;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only snapshot of one source's stabilization counters.
 *
 * <p>
 * Counters are cumulative since the source was first seen (or since the last
 * {@link DetectionStabilizer#resetStats(String)}); {@code activeTracks} and
 * {@code tracksByClass} describe the registry at snapshot time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"source_id", "mode", "enabled", "total_detected", "total_confirmed",
        "total_ignored", "total_removed", "total_invalid", "active_tracks", "confirm_ratio",
        "tracks_by_class"})
public final class StabilizationStats implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String sourceId;
    private final StabilizationMode mode;
    private final boolean enabled;
    private final long totalDetected;
    private final long totalConfirmed;
    private final long totalIgnored;
    private final long totalRemoved;
    private final long totalInvalid;
    private final int activeTracks;
    private final Map<String, Integer> tracksByClass;

    private StabilizationStats(Builder b) {
        this.sourceId = b.sourceId;
        this.mode = b.mode;
        this.enabled = b.enabled;
        this.totalDetected = b.totalDetected;
        this.totalConfirmed = b.totalConfirmed;
        this.totalIgnored = b.totalIgnored;
        this.totalRemoved = b.totalRemoved;
        this.totalInvalid = b.totalInvalid;
        this.activeTracks = b.activeTracks;
        this.tracksByClass = Collections.unmodifiableMap(new LinkedHashMap<>(b.tracksByClass));
    }

    /**
     * Zeroed snapshot, used for unknown or empty sources.
     */
    public static StabilizationStats empty(String sourceId, StabilizationMode mode, boolean enabled) {
        return builder().sourceId(sourceId).mode(mode).enabled(enabled).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonProperty("source_id")
    public String getSourceId() {
        return sourceId;
    }

    @JsonProperty("mode")
    public StabilizationMode getMode() {
        return mode;
    }

    @JsonProperty("enabled")
    public boolean isEnabled() {
        return enabled;
    }

    @JsonProperty("total_detected")
    public long getTotalDetected() {
        return totalDetected;
    }

    @JsonProperty("total_confirmed")
    public long getTotalConfirmed() {
        return totalConfirmed;
    }

    @JsonProperty("total_ignored")
    public long getTotalIgnored() {
        return totalIgnored;
    }

    @JsonProperty("total_removed")
    public long getTotalRemoved() {
        return totalRemoved;
    }

    @JsonProperty("total_invalid")
    public long getTotalInvalid() {
        return totalInvalid;
    }

    @JsonProperty("active_tracks")
    public int getActiveTracks() {
        return activeTracks;
    }

    @JsonProperty("tracks_by_class")
    public Map<String, Integer> getTracksByClass() {
        return tracksByClass;
    }

    /**
     * @return {@code totalConfirmed / totalDetected}, or 0.0 before any
     *         detection was seen
     */
    @JsonProperty("confirm_ratio")
    public double getConfirmRatio() {
        return totalDetected > 0 ? (double) totalConfirmed / totalDetected : 0.0;
    }

    /**
     * Fluent builder for {@link StabilizationStats}.
     */
    public static class Builder {
        private String sourceId;
        private StabilizationMode mode = StabilizationMode.TEMPORAL;
        private boolean enabled = true;
        private long totalDetected;
        private long totalConfirmed;
        private long totalIgnored;
        private long totalRemoved;
        private long totalInvalid;
        private int activeTracks;
        private Map<String, Integer> tracksByClass = Collections.emptyMap();

        public Builder sourceId(String v) {
            this.sourceId = v;
            return this;
        }

        public Builder mode(StabilizationMode v) {
            this.mode = v;
            return this;
        }

        public Builder enabled(boolean v) {
            this.enabled = v;
            return this;
        }

        public Builder totalDetected(long v) {
            this.totalDetected = v;
            return this;
        }

        public Builder totalConfirmed(long v) {
            this.totalConfirmed = v;
            return this;
        }

        public Builder totalIgnored(long v) {
            this.totalIgnored = v;
            return this;
        }

        public Builder totalRemoved(long v) {
            this.totalRemoved = v;
            return this;
        }

        public Builder totalInvalid(long v) {
            this.totalInvalid = v;
            return this;
        }

        public Builder activeTracks(int v) {
            this.activeTracks = v;
            return this;
        }

        public Builder tracksByClass(Map<String, Integer> v) {
            this.tracksByClass = v != null ? v : Collections.emptyMap();
            return this;
        }

        public StabilizationStats build() {
            return new StabilizationStats(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StabilizationStats that))
            return false;
        return enabled == that.enabled
                && totalDetected == that.totalDetected
                && totalConfirmed == that.totalConfirmed
                && totalIgnored == that.totalIgnored
                && totalRemoved == that.totalRemoved
                && totalInvalid == that.totalInvalid
                && activeTracks == that.activeTracks
                && Objects.equals(sourceId, that.sourceId)
                && mode == that.mode
                && Objects.equals(tracksByClass, that.tracksByClass);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, mode, enabled, totalDetected, totalConfirmed, totalIgnored,
                totalRemoved, totalInvalid, activeTracks, tracksByClass);
    }

    @Override
    public String toString() {
        return "StabilizationStats{" +
                "sourceId='" + sourceId + '\'' +
                ", mode=" + mode +
                ", enabled=" + enabled +
                ", totalDetected=" + totalDetected +
                ", totalConfirmed=" + totalConfirmed +
                ", totalIgnored=" + totalIgnored +
                ", totalRemoved=" + totalRemoved +
                ", totalInvalid=" + totalInvalid +
                ", activeTracks=" + activeTracks +
                ", confirmRatio=" + String.format("%.3f", getConfirmRatio()) +
                ", tracksByClass=" + tracksByClass +
                '}';
    }
}

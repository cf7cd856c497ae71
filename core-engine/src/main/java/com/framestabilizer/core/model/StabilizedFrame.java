package com.framestabilizer.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of stabilizing one {@link DetectionFrame}, forwarded to downstream
 * consumers (publishers, visualizers).
 *
 * @since 1.0.0
 */
public class StabilizedFrame implements Serializable {

    private static final long serialVersionUID = 1L;

    private String sourceId;
    private long frameId;
    private Instant timestamp;

    /** Number of raw detections that entered the stabilizer. */
    private int rawCount;

    private List<Detection> detections = new ArrayList<>();

    /** No-arg constructor required by Jackson. */
    public StabilizedFrame() {
    }

    /**
     * Build the output frame for {@code input}, carrying over its identity.
     *
     * @param input      the raw frame; must not be {@code null}
     * @param stabilized detections returned by the stabilizer
     * @return a new stabilized frame
     */
    public static StabilizedFrame of(DetectionFrame input, List<Detection> stabilized) {
        Objects.requireNonNull(input, "input frame must not be null");
        StabilizedFrame frame = new StabilizedFrame();
        frame.setSourceId(input.getSourceId());
        frame.setFrameId(input.getFrameId());
        frame.setTimestamp(input.getTimestamp());
        frame.setRawCount(input.getDetections().size());
        frame.setDetections(stabilized);
        return frame;
    }

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId;
    }

    public long getFrameId() {
        return frameId;
    }

    public void setFrameId(long frameId) {
        this.frameId = frameId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public int getRawCount() {
        return rawCount;
    }

    public void setRawCount(int rawCount) {
        this.rawCount = rawCount;
    }

    public List<Detection> getDetections() {
        return Collections.unmodifiableList(detections);
    }

    public void setDetections(List<Detection> detections) {
        this.detections = detections != null ? new ArrayList<>(detections) : new ArrayList<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StabilizedFrame that))
            return false;
        return frameId == that.frameId
                && rawCount == that.rawCount
                && Objects.equals(sourceId, that.sourceId)
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(detections, that.detections);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, frameId, timestamp, rawCount, detections);
    }

    @Override
    public String toString() {
        return "StabilizedFrame{" +
                "sourceId='" + sourceId + '\'' +
                ", frameId=" + frameId +
                ", rawCount=" + rawCount +
                ", stabilized=" + detections.size() +
                '}';
    }
}

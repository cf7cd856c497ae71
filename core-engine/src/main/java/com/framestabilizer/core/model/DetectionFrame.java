package com.framestabilizer.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One frame's worth of raw detections from a single source (e.g. a camera).
 *
 * <p>
 * Wire format published by the perception pipeline:
 * </p>
 *
 * <pre>
 * {"sourceId": "cam-1", "frameId": 42, "timestamp": "2024-05-01T10:00:00Z",
 *  "detections": [{"class": "person", "confidence": 0.7, ...}]}
 * </pre>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe; owned by one pipeline stage at a time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DetectionFrame implements Serializable {

    private static final long serialVersionUID = 1L;

    private String sourceId;
    private long frameId;
    private Instant timestamp;
    private List<Detection> detections = new ArrayList<>();

    /** No-arg constructor required by Jackson. */
    public DetectionFrame() {
    }

    public DetectionFrame(String sourceId, long frameId, Instant timestamp, List<Detection> detections) {
        this.sourceId = sourceId;
        this.frameId = frameId;
        this.timestamp = timestamp;
        setDetections(detections);
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

    /**
     * @return unmodifiable view of the raw detections
     */
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
        if (!(o instanceof DetectionFrame that))
            return false;
        return frameId == that.frameId
                && Objects.equals(sourceId, that.sourceId)
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(detections, that.detections);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, frameId, timestamp, detections);
    }

    @Override
    public String toString() {
        return "DetectionFrame{" +
                "sourceId='" + sourceId + '\'' +
                ", frameId=" + frameId +
                ", timestamp=" + timestamp +
                ", detections=" + detections.size() +
                '}';
    }
}

package com.framestabilizer.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * A single object detection for one frame.
 *
 * <p>
 * Raw detections come from the perception model and carry no identity.
 * Stabilized detections produced by the engine additionally carry a
 * {@link TrackInfo}. The JSON form is flat, matching the model output:
 * </p>
 *
 * <pre>
 * {"class": "person", "confidence": 0.62, "x": 0.5, "y": 0.4,
 *  "width": 0.2, "height": 0.35, "class_id": 0}
 * </pre>
 *
 * <p>
 * Instances are immutable. Fields may be {@code null} when deserialized from
 * untrusted input; call {@link #validate()} before relying on them.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Detection implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String className;
    private final Double confidence;
    private final BoundingBox boundingBox;
    private final Integer classId;
    private final TrackInfo trackInfo;

    private Detection(Builder builder) {
        this.className = builder.className;
        this.confidence = builder.confidence;
        this.boundingBox = builder.boundingBox;
        this.classId = builder.classId;
        this.trackInfo = builder.trackInfo;
    }

    /**
     * Jackson entry point. A bounding box is only materialised when all four
     * coordinates are present.
     */
    @JsonCreator
    static Detection fromJson(@JsonProperty("class") String className,
            @JsonProperty("confidence") Double confidence,
            @JsonProperty("x") Double x,
            @JsonProperty("y") Double y,
            @JsonProperty("width") Double width,
            @JsonProperty("height") Double height,
            @JsonProperty("class_id") Integer classId,
            @JsonProperty("_stabilization") TrackInfo trackInfo) {
        BoundingBox box = (x != null && y != null && width != null && height != null)
                ? new BoundingBox(x, y, width, height)
                : null;
        return builder()
                .className(className)
                .confidence(confidence)
                .boundingBox(box)
                .classId(classId)
                .trackInfo(trackInfo)
                .build();
    }

    /**
     * Convenience factory for a raw detection.
     */
    public static Detection of(String className, double confidence, BoundingBox boundingBox) {
        return builder().className(className).confidence(confidence).boundingBox(boundingBox).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy of this detection with the given tracking metadata.
     */
    public Detection withTrackInfo(TrackInfo info) {
        return toBuilder().trackInfo(info).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .className(className)
                .confidence(confidence)
                .boundingBox(boundingBox)
                .classId(classId)
                .trackInfo(trackInfo);
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Verify that the label, confidence and bounding box are present and
     * legal.
     *
     * @throws InvalidDetectionException describing the first violation found
     */
    public void validate() {
        if (className == null || className.isBlank()) {
            throw new InvalidDetectionException("Detection is missing its class label");
        }
        if (confidence == null) {
            throw new InvalidDetectionException("Detection '" + className + "' is missing its confidence");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new InvalidDetectionException("Detection '" + className
                    + "' has confidence outside [0, 1]: " + confidence);
        }
        if (boundingBox == null) {
            throw new InvalidDetectionException("Detection '" + className + "' is missing its bounding box");
        }
        if (!boundingBox.isWellFormed()) {
            throw new InvalidDetectionException("Detection '" + className
                    + "' has a malformed bounding box: " + boundingBox);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("class")
    public String getClassName() {
        return className;
    }

    /**
     * @return the confidence, or {@code null} when absent from the input
     */
    @JsonProperty("confidence")
    public Double getConfidence() {
        return confidence;
    }

    @JsonIgnore
    public BoundingBox getBoundingBox() {
        return boundingBox;
    }

    @JsonProperty("x")
    Double jsonX() {
        return boundingBox != null ? boundingBox.getX() : null;
    }

    @JsonProperty("y")
    Double jsonY() {
        return boundingBox != null ? boundingBox.getY() : null;
    }

    @JsonProperty("width")
    Double jsonWidth() {
        return boundingBox != null ? boundingBox.getWidth() : null;
    }

    @JsonProperty("height")
    Double jsonHeight() {
        return boundingBox != null ? boundingBox.getHeight() : null;
    }

    @JsonProperty("class_id")
    public Integer getClassId() {
        return classId;
    }

    /**
     * @return tracking metadata, or {@code null} for raw detections
     */
    @JsonProperty("_stabilization")
    public TrackInfo getTrackInfo() {
        return trackInfo;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link Detection}. Performs no validation so that
     * malformed input can be represented and rejected by the engine.
     */
    public static class Builder {
        private String className;
        private Double confidence;
        private BoundingBox boundingBox;
        private Integer classId;
        private TrackInfo trackInfo;

        public Builder className(String className) {
            this.className = className;
            return this;
        }

        public Builder confidence(Double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder boundingBox(BoundingBox boundingBox) {
            this.boundingBox = boundingBox;
            return this;
        }

        public Builder classId(Integer classId) {
            this.classId = classId;
            return this;
        }

        public Builder trackInfo(TrackInfo trackInfo) {
            this.trackInfo = trackInfo;
            return this;
        }

        public Detection build() {
            return new Detection(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Detection that))
            return false;
        return Objects.equals(className, that.className)
                && Objects.equals(confidence, that.confidence)
                && Objects.equals(boundingBox, that.boundingBox)
                && Objects.equals(classId, that.classId)
                && Objects.equals(trackInfo, that.trackInfo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(className, confidence, boundingBox, classId, trackInfo);
    }

    @Override
    public String toString() {
        return "Detection{" +
                "className='" + className + '\'' +
                ", confidence=" + confidence +
                ", boundingBox=" + boundingBox +
                (classId != null ? ", classId=" + classId : "") +
                (trackInfo != null ? ", trackInfo=" + trackInfo : "") +
                '}';
    }
}

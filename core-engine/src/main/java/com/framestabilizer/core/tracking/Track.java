package com.framestabilizer.core.tracking;

import com.framestabilizer.core.model.BoundingBox;
import com.framestabilizer.core.model.Detection;
import com.framestabilizer.core.model.TrackInfo;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Mutable state of one tracked object within one source.
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>{@code gapFrames == 0} whenever the track was matched this frame</li>
 * <li>{@code consecutiveFrames} never decreases; a miss only grows
 * {@code gapFrames}</li>
 * <li>the class label is fixed at creation</li>
 * </ul>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * <strong>Not</strong> thread-safe. Tracks are only touched while the owning
 * {@link SourceTracks} lock is held.
 * </p>
 *
 * @since 1.0.0
 */
public final class Track {

    /** Number of accepted confidences retained for statistics. */
    public static final int HISTORY_SIZE = 10;

    private final long id;
    private final String className;
    private final Integer classId;

    private BoundingBox boundingBox;
    private double confidence;
    private final Deque<Double> confidenceHistory = new ArrayDeque<>(HISTORY_SIZE);

    private int consecutiveFrames;
    private int gapFrames;
    private TrackState state = TrackState.PROVISIONAL;
    private boolean matchedThisFrame;

    /**
     * Create a provisional track from its first accepted detection.
     *
     * @param id        per-source unique id
     * @param detection a validated detection
     */
    Track(long id, Detection detection) {
        Objects.requireNonNull(detection, "detection must not be null");
        this.id = id;
        this.className = detection.getClassName();
        this.classId = detection.getClassId();
        this.boundingBox = detection.getBoundingBox();
        this.confidence = detection.getConfidence();
        this.consecutiveFrames = 1;
        this.gapFrames = 0;
        this.matchedThisFrame = true;
        recordConfidence(confidence);
    }

    // ---------------------------------------------------------------
    // Mutations (driven by TrackStateMachine)
    // ---------------------------------------------------------------

    void absorb(Detection detection) {
        this.boundingBox = detection.getBoundingBox();
        this.confidence = detection.getConfidence();
        this.consecutiveFrames++;
        this.gapFrames = 0;
        this.matchedThisFrame = true;
        recordConfidence(confidence);
    }

    void markMissed() {
        this.gapFrames++;
        this.matchedThisFrame = false;
    }

    void confirm() {
        this.state = TrackState.CONFIRMED;
    }

    public void beginFrame() {
        this.matchedThisFrame = false;
    }

    private void recordConfidence(double value) {
        if (confidenceHistory.size() == HISTORY_SIZE) {
            confidenceHistory.pollFirst();
        }
        confidenceHistory.addLast(value);
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public long getId() {
        return id;
    }

    public String getClassName() {
        return className;
    }

    public BoundingBox getBoundingBox() {
        return boundingBox;
    }

    public double getConfidence() {
        return confidence;
    }

    public int getConsecutiveFrames() {
        return consecutiveFrames;
    }

    public int getGapFrames() {
        return gapFrames;
    }

    public TrackState getState() {
        return state;
    }

    public boolean isConfirmed() {
        return state == TrackState.CONFIRMED;
    }

    public boolean isMatchedThisFrame() {
        return matchedThisFrame;
    }

    /**
     * @return {@code true} if this track belongs in the current frame's output
     */
    public boolean isEmittable() {
        return isConfirmed() && matchedThisFrame;
    }

    /**
     * Mean of the most recent {@value #HISTORY_SIZE} accepted confidences.
     */
    public double averageConfidence() {
        if (confidenceHistory.isEmpty()) {
            return confidence;
        }
        double sum = 0;
        for (double c : confidenceHistory) {
            sum += c;
        }
        return sum / confidenceHistory.size();
    }

    /**
     * Emission view of this track: its latest box, label and confidence plus
     * tracking metadata.
     */
    public Detection toDetection() {
        return Detection.builder()
                .className(className)
                .confidence(confidence)
                .boundingBox(boundingBox)
                .classId(classId)
                .trackInfo(new TrackInfo(id, consecutiveFrames, averageConfidence()))
                .build();
    }

    @Override
    public String toString() {
        return "Track{" +
                "id=" + id +
                ", className='" + className + '\'' +
                ", state=" + state +
                ", consecutiveFrames=" + consecutiveFrames +
                ", gapFrames=" + gapFrames +
                ", confidence=" + confidence +
                '}';
    }
}

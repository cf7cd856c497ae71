package com.framestabilizer.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Tracking metadata attached to a stabilized detection.
 *
 * @since 1.0.0
 */
public final class TrackInfo implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long trackId;
    private final int framesTracked;
    private final double averageConfidence;

    @JsonCreator
    public TrackInfo(@JsonProperty("track_id") long trackId,
            @JsonProperty("frames_tracked") int framesTracked,
            @JsonProperty("avg_confidence") double averageConfidence) {
        this.trackId = trackId;
        this.framesTracked = framesTracked;
        this.averageConfidence = averageConfidence;
    }

    @JsonProperty("track_id")
    public long getTrackId() {
        return trackId;
    }

    /** Consecutive accepted matches of the track. */
    @JsonProperty("frames_tracked")
    public int getFramesTracked() {
        return framesTracked;
    }

    @JsonProperty("avg_confidence")
    public double getAverageConfidence() {
        return averageConfidence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrackInfo that))
            return false;
        return trackId == that.trackId
                && framesTracked == that.framesTracked
                && Double.compare(averageConfidence, that.averageConfidence) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(trackId, framesTracked, averageConfidence);
    }

    @Override
    public String toString() {
        return "TrackInfo{trackId=" + trackId
                + ", framesTracked=" + framesTracked
                + ", averageConfidence=" + averageConfidence + '}';
    }
}

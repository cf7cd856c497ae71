package com.framestabilizer.core.tracking;

/**
 * Dual confidence threshold (Schmitt-trigger style).
 *
 * <p>
 * A confirmed track only needs {@code persistConfidence} to stay alive, while
 * anything not yet confirmed, including a detection with no track at all,
 * must reach {@code appearConfidence}.
 * </p>
 *
 * @since 1.0.0
 */
public final class HysteresisPolicy {

    private final double appearConfidence;
    private final double persistConfidence;

    /**
     * @throws IllegalArgumentException if {@code persistConfidence} exceeds
     *                                  {@code appearConfidence}
     */
    public HysteresisPolicy(double appearConfidence, double persistConfidence) {
        if (persistConfidence > appearConfidence) {
            throw new IllegalArgumentException("persistConfidence (" + persistConfidence
                    + ") must be <= appearConfidence (" + appearConfidence + ")");
        }
        this.appearConfidence = appearConfidence;
        this.persistConfidence = persistConfidence;
    }

    /**
     * @param track an existing track
     * @return the confidence a detection must reach to advance {@code track}
     */
    public double threshold(Track track) {
        return track.isConfirmed() ? persistConfidence : appearConfidence;
    }

    /**
     * @return the confidence a detection with no track must reach
     */
    public double appearThreshold() {
        return appearConfidence;
    }

    public double persistThreshold() {
        return persistConfidence;
    }
}

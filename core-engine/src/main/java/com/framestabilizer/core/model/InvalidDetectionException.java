package com.framestabilizer.core.model;

/**
 * Thrown when a raw detection is missing a required field or carries an
 * out-of-range value.
 *
 * <p>
 * Recoverable: the stabilizer logs, counts and skips the offending detection
 * and keeps processing the rest of the frame.
 * </p>
 *
 * @since 1.0.0
 */
public class InvalidDetectionException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidDetectionException(String message) {
        super(message);
    }
}

package com.framestabilizer.core.control;

/**
 * Thrown when a control message names a command this engine does not
 * provide.
 *
 * @since 1.0.0
 */
public class CommandNotAvailableException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public CommandNotAvailableException(String message) {
        super(message);
    }
}

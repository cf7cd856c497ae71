package com.framestabilizer.core.config;

/**
 * Thrown when a stabilization configuration violates its constraints.
 *
 * <p>
 * Fatal: raised at construction / load time so that no partially valid
 * stabilizer can ever be created.
 * </p>
 *
 * @since 1.0.0
 */
public class InvalidConfigException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigException(String message) {
        super(message);
    }

    public InvalidConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}

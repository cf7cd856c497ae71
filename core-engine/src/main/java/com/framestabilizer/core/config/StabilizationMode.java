package com.framestabilizer.core.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Stabilization strategy selected by configuration.
 *
 * @since 1.0.0
 */
public enum StabilizationMode {

    /** Pass-through, no filtering (baseline). */
    NONE,

    /** Temporal confirmation + confidence hysteresis + IoU tracking. */
    TEMPORAL;

    /**
     * Parse a mode name case-insensitively.
     *
     * @param value mode name, e.g. {@code "temporal"}
     * @return the matching mode
     * @throws InvalidConfigException if the name is {@code null} or unknown
     */
    public static StabilizationMode fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidConfigException("Stabilization mode is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigException("Unknown stabilization mode: '" + value
                    + "'. Supported: " + supported(), e);
        }
    }

    private static String supported() {
        return Arrays.stream(values())
                .map(m -> m.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(", "));
    }
}

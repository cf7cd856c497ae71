package com.framestabilizer.core.control;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Control commands understood by {@link StabilizationCommandHandler}.
 *
 * @since 1.0.0
 */
public enum CommandType {

    TOGGLE_STABILIZATION("toggle_stabilization", "Flip stabilization on/off, tracks preserved"),
    ENABLE_STABILIZATION("enable_stabilization", "Resume stabilization"),
    DISABLE_STABILIZATION("disable_stabilization", "Switch to pass-through, tracks preserved"),
    STABILIZATION_RESET("stabilization_reset", "Discard tracks of one source, or of all sources"),
    STABILIZATION_STATS("stabilization_stats", "Report counters of one source, or of all sources");

    private final String wireName;
    private final String description;

    CommandType(String wireName, String description) {
        this.wireName = wireName;
        this.description = description;
    }

    public String wireName() {
        return wireName;
    }

    public String description() {
        return description;
    }

    /**
     * Resolve a command from its wire name, case-insensitively.
     *
     * @param name e.g. {@code "stabilization_reset"}
     * @return the matching command
     * @throws CommandNotAvailableException if no command has that name
     */
    public static CommandType fromWire(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (CommandType type : values()) {
                if (type.wireName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new CommandNotAvailableException("Command '" + name + "' not available. "
                + "Available commands: " + available());
    }

    static String available() {
        return Arrays.stream(values())
                .map(CommandType::wireName)
                .sorted()
                .collect(Collectors.joining(", "));
    }
}

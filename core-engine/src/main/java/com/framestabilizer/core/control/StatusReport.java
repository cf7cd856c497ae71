package com.framestabilizer.core.control;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.framestabilizer.core.config.StabilizationMode;
import com.framestabilizer.core.stabilization.StabilizationStats;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Reply published on the status channel after a control command ran.
 *
 * <p>
 * {@code stats} is present only for {@link CommandType#STABILIZATION_STATS};
 * it holds one entry per requested source.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"command", "source_id", "mode", "enabled", "stats", "timestamp"})
public final class StatusReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final CommandType command;
    private final String sourceId;
    private final StabilizationMode mode;
    private final boolean enabled;
    private final List<StabilizationStats> stats;
    private final Instant timestamp;

    public StatusReport(CommandType command, String sourceId, StabilizationMode mode, boolean enabled,
            List<StabilizationStats> stats, Instant timestamp) {
        this.command = Objects.requireNonNull(command, "command must not be null");
        this.sourceId = sourceId;
        this.mode = mode;
        this.enabled = enabled;
        this.stats = stats != null ? List.copyOf(stats) : null;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    @JsonProperty("command")
    public String getCommandName() {
        return command.wireName();
    }

    public CommandType command() {
        return command;
    }

    @JsonProperty("source_id")
    public String getSourceId() {
        return sourceId;
    }

    public StabilizationMode getMode() {
        return mode;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * @return per-source counters, or {@code null} when the command reports
     *         none
     */
    public List<StabilizationStats> getStats() {
        return stats;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StatusReport that))
            return false;
        return enabled == that.enabled
                && command == that.command
                && Objects.equals(sourceId, that.sourceId)
                && mode == that.mode
                && Objects.equals(stats, that.stats)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(command, sourceId, mode, enabled, stats, timestamp);
    }

    @Override
    public String toString() {
        return "StatusReport{" +
                "command=" + command.wireName() +
                ", sourceId='" + sourceId + '\'' +
                ", mode=" + mode +
                ", enabled=" + enabled +
                ", stats=" + (stats != null ? stats.size() : 0) +
                ", timestamp=" + timestamp +
                '}';
    }
}

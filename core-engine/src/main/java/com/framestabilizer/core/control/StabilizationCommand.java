package com.framestabilizer.core.control;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Out-of-band control message, e.g.
 *
 * <pre>
 * {"command": "stabilization_reset", "source_id": "cam-1"}
 * </pre>
 *
 * <p>
 * {@code source_id} is optional; commands that accept it apply to every
 * source when it is absent.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StabilizationCommand implements Serializable {

    private static final long serialVersionUID = 1L;

    private String command;

    @JsonProperty("source_id")
    private String sourceId;

    /** No-arg constructor required by Jackson. */
    public StabilizationCommand() {
    }

    public StabilizationCommand(String command, String sourceId) {
        this.command = command;
        this.sourceId = sourceId;
    }

    public static StabilizationCommand of(CommandType type) {
        return new StabilizationCommand(type.wireName(), null);
    }

    public static StabilizationCommand of(CommandType type, String sourceId) {
        return new StabilizationCommand(type.wireName(), sourceId);
    }

    public String getCommand() {
        return command;
    }

    public void setCommand(String command) {
        this.command = command;
    }

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId;
    }

    /**
     * @return whether a non-blank source id was given
     */
    public boolean hasSourceId() {
        return sourceId != null && !sourceId.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StabilizationCommand that))
            return false;
        return Objects.equals(command, that.command) && Objects.equals(sourceId, that.sourceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(command, sourceId);
    }

    @Override
    public String toString() {
        return "StabilizationCommand{command='" + command + "', sourceId='" + sourceId + "'}";
    }
}

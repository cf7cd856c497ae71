package com.framestabilizer.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.framestabilizer.core.control.StabilizationCommand;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Flink {@link DeserializationSchema} for control messages on the commands
 * topic. Messages that are not JSON, or carry no {@code command}, are logged
 * and dropped; unknown command names are rejected later by the handler.
 */
public class CommandDeserializationSchema implements DeserializationSchema<StabilizationCommand> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(CommandDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public StabilizationCommand deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            StabilizationCommand command = objectMapper().readValue(message, StabilizationCommand.class);
            if (command.getCommand() == null || command.getCommand().isBlank()) {
                LOG.warn("Dropping control message without 'command' field");
                return null;
            }
            return command;
        } catch (Exception e) {
            LOG.warn("Failed to deserialize control message – skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(StabilizationCommand nextElement) {
        return false;
    }

    @Override
    public TypeInformation<StabilizationCommand> getProducedType() {
        return TypeInformation.of(StabilizationCommand.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}

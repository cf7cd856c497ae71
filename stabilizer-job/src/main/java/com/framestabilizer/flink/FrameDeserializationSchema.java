package com.framestabilizer.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.framestabilizer.core.model.DetectionFrame;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes →
 * {@link DetectionFrame}.
 * <p>
 * Malformed messages, and frames without a {@code sourceId} to key on, are
 * logged and dropped (returns {@code null}), so a single bad record does not
 * crash the pipeline. Individual bad detections inside a well-formed frame are
 * left for the stabilizer to skip and count.
 * </p>
 */
public class FrameDeserializationSchema implements DeserializationSchema<DetectionFrame> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(FrameDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public DetectionFrame deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            DetectionFrame frame = objectMapper().readValue(message, DetectionFrame.class);
            if (frame.getSourceId() == null || frame.getSourceId().isBlank()) {
                LOG.warn("Dropping frame {} without sourceId", frame.getFrameId());
                return null;
            }
            return frame;
        } catch (Exception e) {
            LOG.warn("Failed to deserialize detection frame – skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(DetectionFrame nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<DetectionFrame> getProducedType() {
        return TypeInformation.of(DetectionFrame.class);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}

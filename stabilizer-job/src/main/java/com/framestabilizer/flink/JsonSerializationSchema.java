package com.framestabilizer.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink {@link SerializationSchema} that converts any Jackson-mappable value
 * → JSON bytes for publishing to Kafka. Used for both stabilized frames and
 * status reports.
 *
 * @param <T> record type
 */
public class JsonSerializationSchema<T> implements SerializationSchema<T> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(JsonSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(T element) {
        try {
            return objectMapper().writeValueAsBytes(element);
        } catch (Exception e) {
            LOG.error("Failed to serialize {}: {}",
                    element != null ? element.getClass().getSimpleName() : "null", e.getMessage(), e);
            return new byte[0];
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}

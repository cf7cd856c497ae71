package com.framestabilizer.flink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.framestabilizer.core.config.StabilizationMode;
import com.framestabilizer.core.control.CommandType;
import com.framestabilizer.core.control.StatusReport;
import com.framestabilizer.core.model.BoundingBox;
import com.framestabilizer.core.model.Detection;
import com.framestabilizer.core.model.DetectionFrame;
import com.framestabilizer.core.model.StabilizedFrame;
import com.framestabilizer.core.model.TrackInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link JsonSerializationSchema}.
 */
class JsonSerializationSchemaTest {

    private final ObjectMapper reader = new ObjectMapper();

    @Test
    @DisplayName("Stabilized frame is written in the upstream detection format")
    void shouldSerializeStabilizedFrame() throws Exception {
        Detection tracked = Detection.of("person", 0.8, new BoundingBox(10, 20, 30, 40))
                .withTrackInfo(new TrackInfo(3, 5, 0.75));
        DetectionFrame input = new DetectionFrame("cam-1", 11, Instant.parse("2024-05-01T10:00:00Z"),
                List.of(tracked, tracked));

        byte[] bytes = new JsonSerializationSchema<StabilizedFrame>()
                .serialize(StabilizedFrame.of(input, List.of(tracked)));
        JsonNode node = reader.readTree(bytes);

        assertThat(node.get("sourceId").asText()).isEqualTo("cam-1");
        assertThat(node.get("frameId").asLong()).isEqualTo(11);
        assertThat(node.get("timestamp").asText()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(node.get("rawCount").asInt()).isEqualTo(2);
        JsonNode detection = node.get("detections").get(0);
        assertThat(detection.get("class").asText()).isEqualTo("person");
        assertThat(detection.get("_stabilization").get("track_id").asLong()).isEqualTo(3);
    }

    @Test
    @DisplayName("Status report is written with snake_case keys")
    void shouldSerializeStatusReport() throws Exception {
        StatusReport report = new StatusReport(CommandType.TOGGLE_STABILIZATION, null,
                StabilizationMode.TEMPORAL, false, null, Instant.parse("2024-05-01T10:00:00Z"));

        JsonNode node = reader.readTree(new JsonSerializationSchema<StatusReport>().serialize(report));

        assertThat(node.get("command").asText()).isEqualTo("toggle_stabilization");
        assertThat(node.get("enabled").asBoolean()).isFalse();
        assertThat(node.has("source_id")).isFalse();
        assertThat(node.has("stats")).isFalse();
    }

    @Test
    @DisplayName("Unserializable value yields an empty payload instead of failing")
    void shouldReturnEmptyPayloadOnFailure() {
        byte[] bytes = new JsonSerializationSchema<Object>().serialize(new Object());

        assertThat(bytes).isEmpty();
    }
}

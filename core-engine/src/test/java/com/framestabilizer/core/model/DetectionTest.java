package com.framestabilizer.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Detection} validation and its JSON wire format.
 */
class DetectionTest {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Well-formed detection passes validation")
    void shouldAcceptValidDetection() {
        Detection detection = Detection.of("person", 0.7, new BoundingBox(100, 100, 20, 40));

        assertThatCode(detection::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Confidence bounds 0 and 1 are inclusive")
    void shouldAcceptBoundaryConfidences() {
        assertThatCode(() -> Detection.of("car", 0.0, box()).validate()).doesNotThrowAnyException();
        assertThatCode(() -> Detection.of("car", 1.0, box()).validate()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Blank or missing label is rejected")
    void shouldRejectMissingLabel() {
        assertThatThrownBy(() -> Detection.of(" ", 0.7, box()).validate())
                .isInstanceOf(InvalidDetectionException.class)
                .hasMessageContaining("class label");
        assertThatThrownBy(() -> Detection.of(null, 0.7, box()).validate())
                .isInstanceOf(InvalidDetectionException.class);
    }

    @Test
    @DisplayName("Confidence outside [0, 1], NaN or missing is rejected")
    void shouldRejectIllegalConfidence() {
        assertThatThrownBy(() -> Detection.of("person", 1.2, box()).validate())
                .isInstanceOf(InvalidDetectionException.class)
                .hasMessageContaining("outside [0, 1]");
        assertThatThrownBy(() -> Detection.of("person", -0.1, box()).validate())
                .isInstanceOf(InvalidDetectionException.class);
        assertThatThrownBy(() -> Detection.of("person", Double.NaN, box()).validate())
                .isInstanceOf(InvalidDetectionException.class);
        assertThatThrownBy(() -> Detection.builder().className("person").boundingBox(box()).build().validate())
                .isInstanceOf(InvalidDetectionException.class)
                .hasMessageContaining("missing its confidence");
    }

    @Test
    @DisplayName("Missing or malformed bounding box is rejected")
    void shouldRejectBadBoundingBox() {
        assertThatThrownBy(() -> Detection.of("person", 0.7, null).validate())
                .isInstanceOf(InvalidDetectionException.class)
                .hasMessageContaining("bounding box");
        assertThatThrownBy(() -> Detection.of("person", 0.7, new BoundingBox(1, 1, -3, 2)).validate())
                .isInstanceOf(InvalidDetectionException.class)
                .hasMessageContaining("malformed");
    }

    // ------------------------------------------------------------------
    // JSON
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should read the flat upstream format and ignore unknown fields")
    void shouldDeserializeUpstreamFormat() throws Exception {
        String json = "{\"class\":\"person\",\"confidence\":0.82,\"x\":320.5,\"y\":240.0,"
                + "\"width\":50.0,\"height\":120.0,\"class_id\":0,\"detection_id\":\"abc\"}";

        Detection detection = mapper.readValue(json, Detection.class);

        assertThat(detection.getClassName()).isEqualTo("person");
        assertThat(detection.getConfidence()).isEqualTo(0.82);
        assertThat(detection.getClassId()).isZero();
        assertThat(detection.getBoundingBox()).isEqualTo(new BoundingBox(320.5, 240.0, 50.0, 120.0));
        assertThat(detection.getTrackInfo()).isNull();
    }

    @Test
    @DisplayName("Incomplete coordinates yield a detection without a box")
    void shouldLeaveBoxNullWhenCoordinatesMissing() throws Exception {
        Detection detection = mapper.readValue(
                "{\"class\":\"person\",\"confidence\":0.5,\"x\":1,\"y\":2}", Detection.class);

        assertThat(detection.getBoundingBox()).isNull();
        assertThatThrownBy(detection::validate).isInstanceOf(InvalidDetectionException.class);
    }

    @Test
    @DisplayName("Stabilized detection carries its tracking metadata")
    void shouldSerializeTrackInfo() throws Exception {
        Detection detection = Detection.of("car", 0.6, new BoundingBox(10, 20, 30, 40))
                .withTrackInfo(new TrackInfo(7, 4, 0.55));

        JsonNode node = mapper.readTree(mapper.writeValueAsString(detection));

        assertThat(node.get("class").asText()).isEqualTo("car");
        assertThat(node.get("x").asDouble()).isEqualTo(10.0);
        assertThat(node.get("height").asDouble()).isEqualTo(40.0);
        assertThat(node.has("class_id")).isFalse();
        assertThat(node.has("boundingBox")).isFalse();
        assertThat(node.get("_stabilization").get("track_id").asLong()).isEqualTo(7);
        assertThat(node.get("_stabilization").get("frames_tracked").asInt()).isEqualTo(4);
        assertThat(node.get("_stabilization").get("avg_confidence").asDouble()).isEqualTo(0.55);
    }

    @Test
    @DisplayName("Frame JSON keeps sourceId, timestamp and detections")
    void shouldDeserializeFrame() throws Exception {
        String json = "{\"sourceId\":\"cam-1\",\"frameId\":42,\"timestamp\":\"2024-05-01T10:00:00Z\","
                + "\"detections\":[{\"class\":\"person\",\"confidence\":0.7,"
                + "\"x\":1,\"y\":2,\"width\":3,\"height\":4}]}";

        DetectionFrame frame = mapper.readValue(json, DetectionFrame.class);

        assertThat(frame.getSourceId()).isEqualTo("cam-1");
        assertThat(frame.getFrameId()).isEqualTo(42);
        assertThat(frame.getTimestamp()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(frame.getDetections()).hasSize(1);
        assertThat(frame.getDetections().get(0).getBoundingBox()).isEqualTo(new BoundingBox(1, 2, 3, 4));
    }

    @Test
    @DisplayName("Stabilized frame keeps the input's identity and raw count")
    void shouldBuildStabilizedFrameFromInput() {
        Detection raw = Detection.of("person", 0.7, box());
        DetectionFrame input = new DetectionFrame("cam-2", 9, Instant.EPOCH, List.of(raw, raw));

        StabilizedFrame output = StabilizedFrame.of(input, List.of(raw));

        assertThat(output.getSourceId()).isEqualTo("cam-2");
        assertThat(output.getFrameId()).isEqualTo(9);
        assertThat(output.getTimestamp()).isEqualTo(Instant.EPOCH);
        assertThat(output.getRawCount()).isEqualTo(2);
        assertThat(output.getDetections()).containsExactly(raw);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static BoundingBox box() {
        return new BoundingBox(50, 50, 10, 10);
    }
}

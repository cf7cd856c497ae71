package com.framestabilizer.core.control;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.framestabilizer.core.config.StabilizationConfig;
import com.framestabilizer.core.model.BoundingBox;
import com.framestabilizer.core.model.Detection;
import com.framestabilizer.core.stabilization.StabilizationStats;
import com.framestabilizer.core.stabilization.TemporalHysteresisStabilizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StabilizationCommandHandler}.
 */
class StabilizationCommandHandlerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private TemporalHysteresisStabilizer stabilizer;
    private StabilizationCommandHandler handler;

    @BeforeEach
    void setUp() {
        stabilizer = new TemporalHysteresisStabilizer(StabilizationConfig.defaults());
        handler = new StabilizationCommandHandler(stabilizer, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("toggle_stabilization flips the flag and reports the new state")
    void shouldToggle() {
        StatusReport report = handler.handle(StabilizationCommand.of(CommandType.TOGGLE_STABILIZATION));

        assertThat(report.command()).isEqualTo(CommandType.TOGGLE_STABILIZATION);
        assertThat(report.isEnabled()).isFalse();
        assertThat(stabilizer.isEnabled()).isFalse();
        assertThat(report.getTimestamp()).isEqualTo(NOW);
        assertThat(report.getStats()).isNull();
    }

    @Test
    @DisplayName("enable / disable are idempotent")
    void shouldEnableAndDisable() {
        handler.handle(StabilizationCommand.of(CommandType.DISABLE_STABILIZATION));
        StatusReport report = handler.handle(StabilizationCommand.of(CommandType.DISABLE_STABILIZATION));
        assertThat(report.isEnabled()).isFalse();

        report = handler.handle(StabilizationCommand.of(CommandType.ENABLE_STABILIZATION));
        assertThat(report.isEnabled()).isTrue();
    }

    @Test
    @DisplayName("stabilization_reset with a source clears only that source")
    void shouldResetOneSource() {
        warmUp("cam-1");
        warmUp("cam-2");

        StatusReport report = handler.handle(StabilizationCommand.of(CommandType.STABILIZATION_RESET, "cam-1"));

        assertThat(report.getSourceId()).isEqualTo("cam-1");
        assertThat(stabilizer.getStats("cam-1").getActiveTracks()).isZero();
        assertThat(stabilizer.getStats("cam-2").getActiveTracks()).isEqualTo(1);
    }

    @Test
    @DisplayName("stabilization_reset without a source clears all sources")
    void shouldResetAllSources() {
        warmUp("cam-1");
        warmUp("cam-2");

        StatusReport report = handler.handle(new StabilizationCommand("stabilization_reset", " "));

        assertThat(report.getSourceId()).isNull();
        assertThat(stabilizer.getStats("cam-1").getActiveTracks()).isZero();
        assertThat(stabilizer.getStats("cam-2").getActiveTracks()).isZero();
    }

    @Test
    @DisplayName("stabilization_stats reports one source, or every known source")
    void shouldReportStats() {
        warmUp("cam-1");
        warmUp("cam-2");

        StatusReport one = handler.handle(StabilizationCommand.of(CommandType.STABILIZATION_STATS, "cam-2"));
        StatusReport all = handler.handle(StabilizationCommand.of(CommandType.STABILIZATION_STATS));

        assertThat(one.getStats()).extracting(StabilizationStats::getSourceId).containsExactly("cam-2");
        assertThat(one.getStats().get(0).getTotalDetected()).isEqualTo(1);
        assertThat(all.getStats()).extracting(StabilizationStats::getSourceId)
                .containsExactly("cam-1", "cam-2");
    }

    @Test
    @DisplayName("Command names are case-insensitive; unknown ones list what is available")
    void shouldResolveCommandNames() {
        assertThat(handler.handle(new StabilizationCommand("STABILIZATION_STATS", null)).command())
                .isEqualTo(CommandType.STABILIZATION_STATS);

        assertThatThrownBy(() -> handler.handle(new StabilizationCommand("pause", null)))
                .isInstanceOf(CommandNotAvailableException.class)
                .hasMessageContaining("'pause' not available")
                .hasMessageContaining("stabilization_reset");
        assertThatThrownBy(() -> handler.handle(new StabilizationCommand(null, null)))
                .isInstanceOf(CommandNotAvailableException.class);
    }

    @Test
    @DisplayName("Command and status use snake_case JSON")
    void shouldUseWireFormat() throws Exception {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        warmUp("cam-1");

        StabilizationCommand command = mapper.readValue(
                "{\"command\":\"stabilization_stats\",\"source_id\":\"cam-1\",\"extra\":1}",
                StabilizationCommand.class);
        JsonNode status = mapper.readTree(mapper.writeValueAsString(handler.handle(command)));

        assertThat(command.getSourceId()).isEqualTo("cam-1");
        assertThat(status.get("command").asText()).isEqualTo("stabilization_stats");
        assertThat(status.get("source_id").asText()).isEqualTo("cam-1");
        assertThat(status.get("enabled").asBoolean()).isTrue();
        assertThat(status.get("timestamp").asText()).isEqualTo("2024-05-01T10:00:00Z");
        JsonNode stats = status.get("stats").get(0);
        assertThat(stats.get("total_detected").asLong()).isEqualTo(1);
        assertThat(stats.get("active_tracks").asInt()).isEqualTo(1);
        assertThat(stats.get("tracks_by_class").get("person").asInt()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Helper
    // ------------------------------------------------------------------

    private void warmUp(String sourceId) {
        stabilizer.process(List.of(Detection.of("person", 0.8, new BoundingBox(50, 50, 10, 10))), sourceId);
    }
}

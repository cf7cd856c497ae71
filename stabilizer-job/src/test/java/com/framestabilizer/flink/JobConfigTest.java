package com.framestabilizer.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Builder defaults are valid")
    void shouldBuildWithDefaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getKafkaFramesTopic()).isEqualTo("detections");
        assertThat(config.getKafkaCommandsTopic()).isEqualTo("stabilization-commands");
        assertThat(config.getKafkaStabilizedTopic()).isEqualTo("detections-stabilized");
        assertThat(config.getKafkaStatusTopic()).isEqualTo("stabilization-status");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getStabilizationConfigPath()).isEmpty();
    }

    @Test
    @DisplayName("Should reject blank topic names")
    void shouldRejectBlankTopic() {
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaCommandsTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaCommandsTopic");
    }

    @Test
    @DisplayName("Should reject writing stabilized frames back to the frames topic")
    void shouldRejectFeedbackLoop() {
        assertThatThrownBy(() -> new JobConfig.Builder()
                .kafkaFramesTopic("detections")
                .kafkaStabilizedTopic("detections")
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must differ");
    }

    @Test
    @DisplayName("Should reject non-positive parallelism and checkpoint interval")
    void shouldRejectIllegalNumbers() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> new JobConfig.Builder().checkpointIntervalMs(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("checkpointIntervalMs");
    }

    @Test
    @DisplayName("Kafka properties carry bootstrap servers and group id")
    void shouldBuildKafkaProperties() {
        JobConfig config = new JobConfig.Builder()
                .kafkaBootstrapServers("kafka:29092")
                .kafkaGroupId("stabilizer-test")
                .build();

        Properties consumer = config.kafkaConsumerProperties();
        Properties producer = config.kafkaProducerProperties();

        assertThat(consumer.getProperty("bootstrap.servers")).isEqualTo("kafka:29092");
        assertThat(consumer.getProperty("group.id")).isEqualTo("stabilizer-test");
        assertThat(producer.getProperty("bootstrap.servers")).isEqualTo("kafka:29092");
    }
}

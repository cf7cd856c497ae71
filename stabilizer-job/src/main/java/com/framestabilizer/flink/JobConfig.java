package com.framestabilizer.flink;

import java.io.Serializable;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable configuration object for the frame stabilizer Flink job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job is configurable through Kubernetes Deployment env vars, Docker
 * {@code -e} flags, or a shell environment. Stabilization parameters live in
 * a separate YAML file, see
 * {@link com.framestabilizer.core.config.StabilizationConfigLoader}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaFramesTopic;
    private final String kafkaCommandsTopic;
    private final String kafkaStabilizedTopic;
    private final String kafkaStatusTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // Stabilization
    // ---------------------------------------------------------------
    private final String stabilizationConfigPath;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaFramesTopic = b.kafkaFramesTopic;
        this.kafkaCommandsTopic = b.kafkaCommandsTopic;
        this.kafkaStabilizedTopic = b.kafkaStabilizedTopic;
        this.kafkaStatusTopic = b.kafkaStatusTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.stabilizationConfigPath = b.stabilizationConfigPath;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaFramesTopic(env("KAFKA_FRAMES_TOPIC", Builder.DEFAULT_FRAMES_TOPIC))
                    .kafkaCommandsTopic(env("KAFKA_COMMANDS_TOPIC", Builder.DEFAULT_COMMANDS_TOPIC))
                    .kafkaStabilizedTopic(env("KAFKA_STABILIZED_TOPIC", Builder.DEFAULT_STABILIZED_TOPIC))
                    .kafkaStatusTopic(env("KAFKA_STATUS_TOPIC", Builder.DEFAULT_STATUS_TOPIC))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", Builder.DEFAULT_GROUP_ID))
                    .parallelism(parseIntEnv("FLINK_PARALLELISM", "1"))
                    .checkpointIntervalMs(parseLongEnv("FLINK_CHECKPOINT_INTERVAL_MS", "60000"))
                    .stabilizationConfigPath(env("STABILIZATION_CONFIG_PATH", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    /**
     * Build Kafka consumer {@link Properties}.
     *
     * @return new Properties instance configured for consumption
     */
    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("group.id", kafkaGroupId);
        props.setProperty("auto.offset.reset", "earliest");
        return props;
    }

    /**
     * Build Kafka producer {@link Properties}.
     *
     * @return new Properties instance configured for production
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("transaction.timeout.ms", "900000");
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaFramesTopic() {
        return kafkaFramesTopic;
    }

    public String getKafkaCommandsTopic() {
        return kafkaCommandsTopic;
    }

    public String getKafkaStabilizedTopic() {
        return kafkaStabilizedTopic;
    }

    public String getKafkaStatusTopic() {
        return kafkaStatusTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    /**
     * @return path of the stabilization YAML, or an empty string to use the
     *         loader's default resolution
     */
    public String getStabilizationConfigPath() {
        return stabilizationConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (parallelism &gt; 0, checkpoint interval &gt; 0, non-blank topic
     * names) and that the stabilized output does not feed back into the
     * frames input.
     * </p>
     */
    public static class Builder {
        static final String DEFAULT_FRAMES_TOPIC = "detections";
        static final String DEFAULT_COMMANDS_TOPIC = "stabilization-commands";
        static final String DEFAULT_STABILIZED_TOPIC = "detections-stabilized";
        static final String DEFAULT_STATUS_TOPIC = "stabilization-status";
        static final String DEFAULT_GROUP_ID = "frame-stabilizer";

        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaFramesTopic = DEFAULT_FRAMES_TOPIC;
        private String kafkaCommandsTopic = DEFAULT_COMMANDS_TOPIC;
        private String kafkaStabilizedTopic = DEFAULT_STABILIZED_TOPIC;
        private String kafkaStatusTopic = DEFAULT_STATUS_TOPIC;
        private String kafkaGroupId = DEFAULT_GROUP_ID;
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String stabilizationConfigPath = "";

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaFramesTopic(String v) {
            this.kafkaFramesTopic = v;
            return this;
        }

        public Builder kafkaCommandsTopic(String v) {
            this.kafkaCommandsTopic = v;
            return this;
        }

        public Builder kafkaStabilizedTopic(String v) {
            this.kafkaStabilizedTopic = v;
            return this;
        }

        public Builder kafkaStatusTopic(String v) {
            this.kafkaStatusTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder stabilizationConfigPath(String v) {
            this.stabilizationConfigPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(kafkaFramesTopic, "kafkaFramesTopic");
            requireNonBlank(kafkaCommandsTopic, "kafkaCommandsTopic");
            requireNonBlank(kafkaStabilizedTopic, "kafkaStabilizedTopic");
            requireNonBlank(kafkaStatusTopic, "kafkaStatusTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");

            if (kafkaFramesTopic.equals(kafkaStabilizedTopic)) {
                throw new IllegalArgumentException(
                        "kafkaStabilizedTopic must differ from kafkaFramesTopic, both are: "
                                + kafkaFramesTopic);
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (stabilizationConfigPath == null) {
                stabilizationConfigPath = "";
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaFramesTopic='" + kafkaFramesTopic + '\'' +
                ", kafkaCommandsTopic='" + kafkaCommandsTopic + '\'' +
                ", kafkaStabilizedTopic='" + kafkaStabilizedTopic + '\'' +
                ", kafkaStatusTopic='" + kafkaStatusTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", stabilizationConfigPath='" + stabilizationConfigPath + '\'' +
                '}';
    }
}

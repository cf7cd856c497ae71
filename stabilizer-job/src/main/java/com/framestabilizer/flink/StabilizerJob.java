package com.framestabilizer.flink;

import com.framestabilizer.core.config.StabilizationConfig;
import com.framestabilizer.core.config.StabilizationConfigLoader;
import com.framestabilizer.core.control.StabilizationCommand;
import com.framestabilizer.core.control.StatusReport;
import com.framestabilizer.core.model.DetectionFrame;
import com.framestabilizer.core.model.StabilizedFrame;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.typeinfo.BasicTypeInfo;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.BroadcastStream;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Main entry point for the frame stabilizer Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (frames topic)
 *     → Deserialize JSON → DetectionFrame
 *     → Key by sourceId
 *     → StabilizationProcessFunction ← broadcast ← Kafka (commands topic)
 *     → Serialize StabilizedFrame → JSON → Kafka (stabilized topic)
 *     ↳ side output StatusReport → JSON → Kafka (status topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job settings are resolved from environment variables via {@link JobConfig};
 * stabilization parameters from YAML via {@link StabilizationConfigLoader}.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Exactly-once semantics are enabled when checkpointing is active. Kafka
 * offsets and the broadcast control state survive failures; live tracks do
 * not and are rebuilt within {@code minFrames} frames.
 * </p>
 *
 * @since 1.0.0
 */
public final class StabilizerJob {

        private static final Logger LOG = LoggerFactory.getLogger(StabilizerJob.class);

        private StabilizerJob() {
                // entry-point class — not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting frame stabilizer with config: {}", config);

                // 2. Load and validate stabilization parameters (fail fast)
                StabilizationConfig stabilizationConfig = loadStabilizationConfig(config);

                // 3. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                // 4. Build pipeline
                buildPipeline(env, config, stabilizationConfig);

                // 5. Execute
                env.execute("Frame Stabilizer – Detection Stabilization");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the full Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        StabilizationConfig stabilizationConfig) {
                // Frames source
                KafkaSource<DetectionFrame> framesSource = KafkaSource.<DetectionFrame>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setProperties(config.kafkaConsumerProperties())
                                .setTopics(config.getKafkaFramesTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new FrameDeserializationSchema())
                                .build();

                DataStream<DetectionFrame> frames = env
                                .fromSource(framesSource, WatermarkStrategy.noWatermarks(), "kafka-frames-source")
                                .filter(Objects::nonNull) // drop deserialization failures
                                .name("drop-malformed-frames");

                // Commands source; stale commands are not replayed on a fresh start
                KafkaSource<StabilizationCommand> commandsSource = KafkaSource.<StabilizationCommand>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setProperties(config.kafkaConsumerProperties())
                                .setTopics(config.getKafkaCommandsTopic())
                                .setGroupId(config.getKafkaGroupId() + "-control")
                                .setStartingOffsets(OffsetsInitializer.latest())
                                .setValueOnlyDeserializer(new CommandDeserializationSchema())
                                .build();

                BroadcastStream<StabilizationCommand> commands = env
                                .fromSource(commandsSource, WatermarkStrategy.noWatermarks(),
                                                "kafka-commands-source")
                                .filter(Objects::nonNull)
                                .name("drop-malformed-commands")
                                .broadcast(StabilizationProcessFunction.CONTROL_STATE);

                // Key by source & stabilize
                SingleOutputStreamOperator<StabilizedFrame> stabilized = frames
                                .keyBy(DetectionFrame::getSourceId, BasicTypeInfo.STRING_TYPE_INFO)
                                .connect(commands)
                                .process(new StabilizationProcessFunction(stabilizationConfig))
                                .name("detection-stabilization");

                DataStream<StatusReport> status = stabilized
                                .getSideOutput(StabilizationProcessFunction.STATUS_TAG);

                // Sinks
                stabilized.sinkTo(kafkaSink(config, config.getKafkaStabilizedTopic()))
                                .name("kafka-stabilized-sink");
                status.sinkTo(kafkaSink(config, config.getKafkaStatusTopic()))
                                .name("kafka-status-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static <T> KafkaSink<T> kafkaSink(JobConfig config, String topic) {
                return KafkaSink.<T>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setKafkaProducerConfig(config.kafkaProducerProperties())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.<T>builder()
                                                                .setTopic(topic)
                                                                .setValueSerializationSchema(
                                                                                new JsonSerializationSchema<T>())
                                                                .build())
                                .build();
        }

        static StabilizationConfig loadStabilizationConfig(JobConfig config) {
                String path = config.getStabilizationConfigPath();
                if (path != null && !path.isBlank()) {
                        return StabilizationConfigLoader.fromFile(path);
                }
                return StabilizationConfigLoader.load();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                // Retain checkpoints on cancellation so state can be restored
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}

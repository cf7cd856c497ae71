package com.framestabilizer.flink;

import com.framestabilizer.core.config.StabilizationConfig;
import com.framestabilizer.core.control.CommandNotAvailableException;
import com.framestabilizer.core.control.StabilizationCommand;
import com.framestabilizer.core.control.StabilizationCommandHandler;
import com.framestabilizer.core.control.StatusReport;
import com.framestabilizer.core.model.Detection;
import com.framestabilizer.core.model.DetectionFrame;
import com.framestabilizer.core.model.StabilizedFrame;
import com.framestabilizer.core.stabilization.DetectionStabilizer;
import com.framestabilizer.core.stabilization.StabilizerFactory;
import org.apache.flink.api.common.state.MapStateDescriptor;
import org.apache.flink.api.common.state.ReadOnlyBroadcastState;
import org.apache.flink.api.common.typeinfo.BasicTypeInfo;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.co.KeyedBroadcastProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Flink {@link KeyedBroadcastProcessFunction} that runs the detection
 * stabilizer on frames keyed by {@code sourceId} and applies broadcast control
 * commands.
 *
 * <h3>State Management</h3>
 * <p>
 * Each parallel instance owns one {@link DetectionStabilizer} created in
 * {@link #open(Configuration)}. Tracks are short-lived (a few frames) and
 * rebuild on their own, so they are held in memory and not checkpointed. The
 * enabled flag is the only state worth restoring: it is mirrored into
 * broadcast state ({@link #CONTROL_STATE}) and re-applied to a fresh
 * stabilizer on the first frame after a restore.
 * </p>
 *
 * <h3>Control commands</h3>
 * <p>
 * Commands reach every parallel instance. Each instance applies the command to
 * its own stabilizer and emits a {@link StatusReport} on {@link #STATUS_TAG};
 * a stats report therefore covers the sources owned by that instance.
 * </p>
 *
 * @since 1.0.0
 */
public class StabilizationProcessFunction
        extends KeyedBroadcastProcessFunction<String, DetectionFrame, StabilizationCommand, StabilizedFrame> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(StabilizationProcessFunction.class);

    /** Side output carrying the reply to every control command. */
    public static final OutputTag<StatusReport> STATUS_TAG = new OutputTag<>("stabilization-status") {
    };

    /** Broadcast state holding the last requested enabled flag. */
    public static final MapStateDescriptor<String, Boolean> CONTROL_STATE = new MapStateDescriptor<>(
            "stabilization-control", BasicTypeInfo.STRING_TYPE_INFO, BasicTypeInfo.BOOLEAN_TYPE_INFO);

    static final String ENABLED_KEY = "enabled";

    private final StabilizationConfig stabilizationConfig;

    private transient DetectionStabilizer stabilizer;
    private transient StabilizationCommandHandler commandHandler;
    private transient StabilizationMetrics metrics;

    /**
     * @param stabilizationConfig validated stabilization parameters; must not
     *                            be {@code null}
     */
    public StabilizationProcessFunction(StabilizationConfig stabilizationConfig) {
        this.stabilizationConfig = Objects.requireNonNull(stabilizationConfig,
                "StabilizationConfig must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        stabilizer = StabilizerFactory.create(stabilizationConfig);
        commandHandler = new StabilizationCommandHandler(stabilizer);
        metrics = new StabilizationMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("StabilizationProcessFunction opened (subtask {}, mode={})",
                getRuntimeContext().getIndexOfThisSubtask(), stabilizer.mode());
    }

    @Override
    public void close() {
        LOG.info("StabilizationProcessFunction closing");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(DetectionFrame frame,
            KeyedBroadcastProcessFunction<String, DetectionFrame, StabilizationCommand, StabilizedFrame>.ReadOnlyContext ctx,
            Collector<StabilizedFrame> out) throws Exception {
        long startNanos = System.nanoTime();

        syncEnabledFlag(ctx.getBroadcastState(CONTROL_STATE));

        List<Detection> stabilized;
        try {
            stabilized = stabilizer.process(frame.getDetections(), ctx.getCurrentKey());
        } catch (Exception e) {
            LOG.error("Stabilization failed for frame {} of source [{}] – dropping frame",
                    frame.getFrameId(), ctx.getCurrentKey(), e);
            return;
        }

        out.collect(StabilizedFrame.of(frame, stabilized));

        metrics.recordFrame(frame.getDetections().size(), stabilized.size());
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        metrics.recordLatency(durationMs);
    }

    @Override
    public void processBroadcastElement(StabilizationCommand command,
            KeyedBroadcastProcessFunction<String, DetectionFrame, StabilizationCommand, StabilizedFrame>.Context ctx,
            Collector<StabilizedFrame> out) throws Exception {
        StatusReport report;
        try {
            report = commandHandler.handle(command);
        } catch (CommandNotAvailableException e) {
            LOG.warn("Rejected control command: {}", e.getMessage());
            metrics.incrementCommandsRejected();
            return;
        }

        ctx.getBroadcastState(CONTROL_STATE).put(ENABLED_KEY, report.isEnabled());
        ctx.output(STATUS_TAG, report);
        metrics.incrementCommandsProcessed();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private void syncEnabledFlag(ReadOnlyBroadcastState<String, Boolean> control) throws Exception {
        Boolean requested = control.get(ENABLED_KEY);
        if (requested == null || requested == stabilizer.isEnabled()) {
            return;
        }
        if (requested) {
            stabilizer.enable();
        } else {
            stabilizer.disable();
        }
    }
}

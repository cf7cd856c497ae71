package com.framestabilizer.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Custom Flink metric definitions for the frame stabilizer.
 * <p>
 * Flink exposes these via its configured metric reporters (e.g. Prometheus).
 * The metric reporter is configured in {@code flink-conf.yaml} at cluster
 * level; the job only defines the metrics.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code frames_processed_total} – counter of frames stabilized</li>
 *   <li>{@code raw_detections_total} – detections entering the stabilizer</li>
 *   <li>{@code stabilized_detections_total} – detections emitted</li>
 *   <li>{@code commands_processed_total} – control commands applied</li>
 *   <li>{@code commands_rejected_total} – unknown control commands</li>
 *   <li>{@code processing_latency_ms} – histogram of per-frame latency</li>
 * </ul>
 */
public class StabilizationMetrics {

    private final Counter framesProcessed;
    private final Counter rawDetections;
    private final Counter stabilizedDetections;
    private final Counter commandsProcessed;
    private final Counter commandsRejected;
    private final Histogram processingLatency;

    public StabilizationMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("frame_stabilizer");

        this.framesProcessed = group.counter("frames_processed_total");
        this.rawDetections = group.counter("raw_detections_total");
        this.stabilizedDetections = group.counter("stabilized_detections_total");
        this.commandsProcessed = group.counter("commands_processed_total");
        this.commandsRejected = group.counter("commands_rejected_total");

        // sliding window of 350 samples, exposes p50/p95/p99
        this.processingLatency = group
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void recordFrame(int rawCount, int stabilizedCount) {
        framesProcessed.inc();
        rawDetections.inc(rawCount);
        stabilizedDetections.inc(stabilizedCount);
    }

    public void incrementCommandsProcessed() {
        commandsProcessed.inc();
    }

    public void incrementCommandsRejected() {
        commandsRejected.inc();
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}

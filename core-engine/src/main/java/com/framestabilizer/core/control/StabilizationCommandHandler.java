package com.framestabilizer.core.control;

import com.framestabilizer.core.stabilization.DetectionStabilizer;
import com.framestabilizer.core.stabilization.StabilizationStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Applies control commands to a {@link DetectionStabilizer}.
 *
 * <p>
 * Runs on the control path, concurrently with frame processing; all the
 * stabilizer operations it calls are safe for that.
 * </p>
 *
 * <ul>
 * <li>{@code toggle_stabilization} / {@code enable_stabilization} /
 * {@code disable_stabilization} change the enabled flag; tracks survive.</li>
 * <li>{@code stabilization_reset} discards the tracks of {@code source_id}, or
 * of every source when it is absent.</li>
 * <li>{@code stabilization_stats} reports the counters of {@code source_id},
 * or of every known source when it is absent.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class StabilizationCommandHandler {

    private static final Logger LOG = LoggerFactory.getLogger(StabilizationCommandHandler.class);

    private final DetectionStabilizer stabilizer;
    private final Clock clock;

    public StabilizationCommandHandler(DetectionStabilizer stabilizer) {
        this(stabilizer, Clock.systemUTC());
    }

    public StabilizationCommandHandler(DetectionStabilizer stabilizer, Clock clock) {
        this.stabilizer = Objects.requireNonNull(stabilizer, "stabilizer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Execute one command.
     *
     * @param command the control message; must not be {@code null}
     * @return the resulting status
     * @throws CommandNotAvailableException if the command name is unknown
     */
    public StatusReport handle(StabilizationCommand command) {
        Objects.requireNonNull(command, "command must not be null");
        CommandType type = CommandType.fromWire(command.getCommand());
        String sourceId = command.hasSourceId() ? command.getSourceId() : null;

        LOG.info("Control command received: {} (source={})", type.wireName(),
                sourceId != null ? sourceId : "*");

        List<StabilizationStats> stats = null;
        switch (type) {
            case TOGGLE_STABILIZATION -> stabilizer.toggle();
            case ENABLE_STABILIZATION -> stabilizer.enable();
            case DISABLE_STABILIZATION -> stabilizer.disable();
            case STABILIZATION_RESET -> {
                if (sourceId != null) {
                    stabilizer.reset(sourceId);
                } else {
                    stabilizer.resetAll();
                }
            }
            case STABILIZATION_STATS -> stats = collectStats(sourceId);
        }

        return new StatusReport(type, sourceId, stabilizer.mode(), stabilizer.isEnabled(), stats,
                clock.instant());
    }

    private List<StabilizationStats> collectStats(String sourceId) {
        if (sourceId != null) {
            return List.of(stabilizer.getStats(sourceId));
        }
        List<StabilizationStats> all = new ArrayList<>();
        for (String known : stabilizer.knownSources()) {
            all.add(stabilizer.getStats(known));
        }
        return all;
    }
}

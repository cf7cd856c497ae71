package com.framestabilizer.core.tracking;

import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * All tracking state, partitioned by source id.
 *
 * <p>
 * Sources are independent: each {@link SourceTracks} carries its own lock, so
 * frames of different sources never contend. Entries are created lazily on
 * the first frame of a source and are never removed; a reset empties an entry
 * in place so a frame already holding it cannot race a replacement.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrackRegistry {

    private final ConcurrentMap<String, SourceTracks> sources = new ConcurrentHashMap<>();

    /**
     * @param sourceId source identifier; must not be {@code null}
     * @return the source's tracking state, created if absent
     */
    public SourceTracks acquire(String sourceId) {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        return sources.computeIfAbsent(sourceId, SourceTracks::new);
    }

    /**
     * Look up a source without creating it.
     *
     * @param sourceId source identifier
     * @return the source's tracking state, or empty if never seen
     */
    public Optional<SourceTracks> find(String sourceId) {
        if (sourceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sources.get(sourceId));
    }

    /**
     * @return unmodifiable, sorted snapshot of known source ids
     */
    public Set<String> sourceIds() {
        return Collections.unmodifiableSet(new TreeSet<>(sources.keySet()));
    }
}

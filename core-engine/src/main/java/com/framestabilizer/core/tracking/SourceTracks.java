package com.framestabilizer.core.tracking;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracking state of a single source: its tracks bucketed by class label, the
 * track id sequence and the cumulative counters.
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Every method except {@link #lock()} and {@link #getSourceId()} must be
 * called with {@link #lock()} held. A whole frame, a reset or a stats
 * snapshot is one critical section.
 * </p>
 *
 * @since 1.0.0
 */
public final class SourceTracks {

    private final String sourceId;
    private final ReentrantLock lock = new ReentrantLock();

    /** className → tracks of that class in creation order. */
    private final Map<String, List<Track>> tracksByClass = new LinkedHashMap<>();

    /** Never rewound, not even by {@link #clearTracks()}. */
    private long nextTrackId = 1;

    private long totalDetected;
    private long totalConfirmed;
    private long totalIgnored;
    private long totalRemoved;
    private long totalInvalid;

    SourceTracks(String sourceId) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId must not be null");
    }

    public String getSourceId() {
        return sourceId;
    }

    public ReentrantLock lock() {
        return lock;
    }

    // ---------------------------------------------------------------
    // Tracks
    // ---------------------------------------------------------------

    public long nextTrackId() {
        return nextTrackId++;
    }

    public void add(Track track) {
        tracksByClass.computeIfAbsent(track.getClassName(), k -> new ArrayList<>()).add(track);
    }

    /**
     * @return snapshot of all tracks ordered by creation (ascending id)
     */
    public List<Track> tracks() {
        List<Track> all = new ArrayList<>();
        for (List<Track> bucket : tracksByClass.values()) {
            all.addAll(bucket);
        }
        all.sort(Comparator.comparingLong(Track::getId));
        return all;
    }

    public int activeTrackCount() {
        int count = 0;
        for (List<Track> bucket : tracksByClass.values()) {
            count += bucket.size();
        }
        return count;
    }

    /**
     * @return live track count per class label, in first-seen class order
     */
    public Map<String, Integer> trackCountsByClass() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        tracksByClass.forEach((className, bucket) -> counts.put(className, bucket.size()));
        return counts;
    }

    /**
     * Drop every track whose gap exceeds {@code maxGap}, and any class bucket
     * left empty. Runs after all of a frame's updates have been applied.
     *
     * @param maxGap maximum tolerated gap
     * @return number of tracks removed
     */
    public int removeExpired(int maxGap) {
        int removed = 0;
        Iterator<Map.Entry<String, List<Track>>> buckets = tracksByClass.entrySet().iterator();
        while (buckets.hasNext()) {
            List<Track> bucket = buckets.next().getValue();
            int before = bucket.size();
            bucket.removeIf(track -> track.getGapFrames() > maxGap);
            removed += before - bucket.size();
            if (bucket.isEmpty()) {
                buckets.remove();
            }
        }
        return removed;
    }

    /**
     * @return number of tracks discarded
     */
    public int clearTracks() {
        int count = activeTrackCount();
        tracksByClass.clear();
        return count;
    }

    // ---------------------------------------------------------------
    // Counters
    // ---------------------------------------------------------------

    public void recordDetected(int count) {
        totalDetected += count;
    }

    public void recordConfirmed() {
        totalConfirmed++;
    }

    public void recordIgnored() {
        totalIgnored++;
    }

    public void recordRemoved(int count) {
        totalRemoved += count;
    }

    public void recordInvalid(int count) {
        totalInvalid += count;
    }

    public void resetCounters() {
        totalDetected = 0;
        totalConfirmed = 0;
        totalIgnored = 0;
        totalRemoved = 0;
        totalInvalid = 0;
    }

    public long getTotalDetected() {
        return totalDetected;
    }

    public long getTotalConfirmed() {
        return totalConfirmed;
    }

    public long getTotalIgnored() {
        return totalIgnored;
    }

    public long getTotalRemoved() {
        return totalRemoved;
    }

    public long getTotalInvalid() {
        return totalInvalid;
    }
}

package com.drawforecast.common.buffer;

import com.drawforecast.common.model.OutcomeRecord;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Bounded, de-duplicated window of recent {@link OutcomeRecord}s, newest first.
 *
 * <h3>Invariants</h3>
 * <ul>
 *   <li>No two records share a {@code periodId}; re-ingesting a known period is a no-op.</li>
 *   <li>Each accepted record is inserted at the head; existing records are never reordered.</li>
 *   <li>Length never exceeds {@code capacity}; overflow evicts from the tail (oldest).</li>
 * </ul>
 *
 * <p>Callers hand records over in arrival order (oldest first) so the head stays the newest draw.
 * Thread-safe; readers receive immutable snapshots.
 */
public final class DataBuffer {

    public static final int DEFAULT_CAPACITY = 200;

    private final int capacity;
    private final List<OutcomeRecord> records = new ArrayList<>();
    private final Set<String> periodIds = new HashSet<>();

    public DataBuffer() {
        this(DEFAULT_CAPACITY);
    }

    public DataBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Inserts every record whose period is not yet present, then trims the tail to capacity.
     *
     * @return number of records actually inserted (0 when nothing changed)
     */
    public synchronized int ingest(List<OutcomeRecord> newRecords) {
        int inserted = 0;
        for (OutcomeRecord record : newRecords) {
            if (periodIds.add(record.periodId())) {
                records.add(0, record);
                inserted++;
            }
        }
        while (records.size() > capacity) {
            OutcomeRecord evicted = records.remove(records.size() - 1);
            periodIds.remove(evicted.periodId());
        }
        return inserted;
    }

    /** Immutable newest-first snapshot. */
    public synchronized List<OutcomeRecord> records() {
        return List.copyOf(records);
    }

    public synchronized boolean contains(String periodId) {
        return periodIds.contains(periodId);
    }

    public synchronized int size() {
        return records.size();
    }
}

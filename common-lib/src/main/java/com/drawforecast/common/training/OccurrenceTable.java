package com.drawforecast.common.training;

import com.drawforecast.common.model.OutcomeRecord;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup from a digit-sequence key to the digits observed right after it.
 *
 * <p>Backs both the pattern table (keys are concatenated digits, {@code "123"}) and the
 * Markov table (keys are dash-joined digits, {@code "1-2-3"}). Tables are only ever built
 * from scratch through {@link Builder}; a new training pass produces a new table.
 */
public final class OccurrenceTable {

    public static final String PATTERN_SEPARATOR = "";
    public static final String MARKOV_SEPARATOR  = "-";

    private static final OccurrenceTable EMPTY = new OccurrenceTable(Map.of());

    private final Map<String, Counts> entries;

    private OccurrenceTable(Map<String, Counts> entries) {
        this.entries = entries;
    }

    public static OccurrenceTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Counts> lookup(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public int size() {
        return entries.size();
    }

    /**
     * Joins the digits of {@code records[from, from + length)} with {@code separator}.
     */
    public static String key(List<OutcomeRecord> records, int from, int length, String separator) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < from + length; i++) {
            if (i > from) sb.append(separator);
            sb.append(records.get(i).digit());
        }
        return sb.toString();
    }

    // ── Counts ──────────────────────────────────────────────────────────────

    /** Per-digit follower counts for one key. */
    public static final class Counts {

        private final int[] counts;
        private final int total;

        private Counts(int[] counts, int total) {
            this.counts = counts;
            this.total  = total;
        }

        public int total() {
            return total;
        }

        public int count(int digit) {
            return counts[digit];
        }

        /** Most frequent follower; the lowest digit wins ties. */
        public int majorityDigit() {
            int best = 0;
            for (int d = 1; d < counts.length; d++) {
                if (counts[d] > counts[best]) best = d;
            }
            return best;
        }

        /** Share of the majority digit, in (0, 1]. */
        public double majorityShare() {
            return total == 0 ? 0.0 : (double) counts[majorityDigit()] / total;
        }

        @Override
        public String toString() {
            return "Counts{counts=" + Arrays.toString(counts) + ", total=" + total + "}";
        }
    }

    // ── Builder ─────────────────────────────────────────────────────────────

    public static final class Builder {

        private final Map<String, int[]> counts = new HashMap<>();

        private Builder() {}

        public Builder record(String key, int nextDigit) {
            if (nextDigit < 0 || nextDigit > 9) {
                throw new IllegalArgumentException("follower digit out of range 0-9: " + nextDigit);
            }
            counts.computeIfAbsent(key, k -> new int[10])[nextDigit]++;
            return this;
        }

        public OccurrenceTable build() {
            Map<String, Counts> frozen = new HashMap<>(counts.size() * 2);
            counts.forEach((key, c) -> frozen.put(key, new Counts(c.clone(), Arrays.stream(c).sum())));
            return new OccurrenceTable(Collections.unmodifiableMap(frozen));
        }
    }
}

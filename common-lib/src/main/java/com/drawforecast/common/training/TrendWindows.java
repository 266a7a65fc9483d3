package com.drawforecast.common.training;

import com.drawforecast.common.model.OutcomeRecord;

import java.util.List;

/**
 * Bit slices of the buffer head used by the trend model: 10, 30 and 60 newest draws
 * (shorter when the buffer is shorter).
 */
public record TrendWindows(List<Integer> shortTerm, List<Integer> mediumTerm, List<Integer> longTerm) {

    public static final int SHORT_TERM  = 10;
    public static final int MEDIUM_TERM = 30;
    public static final int LONG_TERM   = 60;

    public TrendWindows {
        shortTerm  = List.copyOf(shortTerm);
        mediumTerm = List.copyOf(mediumTerm);
        longTerm   = List.copyOf(longTerm);
    }

    public static TrendWindows empty() {
        return new TrendWindows(List.of(), List.of(), List.of());
    }

    public static TrendWindows from(List<OutcomeRecord> records) {
        return new TrendWindows(bits(records, SHORT_TERM), bits(records, MEDIUM_TERM), bits(records, LONG_TERM));
    }

    /** Share of BIG bits; an empty window divides by one and yields 0. */
    public static double bigRatio(List<Integer> window) {
        int big = 0;
        for (int bit : window) big += bit;
        return (double) big / Math.max(window.size(), 1);
    }

    private static List<Integer> bits(List<OutcomeRecord> records, int length) {
        return records.stream().limit(length).map(OutcomeRecord::bit).toList();
    }
}

package com.drawforecast.common.context;

import com.drawforecast.common.buffer.DataBuffer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable tunables of the forecasting core.
 *
 * @param bufferCapacity      maximum records kept in the {@link DataBuffer}
 * @param patternLengths      digit-sequence lengths tried by the pattern model, ascending
 * @param markovOrder         highest Markov order (keys of length 1..order)
 * @param initialWeights      starting ensemble weights, in ensemble order
 * @param recurrentCellSeed   seed of the recurrent cell's weight initialisation
 */
public record ForecastSettings(
    int bufferCapacity,
    List<Integer> patternLengths,
    int markovOrder,
    Map<String, Double> initialWeights,
    long recurrentCellSeed
) {
    public static final long DEFAULT_SEED = 20_241_107L;

    public ForecastSettings {
        patternLengths = List.copyOf(patternLengths);
        initialWeights = Collections.unmodifiableMap(new LinkedHashMap<>(initialWeights));
    }

    public static ForecastSettings defaults() {
        return withSeed(DEFAULT_SEED);
    }

    public static ForecastSettings withSeed(long seed) {
        return new ForecastSettings(DataBuffer.DEFAULT_CAPACITY, List.of(3, 4, 5, 6, 7, 8), 3,
            defaultWeights(), seed);
    }

    public static Map<String, Double> defaultWeights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("pattern",   0.15);
        weights.put("markov",    0.15);
        weights.put("frequency", 0.15);
        weights.put("neural",    0.20);
        weights.put("trend",     0.15);
        weights.put("quantum",   0.20);
        return weights;
    }
}

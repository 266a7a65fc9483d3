package com.drawforecast.common.analysis;

import com.drawforecast.common.model.MarketState;
import com.drawforecast.common.model.OutcomeRecord;
import com.drawforecast.common.model.TrendLabel;

import java.time.Clock;
import java.util.List;

/**
 * Derives the {@link MarketState} from the newest records of the buffer.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Take the newest min({@value #WINDOW}, n) records. With fewer than
 *       {@value #MIN_RECORDS} records the previous state is returned untouched.</li>
 *   <li>volatility = std(digits) / (mean(digits) + 0.001).</li>
 *   <li>entropy = Shannon entropy (base 2) of the bits; bias = share of BIG.</li>
 *   <li>recentTrend = {@link TrendLabel#fromBigCount(int)} over the ten newest bits.</li>
 *   <li>Runs test and spectral bias from {@link RandomnessStatistics}.</li>
 *   <li>exploitable = entropy &lt; {@value #EXPLOITABLE_ENTROPY} and
 *       |z| &gt; {@value #EXPLOITABLE_Z}.</li>
 * </ol>
 *
 * <p>Stateless apart from the clock used for {@code lastUpdate}.
 */
public class MarketStateAnalyzer {

    static final int    WINDOW              = 50;
    static final int    MIN_RECORDS         = 30;
    static final int    TREND_WINDOW        = 10;
    static final double VOLATILITY_EPSILON  = 0.001;
    static final double EXPLOITABLE_ENTROPY = 0.92;
    static final double EXPLOITABLE_Z       = 1.96;
    static final double MIN_CONFIDENCE      = 0.3;
    static final double MAX_CONFIDENCE      = 0.9;

    private final Clock clock;

    public MarketStateAnalyzer() {
        this(Clock.systemUTC());
    }

    public MarketStateAnalyzer(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param records  buffer snapshot, newest first
     * @param previous state to keep when there is too little data
     * @return a fresh state, or {@code previous} itself when fewer than {@value #MIN_RECORDS} records
     */
    public MarketState analyze(List<OutcomeRecord> records, MarketState previous) {
        if (records.size() < MIN_RECORDS) {
            return previous;
        }

        int size = Math.min(WINDOW, records.size());
        int[] digits = new int[size];
        int[] bits   = new int[size];
        for (int i = 0; i < size; i++) {
            digits[i] = records.get(i).digit();
            bits[i]   = records.get(i).bit();
        }

        double volatility = RandomnessStatistics.stdDev(digits)
                          / (RandomnessStatistics.mean(digits) + VOLATILITY_EPSILON);
        double entropy = RandomnessStatistics.shannonEntropy(bits);
        double bias    = (double) RandomnessStatistics.countOnes(bits) / size;

        int recentBig = 0;
        for (int i = 0; i < Math.min(TREND_WINDOW, size); i++) {
            recentBig += bits[i];
        }
        TrendLabel recentTrend = TrendLabel.fromBigCount(recentBig);

        RandomnessStatistics.RunsTestResult runs = RandomnessStatistics.runsTest(bits);
        double spectralBias = RandomnessStatistics.spectralBias(digits);
        boolean exploitable = entropy < EXPLOITABLE_ENTROPY && Math.abs(runs.zScore()) > EXPLOITABLE_Z;

        // entropy of a binary alphabet is already normalised to [0, 1]
        double randomnessQuality = 1.0 - entropy;
        double confidence = clamp(1.0 - Math.abs(bias - 0.5) * 2.0, MIN_CONFIDENCE, MAX_CONFIDENCE);

        return new MarketState(volatility, bias, entropy, recentTrend, confidence, randomnessQuality,
            exploitable, runs.zScore(), spectralBias, clock.instant());
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}

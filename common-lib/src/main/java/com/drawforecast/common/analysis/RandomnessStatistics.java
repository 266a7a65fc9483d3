package com.drawforecast.common.analysis;

import java.util.HashMap;
import java.util.Map;

/**
 * Pure statistics over digit and bit sequences.
 * Sequences are expected newest-first (index 0 = most recent draw); none of the
 * statistics here depend on direction.
 */
public final class RandomnessStatistics {

    private RandomnessStatistics() {}

    /** Below this length the runs test reports z = 0. */
    static final int MIN_RUNS_TEST_LENGTH = 10;

    /** Digit jumps of at least this size count towards spectral bias. */
    static final int SPECTRAL_JUMP = 3;

    // ── Moments ─────────────────────────────────────────────────────────────

    public static double mean(int[] values) {
        if (values.length == 0) return 0.0;
        double sum = 0;
        for (int v : values) sum += v;
        return sum / values.length;
    }

    /** Population standard deviation. */
    public static double stdDev(int[] values) {
        if (values.length == 0) return 0.0;
        double mean = mean(values);
        double variance = 0;
        for (int v : values) {
            double diff = v - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / values.length);
    }

    // ── Entropy ─────────────────────────────────────────────────────────────

    /**
     * Base-2 Shannon entropy of the value distribution.
     * A balanced bit sequence scores 1.0; a constant sequence scores 0.0.
     */
    public static double shannonEntropy(int[] values) {
        if (values.length == 0) return 0.0;
        Map<Integer, Integer> freq = new HashMap<>();
        for (int v : values) freq.merge(v, 1, Integer::sum);
        double entropy = 0;
        for (int count : freq.values()) {
            double p = (double) count / values.length;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }

    // ── Runs test ───────────────────────────────────────────────────────────

    /**
     * Runs test over a bit sequence.
     *
     * <pre>
     *   runs     = 1 + number of adjacent changes
     *   expected = 2·n0·n1 / n + 1
     *   variance = 2·n0·n1·(2·n0·n1 − n) / (n²·(n − 1))
     *   z        = (runs − expected) / √variance     (0 when variance ≤ 0)
     * </pre>
     * Sequences shorter than {@value #MIN_RUNS_TEST_LENGTH} return all zeros.
     */
    public static RunsTestResult runsTest(int[] bits) {
        int n = bits.length;
        if (n < MIN_RUNS_TEST_LENGTH) {
            return new RunsTestResult(0, 0.0, 0.0);
        }
        int runs = 1;
        for (int i = 1; i < n; i++) {
            if (bits[i] != bits[i - 1]) runs++;
        }
        int n1 = countOnes(bits);
        int n0 = n - n1;
        double product = 2.0 * n0 * n1;
        double expected = product / n + 1;
        double variance = (product * (product - n)) / ((double) n * n * (n - 1));
        double zScore = variance > 0 ? (runs - expected) / Math.sqrt(variance) : 0.0;
        return new RunsTestResult(runs, expected, zScore);
    }

    public record RunsTestResult(int runs, double expected, double zScore) {}

    // ── Spectral bias ───────────────────────────────────────────────────────

    /** Fraction of consecutive differences with |d| ≥ {@value #SPECTRAL_JUMP}. */
    public static double spectralBias(int[] digits) {
        if (digits.length < 2) return 0.0;
        int jumps = 0;
        for (int i = 1; i < digits.length; i++) {
            if (Math.abs(digits[i] - digits[i - 1]) >= SPECTRAL_JUMP) jumps++;
        }
        return (double) jumps / (digits.length - 1);
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    public static int countOnes(int[] bits) {
        int ones = 0;
        for (int b : bits) {
            if (b == 1) ones++;
        }
        return ones;
    }
}

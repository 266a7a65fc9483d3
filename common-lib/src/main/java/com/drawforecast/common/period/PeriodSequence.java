package com.drawforecast.common.period;

import java.math.BigInteger;

/**
 * Arithmetic on draw period identifiers.
 *
 * <p>Period ids are fixed-width decimal strings ({@code yyyyMMdd} + game code + draw
 * number, e.g. {@code 20250612100010845}); the next period is the numeric successor,
 * left-padded to the original width.
 */
public final class PeriodSequence {

    private PeriodSequence() {}

    /**
     * @throws IllegalArgumentException when {@code period} is not a non-empty digit string
     */
    public static String next(String period) {
        if (period == null || period.isEmpty() || !period.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("period is not numeric: " + period);
        }
        String successor = new BigInteger(period).add(BigInteger.ONE).toString();
        if (successor.length() >= period.length()) {
            return successor;
        }
        return "0".repeat(period.length() - successor.length()) + successor;
    }

    /** Orders numeric period ids; shorter ids sort first. */
    public static int compare(String a, String b) {
        if (a.length() != b.length()) {
            return Integer.compare(a.length(), b.length());
        }
        return a.compareTo(b);
    }
}

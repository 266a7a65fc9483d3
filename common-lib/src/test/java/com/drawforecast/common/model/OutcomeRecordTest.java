package com.drawforecast.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeRecordTest {

    @Test
    @DisplayName("label and bit are derived from the digit")
    void derivedFields() {
        OutcomeRecord four = OutcomeRecord.of("1", 4, Instant.EPOCH);
        OutcomeRecord five = OutcomeRecord.of("2", 5, Instant.EPOCH);

        assertEquals(OutcomeLabel.SMALL, four.label());
        assertEquals(0, four.bit());
        assertEquals(OutcomeLabel.BIG, five.label());
        assertEquals(1, five.bit());
    }

    @Test
    @DisplayName("out-of-range digits and blank periods are rejected")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> OutcomeRecord.of("1", 10, Instant.EPOCH));
        assertThrows(IllegalArgumentException.class, () -> OutcomeRecord.of("1", -1, Instant.EPOCH));
        assertThrows(IllegalArgumentException.class, () -> OutcomeRecord.of(" ", 3, Instant.EPOCH));
    }

    @Test
    @DisplayName("an inconsistent label is rejected")
    void inconsistentLabel() {
        assertThrows(IllegalArgumentException.class,
            () -> new OutcomeRecord("1", 7, OutcomeLabel.SMALL, 0, Instant.EPOCH));
    }

    @Test
    @DisplayName("trend labels follow the BIG count of ten draws")
    void trendLabels() {
        assertEquals(TrendLabel.STRONG_BIG, TrendLabel.fromBigCount(7));
        assertEquals(TrendLabel.BIAS_BIG, TrendLabel.fromBigCount(6));
        assertEquals(TrendLabel.NEUTRAL, TrendLabel.fromBigCount(5));
        assertEquals(TrendLabel.BIAS_SMALL, TrendLabel.fromBigCount(4));
        assertEquals(TrendLabel.STRONG_SMALL, TrendLabel.fromBigCount(3));
    }
}

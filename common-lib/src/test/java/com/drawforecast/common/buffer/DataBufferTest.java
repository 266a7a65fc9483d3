package com.drawforecast.common.buffer;

import com.drawforecast.common.model.OutcomeRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.drawforecast.common.OutcomeFixtures.OBSERVED_AT;
import static com.drawforecast.common.OutcomeFixtures.arrivalOrder;
import static org.junit.jupiter.api.Assertions.*;

class DataBufferTest {

    @Test
    @DisplayName("records ingested in arrival order end up newest-first")
    void ingestInsertsAtHead() {
        DataBuffer buffer = new DataBuffer();
        int inserted = buffer.ingest(arrivalOrder("321"));

        assertEquals(3, inserted);
        List<Integer> digits = buffer.records().stream().map(OutcomeRecord::digit).toList();
        assertEquals(List.of(3, 2, 1), digits);
    }

    @Test
    @DisplayName("re-ingesting known periods leaves contents and order unchanged")
    void reIngestIsNoOp() {
        DataBuffer buffer = new DataBuffer();
        buffer.ingest(arrivalOrder("97531"));
        List<OutcomeRecord> before = buffer.records();

        int inserted = buffer.ingest(arrivalOrder("97531"));

        assertEquals(0, inserted);
        assertEquals(before, buffer.records());
    }

    @Test
    @DisplayName("a period repeated inside one batch is inserted once")
    void duplicateWithinBatch() {
        DataBuffer buffer = new DataBuffer();
        OutcomeRecord first  = OutcomeRecord.of("1001", 4, OBSERVED_AT);
        OutcomeRecord second = OutcomeRecord.of("1001", 8, OBSERVED_AT);

        assertEquals(1, buffer.ingest(List.of(first, second)));
        assertEquals(List.of(first), buffer.records());
    }

    @Test
    @DisplayName("overflow evicts the oldest records first")
    void overflowEvictsTail() {
        DataBuffer buffer = new DataBuffer(5);
        buffer.ingest(arrivalOrder("87654321"));

        assertEquals(5, buffer.size());
        List<Integer> digits = buffer.records().stream().map(OutcomeRecord::digit).toList();
        assertEquals(List.of(8, 7, 6, 5, 4), digits);
    }

    @Test
    @DisplayName("an evicted period can be ingested again")
    void evictedPeriodForgotten() {
        DataBuffer buffer = new DataBuffer(2);
        OutcomeRecord oldest = OutcomeRecord.of("1", 1, OBSERVED_AT);
        buffer.ingest(List.of(oldest, OutcomeRecord.of("2", 2, OBSERVED_AT), OutcomeRecord.of("3", 3, OBSERVED_AT)));

        assertFalse(buffer.contains("1"));
        assertEquals(1, buffer.ingest(List.of(oldest)));
    }

    @Test
    @DisplayName("default capacity of 200 holds across many ingests")
    void defaultCapacity() {
        DataBuffer buffer = new DataBuffer();
        List<OutcomeRecord> batch = new ArrayList<>();
        for (int period = 1; period <= 250; period++) {
            batch.add(OutcomeRecord.of(Integer.toString(period), period % 10, OBSERVED_AT));
            if (batch.size() == 50) {
                buffer.ingest(batch);
                batch = new ArrayList<>();
            }
        }

        assertEquals(DataBuffer.DEFAULT_CAPACITY, buffer.size());
        assertEquals("250", buffer.records().get(0).periodId());
        assertEquals("51", buffer.records().get(DataBuffer.DEFAULT_CAPACITY - 1).periodId());
        assertFalse(buffer.contains("50"));
    }

    @Test
    @DisplayName("non-positive capacity is rejected")
    void invalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new DataBuffer(0));
    }

}

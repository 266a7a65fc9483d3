package com.drawforecast.service.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class DrawFeedUrlBuilderTest {

    @Test
    @DisplayName("path carries the date and the minute of the day")
    void currentPath() {
        DrawFeedUrlBuilder builder = new DrawFeedUrlBuilder(Clock.fixed(Instant.parse("2025-06-12T10:05:42Z"), ZoneOffset.UTC));
        assertEquals("/WinGo_1_20250612100010605_past100_draws", builder.currentPath());
    }

    @Test
    @DisplayName("first minute of the day is draw 0000")
    void midnight() {
        DrawFeedUrlBuilder builder = new DrawFeedUrlBuilder(Clock.fixed(Instant.parse("2025-01-01T00:00:10Z"), ZoneOffset.UTC));
        assertEquals("/WinGo_1_20250101100010000_past100_draws", builder.currentPath());
    }

    @Test
    @DisplayName("date and minute follow the clock's zone")
    void zoned() {
        Clock kolkata = Clock.fixed(Instant.parse("2025-06-12T20:00:00Z"), ZoneId.of("Asia/Kolkata"));
        assertEquals("/WinGo_1_20250613100010090_past100_draws", new DrawFeedUrlBuilder(kolkata).currentPath());
    }
}

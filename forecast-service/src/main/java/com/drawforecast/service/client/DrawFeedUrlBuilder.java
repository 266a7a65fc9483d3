package com.drawforecast.service.client;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Builds the path of the past-100-draws document for the current minute.
 *
 * <pre>
 *   /WinGo_1_{yyyyMMdd}10001{drawNumber:%04d}_past100_draws
 * </pre>
 * where {@code drawNumber} is the minute of the day in the clock's zone.
 */
public class DrawFeedUrlBuilder {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    static final String GAME_PREFIX  = "/WinGo_1_";
    static final String GAME_CODE    = "10001";
    static final String DOCUMENT     = "_past100_draws";

    private final Clock clock;

    public DrawFeedUrlBuilder(Clock clock) {
        this.clock = clock;
    }

    public String currentPath() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        int drawNumber = now.getHour() * 60 + now.getMinute();
        return GAME_PREFIX + now.format(DATE) + GAME_CODE + String.format("%04d", drawNumber) + DOCUMENT;
    }
}

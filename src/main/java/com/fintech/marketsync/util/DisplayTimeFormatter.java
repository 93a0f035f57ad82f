package com.fintech.marketsync.util;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Human-readable timestamps for cached candles: UTC plus one display zone.
 */
public class DisplayTimeFormatter {

    private static final DateTimeFormatter PATTERN = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ZoneId displayZone;

    public DisplayTimeFormatter(ZoneId displayZone) {
        this.displayZone = displayZone;
    }

    public String utc(long epochSeconds) {
        return PATTERN.format(Instant.ofEpochSecond(epochSeconds).atZone(ZoneOffset.UTC));
    }

    public String local(long epochSeconds) {
        return PATTERN.format(Instant.ofEpochSecond(epochSeconds).atZone(displayZone));
    }

    public String localMillis(long epochMillis) {
        return PATTERN.format(Instant.ofEpochMilli(epochMillis).atZone(displayZone));
    }

    public ZoneId getDisplayZone() {
        return displayZone;
    }
}

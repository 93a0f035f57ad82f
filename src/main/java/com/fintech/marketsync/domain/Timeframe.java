package com.fintech.marketsync.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Registry of supported candle timeframes with epoch-aligned bucket calculations.
 * Codes are the canonical cache/storage form ("1m", "4h", "1d"); exchange bars
 * and streaming channel names are derived from the same entries.
 */
public enum Timeframe {

    M1(1, "1m", "1m"),
    M3(3, "3m", "3m"),
    M5(5, "5m", "5m"),
    M15(15, "15m", "15m"),
    M30(30, "30m", "30m"),
    H1(60, "1h", "1H"),
    H4(240, "4h", "4H"),
    H6(360, "6h", "6H"),
    H12(720, "12h", "12H"),
    D1(1440, "1d", "1D");

    private static final String CHANNEL_PREFIX = "candle";

    private final int minutes;
    private final String code;
    private final String exchangeBar;

    Timeframe(int minutes, String code, String exchangeBar) {
        this.minutes = minutes;
        this.code = code;
        this.exchangeBar = exchangeBar;
    }

    public int minutes() {
        return minutes;
    }

    public String code() {
        return code;
    }

    /** Bar parameter used by the exchange REST API ("1H", "1D"). */
    public String exchangeBar() {
        return exchangeBar;
    }

    /** Streaming channel name, e.g. "candle1H". */
    public String channel() {
        return CHANNEL_PREFIX + exchangeBar;
    }

    public long toMillis() {
        return minutes * 60_000L;
    }

    public long toSeconds() {
        return minutes * 60L;
    }

    public static Optional<Timeframe> fromMinutes(int minutes) {
        return Arrays.stream(values()).filter(tf -> tf.minutes == minutes).findFirst();
    }

    public static Optional<Timeframe> fromChannel(String channel) {
        return Arrays.stream(values()).filter(tf -> tf.channel().equals(channel)).findFirst();
    }

    /**
     * Maps a minute count to its canonical code. Minute counts outside the registry
     * never fail: below one hour they become "Nm", otherwise "Nh" with N = minutes / 60.
     */
    public static String toCode(int minutes) {
        if (minutes <= 0) {
            throw new IllegalArgumentException("Timeframe minutes must be positive: " + minutes);
        }
        return fromMinutes(minutes)
            .map(Timeframe::code)
            .orElseGet(() -> minutes < 60 ? minutes + "m" : (minutes / 60) + "h");
    }

    /**
     * Inverse of {@link #toCode(int)}. Accepts registry codes plus any derived
     * "Nm", "Nh" or "Nd" code.
     *
     * @throws IllegalArgumentException if the code cannot be parsed
     */
    public static int toMinutes(String code) {
        if (code == null || code.length() < 2) {
            throw new IllegalArgumentException("Invalid timeframe code: " + code);
        }
        for (Timeframe tf : values()) {
            if (tf.code.equals(code)) {
                return tf.minutes;
            }
        }
        char unit = Character.toLowerCase(code.charAt(code.length() - 1));
        int amount;
        try {
            amount = Integer.parseInt(code.substring(0, code.length() - 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid timeframe code: " + code, e);
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("Invalid timeframe code: " + code);
        }
        return switch (unit) {
            case 'm' -> amount;
            case 'h' -> amount * 60;
            case 'd' -> amount * 1440;
            default -> throw new IllegalArgumentException("Invalid timeframe code: " + code);
        };
    }

    /**
     * Aligns a millisecond timestamp to its bucket start and returns epoch seconds:
     * floor(ts / (minutes * 60_000)) * minutes * 60.
     */
    public static long align(long timestampMs, int minutes) {
        long bucketMs = minutes * 60_000L;
        return Math.floorDiv(timestampMs, bucketMs) * minutes * 60L;
    }

    /** Aligns an epoch-second timestamp to this timeframe's bucket start. */
    public long alignSeconds(long timestampSeconds) {
        return align(timestampSeconds * 1000L, minutes);
    }
}

package com.fintech.marketsync.util;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TimeWindowManager Tests")
class TimeWindowManagerTest {

    // 2024-01-01T00:00:00Z, a boundary for every timeframe up to one day
    private static final long BOUNDARY_MS = 1_704_067_200_000L;

    private TimeWindowManager manager;

    @BeforeEach
    void setUp() {
        manager = new TimeWindowManager(2, 3);
    }

    @ParameterizedTest(name = "{0}s after boundary -> {1}")
    @CsvSource({
        "0, false",
        "1, false",
        "2, true",
        "4, true",
        "5, false",
        "30, false"
    })
    @DisplayName("Should detect the bar-end window after a boundary")
    void testBarEndWindow(int secondsAfter, boolean expected) {
        assertThat(manager.isBarEnd(BOUNDARY_MS + secondsAfter * 1000L, 5)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Bar-end window should follow each timeframe's own boundary")
    void testBarEndPerTimeframe() {
        long twoMinutesThreeSeconds = BOUNDARY_MS + 123_000L;

        assertThat(manager.isBarEnd(twoMinutesThreeSeconds, 1)).isTrue();
        assertThat(manager.isBarEnd(twoMinutesThreeSeconds, 5)).isFalse();
    }

    @ParameterizedTest(name = "{0}m refreshes every {1}s")
    @CsvSource({
        "1, 5",
        "3, 10",
        "5, 10",
        "15, 20",
        "30, 20",
        "60, 30",
        "240, 30",
        "1440, 60"
    })
    void testRefreshIntervals(int minutes, long expectedSeconds) {
        assertThat(manager.currentRefreshIntervalSeconds(minutes)).isEqualTo(expectedSeconds);
    }

    @Test
    @DisplayName("Should flag a candle current until its bucket closes")
    void testIsCurrent() {
        long candleTs = BOUNDARY_MS / 1000L;

        assertThat(manager.isCurrent(candleTs, 1, BOUNDARY_MS + 59_999L)).isTrue();
        assertThat(manager.isCurrent(candleTs, 1, BOUNDARY_MS + 60_000L)).isFalse();
    }

    @Test
    @DisplayName("Should count whole buckets between timestamps")
    void testWindowsBetween() {
        long from = BOUNDARY_MS / 1000L;

        assertThat(manager.windowsBetween(from, from + 3600, 15)).isEqualTo(4);
        assertThat(manager.windowsBetween(from, from + 59, 1)).isZero();
    }
}

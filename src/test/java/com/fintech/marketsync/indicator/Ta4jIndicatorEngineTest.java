package com.fintech.marketsync.indicator;

import com.fintech.marketsync.domain.Candle;
import com.fintech.marketsync.domain.IndicatorCandle;
import com.fintech.marketsync.support.TestCandles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Ta4j Indicator Engine Tests")
class Ta4jIndicatorEngineTest {

    private static final long T0 = 1_704_067_200L;

    private Ta4jIndicatorEngine engine;

    @BeforeEach
    void setUp() {
        engine = new Ta4jIndicatorEngine(199);
    }

    @Test
    @DisplayName("Exactly the minimum number of candles should compute")
    void testExactMinimum() {
        List<IndicatorCandle> result = engine.compute(TestCandles.series(T0, 1, 199));

        assertThat(result).hasSize(199);
        assertThat(result.get(198).rsi()).isNotNull();
        assertThat(result.get(198).ma20()).isNotNull();
        assertThat(result.get(198).ma200()).isNull();
    }

    @Test
    @DisplayName("Fewer candles than the minimum should fail")
    void testBelowMinimum() {
        assertThatThrownBy(() -> engine.compute(TestCandles.series(T0, 1, 198)))
            .isInstanceOf(InsufficientCandlesException.class);
    }

    @Test
    @DisplayName("Values should stay null until their period is covered")
    void testNullBeforePeriod() {
        List<IndicatorCandle> result = engine.compute(TestCandles.series(T0, 1, 250));

        assertThat(result.get(5).ema7()).isNull();
        assertThat(result.get(6).ema7()).isNotNull();
        assertThat(result.get(18).ma20()).isNull();
        assertThat(result.get(19).ma20()).isNotNull();
        assertThat(result.get(13).rsi()).isNull();
        assertThat(result.get(14).rsi()).isNotNull();
        assertThat(result.get(198).ma200()).isNull();
        assertThat(result.get(199).ma200()).isNotNull();
    }

    @Test
    @DisplayName("Moving averages should match the arithmetic mean of closes")
    void testMovingAverageValues() {
        List<Candle> rising = new ArrayList<>();
        for (int i = 0; i < 199; i++) {
            double close = 100 + i;
            rising.add(Candle.of(T0 + i * 60L, close, close + 1, close - 1, close, 10));
        }

        List<IndicatorCandle> result = engine.compute(rising);

        assertThat(result.get(19).ma20()).isCloseTo(109.5, within(1e-9));
        assertThat(result.get(198).rsi()).isCloseTo(100.0, within(1e-6));
    }

    @Test
    @DisplayName("States should stay within their documented ranges")
    void testStateRanges() {
        List<IndicatorCandle> result = engine.compute(TestCandles.series(T0, 1, 400));

        assertThat(result).allSatisfy(c -> {
            assertThat(c.trendState()).isIn(-2, 0, 2);
            assertThat(c.bbState()).isIn(-2, -1, 0, 2);
            assertThat(c.autoTrendState()).isNull();
        });
    }

    @Test
    @DisplayName("Should reject windows that are not strictly ascending")
    void testRejectsUnordered() {
        List<Candle> candles = new ArrayList<>(TestCandles.series(T0, 1, 199));
        candles.set(10, candles.get(9));

        assertThatThrownBy(() -> engine.compute(candles)).isInstanceOf(IllegalArgumentException.class);
    }
}

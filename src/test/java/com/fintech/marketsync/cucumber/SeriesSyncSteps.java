package com.fintech.marketsync.cucumber;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.marketsync.cache.CandleCodec;
import com.fintech.marketsync.config.ApplicationConfig;
import com.fintech.marketsync.config.MarketDataProperties;
import com.fintech.marketsync.domain.Candle;
import com.fintech.marketsync.domain.Gap;
import com.fintech.marketsync.domain.Timeframe;
import com.fintech.marketsync.indicator.AutoTrendResolver;
import com.fintech.marketsync.indicator.Ta4jIndicatorEngine;
import com.fintech.marketsync.ingestion.CandleFetcher;
import com.fintech.marketsync.persistence.DurableCandleWriter;
import com.fintech.marketsync.series.CandleSeriesStore;
import com.fintech.marketsync.series.GapBackfillService;
import com.fintech.marketsync.support.FakeExchangeClient;
import com.fintech.marketsync.support.InMemoryCandleCache;
import com.fintech.marketsync.support.MutableClock;
import com.fintech.marketsync.support.TestCandles;
import com.fintech.marketsync.support.TestProperties;
import com.fintech.marketsync.sync.CandleSyncService;
import com.fintech.marketsync.util.DisplayTimeFormatter;
import com.fintech.marketsync.util.TimeWindowManager;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * Step definitions for raw series merging, retention and gap backfill.
 * Everything runs against an in-memory cache and a scripted exchange.
 */
public class SeriesSyncSteps {

    private static final long T0 = 1_704_067_200L;

    private final MarketDataProperties properties = TestProperties.fast();
    private final FakeExchangeClient exchange = new FakeExchangeClient(300);
    private final MutableClock clock = MutableClock.atEpochSecond(T0);
    private final InMemoryCandleCache cache = new InMemoryCandleCache(clock);

    private String symbol;
    private String timeframe;
    private int minutes;
    private CandleSeriesStore store;
    private CandleSyncService syncService;

    private CandleSeriesStore store() {
        if (store == null) {
            store = new CandleSeriesStore(cache, new CandleCodec(new ObjectMapper()),
                new DisplayTimeFormatter(ZoneOffset.UTC), clock, properties);
        }
        return store;
    }

    private CandleSyncService syncService() {
        if (syncService == null) {
            CandleFetcher fetcher = new CandleFetcher(exchange, new ApplicationConfig().retryRegistry(properties),
                new TimeWindowManager(2, 3), clock, properties);
            syncService = new CandleSyncService(fetcher, store(), new GapBackfillService(store(), fetcher, properties),
                new Ta4jIndicatorEngine(properties), new AutoTrendResolver(properties),
                mock(DurableCandleWriter.class), properties);
        }
        return syncService;
    }

    private long minute(int offset) {
        return T0 + offset * minutes * 60L;
    }

    @Given("a sync engine for {string} on the {string} timeframe")
    public void aSyncEngineFor(String symbol, String timeframe) {
        this.symbol = symbol;
        this.timeframe = timeframe;
        this.minutes = Timeframe.toMinutes(timeframe);
        properties.setSymbols(List.of(symbol));
        properties.setTimeframes(List.of(minutes));
        properties.getSeries().setMaxLen(100);
        properties.getIndicators().setMinCandles(30);
        properties.getIndicators().setWarmUpCount(10);
    }

    @Given("the store keeps {int} candles")
    public void theStoreKeeps(int maxLen) {
        properties.getSeries().setMaxLen(maxLen);
    }

    @Given("the backfill cap is {int} candles")
    public void theBackfillCapIs(int cap) {
        properties.getSeries().setGapBackfillCap(cap);
    }

    @Given("the exchange has {int} closed candles")
    public void theExchangeHasClosedCandles(int count) {
        exchange.addSeries(symbol, minutes, T0, count);
    }

    @Given("the store already holds the first {int} of them")
    public void theStoreHoldsTheFirst(int count) {
        theRawSeriesHolds(count);
    }

    @Given("the raw series holds {int} candles")
    public void theRawSeriesHolds(int count) {
        store().merge(symbol, timeframe, TestCandles.series(T0, minutes, count), 0);
    }

    @When("{int} candles are merged into the raw series")
    public void candlesAreMerged(int count) {
        store().merge(symbol, timeframe, TestCandles.series(T0, minutes, count), 0);
    }

    @When("the candle at bar {int} is merged again with close {double}")
    public void theCandleIsMergedAgain(int bar, double close) {
        store().merge(symbol, timeframe, List.of(TestCandles.candle(minute(bar), close)), 0);
    }

    @When("the completed candles are synchronized just after bar {int} closes")
    public void theCompletedCandlesAreSynchronized(int bar) {
        clock.set(Instant.ofEpochSecond(minute(bar + 1) + 3));
        syncService().syncCompleted(symbol, minutes);
    }

    @Then("the raw series holds {int} contiguous candles")
    public void theRawSeriesHoldsContiguous(int count) {
        List<Candle> raw = store().loadRaw(symbol, timeframe);
        assertThat(raw).hasSize(count);
        for (int i = 1; i < raw.size(); i++) {
            assertThat(raw.get(i).timestamp() - raw.get(i - 1).timestamp()).isEqualTo(minutes * 60L);
        }
    }

    @Then("the raw series holds {int} candles from bar {int} to bar {int}")
    public void theRawSeriesHoldsRange(int count, int first, int last) {
        List<Candle> raw = store().loadRaw(symbol, timeframe);
        assertThat(raw).hasSize(count);
        assertThat(raw.get(0).timestamp()).isEqualTo(minute(first));
        assertThat(raw.get(raw.size() - 1).timestamp()).isEqualTo(minute(last));
    }

    @Then("the candle at bar {int} has close {double}")
    public void theCandleHasClose(int bar, double close) {
        assertThat(store().loadRaw(symbol, timeframe))
            .filteredOn(c -> c.timestamp() == minute(bar))
            .singleElement()
            .satisfies(c -> assertThat(c.close()).isEqualTo(close));
    }

    @Then("no unresolved gaps are recorded")
    public void noUnresolvedGaps() {
        assertThat(store().unresolvedGaps(symbol, timeframe)).isEmpty();
    }

    @Then("an unresolved gap is recorded from bar {int} to bar {int}")
    public void anUnresolvedGapIsRecorded(int from, int to) {
        assertThat(store().unresolvedGaps(symbol, timeframe)).containsExactly(new Gap(minute(from), minute(to)));
    }

    @Then("the indicator series is not empty")
    public void theIndicatorSeriesIsNotEmpty() {
        assertThat(store().loadIndicatorSeries(symbol, timeframe)).isNotEmpty();
    }
}

package com.fintech.marketsync.series;

import com.fintech.marketsync.config.MarketDataProperties;
import com.fintech.marketsync.domain.Candle;
import com.fintech.marketsync.domain.Gap;
import com.fintech.marketsync.domain.Timeframe;
import com.fintech.marketsync.ingestion.CandleFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Detects holes between the stored raw series and the source's newest closed candle
 * and backfills them with a bounded fetch.
 *
 * Holes larger than the backfill cap are clamped to the newest buckets; the part that
 * could not be fetched is recorded as an unresolved gap.
 */
@Service
public class GapBackfillService {

    private static final Logger log = LoggerFactory.getLogger(GapBackfillService.class);

    private final CandleSeriesStore seriesStore;
    private final CandleFetcher fetcher;
    private final long backfillCap;
    private final double thresholdFactor;

    public GapBackfillService(CandleSeriesStore seriesStore, CandleFetcher fetcher, MarketDataProperties properties) {
        this.seriesStore = seriesStore;
        this.fetcher = fetcher;
        this.backfillCap = properties.getSeries().getGapBackfillCap();
        this.thresholdFactor = properties.getSeries().getGapThresholdFactor();
    }

    /**
     * Outcome of one gap check.
     *
     * @param gap the detected hole, empty when the series was contiguous
     * @param fetched candles merged by the backfill
     * @param clamped true when the hole exceeded the backfill cap
     */
    public record BackfillResult(Optional<Gap> gap, int fetched, boolean clamped) {

        static BackfillResult none() {
            return new BackfillResult(Optional.empty(), 0, false);
        }

        public boolean gapDetected() {
            return gap.isPresent();
        }
    }

    /**
     * Compares the last stored timestamp with the newest closed candle at the source.
     * Re-running on a complete series is a no-op.
     */
    public BackfillResult detectAndFillGap(String symbol, int minutes) {
        String timeframe = Timeframe.toCode(minutes);
        Optional<Long> last = seriesStore.lastTimestamp(symbol, timeframe);
        if (last.isEmpty()) {
            log.debug("No stored series yet, skipping gap check: symbol={}, timeframe={}", symbol, timeframe);
            return BackfillResult.none();
        }
        List<Candle> newest = fetcher.fetchLatest(symbol, minutes, 2, false);
        if (newest.isEmpty()) {
            return BackfillResult.none();
        }
        return fillGap(symbol, minutes, last.get(), newest.get(newest.size() - 1).timestamp());
    }

    /**
     * Backfills between a known last timestamp and the newest source timestamp,
     * both epoch seconds.
     */
    public BackfillResult fillGap(String symbol, int minutes, long lastTs, long newestTs) {
        String timeframe = Timeframe.toCode(minutes);
        long intervalSec = minutes * 60L;
        if (newestTs - lastTs <= thresholdFactor * intervalSec) {
            if (!seriesStore.unresolvedGaps(symbol, timeframe).isEmpty()
                    && contiguous(seriesStore.loadRaw(symbol, timeframe), intervalSec)) {
                seriesStore.clearGaps(symbol, timeframe);
            }
            return BackfillResult.none();
        }

        Gap gap = new Gap(lastTs, newestTs);
        long expected = gap.expectedCandles(minutes);
        long fromTs = lastTs;
        boolean clamped = false;
        if (expected > backfillCap) {
            fromTs = newestTs - backfillCap * intervalSec;
            clamped = true;
            log.warn("Gap exceeds backfill cap, clamping: symbol={}, timeframe={}, expected={}, cap={}, lostFrom={}, lostTo={}",
                symbol, timeframe, expected, backfillCap, lastTs, fromTs);
            seriesStore.recordGap(symbol, timeframe, new Gap(lastTs, fromTs));
        }

        log.info("Backfilling gap: symbol={}, timeframe={}, from={}, to={}, expected={}",
            symbol, timeframe, fromTs, newestTs, Math.min(expected, backfillCap));
        List<Candle> candles = fetcher.fetchSince(symbol, minutes, (fromTs + 1) * 1000L, (int) backfillCap);
        seriesStore.merge(symbol, timeframe, candles, 0);

        long requested = (newestTs - fromTs) / intervalSec;
        if (candles.size() < requested) {
            log.warn("Backfill incomplete: symbol={}, timeframe={}, fetched={}, requested={}",
                symbol, timeframe, candles.size(), requested);
            seriesStore.recordGap(symbol, timeframe, new Gap(fromTs, newestTs));
        } else if (!clamped) {
            seriesStore.clearGaps(symbol, timeframe);
        }
        return new BackfillResult(Optional.of(gap), candles.size(), clamped);
    }

    private boolean contiguous(List<Candle> series, long intervalSec) {
        for (int i = 1; i < series.size(); i++) {
            if (series.get(i).timestamp() - series.get(i - 1).timestamp() > thresholdFactor * intervalSec) {
                return false;
            }
        }
        return true;
    }
}

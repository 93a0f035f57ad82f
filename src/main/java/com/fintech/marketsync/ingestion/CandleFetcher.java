package com.fintech.marketsync.ingestion;

import com.fintech.marketsync.config.MarketDataProperties;
import com.fintech.marketsync.domain.Candle;
import com.fintech.marketsync.domain.Timeframe;
import com.fintech.marketsync.ingestion.exchange.ExchangeCandle;
import com.fintech.marketsync.ingestion.exchange.ExchangeClient;
import com.fintech.marketsync.ingestion.exchange.ExchangeNetworkException;
import com.fintech.marketsync.util.TimeWindowManager;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/**
 * Polling client: pulls candles from the exchange, retries rate limits with
 * exponential backoff, paginates above the provider page size, and turns raw rows
 * into aligned, validated candles.
 */
@Component
public class CandleFetcher {

    private static final Logger log = LoggerFactory.getLogger(CandleFetcher.class);

    public static final String RETRY_NAME = "exchange";

    private final ExchangeClient exchangeClient;
    private final Retry retry;
    private final TimeWindowManager timeWindowManager;
    private final Clock clock;
    private final long pageDelayMs;

    public CandleFetcher(
            ExchangeClient exchangeClient,
            RetryRegistry retryRegistry,
            TimeWindowManager timeWindowManager,
            Clock clock,
            MarketDataProperties properties) {
        this.exchangeClient = exchangeClient;
        this.retry = retryRegistry.retry(RETRY_NAME, RETRY_NAME);
        this.timeWindowManager = timeWindowManager;
        this.clock = clock;
        this.pageDelayMs = properties.getExchange().getPageDelayMs();

        retry.getEventPublisher()
            .onRetry(event -> log.warn("Exchange call retry: attempt={}, wait={}ms, cause={}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "n/a"));
    }

    /**
     * Newest candles. Paginates backward when limit exceeds the provider page size.
     *
     * @param includeCurrent keep the in-progress candle, flagged current
     */
    public List<Candle> fetchLatest(String symbol, int minutes, int limit, boolean includeCurrent) {
        int pageSize = exchangeClient.maxPageSize();
        if (limit <= pageSize) {
            return toCandles(symbol, minutes, call(symbol, minutes, limit, null), includeCurrent);
        }
        return fetchHistory(symbol, minutes, limit, includeCurrent);
    }

    /**
     * Walks backward from the newest page until target candles are collected or a page
     * adds nothing new. Older pages are time-anchored and start historyPageSize buckets
     * before the oldest candle so far.
     */
    public List<Candle> fetchHistory(String symbol, int minutes, int target, boolean includeCurrent) {
        int pageSize = exchangeClient.maxPageSize();
        int historyPageSize = exchangeClient.maxHistoryPageSize();
        long intervalMs = minutes * 60_000L;
        TreeMap<Long, Candle> collected = new TreeMap<>();

        List<Candle> first = toCandles(symbol, minutes, call(symbol, minutes, pageSize, null), includeCurrent);
        first.forEach(c -> collected.put(c.timestamp(), c));

        int pages = 1;
        while (collected.size() < target && !collected.isEmpty()) {
            long oldestMs = collected.firstKey() * 1000L;
            long sinceMs = oldestMs - historyPageSize * intervalMs;
            pause();
            List<Candle> page = toCandles(symbol, minutes,
                call(symbol, minutes, historyPageSize, sinceMs), includeCurrent);
            int before = collected.size();
            page.forEach(c -> collected.putIfAbsent(c.timestamp(), c));
            pages++;
            int added = collected.size() - before;
            log.debug("History page: symbol={}, timeframe={}, page={}, added={}, total={}",
                symbol, Timeframe.toCode(minutes), pages, added, collected.size());
            if (added == 0) {
                log.info("History exhausted: symbol={}, timeframe={}, collected={}, target={}",
                    symbol, Timeframe.toCode(minutes), collected.size(), target);
                break;
            }
        }
        return tail(new ArrayList<>(collected.values()), target);
    }

    /**
     * Candles at or after sinceMs, walking forward page by page until limit is reached
     * or the source has nothing newer.
     */
    public List<Candle> fetchSince(String symbol, int minutes, long sinceMs, int limit) {
        int pageSize = exchangeClient.maxHistoryPageSize();
        long intervalMs = minutes * 60_000L;
        TreeMap<Long, Candle> collected = new TreeMap<>();
        long cursor = sinceMs;
        while (collected.size() < limit) {
            int request = Math.min(pageSize, limit - collected.size());
            List<Candle> page = toCandles(symbol, minutes, call(symbol, minutes, request, cursor), false);
            int before = collected.size();
            page.stream()
                .filter(c -> c.timestamp() * 1000L >= sinceMs)
                .forEach(c -> collected.putIfAbsent(c.timestamp(), c));
            if (collected.size() == before) {
                break;
            }
            cursor = collected.lastKey() * 1000L + intervalMs;
            if (cursor > clock.millis()) {
                break;
            }
            pause();
        }
        return new ArrayList<>(collected.values());
    }

    private List<ExchangeCandle> call(String symbol, int minutes, int limit, Long sinceMs) {
        return retry.executeSupplier(() -> exchangeClient.fetchCandles(symbol, minutes, limit, sinceMs));
    }

    /**
     * Validates and aligns raw rows. Malformed rows, invalid OHLC and zero-volume closed
     * candles are skipped one by one. A row the exchange has not confirmed stays current
     * even after its bucket has ended.
     */
    List<Candle> toCandles(String symbol, int minutes, List<ExchangeCandle> rows, boolean includeCurrent) {
        long now = clock.millis();
        TreeMap<Long, Candle> byTimestamp = new TreeMap<>();
        int skipped = 0;
        for (ExchangeCandle row : rows) {
            Candle candle = parse(row, minutes, now);
            if (candle == null) {
                skipped++;
                continue;
            }
            if (candle.current() && !includeCurrent) {
                continue;
            }
            if (!candle.current() && candle.volume() == 0) {
                skipped++;
                continue;
            }
            byTimestamp.put(candle.timestamp(), candle);
        }
        if (skipped > 0) {
            log.warn("Skipped invalid candle rows: symbol={}, timeframe={}, skipped={}",
                symbol, Timeframe.toCode(minutes), skipped);
        }
        return new ArrayList<>(byTimestamp.values());
    }

    private Candle parse(ExchangeCandle row, int minutes, long nowMs) {
        if (row == null || row.fields() == null || row.fields().size() < ExchangeCandle.MIN_FIELDS) {
            return null;
        }
        for (int i = 0; i < ExchangeCandle.MIN_FIELDS; i++) {
            if (row.field(i) == null) {
                return null;
            }
        }
        try {
            long tsMs = Long.parseLong(row.field(0).trim());
            long aligned = Timeframe.align(tsMs, minutes);
            boolean unconfirmed = row.fields().size() > ExchangeCandle.MIN_FIELDS && !row.confirmed();
            boolean current = timeWindowManager.isCurrent(aligned, minutes, nowMs) || unconfirmed;
            return new Candle(
                aligned,
                Double.parseDouble(row.field(1)),
                Double.parseDouble(row.field(2)),
                Double.parseDouble(row.field(3)),
                Double.parseDouble(row.field(4)),
                Double.parseDouble(row.field(5)),
                current
            );
        } catch (IllegalArgumentException e) {
            log.debug("Invalid candle row {}: {}", row.fields(), e.getMessage());
            return null;
        }
    }

    private void pause() {
        if (pageDelayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(pageDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeNetworkException("Interrupted between pages", e);
        }
    }

    private static <T> List<T> tail(List<T> list, int size) {
        return list.size() <= size ? list : new ArrayList<>(list.subList(list.size() - size, list.size()));
    }
}

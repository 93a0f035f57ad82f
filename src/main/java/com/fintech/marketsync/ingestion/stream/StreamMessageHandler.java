package com.fintech.marketsync.ingestion.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.marketsync.config.MarketDataProperties;
import com.fintech.marketsync.domain.Candle;
import com.fintech.marketsync.domain.Timeframe;
import com.fintech.marketsync.series.CandleSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Consumes push messages from the exchange stream.
 *
 * Candle pushes update the latest slot of the channel's own timeframe. Writes are
 * throttled per symbol: pushes inside the save interval only replace the pending
 * candle for their timeframe, and the next due push flushes every pending timeframe
 * of that symbol in one write.
 */
@Component
public class StreamMessageHandler {

    private static final Logger log = LoggerFactory.getLogger(StreamMessageHandler.class);

    private final CandleSeriesStore seriesStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final long saveIntervalMs;

    private final Map<String, AtomicLong> messageCounts = new ConcurrentHashMap<>();
    private final Map<String, Long> lastSaveBySymbol = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Candle>> pendingBySymbol = new ConcurrentHashMap<>();
    private final AtomicLong malformedCount = new AtomicLong(0);

    public StreamMessageHandler(
            CandleSeriesStore seriesStore,
            ObjectMapper objectMapper,
            Clock clock,
            MarketDataProperties properties) {
        this.seriesStore = seriesStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.saveIntervalMs = properties.getStreaming().getSaveIntervalMs();
    }

    /**
     * Handles one raw text frame. Never throws for bad input: malformed frames are
     * counted and logged.
     */
    public void handle(String message) {
        if (message == null || message.isBlank() || "pong".equals(message)) {
            return;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(message);
        } catch (IOException e) {
            malformedCount.incrementAndGet();
            log.warn("Unparseable stream message: error={}, length={}", e.getMessage(), message.length());
            return;
        }

        if (root.has("event")) {
            handleEvent(root);
            return;
        }
        JsonNode arg = root.path("arg");
        JsonNode data = root.path("data");
        if (arg.isMissingNode() || !data.isArray() || data.isEmpty()) {
            log.debug("Ignoring stream message without candle data");
            return;
        }

        String channel = arg.path("channel").asText("");
        String symbol = arg.path("instId").asText("");
        Optional<Timeframe> timeframe = Timeframe.fromChannel(channel);
        if (timeframe.isEmpty() || symbol.isEmpty()) {
            log.debug("Ignoring push for unknown channel: channel={}, symbol={}", channel, symbol);
            return;
        }
        messageCounts.computeIfAbsent(symbol + ":" + channel, k -> new AtomicLong()).incrementAndGet();

        for (JsonNode row : data) {
            toCandle(row, timeframe.get()).ifPresent(candle ->
                pendingBySymbol.computeIfAbsent(symbol, k -> new ConcurrentHashMap<>())
                    .put(timeframe.get().code(), candle));
        }
        flushIfDue(symbol);
    }

    private void handleEvent(JsonNode root) {
        String event = root.path("event").asText();
        if ("error".equals(event)) {
            log.error("Stream error event: code={}, msg={}", root.path("code").asText(), root.path("msg").asText());
        } else {
            log.info("Stream event: event={}, arg={}", event, root.path("arg"));
        }
    }

    private void flushIfDue(String symbol) {
        long now = clock.millis();
        Long last = lastSaveBySymbol.get(symbol);
        if (last != null && now - last < saveIntervalMs) {
            return;
        }
        Map<String, Candle> pending = pendingBySymbol.remove(symbol);
        if (pending == null || pending.isEmpty()) {
            return;
        }
        lastSaveBySymbol.put(symbol, now);
        try {
            seriesStore.updateLatest(symbol, new LinkedHashMap<>(pending));
            log.debug("Stream latest saved: symbol={}, timeframes={}", symbol, pending.keySet());
        } catch (RuntimeException e) {
            log.error("Failed to save streamed candles: symbol={}, error={}", symbol, e.getMessage());
        }
    }

    Optional<Candle> toCandle(JsonNode row, Timeframe timeframe) {
        if (!row.isArray() || row.size() < 6) {
            malformedCount.incrementAndGet();
            return Optional.empty();
        }
        try {
            long timestamp = Timeframe.align(Long.parseLong(row.get(0).asText()), timeframe.minutes());
            boolean confirmed = row.size() > 6 && "1".equals(row.get(row.size() - 1).asText());
            return Optional.of(new Candle(
                timestamp,
                Double.parseDouble(row.get(1).asText()),
                Double.parseDouble(row.get(2).asText()),
                Double.parseDouble(row.get(3).asText()),
                Double.parseDouble(row.get(4).asText()),
                Double.parseDouble(row.get(5).asText()),
                !confirmed));
        } catch (IllegalArgumentException e) {
            malformedCount.incrementAndGet();
            log.warn("Malformed streamed candle: timeframe={}, row={}, error={}", timeframe.code(), row, e.getMessage());
            return Optional.empty();
        }
    }

    /** Returns per-channel message counts since the last call and resets them. */
    public Map<String, Long> drainMessageCounts() {
        Map<String, Long> snapshot = new TreeMap<>();
        messageCounts.forEach((key, count) -> {
            long value = count.getAndSet(0);
            if (value > 0) {
                snapshot.put(key, value);
            }
        });
        return snapshot;
    }

    public long getMalformedCount() {
        return malformedCount.get();
    }
}

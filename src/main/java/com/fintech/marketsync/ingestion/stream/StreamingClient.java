package com.fintech.marketsync.ingestion.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fintech.marketsync.cache.CacheKeys;
import com.fintech.marketsync.cache.CandleCache;
import com.fintech.marketsync.config.MarketDataProperties;
import com.fintech.marketsync.domain.Timeframe;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps one subscription to the exchange's candle stream alive.
 *
 * A supervisor thread connects, subscribes to every symbol x timeframe channel and
 * waits for the socket to close; on close or error it unsubscribes and closes the old
 * socket, records the disconnected state and reconnects after a fixed delay. Text frames go to the ring buffer, "pong"
 * replies are discarded. A scheduler sends the "ping" heartbeat and logs message
 * counts per channel.
 */
@Component
@ConditionalOnProperty(prefix = "market-data.streaming", name = "enabled", havingValue = "true", matchIfMissing = true)
public class StreamingClient {

    private static final Logger log = LoggerFactory.getLogger(StreamingClient.class);

    static final String STATUS_CONNECTED = "connected";
    static final String STATUS_DISCONNECTED = "disconnected";

    private static final long CLOSE_TIMEOUT_MS = 2_000L;

    private final HttpClient httpClient;
    private final StreamEventPublisher publisher;
    private final StreamMessageHandler messageHandler;
    private final CandleCache cache;
    private final ObjectMapper objectMapper;
    private final MarketDataProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<WebSocket> socketRef = new AtomicReference<>();
    private final AtomicReference<CompletableFuture<Void>> closedRef = new AtomicReference<>();

    private ScheduledExecutorService scheduler;
    private Thread supervisor;

    public StreamingClient(
            HttpClient httpClient,
            StreamEventPublisher publisher,
            StreamMessageHandler messageHandler,
            CandleCache cache,
            ObjectMapper objectMapper,
            MarketDataProperties properties) {
        this.httpClient = httpClient;
        this.publisher = publisher;
        this.messageHandler = messageHandler;
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @PostConstruct
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        MarketDataProperties.Streaming streaming = properties.getStreaming();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "stream-heartbeat");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(this::sendHeartbeat,
            streaming.getHeartbeatMs(), streaming.getHeartbeatMs(), TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(this::reportStatus,
            streaming.getStatusIntervalMs(), streaming.getStatusIntervalMs(), TimeUnit.MILLISECONDS);

        supervisor = new Thread(this::superviseConnection, "stream-supervisor");
        supervisor.setDaemon(true);
        supervisor.start();
        log.info("Streaming client started: url={}, symbols={}, timeframes={}",
            streaming.getUrl(), properties.getSymbols(), properties.getTimeframes());
    }

    private void superviseConnection() {
        long reconnectDelayMs = properties.getStreaming().getReconnectDelayMs();
        while (running.get()) {
            try {
                connectAndAwaitClose();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException | ExecutionException | TimeoutException e) {
                log.warn("Stream connection failed: error={}", e.getMessage());
            }
            markDisconnected();
            if (!running.get()) {
                break;
            }
            log.info("Reconnecting stream in {}ms", reconnectDelayMs);
            try {
                Thread.sleep(reconnectDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Stream supervisor exited");
    }

    private void connectAndAwaitClose() throws InterruptedException, ExecutionException, TimeoutException {
        CompletableFuture<Void> closed = new CompletableFuture<>();
        closedRef.set(closed);
        URI uri = URI.create(properties.getStreaming().getUrl());
        long timeoutMs = properties.getExchange().getRequestTimeoutMs();

        WebSocket socket = httpClient.newWebSocketBuilder()
            .connectTimeout(Duration.ofMillis(timeoutMs))
            .buildAsync(uri, new FrameListener(closed))
            .get(timeoutMs, TimeUnit.MILLISECONDS);
        socketRef.set(socket);
        setStatus(STATUS_CONNECTED);
        log.info("Stream connected: url={}", uri);

        socket.sendText(subscriptionMessage("subscribe"), true);
        try {
            closed.get();
        } catch (ExecutionException e) {
            log.warn("Stream closed with error: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }
    }

    private final class FrameListener implements WebSocket.Listener {

        private final StringBuilder buffer = new StringBuilder();
        private final CompletableFuture<Void> closed;

        private FrameListener(CompletableFuture<Void> closed) {
            this.closed = closed;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buffer.append(data);
            if (last) {
                String frame = buffer.toString();
                buffer.setLength(0);
                if (!"pong".equals(frame)) {
                    publisher.tryPublish(frame);
                }
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.warn("Stream closed by server: status={}, reason={}", statusCode, reason);
            closed.complete(null);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.error("Stream error: {}", error.getMessage(), error);
            closed.completeExceptionally(error);
        }
    }

    /** Builds the subscribe or unsubscribe request for every configured channel. */
    String subscriptionMessage(String op) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("op", op);
        ArrayNode args = request.putArray("args");
        for (String symbol : properties.getSymbols()) {
            for (int minutes : properties.getTimeframes()) {
                Optional<Timeframe> timeframe = Timeframe.fromMinutes(minutes);
                if (timeframe.isEmpty()) {
                    log.warn("No stream channel for timeframe, skipping: minutes={}", minutes);
                    continue;
                }
                ObjectNode arg = args.addObject();
                arg.put("channel", timeframe.get().channel());
                arg.put("instId", symbol);
            }
        }
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode subscription request", e);
        }
    }

    private void sendHeartbeat() {
        WebSocket socket = socketRef.get();
        if (socket == null || socket.isOutputClosed()) {
            return;
        }
        socket.sendText("ping", true).exceptionally(e -> {
            log.warn("Heartbeat failed, forcing reconnect: {}", e.getMessage());
            socket.abort();
            CompletableFuture<Void> closed = closedRef.get();
            if (closed != null) {
                closed.complete(null);
            }
            return null;
        });
    }

    void reportStatus() {
        try {
            Map<String, Long> counts = messageHandler.drainMessageCounts();
            log.info("Stream status: connected={}, channels={}, messages={}, dropped={}, malformed={}",
                isConnected(), counts.size(), counts, publisher.getFramesDropped(), messageHandler.getMalformedCount());
            setStatus(isConnected() ? STATUS_CONNECTED : STATUS_DISCONNECTED);
        } catch (RuntimeException e) {
            log.warn("Stream status report failed: {}", e.getMessage());
        }
    }

    public boolean isConnected() {
        WebSocket socket = socketRef.get();
        return socket != null && !socket.isOutputClosed() && !socket.isInputClosed();
    }

    private void markDisconnected() {
        WebSocket socket = socketRef.getAndSet(null);
        if (socket != null) {
            closeQuietly(socket, "reconnect");
        }
        setStatus(STATUS_DISCONNECTED);
    }

    /**
     * Best-effort unsubscribe and close. Falls back to abort when the output side is
     * already closed or the close handshake does not complete in time.
     */
    void closeQuietly(WebSocket socket, String reason) {
        if (socket.isOutputClosed()) {
            socket.abort();
            return;
        }
        try {
            socket.sendText(subscriptionMessage("unsubscribe"), true)
                .thenCompose(ws -> ws.sendClose(WebSocket.NORMAL_CLOSURE, reason))
                .get(CLOSE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            socket.abort();
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.warn("Graceful stream close failed, aborting: reason={}, error={}", reason, e.getMessage());
            socket.abort();
        }
    }

    private void setStatus(String status) {
        try {
            cache.set(CacheKeys.STREAM_STATUS, status);
        } catch (RuntimeException e) {
            log.warn("Failed to record stream status: status={}, error={}", status, e.getMessage());
        }
    }

    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping streaming client...");
        WebSocket socket = socketRef.getAndSet(null);
        if (socket != null) {
            closeQuietly(socket, "shutdown");
        }
        CompletableFuture<Void> closed = closedRef.get();
        if (closed != null) {
            closed.complete(null);
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        if (supervisor != null) {
            supervisor.interrupt();
        }
        setStatus(STATUS_DISCONNECTED);
        log.info("Streaming client stopped");
    }
}

package com.fintech.marketsync.ingestion.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.marketsync.cache.CacheKeys;
import com.fintech.marketsync.config.MarketDataProperties;
import com.fintech.marketsync.support.InMemoryCandleCache;
import com.fintech.marketsync.support.MutableClock;
import com.fintech.marketsync.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Streaming Client Tests")
class StreamingClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MarketDataProperties properties;
    private InMemoryCandleCache cache;
    private StreamMessageHandler messageHandler;
    private StreamingClient client;

    @BeforeEach
    void setUp() {
        properties = TestProperties.fast();
        properties.setSymbols(List.of("BTC-USDT-SWAP", "ETH-USDT-SWAP"));
        properties.setTimeframes(List.of(1, 60, 240));
        cache = new InMemoryCandleCache(MutableClock.atEpochSecond(1_704_067_200L));
        messageHandler = mock(StreamMessageHandler.class);
        client = new StreamingClient(HttpClient.newHttpClient(), mock(StreamEventPublisher.class),
            messageHandler, cache, objectMapper, properties);
    }

    @Test
    @DisplayName("Subscription covers every symbol and timeframe channel")
    void testSubscriptionMessage() throws Exception {
        JsonNode request = objectMapper.readTree(client.subscriptionMessage("subscribe"));

        assertThat(request.path("op").asText()).isEqualTo("subscribe");
        JsonNode args = request.path("args");
        assertThat(args).hasSize(6);
        assertThat(args.get(0).path("channel").asText()).isEqualTo("candle1m");
        assertThat(args.get(0).path("instId").asText()).isEqualTo("BTC-USDT-SWAP");
        assertThat(args.get(1).path("channel").asText()).isEqualTo("candle1H");
        assertThat(args.get(2).path("channel").asText()).isEqualTo("candle4H");
        assertThat(args.get(5).path("instId").asText()).isEqualTo("ETH-USDT-SWAP");
    }

    @Test
    @DisplayName("Unsubscribe uses the same channel list")
    void testUnsubscribeMessage() throws Exception {
        JsonNode subscribe = objectMapper.readTree(client.subscriptionMessage("subscribe"));
        JsonNode unsubscribe = objectMapper.readTree(client.subscriptionMessage("unsubscribe"));

        assertThat(unsubscribe.path("op").asText()).isEqualTo("unsubscribe");
        assertThat(unsubscribe.path("args")).isEqualTo(subscribe.path("args"));
    }

    @Test
    @DisplayName("Status report drains message counts and records the disconnected state")
    void testReportStatusWhileDisconnected() {
        when(messageHandler.drainMessageCounts()).thenReturn(Map.of("BTC-USDT-SWAP:candle1m", 12L));

        client.reportStatus();

        verify(messageHandler).drainMessageCounts();
        assertThat(client.isConnected()).isFalse();
        assertThat(cache.get(CacheKeys.STREAM_STATUS)).contains(StreamingClient.STATUS_DISCONNECTED);
    }

    @Test
    @DisplayName("Closing an open socket unsubscribes then sends a normal close")
    void testCloseQuietlyUnsubscribes() {
        WebSocket socket = mock(WebSocket.class);
        when(socket.isOutputClosed()).thenReturn(false);
        when(socket.sendText(anyString(), eq(true))).thenReturn(CompletableFuture.completedFuture(socket));
        when(socket.sendClose(anyInt(), anyString())).thenReturn(CompletableFuture.completedFuture(socket));

        client.closeQuietly(socket, "reconnect");

        verify(socket).sendText(client.subscriptionMessage("unsubscribe"), true);
        verify(socket).sendClose(WebSocket.NORMAL_CLOSURE, "reconnect");
        verify(socket, never()).abort();
    }

    @Test
    @DisplayName("A failed unsubscribe aborts the socket")
    void testCloseQuietlyAbortsOnFailure() {
        WebSocket socket = mock(WebSocket.class);
        when(socket.isOutputClosed()).thenReturn(false);
        when(socket.sendText(anyString(), eq(true)))
            .thenReturn(CompletableFuture.failedFuture(new IOException("broken pipe")));

        client.closeQuietly(socket, "reconnect");

        verify(socket, never()).sendClose(anyInt(), anyString());
        verify(socket).abort();
    }

    @Test
    @DisplayName("A socket whose output is already closed is aborted without a handshake")
    void testCloseQuietlyOutputClosed() {
        WebSocket socket = mock(WebSocket.class);
        when(socket.isOutputClosed()).thenReturn(true);

        client.closeQuietly(socket, "reconnect");

        verify(socket, never()).sendText(anyString(), anyBoolean());
        verify(socket).abort();
    }
}

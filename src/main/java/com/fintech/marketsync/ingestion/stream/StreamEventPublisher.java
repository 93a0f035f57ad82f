package com.fintech.marketsync.ingestion.stream;

import com.fintech.marketsync.config.MarketDataProperties;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventFactory;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands raw stream frames from the socket thread to a single consumer thread
 * through an LMAX Disruptor ring buffer, so slow cache writes never stall the
 * socket reader. Frames are dropped and counted when the buffer is full.
 */
@Component
public class StreamEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(StreamEventPublisher.class);

    private final StreamMessageHandler handler;
    private final MarketDataProperties properties;

    private final AtomicLong framesDropped = new AtomicLong(0);
    private final AtomicLong framesHandled = new AtomicLong(0);

    private Disruptor<FrameWrapper> disruptor;
    private RingBuffer<FrameWrapper> ringBuffer;

    public StreamEventPublisher(StreamMessageHandler handler, MarketDataProperties properties, MeterRegistry meterRegistry) {
        this.handler = handler;
        this.properties = properties;

        meterRegistry.gauge("stream.ringbuffer.frames.dropped", framesDropped);
        meterRegistry.gauge("stream.ringbuffer.frames.handled", framesHandled);
    }

    @PostConstruct
    public void start() {
        int bufferSize = properties.getStreaming().getBufferSize();
        EventFactory<FrameWrapper> eventFactory = FrameWrapper::new;

        ThreadFactory threadFactory = new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName("stream-frame-handler-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        };

        WaitStrategy waitStrategy = createWaitStrategy();
        disruptor = new Disruptor<>(eventFactory, bufferSize, threadFactory, ProducerType.MULTI, waitStrategy);
        disruptor.handleEventsWith(this::handleEvent);

        disruptor.setDefaultExceptionHandler(new ExceptionHandler<FrameWrapper>() {
            @Override
            public void handleEventException(Throwable ex, long sequence, FrameWrapper event) {
                log.error("Exception handling stream frame at sequence {}", sequence, ex);
            }

            @Override
            public void handleOnStartException(Throwable ex) {
                log.error("Exception during Disruptor startup", ex);
            }

            @Override
            public void handleOnShutdownException(Throwable ex) {
                log.error("Exception during Disruptor shutdown", ex);
            }
        });

        ringBuffer = disruptor.start();
        log.info("Stream ring buffer started: bufferSize={}, waitStrategy={}",
            bufferSize, waitStrategy.getClass().getSimpleName());
    }

    /**
     * Publishes without blocking the caller.
     *
     * @return false if the buffer was full and the frame dropped
     */
    public boolean tryPublish(String frame) {
        try {
            long sequence = ringBuffer.tryNext();
            try {
                ringBuffer.get(sequence).frame = frame;
                return true;
            } finally {
                ringBuffer.publish(sequence);
            }
        } catch (InsufficientCapacityException e) {
            long dropped = framesDropped.incrementAndGet();
            if (dropped % 1000 == 1) {
                log.warn("Stream ring buffer full, dropping frames: dropped={}", dropped);
            }
            return false;
        }
    }

    private void handleEvent(FrameWrapper wrapper, long sequence, boolean endOfBatch) {
        String frame = wrapper.frame;
        wrapper.frame = null;
        if (frame != null) {
            handler.handle(frame);
            framesHandled.incrementAndGet();
        }
    }

    @PreDestroy
    public void shutdown() {
        if (disruptor != null) {
            log.info("Shutting down stream ring buffer...");
            disruptor.shutdown();
            log.info("Stream ring buffer shutdown complete");
        }
    }

    private WaitStrategy createWaitStrategy() {
        String strategy = properties.getStreaming().getWaitStrategy();
        return switch (strategy.toUpperCase()) {
            case "BLOCKING" -> new BlockingWaitStrategy();
            case "SLEEPING" -> new SleepingWaitStrategy();
            case "YIELDING" -> new YieldingWaitStrategy();
            case "BUSY_SPIN" -> new BusySpinWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy: {}, using BLOCKING", strategy);
                yield new BlockingWaitStrategy();
            }
        };
    }

    private static class FrameWrapper {
        String frame;
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public long getFramesDropped() {
        return framesDropped.get();
    }

    public long getFramesHandled() {
        return framesHandled.get();
    }
}

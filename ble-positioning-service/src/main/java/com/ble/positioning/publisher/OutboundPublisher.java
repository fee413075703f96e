package com.ble.positioning.publisher;

import com.ble.positioning.config.PositioningProperties;
import com.ble.positioning.config.PositioningProperties.OverflowPolicy;
import com.ble.positioning.dto.AlertMessage;
import com.ble.positioning.dto.OutboundMessage;
import com.ble.positioning.dto.PositionMessage;
import com.ble.positioning.metrics.PositioningMetrics;
import com.ble.positioning.model.Beacon;
import com.ble.positioning.model.Floor;
import com.ble.positioning.model.SmoothedPosition;
import com.ble.positioning.model.Zone;
import com.ble.positioning.model.ZoneAlertEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Asynchronous outbound bus for positions and zone alerts.
 *
 * <p>Processing workers only enqueue; a dedicated drain thread hands messages to the
 * {@link OutboundMessageSink}. Enqueueing never blocks the processing tick.</p>
 *
 * <p><strong>Overflow policy:</strong></p>
 * <ul>
 *   <li><strong>DROP_OLDEST</strong> (default): the oldest queued message is discarded to make
 *       room, so consumers always receive the freshest positions</li>
 *   <li><strong>DROP_NEWEST</strong>: the message being enqueued is discarded</li>
 * </ul>
 * Every discarded message is counted.
 *
 * <p><strong>Shutdown:</strong> {@link #stop()} stops intake, lets the drain thread flush what is
 * queued for up to the configured flush timeout, then interrupts it.</p>
 */
@Slf4j
@Service
public class OutboundPublisher {

    private static final long POLL_INTERVAL_MS = 200;

    private final OutboundMessageSink sink;
    private final PositioningMetrics metrics;
    private final BlockingQueue<OutboundMessage> queue;
    private final int capacity;
    private final OverflowPolicy overflowPolicy;
    private final Duration flushTimeout;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong published = new AtomicLong();
    private volatile Thread drainThread;

    @Autowired
    public OutboundPublisher(OutboundMessageSink sink, PositioningMetrics metrics, PositioningProperties properties) {
        this(sink, metrics, properties.getOutbound().getQueueCapacity(),
                properties.getOutbound().getOverflowPolicy(),
                Duration.ofSeconds(properties.getOutbound().getFlushTimeoutSeconds()));
    }

    public OutboundPublisher(OutboundMessageSink sink, PositioningMetrics metrics, int capacity,
            OverflowPolicy overflowPolicy, Duration flushTimeout) {
        if (sink == null) {
            throw new IllegalArgumentException("OutboundMessageSink cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("PositioningMetrics cannot be null");
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("Outbound queue capacity must be positive");
        }
        this.sink = sink;
        this.metrics = metrics;
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.overflowPolicy = overflowPolicy;
        this.flushTimeout = flushTimeout;
    }

    @PostConstruct
    public void start() {
        if (running.compareAndSet(false, true)) {
            Thread thread = new Thread(this::drainLoop, "outbound-publisher");
            thread.setDaemon(true);
            drainThread = thread;
            thread.start();
            log.info("Outbound publisher started - capacity: {}, overflow policy: {}, sink: {}",
                    capacity, overflowPolicy, sink.getClass().getSimpleName());
        }
    }

    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Thread thread = drainThread;
        log.info("Stopping outbound publisher, {} message(s) queued", queue.size());
        if (thread != null) {
            try {
                thread.join(flushTimeout.toMillis());
                if (thread.isAlive()) {
                    log.warn("Outbound publisher did not flush within {} ms, {} message(s) left",
                            flushTimeout.toMillis(), queue.size());
                    thread.interrupt();
                }
            } catch (InterruptedException e) {
                log.warn("Interrupted while flushing outbound publisher");
                thread.interrupt();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Outbound publisher stopped - published: {}, dropped: {}", published.get(), dropped.get());
    }

    public boolean publishPosition(Beacon beacon, SmoothedPosition position) {
        return enqueue(PositionMessage.from(beacon, position));
    }

    public boolean publishPosition(Beacon beacon, Floor floor, SmoothedPosition position) {
        return enqueue(PositionMessage.from(beacon, floor, position));
    }

    public boolean publishAlert(Beacon beacon, Zone zone, ZoneAlertEvent event) {
        return enqueue(AlertMessage.from(beacon, zone, event));
    }

    /**
     * Queues a message without blocking.
     *
     * @return false if this message was discarded by the overflow policy
     */
    public boolean enqueue(OutboundMessage message) {
        if (queue.offer(message)) {
            return true;
        }
        if (overflowPolicy == OverflowPolicy.DROP_NEWEST) {
            recordDrop(message);
            return false;
        }
        while (!queue.offer(message)) {
            OutboundMessage evicted = queue.poll();
            if (evicted != null) {
                recordDrop(evicted);
            }
        }
        return true;
    }

    public int queueSize() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    public long droppedCount() {
        return dropped.get();
    }

    public long publishedCount() {
        return published.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    private void recordDrop(OutboundMessage message) {
        long total = dropped.incrementAndGet();
        metrics.recordOutboundDropped();
        if (total == 1 || total % 1000 == 0) {
            log.warn("Outbound queue full ({} messages), dropped {} {} so far; last: {} [{}]",
                    capacity, total, overflowPolicy == OverflowPolicy.DROP_OLDEST ? "oldest" : "newest",
                    message.type(), message.routingKey());
        }
    }

    private void drainLoop() {
        try {
            while (running.get() || !queue.isEmpty()) {
                OutboundMessage message = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (message != null) {
                    deliver(message);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Outbound drain thread interrupted");
        }
    }

    private void deliver(OutboundMessage message) throws InterruptedException {
        try {
            sink.send(message).get(flushTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS);
            published.incrementAndGet();
            metrics.recordOutboundPublished();
        } catch (ExecutionException | TimeoutException e) {
            metrics.recordOutboundFailed();
            log.error("Failed to deliver {} message [{}]", message.type(), message.routingKey(), e);
        } catch (RuntimeException e) {
            metrics.recordOutboundFailed();
            log.error("Sink rejected {} message [{}]", message.type(), message.routingKey(), e);
        }
    }
}

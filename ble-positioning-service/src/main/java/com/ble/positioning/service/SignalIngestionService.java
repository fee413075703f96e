package com.ble.positioning.service;

import com.ble.positioning.config.PositioningProperties;
import com.ble.positioning.dto.GatewayReading;
import com.ble.positioning.metrics.PositioningMetrics;
import com.ble.positioning.model.Beacon;
import com.ble.positioning.model.Gateway;
import com.ble.positioning.model.RawSignal;
import com.ble.positioning.model.RecoveredCondition;
import com.ble.positioning.repository.SignalStore;
import com.ble.positioning.topology.TopologyProvider;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Entry point for readings arriving from the inbound message bus.
 *
 * <p>{@link #ingest(GatewayReading)} resolves the reading's hardware addresses to topology ids and
 * appends a {@link RawSignal} to the store. A reading naming an unknown or inactive beacon or
 * gateway is dropped and counted as {@code UNRESOLVED_IDENTITY}.</p>
 *
 * <p>{@link #submit(GatewayReading)} is the asynchronous variant for transport callbacks that must
 * return immediately. Readings go through a bounded FIFO drained by a single consumer thread, so
 * readings of one beacon are stored in arrival order. When the queue is full the oldest queued
 * reading is discarded.</p>
 */
@Slf4j
@Service
public class SignalIngestionService {

    private static final long POLL_INTERVAL_MS = 200;
    private static final long WARN_EVERY = 1000;

    private final TopologyProvider topology;
    private final SignalStore signalStore;
    private final PositioningMetrics metrics;
    private final Clock clock;
    private final BlockingQueue<GatewayReading> inbound;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong unresolved = new AtomicLong();
    private final AtomicLong overflowed = new AtomicLong();
    private volatile Thread consumer;

    @Autowired
    public SignalIngestionService(TopologyProvider topology, SignalStore signalStore, PositioningMetrics metrics,
            Clock clock, PositioningProperties properties) {
        this(topology, signalStore, metrics, clock, properties.getInbound().getQueueCapacity());
    }

    public SignalIngestionService(TopologyProvider topology, SignalStore signalStore, PositioningMetrics metrics,
            Clock clock, int queueCapacity) {
        if (topology == null || signalStore == null || metrics == null || clock == null) {
            throw new IllegalArgumentException("Ingestion dependencies cannot be null");
        }
        this.topology = topology;
        this.signalStore = signalStore;
        this.metrics = metrics;
        this.clock = clock;
        this.inbound = new ArrayBlockingQueue<>(queueCapacity);
    }

    @PostConstruct
    public void start() {
        if (running.compareAndSet(false, true)) {
            Thread thread = new Thread(this::consumeLoop, "signal-ingestion");
            thread.setDaemon(true);
            consumer = thread;
            thread.start();
            log.info("Signal ingestion started - queue capacity: {}", inbound.remainingCapacity() + inbound.size());
        }
    }

    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Thread thread = consumer;
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(TimeUnit.SECONDS.toMillis(1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Signal ingestion stopped - {} queued reading(s) discarded, {} unresolved, {} overflowed",
                inbound.size(), unresolved.get(), overflowed.get());
        inbound.clear();
    }

    /**
     * Resolves and stores one reading on the calling thread.
     *
     * @return true if a signal was stored, false if the reading was dropped
     */
    public boolean ingest(GatewayReading reading) {
        Optional<Gateway> gateway = topology.gatewayByMac(reading.gatewayMac()).filter(Gateway::active);
        Optional<Beacon> beacon = topology.beaconByMac(reading.beaconMac()).filter(Beacon::active);
        if (gateway.isEmpty() || beacon.isEmpty()) {
            metrics.recordRecovered(RecoveredCondition.UNRESOLVED_IDENTITY);
            long count = unresolved.incrementAndGet();
            if (count == 1 || count % WARN_EVERY == 0) {
                log.warn("Dropping reading from unresolved {} {} ({} unresolved readings so far)",
                        gateway.isEmpty() ? "gateway" : "beacon",
                        gateway.isEmpty() ? reading.gatewayMac() : reading.beaconMac(), count);
            } else {
                log.debug("Dropping reading beacon={} gateway={}: unresolved identity",
                        reading.beaconMac(), reading.gatewayMac());
            }
            return false;
        }
        Instant observedAt = reading.observedAt() != null ? reading.observedAt() : clock.instant();
        signalStore.append(new RawSignal(beacon.get().id(), gateway.get().id(), reading.rssi(),
                reading.txPower(), observedAt, 0L));
        metrics.recordSignalStored();
        return true;
    }

    /**
     * Queues a reading for the consumer thread without blocking.
     *
     * @return false if an older reading had to be discarded to make room
     */
    public boolean submit(GatewayReading reading) {
        boolean discarded = false;
        while (!inbound.offer(reading)) {
            if (inbound.poll() != null) {
                discarded = true;
                metrics.recordReadingDroppedOnOverflow();
                long count = overflowed.incrementAndGet();
                if (count == 1 || count % WARN_EVERY == 0) {
                    log.warn("Inbound queue full, dropped {} oldest reading(s) so far", count);
                }
            }
        }
        return !discarded;
    }

    public int queuedCount() {
        return inbound.size();
    }

    public long unresolvedCount() {
        return unresolved.get();
    }

    private void consumeLoop() {
        while (running.get()) {
            try {
                GatewayReading reading = inbound.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (reading != null) {
                    ingest(reading);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("Failed to ingest reading", e);
            }
        }
    }
}

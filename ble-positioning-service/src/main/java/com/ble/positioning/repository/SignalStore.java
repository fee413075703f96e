package com.ble.positioning.repository;

import com.ble.positioning.config.PositioningProperties;
import com.ble.positioning.model.RawSignal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Append-only in-memory store of raw RSSI observations, keyed by beacon.
 *
 * <p><strong>Snapshot cuts:</strong> every appended signal receives a sequence number. A cut
 * returned by {@link #snapshot()} is the highest sequence whose append has fully completed, so a
 * read bounded by the cut sees exactly the signals appended before it was taken. Appends hold the
 * shared side of a read/write lock only for the few instructions that assign a sequence and link
 * the signal; taking a cut briefly holds the exclusive side. Appenders never wait on a
 * processing tick and the tick never iterates while holding the lock.</p>
 *
 * <p><strong>Retention:</strong> signals are removed only under the exclusive lock, by
 * {@link #purgeOlderThan(Instant)} and by the per-beacon capacity bound, which evicts the oldest
 * signal first when the next cut is taken. An append never removes anything, so the signals
 * covered by a cut stay put until the next cut or purge.</p>
 */
@Slf4j
@Component
public class SignalStore {

    private final ConcurrentHashMap<String, BeaconSignals> buffers = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock cutLock = new ReentrantReadWriteLock();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong evicted = new AtomicLong();
    private final int maxSignalsPerBeacon;

    @Autowired
    public SignalStore(PositioningProperties properties) {
        this(properties.getProcessing().getMaxSignalsPerBeacon());
    }

    public SignalStore(int maxSignalsPerBeacon) {
        if (maxSignalsPerBeacon < 2) {
            throw new IllegalArgumentException("maxSignalsPerBeacon must be at least 2");
        }
        this.maxSignalsPerBeacon = maxSignalsPerBeacon;
    }

    /**
     * Appends a signal. Safe to call from any thread while reads are in progress.
     *
     * @param signal the observation; any sequence it carries is replaced
     * @return the stored signal with its assigned sequence
     */
    public RawSignal append(RawSignal signal) {
        if (signal == null || signal.beaconId() == null || signal.gatewayId() == null
                || signal.observedAt() == null) {
            throw new IllegalArgumentException("Signal must name a beacon, a gateway and a time");
        }
        cutLock.readLock().lock();
        try {
            RawSignal stored = signal.withSequence(sequence.incrementAndGet());
            buffers.computeIfAbsent(stored.beaconId(), k -> new BeaconSignals()).add(stored);
            return stored;
        } finally {
            cutLock.readLock().unlock();
        }
    }

    /**
     * Takes a consistent cut. Every signal appended before this call returns, and not evicted by
     * the capacity bound on the way, is visible to reads bounded by the returned value; none
     * appended afterwards is.
     */
    public long snapshot() {
        cutLock.writeLock().lock();
        try {
            int trimmed = 0;
            for (BeaconSignals buffer : buffers.values()) {
                trimmed += buffer.trimToCapacity();
            }
            if (trimmed > 0) {
                evicted.addAndGet(trimmed);
                log.debug("Evicted {} raw signals over the per-beacon capacity of {}", trimmed, maxSignalsPerBeacon);
            }
            return sequence.get();
        } finally {
            cutLock.writeLock().unlock();
        }
    }

    /**
     * Signals of a beacon observed within {@code [from, to]} and appended no later than
     * {@code cut}, in append order.
     */
    public List<RawSignal> signals(String beaconId, Instant from, Instant to, long cut) {
        BeaconSignals buffer = buffers.get(beaconId);
        if (buffer == null) {
            return List.of();
        }
        List<RawSignal> result = new ArrayList<>();
        for (RawSignal signal : buffer.signals) {
            if (signal.sequence() <= cut
                    && !signal.observedAt().isBefore(from)
                    && !signal.observedAt().isAfter(to)) {
                result.add(signal);
            }
        }
        result.sort(Comparator.comparingLong(RawSignal::sequence));
        return result;
    }

    /** Range query over everything currently retained, irrespective of cuts. */
    public List<RawSignal> queryRawSignals(String beaconId, Instant from, Instant to) {
        return signals(beaconId, from, to, Long.MAX_VALUE);
    }

    /**
     * Beacons that received at least one signal with a sequence in {@code (previousCut, cut]},
     * sorted by id.
     */
    public Set<String> beaconsWithSignalsBetween(long previousCut, long cut) {
        Set<String> fresh = new TreeSet<>();
        buffers.forEach((beaconId, buffer) -> {
            if (buffer.lastSequence.get() > previousCut && buffer.hasSequenceBetween(previousCut, cut)) {
                fresh.add(beaconId);
            }
        });
        return fresh;
    }

    /**
     * Removes signals observed before the cutoff and drops beacons left without signals.
     *
     * @return number of signals removed
     */
    public int purgeOlderThan(Instant cutoff) {
        int removed = 0;
        cutLock.writeLock().lock();
        try {
            Iterator<BeaconSignals> it = buffers.values().iterator();
            while (it.hasNext()) {
                BeaconSignals buffer = it.next();
                removed += buffer.removeObservedBefore(cutoff);
                if (buffer.size.get() == 0) {
                    it.remove();
                }
            }
        } finally {
            cutLock.writeLock().unlock();
        }
        if (removed > 0) {
            log.debug("Purged {} raw signals observed before {}", removed, cutoff);
        }
        return removed;
    }

    public int size() {
        int total = 0;
        for (BeaconSignals buffer : buffers.values()) {
            total += buffer.size.get();
        }
        return total;
    }

    public int beaconCount() {
        return buffers.size();
    }

    /** Signals evicted by the per-beacon capacity bound since startup. */
    public long evictedCount() {
        return evicted.get();
    }

    private final class BeaconSignals {

        private final ConcurrentLinkedQueue<RawSignal> signals = new ConcurrentLinkedQueue<>();
        private final AtomicInteger size = new AtomicInteger();
        private final AtomicLong lastSequence = new AtomicLong();

        void add(RawSignal signal) {
            signals.add(signal);
            lastSequence.accumulateAndGet(signal.sequence(), Math::max);
            size.incrementAndGet();
        }

        // Caller holds the exclusive lock.
        int trimToCapacity() {
            int removed = 0;
            while (size.get() > maxSignalsPerBeacon && signals.poll() != null) {
                size.decrementAndGet();
                removed++;
            }
            return removed;
        }

        boolean hasSequenceBetween(long lowExclusive, long highInclusive) {
            for (RawSignal signal : signals) {
                if (signal.sequence() > lowExclusive && signal.sequence() <= highInclusive) {
                    return true;
                }
            }
            return false;
        }

        int removeObservedBefore(Instant cutoff) {
            int removed = 0;
            Iterator<RawSignal> it = signals.iterator();
            while (it.hasNext()) {
                if (it.next().observedAt().isBefore(cutoff)) {
                    it.remove();
                    size.decrementAndGet();
                    removed++;
                }
            }
            return removed;
        }
    }
}

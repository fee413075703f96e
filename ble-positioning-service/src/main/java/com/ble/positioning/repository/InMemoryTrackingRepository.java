package com.ble.positioning.repository;

import com.ble.positioning.config.PositioningProperties;
import com.ble.positioning.model.PositionEstimate;
import com.ble.positioning.model.RawSignal;
import com.ble.positioning.model.ZoneAlertEvent;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * In-memory tracking store with bounded history. Position history is capped per beacon and the
 * alert log globally; the oldest entries go first.
 */
@Repository
public class InMemoryTrackingRepository implements TrackingRepository {

    private final SignalStore signalStore;
    private final int maxHistoryPerBeacon;
    private final int maxAlerts;
    private final ConcurrentHashMap<String, Deque<PositionEstimate>> history = new ConcurrentHashMap<>();
    private final Deque<ZoneAlertEvent> alerts = new ArrayDeque<>();

    @Autowired
    public InMemoryTrackingRepository(SignalStore signalStore, PositioningProperties properties) {
        this(signalStore, properties.getProcessing().getMaxHistoryPerBeacon(),
                properties.getProcessing().getMaxAlerts());
    }

    public InMemoryTrackingRepository(SignalStore signalStore, int maxHistoryPerBeacon, int maxAlerts) {
        if (signalStore == null) {
            throw new IllegalArgumentException("SignalStore cannot be null");
        }
        this.signalStore = signalStore;
        this.maxHistoryPerBeacon = maxHistoryPerBeacon;
        this.maxAlerts = maxAlerts;
    }

    @Override
    public void append(PositionEstimate estimate) {
        Deque<PositionEstimate> beaconHistory =
                history.computeIfAbsent(estimate.beaconId(), k -> new ArrayDeque<>());
        synchronized (beaconHistory) {
            beaconHistory.addLast(estimate);
            while (beaconHistory.size() > maxHistoryPerBeacon) {
                beaconHistory.removeFirst();
            }
        }
    }

    @Override
    public void append(ZoneAlertEvent event) {
        synchronized (alerts) {
            alerts.addLast(event);
            while (alerts.size() > maxAlerts) {
                alerts.removeFirst();
            }
        }
    }

    @Override
    public List<RawSignal> queryRawSignals(String beaconId, Instant from, Instant to) {
        return signalStore.queryRawSignals(beaconId, from, to);
    }

    @Override
    public List<PositionEstimate> positionHistory(String beaconId) {
        Deque<PositionEstimate> beaconHistory = history.get(beaconId);
        if (beaconHistory == null) {
            return List.of();
        }
        synchronized (beaconHistory) {
            return List.copyOf(beaconHistory);
        }
    }

    @Override
    public List<ZoneAlertEvent> alerts() {
        synchronized (alerts) {
            return List.copyOf(alerts);
        }
    }
}

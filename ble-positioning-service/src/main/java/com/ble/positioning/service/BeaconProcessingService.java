package com.ble.positioning.service;

import com.ble.positioning.algorithm.EstimationResult;
import com.ble.positioning.algorithm.GatewayRange;
import com.ble.positioning.algorithm.PathLossModel;
import com.ble.positioning.algorithm.PositionEstimator;
import com.ble.positioning.config.PositioningProperties;
import com.ble.positioning.metrics.PositioningMetrics;
import com.ble.positioning.model.AggregatedSignal;
import com.ble.positioning.model.Beacon;
import com.ble.positioning.model.Gateway;
import com.ble.positioning.model.PositionEstimate;
import com.ble.positioning.model.RecoveredCondition;
import com.ble.positioning.model.SmoothedPosition;
import com.ble.positioning.model.Zone;
import com.ble.positioning.model.ZoneAlertEvent;
import com.ble.positioning.publisher.OutboundPublisher;
import com.ble.positioning.repository.TrackingRepository;
import com.ble.positioning.topology.TopologyProvider;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the signal-to-position pipeline for a single beacon.
 *
 * <p><strong>Pipeline:</strong></p>
 * <ol>
 *   <li>Aggregate the beacon's signals in the window ending at the tick, bounded by the tick's
 *       store cut</li>
 *   <li>Convert each gateway's robust RSSI into a range with the path-loss model</li>
 *   <li>Estimate a raw position; stop here if the data is insufficient</li>
 *   <li>Store the raw estimate, smooth it and evaluate zones</li>
 *   <li>Store the alerts and queue position and alert messages for publishing</li>
 * </ol>
 *
 * <p>The whole pipeline runs while holding the beacon's lock from {@link BeaconLockRegistry}, so
 * no two evaluations of the same beacon ever overlap. If the lock is taken the beacon is skipped
 * rather than waited for. Every recovered condition is counted in {@link PositioningMetrics}.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BeaconProcessingService {

    private final TopologyProvider topology;
    private final SignalAggregator aggregator;
    private final PathLossModel pathLossModel;
    private final PositionEstimator estimator;
    private final TemporalSmoother smoother;
    private final ZoneEngine zoneEngine;
    private final TrackingRepository trackingRepository;
    private final OutboundPublisher publisher;
    private final BeaconLockRegistry locks;
    private final PositioningMetrics metrics;
    private final PositioningProperties properties;

    /**
     * Evaluates one beacon.
     *
     * @param beaconId beacon to evaluate
     * @param now tick time; the aggregation window ends here
     * @param cut signal store cut taken at the start of the tick
     */
    public BeaconOutcome process(String beaconId, Instant now, long cut) {
        ReentrantLock lock = locks.lockFor(beaconId);
        if (!lock.tryLock()) {
            metrics.recordBeaconSkippedBusy();
            log.debug("Beacon {} is still being evaluated, skipping", beaconId);
            return BeaconOutcome.BUSY;
        }
        try {
            return processLocked(beaconId, now, cut);
        } finally {
            lock.unlock();
        }
    }

    private BeaconOutcome processLocked(String beaconId, Instant now, long cut) {
        Optional<Beacon> beacon = topology.beacon(beaconId).filter(Beacon::active);
        if (beacon.isEmpty()) {
            log.debug("Beacon {} is not in the active topology, skipping", beaconId);
            return BeaconOutcome.UNKNOWN;
        }

        Map<String, AggregatedSignal> aggregated =
                aggregator.aggregate(beaconId, now, properties.getProcessing().getWindowSeconds(), cut);
        Map<String, GatewayRange> ranges = toRanges(aggregated);

        EstimationResult result = estimator.estimate(beaconId, ranges, now);
        result.conditions().forEach(metrics::recordRecovered);
        if (result.isInsufficient()) {
            log.debug("Beacon {} has insufficient gateway data ({} ranges), position unchanged",
                    beaconId, ranges.size());
            return BeaconOutcome.INSUFFICIENT;
        }

        PositionEstimate estimate = result.estimate();
        if (!result.conditions().isEmpty()) {
            log.debug("Beacon {} estimate recovered from {}", beaconId, result.conditions());
        }
        trackingRepository.append(estimate);
        metrics.recordEstimate(estimate.method());

        SmoothedPosition smoothed = smoother.update(beaconId, estimate);
        List<ZoneAlertEvent> alerts = zoneEngine.evaluate(beaconId, smoothed, now);

        publisher.publishPosition(beacon.get(), topology.floor(smoothed.floorId()).orElse(null), smoothed);
        for (ZoneAlertEvent alert : alerts) {
            trackingRepository.append(alert);
            metrics.recordAlert(alert.alertType());
            Optional<Zone> zone = topology.zone(alert.zoneId());
            if (zone.isPresent()) {
                publisher.publishAlert(beacon.get(), zone.get(), alert);
            }
            log.info("Zone alert: beacon {} {} zone {} at ({}, {})", beaconId, alert.alertType().getLabel(),
                    alert.zoneId(), alert.x(), alert.y());
        }
        return BeaconOutcome.LOCATED;
    }

    private Map<String, GatewayRange> toRanges(Map<String, AggregatedSignal> aggregated) {
        Map<String, GatewayRange> ranges = new TreeMap<>();
        aggregated.forEach((gatewayId, signal) -> {
            Optional<Gateway> gateway = topology.gateway(gatewayId).filter(Gateway::active);
            if (gateway.isEmpty()) {
                return;
            }
            if (!pathLossModel.hasCalibration(gateway.get())) {
                metrics.recordRecovered(RecoveredCondition.MISSING_CALIBRATION);
            }
            double distance = pathLossModel.distance(gateway.get(), signal.robustRssiDbm());
            ranges.put(gatewayId, new GatewayRange(gatewayId, gateway.get().floorId(),
                    gateway.get().position(), distance));
        });
        return ranges;
    }
}

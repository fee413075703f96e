// com/ble/positioning/metrics/PositioningMetrics.java
package com.ble.positioning.metrics;

import com.ble.positioning.model.AlertType;
import com.ble.positioning.model.EstimationMethod;
import com.ble.positioning.model.RecoveredCondition;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Micrometer metrics of the positioning pipeline.
 *
 * <p><strong>Metric Categories:</strong></p>
 * <ul>
 *   <li><strong>Ingestion:</strong> signals stored, readings dropped, payloads rejected</li>
 *   <li><strong>Processing:</strong> ticks, per-beacon evaluations, failures, durations</li>
 *   <li><strong>Results:</strong> estimates by method, alerts by type, suppressed duplicates</li>
 *   <li><strong>Recovered conditions:</strong> one counter per {@link RecoveredCondition}</li>
 *   <li><strong>Outbound:</strong> messages published, dropped on overflow, failed</li>
 * </ul>
 *
 * <p>Recovered conditions never interrupt processing, so these counters are the only place
 * they become visible besides the log.</p>
 */
@Component
public class PositioningMetrics {

    private final MeterRegistry meterRegistry;

    // Ingestion
    private final Counter signalsStored;
    private final Counter readingsDroppedOverflow;
    private final Counter payloadsRejected;

    // Processing
    private final Counter ticks;
    private final Counter beaconsEvaluated;
    private final Counter beaconsSkippedBusy;
    private final Counter beaconFailures;
    private final Timer tickTimer;
    private final Timer beaconTimer;

    // Results
    private final Map<EstimationMethod, Counter> estimatesByMethod = new EnumMap<>(EstimationMethod.class);
    private final Map<AlertType, Counter> alertsByType = new EnumMap<>(AlertType.class);
    private final Counter alertsSuppressed;
    private final Map<RecoveredCondition, Counter> recovered = new EnumMap<>(RecoveredCondition.class);

    // Outbound
    private final Counter outboundPublished;
    private final Counter outboundDropped;
    private final Counter outboundFailed;

    public PositioningMetrics(MeterRegistry meterRegistry) {
        if (meterRegistry == null) {
            throw new IllegalArgumentException("MeterRegistry cannot be null");
        }
        this.meterRegistry = meterRegistry;

        this.signalsStored = Counter.builder("positioning.signals.stored.total")
            .description("Raw signals appended to the signal store")
            .register(meterRegistry);
        this.readingsDroppedOverflow = Counter.builder("positioning.readings.dropped.total")
            .description("Inbound readings discarded because the inbound queue was full")
            .tag("reason", "queue_overflow")
            .register(meterRegistry);
        this.payloadsRejected = Counter.builder("positioning.payloads.rejected.total")
            .description("Gateway messages that could not be decoded")
            .register(meterRegistry);

        this.ticks = Counter.builder("positioning.ticks.total")
            .description("Processing ticks completed")
            .register(meterRegistry);
        this.beaconsEvaluated = Counter.builder("positioning.beacons.evaluated.total")
            .description("Per-beacon pipeline evaluations completed")
            .register(meterRegistry);
        this.beaconsSkippedBusy = Counter.builder("positioning.beacons.skipped.total")
            .description("Beacons skipped because a previous evaluation still held them")
            .register(meterRegistry);
        this.beaconFailures = Counter.builder("positioning.beacons.failed.total")
            .description("Per-beacon evaluations that threw")
            .register(meterRegistry);
        this.tickTimer = Timer.builder("positioning.tick.duration")
            .description("Time taken by one processing tick")
            .register(meterRegistry);
        this.beaconTimer = Timer.builder("positioning.beacon.duration")
            .description("Time taken to evaluate one beacon")
            .register(meterRegistry);

        for (EstimationMethod method : EstimationMethod.values()) {
            estimatesByMethod.put(method, Counter.builder("positioning.estimates.total")
                .description("Position estimates produced")
                .tag("method", method.getLabel())
                .register(meterRegistry));
        }
        for (AlertType type : AlertType.values()) {
            alertsByType.put(type, Counter.builder("positioning.alerts.total")
                .description("Zone alerts emitted")
                .tag("type", type.getLabel())
                .register(meterRegistry));
        }
        this.alertsSuppressed = Counter.builder("positioning.alerts.suppressed.total")
            .description("Zone alerts suppressed by the cooldown window")
            .register(meterRegistry);
        for (RecoveredCondition condition : RecoveredCondition.values()) {
            recovered.put(condition, Counter.builder("positioning.recovered.total")
                .description("Recovered pipeline conditions")
                .tag("condition", condition.getTag())
                .register(meterRegistry));
        }

        this.outboundPublished = Counter.builder("positioning.outbound.published.total")
            .description("Outbound messages handed to the sink")
            .register(meterRegistry);
        this.outboundDropped = Counter.builder("positioning.outbound.dropped.total")
            .description("Outbound messages discarded because the queue was full")
            .register(meterRegistry);
        this.outboundFailed = Counter.builder("positioning.outbound.failed.total")
            .description("Outbound messages the sink failed to deliver")
            .register(meterRegistry);
    }

    public void recordSignalStored() {
        signalsStored.increment();
    }

    public void recordReadingDroppedOnOverflow() {
        readingsDroppedOverflow.increment();
    }

    public void recordPayloadRejected() {
        payloadsRejected.increment();
    }

    public void recordTick(Duration duration) {
        ticks.increment();
        tickTimer.record(duration);
    }

    public void recordBeaconEvaluated(Duration duration) {
        beaconsEvaluated.increment();
        beaconTimer.record(duration);
    }

    public void recordBeaconSkippedBusy() {
        beaconsSkippedBusy.increment();
    }

    public void recordBeaconFailure() {
        beaconFailures.increment();
    }

    public void recordEstimate(EstimationMethod method) {
        estimatesByMethod.get(method).increment();
    }

    public void recordAlert(AlertType type) {
        alertsByType.get(type).increment();
    }

    public void recordAlertSuppressed() {
        alertsSuppressed.increment();
    }

    public void recordRecovered(RecoveredCondition condition) {
        recovered.get(condition).increment();
    }

    public void recordOutboundPublished() {
        outboundPublished.increment();
    }

    public void recordOutboundDropped() {
        outboundDropped.increment();
    }

    public void recordOutboundFailed() {
        outboundFailed.increment();
    }

    public double recoveredCount(RecoveredCondition condition) {
        return recovered.get(condition).count();
    }

    public double alertsSuppressedCount() {
        return alertsSuppressed.count();
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}

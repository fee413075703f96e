// com/ble/positioning/health/ProcessingActivityHealthIndicator.java
package com.ble.positioning.health;

import com.ble.positioning.service.BeaconOutcome;
import com.ble.positioning.service.ProcessingScheduler;
import com.ble.positioning.service.TickStatistics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the processing loop is ticking.
 *
 * <p><strong>Status:</strong></p>
 * <ul>
 *   <li><strong>OUT_OF_SERVICE:</strong> the scheduler is stopped</li>
 *   <li><strong>DOWN:</strong> running, but no tick has completed within
 *       {@code stall-ticks} tick periods</li>
 *   <li><strong>UP:</strong> ticks are completing; details carry the last tick's outcomes</li>
 * </ul>
 */
@Slf4j
@Component("positioningProcessing")
public class ProcessingActivityHealthIndicator implements HealthIndicator {

    private final ProcessingScheduler scheduler;
    private final Clock clock;

    @Value("${management.health.positioning-processing.stall-ticks:5}")
    private long stallTicks;

    @Autowired
    public ProcessingActivityHealthIndicator(ProcessingScheduler scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public ProcessingActivityHealthIndicator(ProcessingScheduler scheduler, Clock clock, long stallTicks) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.stallTicks = stallTicks;
    }

    @Override
    public Health health() {
        if (!scheduler.isRunning()) {
            return Health.outOfService()
                .withDetail("state", scheduler.getState().name())
                .withDetail("reason", "Processing scheduler is stopped")
                .build();
        }

        Instant now = clock.instant();
        Duration stallThreshold = scheduler.getTickPeriod().multipliedBy(Math.max(1, stallTicks));
        TickStatistics lastTick = scheduler.getLastTick();
        Instant lastActivity = lastTick != null ? lastTick.startedAt() : scheduler.getStartedAt();
        Duration sinceLastActivity = lastActivity == null ? Duration.ZERO : Duration.between(lastActivity, now);

        if (sinceLastActivity.compareTo(stallThreshold) > 0) {
            log.warn("Processing loop stalled: no tick for {} ms (threshold {} ms)",
                    sinceLastActivity.toMillis(), stallThreshold.toMillis());
            return Health.down()
                .withDetail("state", scheduler.getState().name())
                .withDetail("timeSinceLastTickMs", sinceLastActivity.toMillis())
                .withDetail("stallThresholdMs", stallThreshold.toMillis())
                .withDetail("reason", "No processing tick completed within the stall threshold")
                .build();
        }

        Health.Builder builder = Health.up()
            .withDetail("state", scheduler.getState().name())
            .withDetail("timeSinceLastTickMs", sinceLastActivity.toMillis())
            .withDetail("stallThresholdMs", stallThreshold.toMillis());
        if (lastTick != null) {
            builder.withDetail("lastTickNumber", lastTick.tickNumber())
                .withDetail("lastTickDurationMs", lastTick.duration().toMillis())
                .withDetail("lastTickBeacons", lastTick.beaconCount())
                .withDetail("lastTickLocated", lastTick.count(BeaconOutcome.LOCATED))
                .withDetail("lastTickInsufficient", lastTick.count(BeaconOutcome.INSUFFICIENT))
                .withDetail("lastTickFailed", lastTick.count(BeaconOutcome.FAILED));
        }
        return builder.build();
    }
}

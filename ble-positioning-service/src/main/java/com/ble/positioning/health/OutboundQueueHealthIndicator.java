package com.ble.positioning.health;

import com.ble.positioning.publisher.OutboundPublisher;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the outbound publisher's drain thread and queue fill level. A queue above the warning
 * utilization stays UP but is flagged, since the publisher is about to start dropping messages.
 */
@Component("positioningOutbound")
public class OutboundQueueHealthIndicator implements HealthIndicator {

    private final OutboundPublisher publisher;

    @Value("${management.health.positioning-outbound.warn-utilization:0.9}")
    private double warnUtilization;

    @Autowired
    public OutboundQueueHealthIndicator(OutboundPublisher publisher) {
        this.publisher = publisher;
    }

    public OutboundQueueHealthIndicator(OutboundPublisher publisher, double warnUtilization) {
        this.publisher = publisher;
        this.warnUtilization = warnUtilization;
    }

    @Override
    public Health health() {
        int queued = publisher.queueSize();
        double utilization = (double) queued / publisher.capacity();
        Health.Builder builder = publisher.isRunning() ? Health.up() : Health.down();
        builder.withDetail("queued", queued)
            .withDetail("capacity", publisher.capacity())
            .withDetail("utilization", utilization)
            .withDetail("published", publisher.publishedCount())
            .withDetail("dropped", publisher.droppedCount())
            .withDetail("nearCapacity", utilization >= warnUtilization);
        if (!publisher.isRunning()) {
            builder.withDetail("reason", "Outbound publisher is not running");
        }
        return builder.build();
    }
}

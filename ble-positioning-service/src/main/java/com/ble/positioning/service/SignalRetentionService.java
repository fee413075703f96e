package com.ble.positioning.service;

import com.ble.positioning.config.PositioningProperties;
import com.ble.positioning.repository.SignalStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Housekeeping: purges raw signals that have aged out of every possible aggregation window.
 *
 * <p>A sweep may land while a tick is still reading the window it computed at its own start.
 * The retention period therefore never drops below the window plus two tick periods, so a purge
 * cannot reach into the window of a tick that started up to one period late.</p>
 */
@Slf4j
@Service
public class SignalRetentionService {

    private final SignalStore signalStore;
    private final Clock clock;
    private final Duration retention;

    public SignalRetentionService(SignalStore signalStore, Clock clock, PositioningProperties properties) {
        this.signalStore = signalStore;
        this.clock = clock;
        PositioningProperties.Processing processing = properties.getProcessing();
        long minimum = processing.getWindowSeconds() + 2 * processing.getTickPeriodSeconds();
        if (processing.getRetentionSeconds() < minimum) {
            log.warn("Retention of {} s is shorter than the aggregation window plus two ticks, using {} s",
                    processing.getRetentionSeconds(), minimum);
        }
        this.retention = Duration.ofSeconds(Math.max(processing.getRetentionSeconds(), minimum));
    }

    @Scheduled(fixedDelayString = "${positioning.processing.retention-sweep-seconds:10}",
            initialDelayString = "${positioning.processing.retention-sweep-seconds:10}",
            timeUnit = TimeUnit.SECONDS)
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(retention);
        int removed = signalStore.purgeOlderThan(cutoff);
        if (removed > 0) {
            log.debug("Retention sweep removed {} signal(s), {} retained for {} beacon(s)",
                    removed, signalStore.size(), signalStore.beaconCount());
        }
        return removed;
    }

    public Duration getRetention() {
        return retention;
    }
}

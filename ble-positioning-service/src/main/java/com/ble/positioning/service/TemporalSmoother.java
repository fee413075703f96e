package com.ble.positioning.service;

import com.ble.positioning.algorithm.util.PlanarGeometry;
import com.ble.positioning.config.PositioningProperties;
import com.ble.positioning.model.PositionEstimate;
import com.ble.positioning.model.SmoothedPosition;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Suppresses jitter between successive raw estimates of a beacon and derives its movement vector.
 *
 * <p><strong>Per update:</strong></p>
 * <ul>
 *   <li><strong>First observation</strong> (or a floor change): the raw estimate is taken as is,
 *       velocity is zero and heading is absent.</li>
 *   <li><strong>Noise:</strong> when the raw estimate is closer than the stability threshold to
 *       the current position and less than the drift window has passed since the position last
 *       advanced, the position is held and the velocity decays toward zero.</li>
 *   <li><strong>Movement:</strong> otherwise the position advances by the exponential filter
 *       {@code α·raw + (1-α)·previous} and velocity is the advance divided by the elapsed time.</li>
 * </ul>
 *
 * <p>Heading is {@code atan2(vy, vx)} in degrees within [0, 360) and absent whenever the beacon
 * is not moving. Each update builds a new {@link SmoothedPosition} and swaps it in atomically;
 * a reader never observes a half-applied update.</p>
 */
@Slf4j
@Component
public class TemporalSmoother {

    /** Speeds below this are reported as zero. */
    static final double SPEED_EPSILON = 1e-3;

    private final double alpha;
    private final double stabilityThreshold;
    private final Duration driftWindow;
    private final double velocityDecay;
    private final ConcurrentHashMap<String, Track> tracks = new ConcurrentHashMap<>();

    @Autowired
    public TemporalSmoother(PositioningProperties properties) {
        this(properties.getSmoothing().getAlpha(),
                properties.getSmoothing().getStabilityDistanceThreshold(),
                Duration.ofSeconds(properties.getSmoothing().getDriftWindowSeconds()),
                properties.getSmoothing().getVelocityDecay());
    }

    public TemporalSmoother(double alpha, double stabilityThreshold, Duration driftWindow, double velocityDecay) {
        if (!(alpha > 0 && alpha <= 1)) {
            throw new IllegalArgumentException("Smoothing alpha must be in (0, 1], got " + alpha);
        }
        if (velocityDecay < 0 || velocityDecay > 1) {
            throw new IllegalArgumentException("Velocity decay must be in [0, 1], got " + velocityDecay);
        }
        this.alpha = alpha;
        this.stabilityThreshold = stabilityThreshold;
        this.driftWindow = driftWindow;
        this.velocityDecay = velocityDecay;
    }

    /**
     * Folds a raw estimate into the beacon's smoothed state.
     *
     * @return the new smoothed position, which is now the beacon's current one
     */
    public SmoothedPosition update(String beaconId, PositionEstimate raw) {
        Track previous = tracks.get(beaconId);
        Track next;
        if (previous == null || !previous.position.floorId().equals(raw.floorId())) {
            if (previous != null) {
                log.debug("Beacon {} changed floor {} -> {}, resetting smoothing",
                        beaconId, previous.position.floorId(), raw.floorId());
            }
            next = new Track(new SmoothedPosition(beaconId, raw.floorId(), raw.x(), raw.y(), 0.0, 0.0, 0.0,
                    null, raw.accuracyRadius(), raw.computedAt()), raw.computedAt());
        } else {
            next = advance(previous, raw);
        }
        tracks.put(beaconId, next);
        return next.position;
    }

    /** Current smoothed position of a beacon, if it has ever been located. */
    public Optional<SmoothedPosition> current(String beaconId) {
        Track track = tracks.get(beaconId);
        return track == null ? Optional.empty() : Optional.of(track.position);
    }

    /** Forgets a beacon; its next estimate is treated as a first observation. */
    public void reset(String beaconId) {
        tracks.remove(beaconId);
    }

    private Track advance(Track previous, PositionEstimate raw) {
        SmoothedPosition prev = previous.position;
        double seconds = Duration.between(prev.updatedAt(), raw.computedAt()).toNanos() / 1e9;
        double accuracy = alpha * raw.accuracyRadius() + (1 - alpha) * prev.accuracy();
        double moved = raw.point().distanceTo(prev.point());
        boolean withinDriftWindow = Duration.between(previous.lastMovedAt, raw.computedAt()).compareTo(driftWindow) < 0;

        if (moved < stabilityThreshold && withinDriftWindow) {
            double vx = prev.velocityX() * velocityDecay;
            double vy = prev.velocityY() * velocityDecay;
            SmoothedPosition held = withVelocity(prev, prev.x(), prev.y(), vx, vy, accuracy, raw.computedAt());
            return new Track(held, previous.lastMovedAt);
        }

        double x = alpha * raw.x() + (1 - alpha) * prev.x();
        double y = alpha * raw.y() + (1 - alpha) * prev.y();
        double vx = prev.velocityX();
        double vy = prev.velocityY();
        if (seconds > 0) {
            vx = (x - prev.x()) / seconds;
            vy = (y - prev.y()) / seconds;
        }
        return new Track(withVelocity(prev, x, y, vx, vy, accuracy, raw.computedAt()), raw.computedAt());
    }

    private static SmoothedPosition withVelocity(SmoothedPosition prev, double x, double y, double vx, double vy,
            double accuracy, Instant at) {
        double speed = Math.hypot(vx, vy);
        if (speed < SPEED_EPSILON) {
            return new SmoothedPosition(prev.beaconId(), prev.floorId(), x, y, 0.0, 0.0, 0.0, null, accuracy, at);
        }
        return new SmoothedPosition(prev.beaconId(), prev.floorId(), x, y, vx, vy, speed,
                PlanarGeometry.headingDegrees(vx, vy), accuracy, at);
    }

    private static final class Track {
        private final SmoothedPosition position;
        private final Instant lastMovedAt;

        private Track(SmoothedPosition position, Instant lastMovedAt) {
            this.position = position;
            this.lastMovedAt = lastMovedAt;
        }
    }
}

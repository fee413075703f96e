// com/ble/positioning/service/ZoneEngine.java
package com.ble.positioning.service;

import com.ble.positioning.algorithm.util.PlanarGeometry;
import com.ble.positioning.config.PositioningProperties;
import com.ble.positioning.metrics.PositioningMetrics;
import com.ble.positioning.model.AlertType;
import com.ble.positioning.model.SmoothedPosition;
import com.ble.positioning.model.Zone;
import com.ble.positioning.model.ZoneAlertEvent;
import com.ble.positioning.model.ZoneMembership;
import com.ble.positioning.topology.TopologyProvider;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Geofencing: tracks which zones each beacon is in and turns transitions into alerts.
 *
 * <p><strong>State machine per (beacon, zone):</strong></p>
 * <ul>
 *   <li><strong>Outside → Inside:</strong> entry alert, if the zone enables it</li>
 *   <li><strong>Inside → Outside:</strong> exit alert, if the zone enables it</li>
 *   <li><strong>Inside, dwell threshold passed:</strong> one dwell alert per stay; it re-arms
 *       only after an exit. A dwell suppressed by the cooldown stays armed and fires once the
 *       cooldown has passed</li>
 * </ul>
 *
 * <p>Only zones on the floor of the beacon's current position are tested. A membership of a zone
 * on another floor, or of a zone no longer configured, counts as Outside.</p>
 *
 * <p><strong>Deduplication:</strong> an alert of the same (beacon, zone, type) emitted less than
 * the cooldown ago is suppressed even though the transition itself is applied. Boundary
 * oscillation therefore yields one entry and one exit per cooldown window at most.</p>
 */
@Slf4j
@Component
public class ZoneEngine {

    private final TopologyProvider topology;
    private final PositioningMetrics metrics;
    private final Duration cooldown;
    private final ConcurrentHashMap<String, BeaconZoneState> states = new ConcurrentHashMap<>();

    @Autowired
    public ZoneEngine(TopologyProvider topology, PositioningMetrics metrics, PositioningProperties properties) {
        this(topology, metrics, Duration.ofSeconds(properties.getZones().getCooldownSeconds()));
    }

    public ZoneEngine(TopologyProvider topology, PositioningMetrics metrics, Duration cooldown) {
        if (topology == null || metrics == null) {
            throw new IllegalArgumentException("TopologyProvider and PositioningMetrics are required");
        }
        this.topology = topology;
        this.metrics = metrics;
        this.cooldown = cooldown;
    }

    /**
     * Evaluates a beacon's new position against the zones of its floor.
     *
     * @return alerts to emit, exits first, then entries and dwells in zone configuration order
     */
    public List<ZoneAlertEvent> evaluate(String beaconId, SmoothedPosition position, Instant now) {
        List<Zone> zones = topology.zonesOnFloor(position.floorId());
        Set<String> insideNow = new HashSet<>();
        for (Zone zone : zones) {
            if (PlanarGeometry.contains(zone.vertices(), position.point())) {
                insideNow.add(zone.id());
            }
        }

        BeaconZoneState state = states.computeIfAbsent(beaconId, k -> new BeaconZoneState());
        List<ZoneAlertEvent> events = new ArrayList<>();
        synchronized (state) {
            state.forgetEmissionsBefore(now.minus(cooldown));

            Iterator<ZoneMembership> memberships = state.memberships.values().iterator();
            while (memberships.hasNext()) {
                ZoneMembership membership = memberships.next();
                if (insideNow.contains(membership.zoneId())) {
                    continue;
                }
                memberships.remove();
                Optional<Zone> zone = topology.zone(membership.zoneId());
                log.debug("Beacon {} left zone {}", beaconId, membership.zoneId());
                if (zone.isPresent() && zone.get().alertOnExit()) {
                    emit(state, events, beaconId, zone.get(), AlertType.EXIT, position, now);
                }
            }

            for (Zone zone : zones) {
                if (!insideNow.contains(zone.id())) {
                    continue;
                }
                ZoneMembership membership = state.memberships.get(zone.id());
                if (membership == null) {
                    state.memberships.put(zone.id(), new ZoneMembership(beaconId, zone.id(), now, false));
                    log.debug("Beacon {} entered zone {}", beaconId, zone.id());
                    if (zone.alertOnEntry()) {
                        emit(state, events, beaconId, zone, AlertType.ENTRY, position, now);
                    }
                } else if (zone.isDwellAlertEnabled() && !membership.dwellAlerted()
                        && Duration.between(membership.since(), now).getSeconds() >= zone.dwellThresholdSeconds()) {
                    if (emit(state, events, beaconId, zone, AlertType.DWELL, position, now)) {
                        state.memberships.put(zone.id(), membership.markDwellAlerted());
                    }
                }
            }
        }
        return events;
    }

    /** Zones the beacon is currently inside. */
    public List<ZoneMembership> memberships(String beaconId) {
        BeaconZoneState state = states.get(beaconId);
        if (state == null) {
            return List.of();
        }
        synchronized (state) {
            return List.copyOf(state.memberships.values());
        }
    }

    /** @return false if the alert was suppressed by the cooldown */
    private boolean emit(BeaconZoneState state, List<ZoneAlertEvent> events, String beaconId, Zone zone,
            AlertType type, SmoothedPosition position, Instant now) {
        EmissionKey key = new EmissionKey(zone.id(), type);
        Instant last = state.lastEmitted.get(key);
        if (last != null && Duration.between(last, now).compareTo(cooldown) < 0) {
            metrics.recordAlertSuppressed();
            log.debug("Suppressed {} alert for beacon {} in zone {}, last one at {}",
                    type.getLabel(), beaconId, zone.id(), last);
            return false;
        }
        state.lastEmitted.put(key, now);
        events.add(ZoneAlertEvent.of(beaconId, zone.id(), type, now, position.point()));
        return true;
    }

    private static final class BeaconZoneState {
        private final Map<String, ZoneMembership> memberships = new LinkedHashMap<>();
        private final Map<EmissionKey, Instant> lastEmitted = new HashMap<>();

        private void forgetEmissionsBefore(Instant horizon) {
            lastEmitted.values().removeIf(at -> at.isBefore(horizon));
        }
    }

    private record EmissionKey(String zoneId, AlertType type) {
    }
}

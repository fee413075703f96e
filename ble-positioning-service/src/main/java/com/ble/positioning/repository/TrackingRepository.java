package com.ble.positioning.repository;

import com.ble.positioning.model.PositionEstimate;
import com.ble.positioning.model.RawSignal;
import com.ble.positioning.model.ZoneAlertEvent;
import java.time.Instant;
import java.util.List;

/**
 * Persistence sink for pipeline output.
 *
 * <p>Everything handed to {@code append} is final: the pipeline never updates or deletes a stored
 * estimate or alert. Implementations must be safe for concurrent use by the processing workers.</p>
 */
public interface TrackingRepository {

    void append(PositionEstimate estimate);

    void append(ZoneAlertEvent event);

    /** Raw observations of a beacon within {@code [from, to]}, oldest first. */
    List<RawSignal> queryRawSignals(String beaconId, Instant from, Instant to);

    /** Stored estimates of a beacon, oldest first. */
    List<PositionEstimate> positionHistory(String beaconId);

    /** Stored alerts, oldest first. */
    List<ZoneAlertEvent> alerts();
}

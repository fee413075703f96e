package com.ble.positioning.service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.stereotype.Component;

/**
 * One lock per beacon. Holding it grants exclusive ownership of the beacon's smoothing and zone
 * state; different beacons never contend.
 */
@Component
public class BeaconLockRegistry {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(String beaconId) {
        return locks.computeIfAbsent(beaconId, k -> new ReentrantLock());
    }
}

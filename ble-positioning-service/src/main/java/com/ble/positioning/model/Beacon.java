package com.ble.positioning.model;

/**
 * A mobile radio tag. Identity only; the pipeline references beacons but never changes them.
 *
 * @param id internal beacon identifier
 * @param mac hardware address, upper-case colon separated
 * @param name display name
 * @param resourceType what the tag is attached to (e.g. "Wheelchair", "Staff")
 * @param active inactive beacons are ignored by ingestion
 */
public record Beacon(String id, String mac, String name, String resourceType, boolean active) {}

package com.ble.positioning.processor;

import com.ble.positioning.dto.GatewayReading;
import com.ble.positioning.exception.GatewayPayloadException;
import com.ble.positioning.topology.MacAddresses;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decodes gateway JSON payloads into {@link GatewayReading}s.
 *
 * <p><strong>Supported formats:</strong></p>
 * <ul>
 *   <li><strong>Batched</strong> (one message per gateway scan):
 *       {@code {"device_info": {"mac": .., "timestamp": ..}, "beacons": [{"mac": .., "rssi": ..,
 *       "tx_power": ..}, ..]}}; the list may also be called {@code data}</li>
 *   <li><strong>Flat</strong> (one message per reading): {@code gatewayMac | gateway_mac},
 *       {@code mac | bleMAC | beacon_mac}, {@code rssi | RSSI}, {@code txPower | txpower |
 *       tx_power}, {@code timestamp | time}. Without a gateway field, {@code mac} is the gateway
 *       and {@code bleMAC} the beacon.</li>
 *   <li>A JSON array of flat readings</li>
 * </ul>
 *
 * <p>Timestamps may be epoch seconds, epoch milliseconds (values above 10¹²) or ISO-8601 strings;
 * a missing timestamp means the receive time. The fallback gateway address (e.g. taken from the
 * transport topic or record key) is used when the payload carries none.</p>
 *
 * <p>Entries of a batch that lack a beacon address or an RSSI are skipped. A payload that is not
 * JSON, or that yields no reading at all, raises {@link GatewayPayloadException}.</p>
 */
@Slf4j
@Component
public class GatewayPayloadParser {

    private static final double MILLIS_THRESHOLD = 1e12;

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public GatewayPayloadParser(ObjectMapper objectMapper, Clock clock) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("ObjectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Parses a payload.
     *
     * @param payload raw JSON text
     * @param fallbackGatewayMac gateway address to use when the payload has none, may be null
     * @return at least one reading
     * @throws GatewayPayloadException if the payload cannot be decoded
     */
    public List<GatewayReading> parse(String payload, String fallbackGatewayMac) {
        if (payload == null || payload.isBlank()) {
            throw new GatewayPayloadException("Empty gateway payload");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new GatewayPayloadException("Gateway payload is not valid JSON: " + e.getOriginalMessage(), e);
        }

        Instant receivedAt = clock.instant();
        List<GatewayReading> readings = new ArrayList<>();
        if (root.isObject() && root.has("device_info")) {
            parseBatched(root, fallbackGatewayMac, receivedAt, readings);
        } else if (root.isArray()) {
            for (JsonNode element : root) {
                if (element.isObject()) {
                    parseFlat(element, fallbackGatewayMac, receivedAt, readings);
                }
            }
        } else if (root.isObject()) {
            parseFlat(root, fallbackGatewayMac, receivedAt, readings);
        } else {
            throw new GatewayPayloadException("Unsupported gateway payload type: " + root.getNodeType());
        }

        if (readings.isEmpty()) {
            throw new GatewayPayloadException("Gateway payload contained no usable reading");
        }
        return readings;
    }

    private void parseBatched(JsonNode root, String fallbackGatewayMac, Instant receivedAt,
            List<GatewayReading> readings) {
        JsonNode deviceInfo = root.path("device_info");
        String gatewayMac = MacAddresses.normalize(text(deviceInfo, "mac"));
        if (gatewayMac == null) {
            gatewayMac = MacAddresses.normalize(fallbackGatewayMac);
        }
        if (gatewayMac == null) {
            throw new GatewayPayloadException("Batched payload names no gateway");
        }
        Instant baseTime = timestamp(deviceInfo.get("timestamp"), receivedAt);

        JsonNode beacons = root.has("beacons") ? root.get("beacons") : root.path("data");
        int skipped = 0;
        for (JsonNode beacon : beacons) {
            String beaconMac = MacAddresses.normalize(text(beacon, "mac"));
            Integer rssi = integer(beacon, "rssi", "RSSI");
            if (beaconMac == null || rssi == null) {
                skipped++;
                continue;
            }
            Instant observedAt = timestamp(beacon.get("timestamp"), baseTime);
            readings.add(new GatewayReading(beaconMac, gatewayMac, rssi,
                    integer(beacon, "tx_power", "txPower", "measured_power"), observedAt));
        }
        if (skipped > 0) {
            log.debug("Skipped {} incomplete beacon entries from gateway {}", skipped, gatewayMac);
        }
    }

    private void parseFlat(JsonNode node, String fallbackGatewayMac, Instant receivedAt,
            List<GatewayReading> readings) {
        String gatewayMac = text(node, "gatewayMac", "gateway_mac");
        String beaconMac;
        if (gatewayMac == null && node.hasNonNull("bleMAC")) {
            gatewayMac = text(node, "mac");
            beaconMac = text(node, "bleMAC");
        } else {
            beaconMac = text(node, "mac", "bleMAC", "beacon_mac");
        }
        if (gatewayMac == null) {
            gatewayMac = fallbackGatewayMac;
        }
        Integer rssi = integer(node, "rssi", "RSSI");
        if (MacAddresses.normalize(beaconMac) == null || MacAddresses.normalize(gatewayMac) == null || rssi == null) {
            log.debug("Skipping incomplete reading: {}", node);
            return;
        }
        JsonNode time = node.hasNonNull("timestamp") ? node.get("timestamp") : node.get("time");
        readings.add(new GatewayReading(MacAddresses.normalize(beaconMac), MacAddresses.normalize(gatewayMac),
                rssi, integer(node, "txPower", "txpower", "tx_power"), timestamp(time, receivedAt)));
    }

    private static String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && !value.isNull() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    private static Integer integer(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isNumber()) {
                return value.intValue();
            }
            if (value.isTextual()) {
                try {
                    return new BigDecimal(value.asText().trim()).intValue();
                } catch (NumberFormatException e) {
                    throw new GatewayPayloadException("Field '" + field + "' is not numeric: " + value.asText(), e);
                }
            }
        }
        return null;
    }

    private static Instant timestamp(JsonNode value, Instant fallback) {
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (value.isNumber()) {
            return fromEpoch(value.doubleValue(), fallback);
        }
        String text = value.asText().trim();
        if (text.isEmpty()) {
            return fallback;
        }
        try {
            return fromEpoch(Double.parseDouble(text), fallback);
        } catch (NumberFormatException notNumeric) {
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                throw new GatewayPayloadException("Unparseable timestamp: " + text, e);
            }
        }
    }

    private static Instant fromEpoch(double epoch, Instant fallback) {
        if (!(epoch > 0)) {
            return fallback;
        }
        if (epoch > MILLIS_THRESHOLD) {
            return Instant.ofEpochMilli((long) epoch);
        }
        long seconds = (long) epoch;
        long nanos = Math.round((epoch - seconds) * 1e9);
        return Instant.ofEpochSecond(seconds, nanos);
    }
}

package com.ble.positioning.topology;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form for hardware addresses: upper-case, colon separated ({@code AA:BB:CC:DD:EE:FF}).
 *
 * <p>Gateways report addresses as bare 12-digit hex strings, dash separated or lower-case
 * depending on firmware, so every lookup goes through {@link #normalize(String)}.</p>
 */
public final class MacAddresses {

    private static final Pattern BARE_HEX = Pattern.compile("[0-9A-F]{12}");

    private MacAddresses() {
    }

    /**
     * Normalizes a hardware address.
     *
     * @param mac address in any common notation, may be null
     * @return canonical address, or null when the input is null or blank
     */
    public static String normalize(String mac) {
        if (mac == null) {
            return null;
        }
        String value = mac.trim().toUpperCase(Locale.ROOT).replace('-', ':');
        if (value.isEmpty()) {
            return null;
        }
        if (BARE_HEX.matcher(value).matches()) {
            StringBuilder sb = new StringBuilder(17);
            for (int i = 0; i < 12; i += 2) {
                if (i > 0) {
                    sb.append(':');
                }
                sb.append(value, i, i + 2);
            }
            return sb.toString();
        }
        return value;
    }

    /** Address without separators, as used in outbound routing keys. */
    public static String compact(String mac) {
        String normalized = normalize(mac);
        return normalized == null ? null : normalized.replace(":", "");
    }
}

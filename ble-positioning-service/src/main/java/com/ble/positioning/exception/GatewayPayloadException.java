package com.ble.positioning.exception;

/**
 * Thrown when a gateway message cannot be decoded into readings.
 *
 * <p>The message is dropped by the adapter that received it; the exception never reaches the
 * processing loop.</p>
 */
public class GatewayPayloadException extends RuntimeException {

    public GatewayPayloadException(String message) {
        super(message);
    }

    public GatewayPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.ble.positioning.publisher;

import com.ble.positioning.dto.OutboundMessage;
import java.util.concurrent.CompletableFuture;

/**
 * Transport behind the {@link OutboundPublisher}. Called from the publisher's drain thread only.
 */
public interface OutboundMessageSink {

    /**
     * Hands a message to the transport.
     *
     * @return completes when the transport has accepted the message, exceptionally if it refused
     */
    CompletableFuture<Void> send(OutboundMessage message);
}

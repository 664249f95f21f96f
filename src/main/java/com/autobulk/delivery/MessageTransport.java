package com.autobulk.delivery;

/**
 * Single-destination delivery channel used by {@link TransportMessageSender}. Implementations
 * throw any runtime exception to signal a failed delivery.
 */
public interface MessageTransport {

    void send(String destination, RenderedMessage message, DispatchContext context);
}

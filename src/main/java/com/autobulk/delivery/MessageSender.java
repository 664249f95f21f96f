package com.autobulk.delivery;

import com.autobulk.error.DeliveryException;

import java.util.List;

/**
 * Delivers one rendered message to many destinations.
 */
public interface MessageSender {

    BulkSendResult sendBulk(RenderedMessage message, List<String> destinations, DispatchContext context)
            throws DeliveryException;
}

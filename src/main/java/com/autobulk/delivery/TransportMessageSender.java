package com.autobulk.delivery;

import com.autobulk.error.DeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Sends to each destination in turn through a {@link MessageTransport}. The first transport
 * failure aborts the remaining destinations.
 */
public class TransportMessageSender implements MessageSender {

    private static final Logger log = LoggerFactory.getLogger(TransportMessageSender.class);

    private final MessageTransport transport;

    public TransportMessageSender(MessageTransport transport) {
        this.transport = transport;
    }

    @Override
    public BulkSendResult sendBulk(RenderedMessage message, List<String> destinations, DispatchContext context)
            throws DeliveryException {
        int sent = 0;
        for (String destination : destinations) {
            try {
                transport.send(destination, message, context);
            } catch (RuntimeException e) {
                throw new DeliveryException("Delivery of template '" + message.templateId() + "' to " + destination
                        + " failed after " + sent + " successful dispatch(es): " + e.getMessage(), e);
            }
            sent++;
        }
        log.info("Template '{}' dispatched to {} recipients", message.templateId(), sent);
        return new BulkSendResult(message.templateId(), sent);
    }
}

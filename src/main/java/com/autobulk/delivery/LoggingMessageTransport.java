package com.autobulk.delivery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transport that only logs what would have been delivered. Used until the host application
 * provides a real {@link MessageTransport} bean.
 */
public class LoggingMessageTransport implements MessageTransport {

    private static final Logger log = LoggerFactory.getLogger(LoggingMessageTransport.class);

    @Override
    public void send(String destination, RenderedMessage message, DispatchContext context) {
        log.info("Sending template '{}' to {} (job {}, attempt {}): {}", message.templateId(), destination,
                context.jobId(), context.attemptNumber(), message.subject());
    }
}

package com.autobulk.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "autobulk.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobDispatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobDispatchScheduler.class);

    private final JobDispatcher dispatcher;

    public JobDispatchScheduler(JobDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Scheduled(fixedDelayString = "${autobulk.worker.poll-interval-in-seconds:5}000")
    public void poll() {
        try {
            int processed = dispatcher.tick();
            if (processed > 0) {
                log.debug("Dispatch tick processed {} job(s)", processed);
            }
        } catch (RuntimeException e) {
            log.error("Dispatch tick failed", e);
        }
    }
}

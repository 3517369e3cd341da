package com.github.dimitryivaniuta.labelbridge.bridge;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops expired bridged sessions. Requires {@code @EnableScheduling}.
 */
@Component
@RequiredArgsConstructor
public class BridgedSessionSweeper {

    private static final Logger log = LoggerFactory.getLogger(BridgedSessionSweeper.class);

    private final SessionBridge bridge;

    @Scheduled(cron = "0 * * * * *") // every minute
    public void sweepExpired() {
        int dropped = bridge.sweepExpired();
        if (dropped > 0) {
            log.info("Bridged session sweep dropped {} expired sessions", dropped);
        }
    }
}

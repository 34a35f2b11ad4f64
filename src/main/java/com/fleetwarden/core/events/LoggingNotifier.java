package com.fleetwarden.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link Notifier} that writes operator notifications to the log.
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void notify(String message) {
        log.info("[NOTIFY] {}", message);
    }
}

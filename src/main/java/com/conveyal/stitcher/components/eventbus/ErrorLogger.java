package com.conveyal.stitcher.components.eventbus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Log error events to the console, ensuring a redundant record of failures that were caught and recovered from.
 */
public class ErrorLogger implements EventHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ErrorLogger.class);

    @Override
    public void handleEvent (Event event) {
        if (event instanceof ErrorEvent) {
            ErrorEvent errorEvent = (ErrorEvent) event;
            LOG.error(errorEvent.traceWithContext(true));
        }
    }

    @Override
    public boolean acceptEvent (Event event) {
        return event instanceof ErrorEvent;
    }

    @Override
    public boolean synchronous () {
        // Log call is very fast and we want to make sure it happens. Do not hand off to another thread.
        return true;
    }

}

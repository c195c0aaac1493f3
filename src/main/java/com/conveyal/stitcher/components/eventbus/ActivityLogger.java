package com.conveyal.stitcher.components.eventbus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Log the comings and goings of workers and sessions. Lost workers and lost sessions are logged as warnings since
 * each one means a job has to be done over.
 */
public class ActivityLogger implements EventHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ActivityLogger.class);

    @Override
    public void handleEvent (Event event) {
        if (event.success) {
            if (event instanceof HttpApiEvent) {
                LOG.debug("{}", event);
            } else {
                LOG.info("{}", event);
            }
        } else {
            LOG.warn("{}", event);
        }
    }

    @Override
    public boolean acceptEvent (Event event) {
        return event instanceof WorkerEvent || event instanceof SessionEvent || event instanceof HttpApiEvent;
    }

    @Override
    public boolean synchronous () {
        return true;
    }

}

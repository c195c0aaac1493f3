package com.conveyal.stitcher.components.eventbus;

import com.conveyal.stitcher.components.Component;
import com.conveyal.stitcher.components.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkState;

/**
 * Shared listener registration across all components. The broker, dispatcher and fleet monitor report what they do
 * by sending events here, without knowing which handlers (logging, tests) are listening.
 *
 * By default execution of the handlers receiving events is asynchronous (handled by a shared pool of threads).
 * Handlers declaring themselves synchronous are run in the thread that sent the event. Event handlers should never
 * themselves trigger more events.
 */
public class EventBus implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(EventBus.class);

    private final TaskScheduler taskScheduler;

    // Linear scan through handlers is simpler than a hashtable and at least as efficient for small numbers of handlers.
    private final List<EventHandler> handlers = new ArrayList<>();

    public EventBus (TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    /** This class is not synchronized, so you should add all handlers at once before any events are fired. */
    public void addHandlers (EventHandler... handlers) {
        checkState(this.handlers.isEmpty());
        for (EventHandler handler : handlers) {
            LOG.info("An instance of {} will receive events.", handler.getClass().getSimpleName());
            this.handlers.add(handler);
        }
    }

    public <T extends Event> void send (final T event) {
        LOG.debug("Bus received event: {}", event);
        for (EventHandler handler : handlers) {
            final boolean accept = handler.acceptEvent(event);
            final boolean synchronous = handler.synchronous();
            if (accept) {
                if (synchronous) {
                    try {
                        handler.handleEvent(event);
                    } catch (Throwable t) {
                        // Do not recursively fire events on errors, there is some programming mistake.
                        LOG.error("Event handler failed.", t);
                    }
                } else {
                    taskScheduler.enqueueLightTask(() -> handler.handleEvent(event));
                }
            }
        }
    }

}

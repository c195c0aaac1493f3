package com.conveyal.stitcher.components.eventbus;

/**
 * A change in the set of workers known to the coordinator.
 */
public class WorkerEvent extends Event {

    public enum Action {
        /** Reported by fleet discovery and not previously tracked. */
        DISCOVERED,
        /** Tracked but no longer reported by fleet discovery. */
        LOST,
        /** Removed by the dispatcher after failing to acknowledge a job. */
        EVICTED
    }

    public final Action action;

    /** The worker address as host:port. */
    public final String host;

    public WorkerEvent (Action action, String host) {
        this.action = action;
        this.host = host;
        this.success = action == Action.DISCOVERED;
    }

    @Override
    public String toString () {
        return String.format("[worker %s %s]", host, action);
    }

}

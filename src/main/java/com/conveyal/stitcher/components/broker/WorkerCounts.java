package com.conveyal.stitcher.components.broker;

/**
 * The number of busy and idle workers at one instant.
 */
public class WorkerCounts {

    public final int running;
    public final int ready;

    public WorkerCounts (int running, int ready) {
        this.running = running;
        this.ready = ready;
    }

    public int total () {
        return running + ready;
    }

    @Override
    public String toString () {
        return String.format("%d running, %d ready", running, ready);
    }

}

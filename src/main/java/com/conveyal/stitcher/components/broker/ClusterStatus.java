package com.conveyal.stitcher.components.broker;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A snapshot of coordinator state for operators. The fields are read from several independently locked structures,
 * so they are individually accurate but not necessarily consistent with one another.
 */
public class ClusterStatus {

    public final int running;

    public final int ready;

    public final int sessions;

    @JsonProperty("pending_reschedules")
    public final int pendingReschedules;

    @JsonProperty("work_items")
    public final int workItems;

    public final int stitched;

    public ClusterStatus (
            int running, int ready, int sessions, int pendingReschedules, int workItems, int stitched
    ) {
        this.running = running;
        this.ready = ready;
        this.sessions = sessions;
        this.pendingReschedules = pendingReschedules;
        this.workItems = workItems;
        this.stitched = stitched;
    }

}

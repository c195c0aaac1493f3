package com.conveyal.stitcher.components.broker;

import com.conveyal.stitcher.models.StitchJob;

/**
 * The record of one job dispatched to one worker, from the moment the dispatch is attempted until the worker reports
 * completion or disappears from the fleet. The status URL is null until the worker acknowledges the job.
 */
public class Session {

    public final String sessionId;
    public final String workerAddress;
    public final StitchJob job;
    public final long createdAt;

    private volatile String statusUrl;
    private volatile long lastAccessed;

    public Session (String sessionId, String workerAddress, StitchJob job) {
        this.sessionId = sessionId;
        this.workerAddress = workerAddress;
        this.job = job;
        this.createdAt = System.currentTimeMillis();
        this.lastAccessed = createdAt;
    }

    public String getStatusUrl () {
        return statusUrl;
    }

    public long getLastAccessed () {
        return lastAccessed;
    }

    /** Record the worker's acknowledgment of the job. */
    void acknowledge (String statusUrl) {
        this.statusUrl = statusUrl;
        this.lastAccessed = System.currentTimeMillis();
    }

    public boolean isAcknowledged () {
        return statusUrl != null;
    }

    @Override
    public String toString () {
        return String.format("Session %s on %s for %s", sessionId, workerAddress, job);
    }

}

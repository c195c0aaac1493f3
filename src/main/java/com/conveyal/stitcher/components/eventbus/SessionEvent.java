package com.conveyal.stitcher.components.eventbus;

import com.conveyal.stitcher.models.StitchJob;

/**
 * Represents the lifecycle of one dispatch: the session is opened when a worker acknowledges a job, and is resolved
 * exactly once, either by the worker reporting completion or by the worker disappearing.
 */
public class SessionEvent extends Event {

    public enum State {
        OPENED, COMPLETED, LOST
    }

    public final String sessionId;

    public final String host;

    public final StitchJob job;

    public final State state;

    public SessionEvent (String sessionId, String host, StitchJob job, State state) {
        this.sessionId = sessionId;
        this.host = host;
        this.job = job;
        this.state = state;
        this.success = state != State.LOST;
    }

    @Override
    public String toString () {
        return String.format("[session %s on %s %s: %s]", sessionId, host, state, job);
    }

}

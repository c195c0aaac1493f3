package com.conveyal.stitcher.components.eventbus;

/**
 * Signals that a request has been processed over the HTTP API, which is almost always a worker checking in.
 */
public class HttpApiEvent extends Event {

    public final String method;

    public final int statusCode;

    /** The URL path of the API endpoint. */
    public final String path;

    /**
     * Total time taken to process the API request.
     * Most requests take less than 1 msec, which gets truncated to zero.
     */
    public final long durationMsec;

    public HttpApiEvent (String method, int statusCode, String path, long durationMsec) {
        this.method = method;
        this.statusCode = statusCode;
        this.path = path;
        this.durationMsec = durationMsec;
    }

    @Override
    public String toString () {
        return String.format("[HTTP %s %s, status code %d, duration %d msec]", method, path, statusCode, durationMsec);
    }

}

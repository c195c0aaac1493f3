package com.conveyal.stitcher.components.eventbus;

import com.conveyal.stitcher.util.ExceptionUtils;

/**
 * This Event is fired each time a Throwable (usually an Exception or Error) occurs in the coordinator, whether in an
 * HTTP handler or in one of the background loops that must keep running after an error.
 */
public class ErrorEvent extends Event {

    // All Events are intended to be eligible for serialization into a log, so we convert the Throwable to
    // some Strings to determine its representation in a simple way.

    public final String summary;

    /**
     * The path portion of the HTTP URL, if the error has occurred while responding to an HTTP request.
     * May be null if the error occurred in a background task.
     */
    public final String httpPath;

    /** The full stack trace of the exception that occurred. */
    public final String stackTrace;

    /** A minimal stack trace showing the immediate cause within our own code. */
    public final String filteredStackTrace;

    public ErrorEvent (Throwable throwable, String httpPath) {
        this.summary = ExceptionUtils.shortCauseString(throwable);
        this.stackTrace = ExceptionUtils.stackTraceString(throwable);
        this.filteredStackTrace = ExceptionUtils.filterStackTrace(throwable);
        this.httpPath = httpPath;
        this.success = false;
    }

    public ErrorEvent (Throwable throwable) {
        this(throwable, null);
    }

    /** Return a string intended for logging on the console. */
    public String traceWithContext (boolean verbose) {
        StringBuilder builder = new StringBuilder();
        if (httpPath != null) {
            builder.append("Accessing ");
            builder.append(httpPath);
            builder.append(": ");
        }
        if (verbose) {
            builder.append(stackTrace);
        } else {
            builder.append(filteredStackTrace);
        }
        return builder.toString();
    }

}

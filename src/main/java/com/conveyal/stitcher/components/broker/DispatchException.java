package com.conveyal.stitcher.components.broker;

/**
 * A worker did not accept a job: it could not be reached, it responded with an error status, or its response did not
 * contain a status URL. The worker is presumed broken and the job must be sent elsewhere.
 */
public class DispatchException extends Exception {

    public DispatchException (String message) {
        super(message);
    }

    public DispatchException (String message, Throwable cause) {
        super(message, cause);
    }

}

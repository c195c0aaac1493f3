package com.conveyal.stitcher.components.discovery;

/**
 * The set of running workers could not be determined, because the listing source was unreachable or returned
 * something we could not interpret. The registry is left as it was until the next successful poll.
 */
public class DiscoveryException extends Exception {

    public DiscoveryException (String message) {
        super(message);
    }

    public DiscoveryException (String message, Throwable cause) {
        super(message, cause);
    }

}

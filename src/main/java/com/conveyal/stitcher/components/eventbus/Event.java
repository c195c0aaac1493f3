package com.conveyal.stitcher.components.eventbus;

import java.util.Date;

/**
 * Metadata about coordinator operation: workers coming and going, sessions opening and closing, errors. These are
 * intended to be serialized into a log, so the field visibility and types of every subclass should take that into
 * consideration.
 */
public abstract class Event {

    /** The time at which this event happened. */
    public Date timestamp = new Date();

    public boolean success = true;

    /**
     * Serialize the specific subtype of event to facilitate filtering.
     * Not using JsonSubtypes annotations because we do not currently anticipate deserializing these objects.
     */
    public String getType () {
        // Will resolve to specific subclass
        return this.getClass().getSimpleName();
    }

}

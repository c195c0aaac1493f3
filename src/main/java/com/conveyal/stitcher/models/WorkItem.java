package com.conveyal.stitcher.models;

import org.locationtech.jts.geom.Envelope;

/**
 * One row of the work catalog: a single grid cell to be stitched for one scenario and one kind of raster.
 * The cell is a JTS Envelope in WGS84 degrees, with X as longitude and Y as latitude.
 */
public class WorkItem {

    public final String scenarioId;
    public final String rasterId;
    public final Envelope cell;
    public final boolean stitched;

    public WorkItem (String scenarioId, String rasterId, Envelope cell, boolean stitched) {
        this.scenarioId = scenarioId;
        this.rasterId = rasterId;
        this.cell = cell;
        this.stitched = stitched;
    }

    /** The payload sent to a worker to process this item. */
    public StitchJob toJob () {
        return new StitchJob(scenarioId, rasterId, cell);
    }

    @Override
    public String toString () {
        return String.format("%s/%s %s%s", scenarioId, rasterId, cell, stitched ? " (stitched)" : "");
    }

}

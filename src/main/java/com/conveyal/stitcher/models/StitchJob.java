package com.conveyal.stitcher.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.locationtech.jts.geom.Envelope;

import java.util.Objects;

/**
 * The job payload sent to a worker inside a StitchRequest, identifying one work catalog item. The same payload is held
 * by the Session while the job is in flight and placed back on the reschedule queue if the worker is lost, so it is a
 * value object compared on all its fields.
 */
public class StitchJob {

    @JsonProperty("scenario_id")
    public String scenarioId;

    @JsonProperty("raster_id")
    public String rasterId;

    @JsonProperty("lng_min")
    public double lngMin;

    @JsonProperty("lat_min")
    public double latMin;

    @JsonProperty("lng_max")
    public double lngMax;

    @JsonProperty("lat_max")
    public double latMax;

    /** No-arg constructor for deserialization. */
    public StitchJob () { }

    public StitchJob (String scenarioId, String rasterId, Envelope cell) {
        this.scenarioId = scenarioId;
        this.rasterId = rasterId;
        this.lngMin = cell.getMinX();
        this.latMin = cell.getMinY();
        this.lngMax = cell.getMaxX();
        this.latMax = cell.getMaxY();
    }

    @JsonIgnore
    public Envelope getCell () {
        return new Envelope(lngMin, lngMax, latMin, latMax);
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StitchJob other = (StitchJob) o;
        return Double.compare(other.lngMin, lngMin) == 0 &&
                Double.compare(other.latMin, latMin) == 0 &&
                Double.compare(other.lngMax, lngMax) == 0 &&
                Double.compare(other.latMax, latMax) == 0 &&
                Objects.equals(scenarioId, other.scenarioId) &&
                Objects.equals(rasterId, other.rasterId);
    }

    @Override
    public int hashCode () {
        return Objects.hash(scenarioId, rasterId, lngMin, latMin, lngMax, latMax);
    }

    @Override
    public String toString () {
        return String.format("%s/%s [%s, %s, %s, %s]", scenarioId, rasterId, lngMin, latMin, lngMax, latMax);
    }

}

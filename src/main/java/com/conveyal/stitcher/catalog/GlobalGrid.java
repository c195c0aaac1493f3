package com.conveyal.stitcher.catalog;

import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A regular tiling of the whole globe in WGS84 into square cells, covering latitude [-90, 90) and longitude
 * [-180, 180). Cells are generated in rows from south to north, and west to east within each row.
 */
public abstract class GlobalGrid {

    public static final double MIN_LAT = -90;
    public static final double MAX_LAT = 90;
    public static final double MIN_LNG = -180;
    public static final double MAX_LNG = 180;

    /** Tolerance when checking that the step evenly divides the extents, to allow steps like 0.1 degrees. */
    private static final double EPSILON = 1e-9;

    /** Number of cells along one axis of the given span, failing if the step does not divide the span evenly. */
    public static int cellsAlong (double span, double stepDegrees) {
        checkArgument(stepDegrees > 0, "Grid step must be positive, was %s.", stepDegrees);
        double n = span / stepDegrees;
        long rounded = Math.round(n);
        checkArgument(rounded > 0 && Math.abs(n - rounded) < EPSILON,
                "Grid step %s degrees does not evenly divide %s degrees.", stepDegrees, span);
        return (int) rounded;
    }

    /**
     * Generate every cell of the grid. Corners are computed by multiplying the step by integer indexes rather than by
     * repeated addition, so that no floating point drift accumulates and adjacent cells share exact edge values.
     */
    public static List<Envelope> cells (double stepDegrees) {
        int nLat = cellsAlong(MAX_LAT - MIN_LAT, stepDegrees);
        int nLng = cellsAlong(MAX_LNG - MIN_LNG, stepDegrees);
        List<Envelope> cells = new ArrayList<>(nLat * nLng);
        for (int y = 0; y < nLat; y++) {
            double latMin = MIN_LAT + y * stepDegrees;
            double latMax = (y + 1 == nLat) ? MAX_LAT : MIN_LAT + (y + 1) * stepDegrees;
            for (int x = 0; x < nLng; x++) {
                double lngMin = MIN_LNG + x * stepDegrees;
                double lngMax = (x + 1 == nLng) ? MAX_LNG : MIN_LNG + (x + 1) * stepDegrees;
                cells.add(new Envelope(lngMin, lngMax, latMin, latMax));
            }
        }
        return cells;
    }

}

package com.travelagent.poi.common;

/**
 * Conversion between kilometers and the planar degree units of the proximity graph.
 */
public class SphericalDistanceLibrary {

    /**
     * Flat conversion factor used by the proximity graph: one degree is taken to be 111 km in every direction.
     * Radius settings for proximity clustering were tuned against this constant, so it is not latitude-corrected.
     */
    public static final double DEGREES_PER_KM = 1 / 111.0;

    /** Radius in planar degree units, using the flat conversion factor. */
    public static double kmToPlanarDegrees (double km) {
        return km * DEGREES_PER_KM;
    }

}

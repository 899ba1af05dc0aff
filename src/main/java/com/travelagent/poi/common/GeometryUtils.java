package com.travelagent.poi.common;

import org.apache.commons.math3.util.FastMath;
import org.locationtech.jts.geom.Coordinate;

/**
 * Distance functions and range checks for WGS84 latitude and longitude values.
 *
 * Two distance measures coexist. The proximity graph and the cluster merging heuristic work in "degree
 * space", treating latitude and longitude as planar axes, and their radius parameters have been tuned against that
 * approximation. Density-based clustering, noise reassignment and duplicate detection use haversine distance.
 */
public class GeometryUtils {

    /** Mean radius of the Earth. Distances compared in tests depend on exactly this value. */
    public static final double RADIUS_OF_EARTH_KM = 6371.0;

    /**
     * Haversine formula for distance on the sphere.
     * @return distance in kilometers
     */
    public static double haversineKm (double lat0, double lon0, double lat1, double lon1) {
        double phi0 = FastMath.toRadians(lat0);
        double phi1 = FastMath.toRadians(lat1);
        double deltaPhi = phi1 - phi0;
        double deltaLambda = FastMath.toRadians(lon1) - FastMath.toRadians(lon0);

        double sinHalfPhi = FastMath.sin(deltaPhi / 2);
        double sinHalfLambda = FastMath.sin(deltaLambda / 2);
        double a = sinHalfPhi * sinHalfPhi + FastMath.cos(phi0) * FastMath.cos(phi1) * sinHalfLambda * sinHalfLambda;
        double c = 2 * FastMath.atan2(FastMath.sqrt(a), FastMath.sqrt(1 - a));
        return RADIUS_OF_EARTH_KM * c;
    }

    /** Haversine distance between two JTS coordinates, which are in (x = lon, y = lat) order. */
    public static double haversineKm (Coordinate c0, Coordinate c1) {
        return haversineKm(c0.y, c0.x, c1.y, c1.x);
    }

    /** Euclidean distance treating degrees of latitude and longitude as equal planar units. */
    public static double planarDegrees (double lat0, double lon0, double lat1, double lon1) {
        double dLat = lat0 - lat1;
        double dLon = lon0 - lon1;
        return FastMath.sqrt(dLat * dLat + dLon * dLon);
    }

    public static double planarDegrees (Coordinate c0, Coordinate c1) {
        return planarDegrees(c0.y, c0.x, c1.y, c1.x);
    }

    //// Methods for range-checking WGS84 values. Unlike envelope checks these never throw: POI data from providers
    //// is routinely incomplete and bad points are simply left out of spatial operations.

    public static boolean isValidLon (double longitude) {
        return Double.isFinite(longitude) && Math.abs(longitude) <= 180;
    }

    public static boolean isValidLat (double latitude) {
        return Double.isFinite(latitude) && Math.abs(latitude) <= 90;
    }

}

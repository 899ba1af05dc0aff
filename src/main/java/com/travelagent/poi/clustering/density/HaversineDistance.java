package com.travelagent.poi.clustering.density;

import com.travelagent.poi.common.GeometryUtils;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.ml.distance.DistanceMeasure;

/**
 * Great-circle distance in kilometers between two {lat, lon} pairs in degrees. Longitudes on either side of the
 * antimeridian are handled by the haversine formula itself.
 */
public class HaversineDistance implements DistanceMeasure {

    private static final long serialVersionUID = 1L;

    public static final HaversineDistance INSTANCE = new HaversineDistance();

    @Override
    public double compute (double[] a, double[] b) throws DimensionMismatchException {
        if (a.length != 2) throw new DimensionMismatchException(a.length, 2);
        if (b.length != 2) throw new DimensionMismatchException(b.length, 2);
        return GeometryUtils.haversineKm(a[0], a[1], b[0], b[1]);
    }

}

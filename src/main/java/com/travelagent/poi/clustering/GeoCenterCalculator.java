package com.travelagent.poi.clustering;

import com.travelagent.poi.model.CoordinateExtractor;
import com.travelagent.poi.model.PoiRecord;
import org.locationtech.jts.geom.Coordinate;

import java.util.Collection;

/**
 * Arithmetic mean of POI coordinates. This is not a true spherical centroid, but over the extent of a city the
 * difference is negligible and it keeps cluster centers easy to reason about.
 */
public abstract class GeoCenterCalculator {

    /**
     * @return the mean coordinate (x = longitude, y = latitude) of the located POIs in the collection, or null if
     *         none of them has a valid location. Unlocated POIs are ignored.
     */
    public static Coordinate center (Collection<PoiRecord> pois) {
        double latSum = 0;
        double lonSum = 0;
        int n = 0;
        for (PoiRecord poi : pois) {
            Coordinate coordinate = CoordinateExtractor.extract(poi);
            if (coordinate == null) continue;
            latSum += coordinate.y;
            lonSum += coordinate.x;
            n += 1;
        }
        if (n == 0) return null;
        return new Coordinate(lonSum / n, latSum / n);
    }

}

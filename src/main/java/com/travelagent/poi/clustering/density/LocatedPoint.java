package com.travelagent.poi.clustering.density;

import com.travelagent.poi.model.LocatedPois;
import org.apache.commons.math3.ml.clustering.Clusterable;

import java.util.ArrayList;
import java.util.List;

/**
 * One located POI as seen by the commons-math clusterers: its {lat, lon} pair plus its index in the located set,
 * so that cluster membership can be turned back into per-point labels.
 *
 * Equality is identity. The commons-math DBSCAN keeps its visit state in a hash map keyed by point, and two POIs at
 * the same coordinates are still two points.
 */
class LocatedPoint implements Clusterable {

    final int index;

    private final double[] latLon;

    LocatedPoint (int index, double lat, double lon) {
        this.index = index;
        this.latLon = new double[] { lat, lon };
    }

    @Override
    public double[] getPoint () {
        return latLon;
    }

    static List<LocatedPoint> wrap (LocatedPois located) {
        List<LocatedPoint> points = new ArrayList<>(located.size());
        for (int i = 0; i < located.size(); i++) {
            points.add(new LocatedPoint(i, located.lat(i), located.lon(i)));
        }
        return points;
    }

}

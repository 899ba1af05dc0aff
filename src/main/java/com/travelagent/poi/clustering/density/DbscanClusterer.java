package com.travelagent.poi.clustering.density;

import com.travelagent.poi.model.LocatedPois;
import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Classic DBSCAN with a fixed search radius in kilometers over great-circle distance, using the commons-math
 * implementation. A point with at least minSamples points (itself included) within the radius is a core point.
 * Clusters are grown from core points in index order, and non-core points reached from a core point join the first
 * cluster that reaches them. Everything else is noise.
 *
 * Neighbors are found by comparing every pair of points, which is O(N^2) but needs no spatial index and so has no
 * trouble near the poles or across the antimeridian.
 */
public class DbscanClusterer {

    private static final Logger LOG = LoggerFactory.getLogger(DbscanClusterer.class);

    public static final int NOISE = HdbscanClusterer.NOISE;

    public final double epsKm;

    public final int minSamples;

    public DbscanClusterer (double epsKm, int minSamples) {
        checkArgument(Double.isFinite(epsKm) && epsKm > 0, "DBSCAN radius must be a positive number of km.");
        checkArgument(minSamples >= 1, "Minimum samples must be at least 1.");
        this.epsKm = epsKm;
        this.minSamples = minSamples;
    }

    public int[] cluster (LocatedPois located) {
        int n = located.size();
        int[] labels = new int[n];
        Arrays.fill(labels, NOISE);
        if (n == 0) return labels;

        // commons-math does not count a point among its own neighbors.
        DBSCANClusterer<LocatedPoint> dbscan = new DBSCANClusterer<>(epsKm, minSamples - 1, HaversineDistance.INSTANCE);
        List<Cluster<LocatedPoint>> clusters = dbscan.cluster(LocatedPoint.wrap(located));
        for (int c = 0; c < clusters.size(); c++) {
            for (LocatedPoint point : clusters.get(c).getPoints()) {
                labels[point.index] = c;
            }
        }
        LOG.debug("DBSCAN (eps {} km, min samples {}) found {} clusters among {} points.",
                epsKm, minSamples, clusters.size(), n);
        return labels;
    }

}

package com.travelagent.poi.clustering.density;

import com.travelagent.poi.model.LocatedPois;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.JDKRandomGenerator;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Lloyd's k-means on raw (lat, lon) degree pairs, for callers who want exactly k day-sized groups and do not care
 * about outliers. Distances are planar, which like the proximity graph distorts east-west distances away from the
 * equator. There is no noise label: every point is assigned to some center.
 *
 * This delegates to the commons-math k-means++ clusterer. Its random generator is seeded afresh on every call, so
 * results are repeatable.
 */
public class KMeansClusterer {

    private static final Logger LOG = LoggerFactory.getLogger(KMeansClusterer.class);

    private static final int SEED = 42;

    private static final int MAX_ITERATIONS = 300;

    public final int k;

    public KMeansClusterer (int k) {
        checkArgument(k >= 1, "Number of clusters must be at least 1.");
        this.k = k;
    }

    /** @return the index of the center each point is assigned to, in [0, min(k, n)). */
    public int[] cluster (LocatedPois located) {
        int n = located.size();
        int[] labels = new int[n];
        if (n == 0) return labels;
        int nCenters = Math.min(k, n);

        RandomGenerator random = new JDKRandomGenerator();
        random.setSeed(SEED);
        KMeansPlusPlusClusterer<LocatedPoint> kMeans =
                new KMeansPlusPlusClusterer<>(nCenters, MAX_ITERATIONS, new EuclideanDistance(), random);
        List<CentroidCluster<LocatedPoint>> clusters = kMeans.cluster(LocatedPoint.wrap(located));
        for (int c = 0; c < clusters.size(); c++) {
            for (LocatedPoint point : clusters.get(c).getPoints()) {
                labels[point.index] = c;
            }
        }
        LOG.debug("k-means with k={} assigned {} points.", nCenters, n);
        return labels;
    }

}

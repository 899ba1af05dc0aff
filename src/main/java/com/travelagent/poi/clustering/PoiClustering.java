package com.travelagent.poi.clustering;

import com.travelagent.poi.clustering.density.DbscanClusterer;
import com.travelagent.poi.clustering.density.HdbscanClusterer;
import com.travelagent.poi.clustering.density.KMeansClusterer;
import com.travelagent.poi.model.ClusterAssignment;
import com.travelagent.poi.model.CoordinateExtractor;
import com.travelagent.poi.model.LocatedPois;
import com.travelagent.poi.model.PoiRecord;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Entry point for grouping POIs into geographically coherent clusters, typically one per day of a trip.
 *
 * Two independent strategies are offered. Proximity clustering links POIs closer than a fixed radius and takes
 * connected components, then merges the smallest components into their neighbors until the requested count is
 * reached. Density clustering (HDBSCAN) finds however many clusters the data supports, then folds outliers into the
 * nearest cluster so that distant but important destinations stay in the itinerary. DBSCAN and k-means are also
 * available through {@link #cluster}.
 *
 * Every method is a pure function of its arguments: POI records are regrouped, never modified or copied, and no
 * state is kept between calls, so one instance may be shared by any number of threads. Malformed POI data never
 * causes an exception. Records without usable coordinates come back in the unlocated list of the result.
 */
public class PoiClustering {

    private static final Logger LOG = LoggerFactory.getLogger(PoiClustering.class);

    /** HDBSCAN never separates POIs that are closer together than this, unless configured otherwise. */
    public static final double DEFAULT_CLUSTER_SELECTION_EPSILON_KM = 0.5;

    public interface Config {
        /** When false, density clustering is unavailable and returns an empty result with a warning. */
        boolean densityClusteringEnabled ();

        /** HDBSCAN clusters that split apart at a smaller distance than this are kept as one. Zero disables it. */
        default double clusterSelectionEpsilonKm () {
            return DEFAULT_CLUSTER_SELECTION_EPSILON_KM;
        }
    }

    private final boolean densityClusteringEnabled;

    private final double clusterSelectionEpsilonKm;

    public PoiClustering (Config config) {
        this.densityClusteringEnabled = config.densityClusteringEnabled();
        this.clusterSelectionEpsilonKm = config.clusterSelectionEpsilonKm();
        checkArgument(Double.isFinite(clusterSelectionEpsilonKm) && clusterSelectionEpsilonKm >= 0,
                "Cluster selection epsilon must be a non-negative number of km.");
    }

    /** An instance with all algorithms enabled. */
    public PoiClustering () {
        this(() -> true);
    }

    /**
     * Cluster by connected components of the proximity graph with the given radius.
     *
     * If there are POIs but none of them has valid coordinates, the result is a single cluster holding all of the
     * input, so that itinerary building still has something to work with. An empty input gives an empty result.
     *
     * @param targetClusters if non-null, merge clusters until no more than this many remain.
     */
    public ClusterAssignment clusterByProximity (List<PoiRecord> pois, double radiusKm, Integer targetClusters) {
        checkNotNull(pois);
        checkArgument(Double.isFinite(radiusKm) && radiusKm > 0, "Clustering radius must be a positive number of km.");
        if (pois.isEmpty()) {
            return ClusterAssignment.empty();
        }
        LocatedPois located = CoordinateExtractor.extractAll(pois);
        if (located.isEmpty()) {
            LOG.warn("No POIs have valid coordinates, returning all {} POIs as a single cluster.", pois.size());
            SortedMap<Integer, List<PoiRecord>> fallback = new TreeMap<>();
            fallback.put(1, pois);
            return new ClusterAssignment(fallback, Collections.emptyList());
        }
        ProximityGraph graph = ProximityGraph.build(located, radiusKm);
        int[] labels = ConnectedComponentClusterer.label(graph);
        SortedMap<Integer, List<PoiRecord>> clusters = new TreeMap<>();
        for (int i = 0; i < located.size(); i++) {
            clusters.computeIfAbsent(labels[i], id -> new ArrayList<>()).add(located.poi(i));
        }
        LOG.info("Proximity clustering made {} clusters from {} located POIs (radius {} km, {} edges).",
                clusters.size(), located.size(), radiusKm, graph.getEdgeCount());
        if (targetClusters != null && clusters.size() > targetClusters) {
            clusters = ClusterBalancer.mergeToTarget(clusters, targetClusters);
        }
        return new ClusterAssignment(clusters, located.unlocated());
    }

    public ClusterAssignment clusterByProximity (List<PoiRecord> pois, double radiusKm) {
        return clusterByProximity(pois, radiusKm, null);
    }

    /**
     * Cluster with HDBSCAN over great-circle distances.
     *
     * Groups of POIs that only split apart below the configured cluster selection epsilon are never separated, so a
     * single tight group of POIs comes out as one cluster however its points happen to be arranged.
     *
     * @param maxClusters if non-null, merge the dense clusters until no more than this many remain. This happens
     *                    before outliers are reassigned.
     * @param assignNoiseToNearest if true, every outlier joins the cluster with the nearest center and the result has
     *                    no noise. If HDBSCAN finds no cluster at all, the outliers together form a single cluster.
     *                    If false, outliers are returned in the noise list of the result.
     */
    public ClusterAssignment clusterByDensity (
            List<PoiRecord> pois,
            int minClusterSize,
            int minSamples,
            Integer maxClusters,
            boolean assignNoiseToNearest
    ) {
        checkNotNull(pois);
        if (!densityClusteringEnabled) {
            LOG.warn("Density clustering is disabled in configuration, returning no clusters.");
            return ClusterAssignment.empty();
        }
        HdbscanClusterer clusterer = new HdbscanClusterer(minClusterSize, minSamples, clusterSelectionEpsilonKm);
        LocatedPois located = CoordinateExtractor.extractAll(pois);
        if (located.isEmpty()) {
            LOG.warn("No valid coordinates among {} POIs, returning no clusters.", pois.size());
            return new ClusterAssignment(Collections.emptyMap(), located.unlocated());
        }
        int[] labels = clusterer.cluster(located);
        return assemble("HDBSCAN", located, labels, maxClusters, assignNoiseToNearest);
    }

    public ClusterAssignment clusterByDensity (List<PoiRecord> pois, int minClusterSize, int minSamples) {
        return clusterByDensity(pois, minClusterSize, minSamples, null, true);
    }

    /**
     * Cluster with fixed-radius DBSCAN. Outliers are returned in the noise list unless assignNoiseToNearest is set.
     */
    public ClusterAssignment clusterByDbscan (
            List<PoiRecord> pois,
            double epsKm,
            int minSamples,
            boolean assignNoiseToNearest
    ) {
        checkNotNull(pois);
        DbscanClusterer clusterer = new DbscanClusterer(epsKm, minSamples);
        LocatedPois located = CoordinateExtractor.extractAll(pois);
        int[] labels = clusterer.cluster(located);
        return assemble("DBSCAN", located, labels, null, assignNoiseToNearest);
    }

    public ClusterAssignment clusterByKMeans (List<PoiRecord> pois, int k) {
        checkNotNull(pois);
        KMeansClusterer clusterer = new KMeansClusterer(k);
        LocatedPois located = CoordinateExtractor.extractAll(pois);
        int[] labels = clusterer.cluster(located);
        return assemble("k-means", located, labels, null, false);
    }

    /** Run the chosen algorithm with its parameters taken from the supplied parameter object. */
    public ClusterAssignment cluster (ClusteringAlgorithm algorithm, List<PoiRecord> pois, ClusteringParameters params) {
        switch (algorithm) {
            case PROXIMITY:
                return clusterByProximity(pois, params.radiusKm, params.maxClusters);
            case HDBSCAN:
                return clusterByDensity(pois, params.minClusterSize, params.minSamples, params.maxClusters,
                        params.assignNoiseToNearest);
            case DBSCAN:
                return clusterByDbscan(pois, params.epsKm, params.minClusterSize, false);
            case KMEANS:
                int k = params.maxClusters == null ? ClusteringParameters.DEFAULT_KMEANS_CLUSTERS : params.maxClusters;
                return clusterByKMeans(pois, k);
            default:
                throw new IllegalArgumentException("Unsupported clustering algorithm " + algorithm);
        }
    }

    /** The mean coordinate of the located POIs (x = longitude, y = latitude), or null if none are located. */
    public static Coordinate clusterCenter (Collection<PoiRecord> pois) {
        return GeoCenterCalculator.center(pois);
    }

    /**
     * Turn per-point labels into a ClusterAssignment. Labels 0, 1, 2... become cluster IDs 1, 2, 3...; the noise
     * label is never used as a cluster ID.
     */
    private static ClusterAssignment assemble (
            String algorithmName,
            LocatedPois located,
            int[] labels,
            Integer maxClusters,
            boolean assignNoiseToNearest
    ) {
        SortedMap<Integer, List<PoiRecord>> clusters = new TreeMap<>();
        List<PoiRecord> noise = new ArrayList<>();
        for (int i = 0; i < located.size(); i++) {
            if (labels[i] == HdbscanClusterer.NOISE) {
                noise.add(located.poi(i));
            } else {
                clusters.computeIfAbsent(labels[i] + 1, id -> new ArrayList<>()).add(located.poi(i));
            }
        }
        LOG.info("{} found {} clusters among {} located POIs ({} noise).",
                algorithmName, clusters.size(), located.size(), noise.size());

        if (maxClusters != null && clusters.size() > maxClusters) {
            clusters = ClusterBalancer.mergeToTarget(clusters, maxClusters);
        } else {
            clusters = ClusterBalancer.reindex(clusters);
        }
        if (!noise.isEmpty() && assignNoiseToNearest) {
            if (clusters.isEmpty()) {
                LOG.info("{} found no dense cluster, keeping all {} POIs together as one cluster.",
                        algorithmName, noise.size());
                clusters.put(1, noise);
            } else {
                clusters = NoiseReassigner.assignToNearest(clusters, noise);
            }
            noise = Collections.emptyList();
        }
        return new ClusterAssignment(clusters, located.unlocated(), noise);
    }

}

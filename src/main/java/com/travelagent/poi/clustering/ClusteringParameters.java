package com.travelagent.poi.clustering;

/**
 * Tuning parameters for {@link PoiClustering#cluster}. Each algorithm reads only the fields relevant to it.
 * The defaults are the values used for city-scale trip planning.
 */
public class ClusteringParameters {

    /** Proximity graph radius in km. */
    public double radiusKm = 2.0;

    /**
     * Upper bound on the number of clusters, usually the number of days in the trip. For PROXIMITY and HDBSCAN,
     * surplus clusters are merged away; null means no limit. For KMEANS this is k, defaulting to 5 when null.
     */
    public Integer maxClusters;

    /** Smallest group HDBSCAN will call a cluster. DBSCAN uses this as its minimum neighborhood size. */
    public int minClusterSize = 3;

    /** Neighbor count defining the HDBSCAN core distance. */
    public int minSamples = 2;

    /** Whether HDBSCAN outliers are folded into the nearest cluster rather than kept apart as noise. */
    public boolean assignNoiseToNearest = true;

    /** DBSCAN search radius in km. */
    public double epsKm = 2.0;

    public static final int DEFAULT_KMEANS_CLUSTERS = 5;

}

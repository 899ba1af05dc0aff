package com.travelagent.poi.clustering;

/**
 * The clustering strategies a caller can choose between. These are alternatives, not refinements of one another.
 */
public enum ClusteringAlgorithm {

    /** Connected components of a fixed-radius proximity graph, optionally merged down to a target count. */
    PROXIMITY,

    /** HDBSCAN over great-circle distance with outliers folded into the nearest cluster. */
    HDBSCAN,

    /** Fixed-radius DBSCAN over great-circle distance. Outliers are kept apart as noise. */
    DBSCAN,

    /** k-means with a fixed number of clusters. */
    KMEANS;

    /** Parse a name case-insensitively, as supplied on the command line or in a request. */
    public static ClusteringAlgorithm fromName (String name) {
        for (ClusteringAlgorithm algorithm : values()) {
            if (algorithm.name().equalsIgnoreCase(name.trim())) return algorithm;
        }
        throw new IllegalArgumentException("Unknown clustering algorithm: " + name);
    }

}

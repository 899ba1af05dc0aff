package com.travelagent.poi.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The result of clustering a list of POIs: a mapping from contiguous 1-based cluster IDs to the POIs in each
 * cluster, in a stable order.
 *
 * POIs that could not take part in clustering are tracked separately rather than silently dropped. Every input
 * record ends up in exactly one of the clusters, the unlocated list, or (only when density clustering was asked
 * to keep outliers apart) the noise list. The record instances are the caller's own, never copies.
 */
public class ClusterAssignment {

    private final SortedMap<Integer, List<PoiRecord>> clusters;

    private final List<PoiRecord> unlocated;

    private final List<PoiRecord> noise;

    public ClusterAssignment (Map<Integer, List<PoiRecord>> clusters, List<PoiRecord> unlocated, List<PoiRecord> noise) {
        TreeMap<Integer, List<PoiRecord>> copy = new TreeMap<>();
        clusters.forEach((id, pois) -> copy.put(id, Collections.unmodifiableList(new ArrayList<>(pois))));
        this.clusters = Collections.unmodifiableSortedMap(copy);
        this.unlocated = Collections.unmodifiableList(new ArrayList<>(unlocated));
        this.noise = Collections.unmodifiableList(new ArrayList<>(noise));
    }

    public ClusterAssignment (Map<Integer, List<PoiRecord>> clusters, List<PoiRecord> unlocated) {
        this(clusters, unlocated, Collections.emptyList());
    }

    public static ClusterAssignment empty () {
        return new ClusterAssignment(Collections.emptyMap(), Collections.emptyList());
    }

    /** Cluster ID to POIs, in ascending ID order. */
    @JsonProperty("clusters")
    public SortedMap<Integer, List<PoiRecord>> getClusters () {
        return clusters;
    }

    @JsonProperty("unlocated")
    public List<PoiRecord> getUnlocated () {
        return unlocated;
    }

    @JsonProperty("noise")
    public List<PoiRecord> getNoise () {
        return noise;
    }

    /** @return the POIs in the given cluster, or an empty list if there is no such cluster. */
    public List<PoiRecord> get (int clusterId) {
        return clusters.getOrDefault(clusterId, Collections.emptyList());
    }

    @JsonIgnore
    public int getClusterCount () {
        return clusters.size();
    }

    @JsonIgnore
    public boolean isEmpty () {
        return clusters.isEmpty();
    }

    /** Total number of POIs placed in clusters, not counting unlocated or noise records. */
    @JsonIgnore
    public int getClusteredPoiCount () {
        int count = 0;
        for (List<PoiRecord> pois : clusters.values()) {
            count += pois.size();
        }
        return count;
    }

    /** The sizes of the clusters in ID order. */
    @JsonIgnore
    public List<Integer> getClusterSizes () {
        List<Integer> sizes = new ArrayList<>(clusters.size());
        clusters.values().forEach(pois -> sizes.add(pois.size()));
        return sizes;
    }

    @Override
    public String toString () {
        return String.format("ClusterAssignment(%d clusters, sizes %s, %d unlocated, %d noise)",
                clusters.size(), getClusterSizes(), unlocated.size(), noise.size());
    }

}

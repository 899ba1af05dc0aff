package com.travelagent.poi.clustering;

import com.travelagent.poi.common.GeometryUtils;
import com.travelagent.poi.model.PoiRecord;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Reduces the number of clusters to a target count by repeatedly folding the smallest cluster into the cluster whose
 * center is closest to its own. A trip of N days wants about N clusters, while proximity or density clustering
 * produce however many the geography dictates.
 *
 * Ties are broken toward the lowest cluster ID, both when picking the smallest cluster and when picking the nearest
 * one, so results depend only on the input. Centers are compared by Euclidean distance in degree space, the same
 * measure the proximity graph uses.
 *
 * Merging only ever moves POIs between lists: the total number of POIs is the same after every step.
 */
public abstract class ClusterBalancer {

    private static final Logger LOG = LoggerFactory.getLogger(ClusterBalancer.class);

    /**
     * Merge clusters until at most targetClusters remain, then renumber the survivors 1..K in ascending order of
     * their original IDs. A target below one is treated as one. If there are already no more clusters than the
     * target, the clusters are only renumbered. The input map and its lists are not modified.
     */
    public static SortedMap<Integer, List<PoiRecord>> mergeToTarget (
            Map<Integer, List<PoiRecord>> clusters,
            int targetClusters
    ) {
        int target = Math.max(1, targetClusters);
        TreeMap<Integer, List<PoiRecord>> working = new TreeMap<>();
        Map<Integer, Coordinate> centers = new HashMap<>();
        clusters.forEach((id, pois) -> {
            working.put(id, new ArrayList<>(pois));
            centers.put(id, GeoCenterCalculator.center(pois));
        });
        int initialCount = working.size();

        while (working.size() > target && working.size() > 1) {
            int smallestId = smallestCluster(working);
            int nearestId = nearestCluster(smallestId, working, centers);
            List<PoiRecord> smallest = working.remove(smallestId);
            List<PoiRecord> nearest = working.get(nearestId);
            nearest.addAll(smallest);
            centers.remove(smallestId);
            centers.put(nearestId, GeoCenterCalculator.center(nearest));
            LOG.debug("Merged cluster {} ({} POIs) into cluster {}, now {} POIs.",
                    smallestId, smallest.size(), nearestId, nearest.size());
        }
        if (working.size() < initialCount) {
            LOG.info("Merged {} clusters down to {} (target {}).", initialCount, working.size(), targetClusters);
        }
        return reindex(working);
    }

    /** @return the ID of the cluster with the fewest POIs, the lowest such ID in case of ties. */
    private static int smallestCluster (SortedMap<Integer, List<PoiRecord>> clusters) {
        int smallestId = 0;
        int smallestSize = Integer.MAX_VALUE;
        for (Map.Entry<Integer, List<PoiRecord>> entry : clusters.entrySet()) {
            if (entry.getValue().size() < smallestSize) {
                smallestSize = entry.getValue().size();
                smallestId = entry.getKey();
            }
        }
        return smallestId;
    }

    /**
     * @return the ID of the cluster other than fromId whose center is nearest the center of fromId. Clusters without
     *         a center (no located POIs) are infinitely far away, but one is still chosen if nothing else is available
     *         so that merging always makes progress.
     */
    private static int nearestCluster (
            int fromId,
            SortedMap<Integer, List<PoiRecord>> clusters,
            Map<Integer, Coordinate> centers
    ) {
        Coordinate fromCenter = centers.get(fromId);
        Integer nearestId = null;
        double nearestDistance = Double.POSITIVE_INFINITY;
        for (Integer candidateId : clusters.keySet()) {
            if (candidateId == fromId) continue;
            Coordinate candidateCenter = centers.get(candidateId);
            double distance = (fromCenter == null || candidateCenter == null)
                    ? Double.POSITIVE_INFINITY
                    : GeometryUtils.planarDegrees(fromCenter, candidateCenter);
            if (nearestId == null || distance < nearestDistance) {
                nearestId = candidateId;
                nearestDistance = distance;
            }
        }
        return nearestId;
    }

    /** Renumber clusters 1..K, preserving the ascending order of their existing IDs. */
    public static SortedMap<Integer, List<PoiRecord>> reindex (SortedMap<Integer, List<PoiRecord>> clusters) {
        TreeMap<Integer, List<PoiRecord>> reindexed = new TreeMap<>();
        int nextId = 1;
        for (List<PoiRecord> pois : clusters.values()) {
            reindexed.put(nextId++, pois);
        }
        return reindexed;
    }

}

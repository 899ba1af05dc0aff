package com.travelagent.poi.clustering;

import com.travelagent.poi.common.GeometryUtils;
import com.travelagent.poi.model.CoordinateExtractor;
import com.travelagent.poi.model.PoiRecord;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Places the outliers left over by density clustering into the cluster whose center is nearest by great-circle
 * distance. For trip planning an isolated POI is often a destination in its own right (a mountain resort or an
 * old town an hour outside the city) and must not be dropped just because nothing else is nearby.
 *
 * Cluster centers are computed once from the dense members only, so the order in which outliers are processed has
 * no effect on where they go.
 */
public abstract class NoiseReassigner {

    private static final Logger LOG = LoggerFactory.getLogger(NoiseReassigner.class);

    /**
     * @param clusters the dense clusters, which must not be empty. Neither the map nor its lists are modified.
     * @param noise POIs to distribute among the clusters.
     * @return a new map with the same keys, each noise POI appended to the list of its nearest cluster.
     */
    public static SortedMap<Integer, List<PoiRecord>> assignToNearest (
            SortedMap<Integer, List<PoiRecord>> clusters,
            List<PoiRecord> noise
    ) {
        if (clusters.isEmpty()) {
            throw new IllegalArgumentException("Noise can only be assigned when at least one cluster exists.");
        }
        TreeMap<Integer, List<PoiRecord>> result = new TreeMap<>();
        TreeMap<Integer, Coordinate> centers = new TreeMap<>();
        clusters.forEach((id, pois) -> {
            result.put(id, new ArrayList<>(pois));
            centers.put(id, GeoCenterCalculator.center(pois));
        });
        LOG.info("Assigning {} noise POIs to the nearest of {} clusters.", noise.size(), clusters.size());
        for (PoiRecord poi : noise) {
            Coordinate coordinate = CoordinateExtractor.extract(poi);
            int nearestId = centers.firstKey();
            double nearestDistanceKm = Double.POSITIVE_INFINITY;
            if (coordinate != null) {
                for (Map.Entry<Integer, Coordinate> entry : centers.entrySet()) {
                    if (entry.getValue() == null) continue;
                    double distanceKm = GeometryUtils.haversineKm(coordinate, entry.getValue());
                    if (distanceKm < nearestDistanceKm) {
                        nearestDistanceKm = distanceKm;
                        nearestId = entry.getKey();
                    }
                }
            }
            result.get(nearestId).add(poi);
            LOG.debug("Noise POI '{}' assigned to cluster {} ({} km from its center).",
                    poi.name, nearestId, String.format("%.2f", nearestDistanceKm));
        }
        return result;
    }

}

package com.travelagent.poi.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.travelagent.poi.common.GeometryUtils;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Pulls latitude and longitude out of the loosely typed location field of POI records. Recognized shapes are:
 * <ul>
 *     <li>a GeoJSON point, <code>{"type": "Point", "coordinates": [lng, lat]}</code></li>
 *     <li>a bare <code>[lng, lat]</code> array</li>
 *     <li>a keyed object, <code>{"latitude": lat, "longitude": lng}</code> or <code>{"lat": lat, "lng": lng}</code></li>
 * </ul>
 * Values must be JSON numbers (numeric strings are rejected) and lie within WGS84 range.
 * A record that fails any of these checks is unlocated. That is never an error here: the record is left out of
 * spatial operations and the caller decides what to do with it.
 */
public abstract class CoordinateExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(CoordinateExtractor.class);

    /**
     * @return the location of the POI as a JTS coordinate (x = longitude, y = latitude), or null if the record has
     *         no valid location.
     */
    public static Coordinate extract (PoiRecord poi) {
        if (poi == null) return null;
        JsonNode location = poi.location;
        if (location == null || location.isNull() || location.isMissingNode()) return null;

        JsonNode latNode;
        JsonNode lonNode;
        JsonNode pair = location.isArray() ? location : location.get("coordinates");
        if (pair != null) {
            if (!pair.isArray() || pair.size() < 2) return null;
            lonNode = pair.get(0);
            latNode = pair.get(1);
        } else if (location.isObject()) {
            latNode = firstPresent(location, "latitude", "lat");
            lonNode = firstPresent(location, "longitude", "lng", "lon");
        } else {
            return null;
        }
        if (latNode == null || lonNode == null || !latNode.isNumber() || !lonNode.isNumber()) return null;

        double lat = latNode.doubleValue();
        double lon = lonNode.doubleValue();
        if (!GeometryUtils.isValidLat(lat) || !GeometryUtils.isValidLon(lon)) return null;
        return new Coordinate(lon, lat);
    }

    private static JsonNode firstPresent (JsonNode object, String... keys) {
        for (String key : keys) {
            JsonNode value = object.get(key);
            if (value != null && !value.isNull()) return value;
        }
        return null;
    }

    /**
     * Extract coordinates from every POI in the list, producing dense coordinate arrays for the located ones along
     * with their positions in the input list.
     */
    public static LocatedPois extractAll (List<PoiRecord> pois) {
        int n = pois.size();
        double[] lats = new double[n];
        double[] lons = new double[n];
        int[] sourceIndexes = new int[n];
        int nLocated = 0;
        for (int i = 0; i < n; i++) {
            Coordinate coordinate = extract(pois.get(i));
            if (coordinate == null) {
                LOG.debug("POI {} has no valid location, excluding it from spatial operations.", pois.get(i));
                continue;
            }
            lats[nLocated] = coordinate.y;
            lons[nLocated] = coordinate.x;
            sourceIndexes[nLocated] = i;
            nLocated += 1;
        }
        if (nLocated == 0 && n > 0) {
            LOG.warn("None of the {} POIs have valid coordinates.", n);
        }
        return new LocatedPois(pois, lats, lons, sourceIndexes, nLocated);
    }

}

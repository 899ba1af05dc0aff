package com.travelagent.poi.dedupe;

import com.google.common.base.Strings;
import com.travelagent.poi.common.GeometryUtils;
import com.travelagent.poi.model.CoordinateExtractor;
import com.travelagent.poi.model.PoiRecord;
import org.locationtech.jts.geom.Coordinate;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Decides whether two POI records describe the same physical place.
 *
 * The primary test is equality of dedupe keys. Because the key embeds a geohash cell, two reports of one place a few
 * meters apart can still land in neighboring cells and get different keys. So as a fallback, two records whose names
 * normalize identically and whose locations are closer than a threshold distance (150 m by default, about one cell
 * at precision 7) are also duplicates.
 */
public class DuplicateMatcher {

    public static final double DEFAULT_DISTANCE_THRESHOLD_M = 150;

    public interface Config {
        double duplicateDistanceMeters ();
    }

    private final DedupeKeyGenerator keyGenerator;

    private final double thresholdKm;

    public DuplicateMatcher (DedupeKeyGenerator keyGenerator, Config config) {
        double thresholdMeters = config.duplicateDistanceMeters();
        checkArgument(Double.isFinite(thresholdMeters) && thresholdMeters >= 0, "Distance threshold must be non-negative.");
        this.keyGenerator = keyGenerator;
        this.thresholdKm = thresholdMeters / 1000;
    }

    public DuplicateMatcher () {
        this(new DedupeKeyGenerator(), () -> DEFAULT_DISTANCE_THRESHOLD_M);
    }

    /**
     * The key to compare a record by: its stored dedupe key if it has one, otherwise one generated from its name and
     * location. Null if the record has no key and either no valid location or no usable name.
     */
    public String effectiveKey (PoiRecord poi) {
        if (!Strings.isNullOrEmpty(poi.dedupeKey)) return poi.dedupeKey;
        return keyGenerator.generate(poi);
    }

    public boolean areDuplicates (PoiRecord a, PoiRecord b) {
        String keyA = effectiveKey(a);
        if (keyA != null && keyA.equals(effectiveKey(b))) {
            return true;
        }
        String nameA = NameNormalizer.normalize(a.name);
        if (nameA.isEmpty() || !nameA.equals(NameNormalizer.normalize(b.name))) {
            return false;
        }
        Coordinate locationA = CoordinateExtractor.extract(a);
        Coordinate locationB = CoordinateExtractor.extract(b);
        if (locationA == null || locationB == null) {
            return false;
        }
        return GeometryUtils.haversineKm(locationA, locationB) < thresholdKm;
    }

}

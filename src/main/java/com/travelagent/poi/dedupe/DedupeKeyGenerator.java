package com.travelagent.poi.dedupe;

import com.travelagent.poi.model.CoordinateExtractor;
import com.travelagent.poi.model.PoiRecord;
import org.locationtech.jts.geom.Coordinate;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Builds the identity key under which a POI is stored: the compact normalized name, an underscore, and the geohash
 * of its location, for example "mykhebeach_w6ugr4s". Two providers reporting the same place with the same name
 * (up to accents, case and punctuation) inside the same geohash cell produce the same key.
 *
 * The precision trades two failure modes against each other. At 8 (about 38 m) the small coordinate differences
 * between providers often split one place into two keys. At 5 or 6 (kilometer scale) unrelated places with generic
 * names like "Central Market" start to collide. 7 (about 150 m) is the default.
 *
 * Keys are computed once when a POI is ingested and then treated as immutable. They are not recomputed from stored
 * coordinates, which may have been corrected since.
 */
public class DedupeKeyGenerator {

    public static final int DEFAULT_PRECISION = 7;

    public interface Config {
        int dedupePrecision ();
    }

    private final int precision;

    public DedupeKeyGenerator (Config config) {
        this.precision = config.dedupePrecision();
        checkArgument(precision >= 1 && precision <= Geohash.MAX_PRECISION, "Dedupe precision must be in [1, 12].");
    }

    public DedupeKeyGenerator () {
        this(() -> DEFAULT_PRECISION);
    }

    public int getPrecision () {
        return precision;
    }

    public static String generateDedupeKey (String name, double lat, double lon, int precision) {
        return NameNormalizer.compact(name) + "_" + Geohash.encode(lat, lon, precision);
    }

    public static String generateDedupeKey (String name, double lat, double lon) {
        return generateDedupeKey(name, lat, lon, DEFAULT_PRECISION);
    }

    /** Key at this generator's configured precision. */
    public String generate (String name, double lat, double lon) {
        return generateDedupeKey(name, lat, lon, precision);
    }

    /**
     * @return the key for the POI's current name and location, or null if it has no valid location or its name
     *         normalizes to nothing.
     */
    public String generate (PoiRecord poi) {
        Coordinate coordinate = CoordinateExtractor.extract(poi);
        if (coordinate == null) return null;
        if (NameNormalizer.normalize(poi.name).isEmpty()) return null;
        return generate(poi.name, coordinate.y, coordinate.x);
    }

}

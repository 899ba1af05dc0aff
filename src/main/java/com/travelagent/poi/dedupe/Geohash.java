package com.travelagent.poi.dedupe;

import com.travelagent.poi.common.GeometryUtils;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Geohash encoding of WGS84 coordinates (http://geohash.org). The world is halved alternately in longitude and
 * latitude, one bit per halving starting with longitude, and each group of five bits becomes one base-32 character.
 * Nearby points usually share a prefix, but two points a few meters apart can still fall on either side of a cell
 * boundary and have no common prefix at all.
 *
 * Approximate cell size by precision: 5 is 4.9 x 4.9 km, 6 is 1.2 x 0.6 km, 7 is 153 x 153 m, 8 is 38 x 19 m.
 */
public abstract class Geohash {

    private static final char[] BASE32 = "0123456789bcdefghjkmnpqrstuvwxyz".toCharArray();

    public static final int MAX_PRECISION = 12;

    public static String encode (double lat, double lon, int precision) {
        checkArgument(precision >= 1 && precision <= MAX_PRECISION, "Geohash precision must be in [1, 12].");
        checkArgument(GeometryUtils.isValidLat(lat) && GeometryUtils.isValidLon(lon), "Coordinates out of range.");
        double minLat = -90;
        double maxLat = 90;
        double minLon = -180;
        double maxLon = 180;
        StringBuilder geohash = new StringBuilder(precision);
        boolean lonBit = true;
        int nBits = 0;
        int character = 0;
        while (geohash.length() < precision) {
            if (lonBit) {
                double mid = (minLon + maxLon) / 2;
                if (lon >= mid) {
                    character = (character << 1) | 1;
                    minLon = mid;
                } else {
                    character = character << 1;
                    maxLon = mid;
                }
            } else {
                double mid = (minLat + maxLat) / 2;
                if (lat >= mid) {
                    character = (character << 1) | 1;
                    minLat = mid;
                } else {
                    character = character << 1;
                    maxLat = mid;
                }
            }
            lonBit = !lonBit;
            if (++nBits == 5) {
                geohash.append(BASE32[character]);
                nBits = 0;
                character = 0;
            }
        }
        return geohash.toString();
    }

}

package com.travelagent.poi.dedupe;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GeohashTest {

    @Test
    public void testKnownValues () {
        // The example from the original geohash.org announcement.
        assertEquals("u4pruydqqvj", Geohash.encode(57.64911, 10.40744, 11));
        assertEquals("u4pruyd", Geohash.encode(57.64911, 10.40744, 7));
        assertEquals("w6ugr4s", Geohash.encode(16.0544, 108.2428, 7));
        assertEquals("w6jtsyd", Geohash.encode(12.2528, 109.1967, 7));
    }

    @Test
    public void testPrefixProperty () {
        String full = Geohash.encode(16.0544, 108.2428, 12);
        assertEquals(12, full.length());
        for (int precision = 1; precision < 12; precision++) {
            assertEquals(full.substring(0, precision), Geohash.encode(16.0544, 108.2428, precision));
        }
    }

    @Test
    public void testBoundaries () {
        // Values on a cell boundary go to the upper cell.
        assertEquals("s000000", Geohash.encode(0, 0, 7));
        assertTrue(Geohash.encode(90, 180, 5).equals("zzzzz"));
        assertEquals("00000", Geohash.encode(-90, -180, 5));
    }

    @Test
    public void testIllegalArguments () {
        assertThrows(IllegalArgumentException.class, () -> Geohash.encode(0, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> Geohash.encode(0, 0, 13));
        assertThrows(IllegalArgumentException.class, () -> Geohash.encode(91, 0, 7));
        assertThrows(IllegalArgumentException.class, () -> Geohash.encode(0, Double.NaN, 7));
    }

}

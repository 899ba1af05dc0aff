package com.travelagent.poi.clustering.density;

import com.travelagent.poi.common.GeometryUtils;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class HaversineDistanceTest {

    @Test
    public void testLatLonOrder () {
        double[] daNang = { 16.0544, 108.2428 };
        double[] hanoi = { 21.0285, 105.8542 };
        double expected = GeometryUtils.haversineKm(16.0544, 108.2428, 21.0285, 105.8542);
        assertEquals(expected, HaversineDistance.INSTANCE.compute(daNang, hanoi), 1e-12);
        assertEquals(expected, HaversineDistance.INSTANCE.compute(hanoi, daNang), 1e-9);
    }

    @Test
    public void testAcrossAntimeridian () {
        double[] east = { 0, 179.9999 };
        double[] west = { 0, -179.9999 };
        assertEquals(0.0222, HaversineDistance.INSTANCE.compute(east, west), 1e-4);
    }

    @Test
    public void testWrongDimension () {
        assertThrows(DimensionMismatchException.class,
                () -> HaversineDistance.INSTANCE.compute(new double[] { 1, 2, 3 }, new double[] { 1, 2 }));
    }

}

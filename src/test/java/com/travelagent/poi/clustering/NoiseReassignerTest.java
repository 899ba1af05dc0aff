package com.travelagent.poi.clustering;

import com.travelagent.poi.TestPois;
import com.travelagent.poi.model.PoiRecord;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import static com.travelagent.poi.TestPois.poi;
import static com.travelagent.poi.TestPois.unlocated;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class NoiseReassignerTest {

    private static SortedMap<Integer, List<PoiRecord>> daNangAndHue () {
        SortedMap<Integer, List<PoiRecord>> clusters = new TreeMap<>();
        clusters.put(1, TestPois.daNang());
        clusters.put(2, TestPois.hue());
        return clusters;
    }

    @Test
    public void testNoiseGoesToNearestCenter () {
        PoiRecord hoiAn = poi("Hoi An", 15.8801, 108.3259);
        PoiRecord hanoi = poi("Hanoi", 21.0285, 105.8542);
        SortedMap<Integer, List<PoiRecord>> result =
                NoiseReassigner.assignToNearest(daNangAndHue(), Arrays.asList(hoiAn, hanoi));
        assertEquals(6, result.get(1).size());
        assertEquals(6, result.get(2).size());
        assertTrue(result.get(1).contains(hoiAn));
        assertTrue(result.get(2).contains(hanoi));
    }

    @Test
    public void testOrderOfNoiseDoesNotMatter () {
        PoiRecord hoiAn = poi("Hoi An", 15.8801, 108.3259);
        PoiRecord laoBao = poi("Lao Bao", 16.6167, 106.6167);
        SortedMap<Integer, List<PoiRecord>> forward =
                NoiseReassigner.assignToNearest(daNangAndHue(), Arrays.asList(hoiAn, laoBao));
        SortedMap<Integer, List<PoiRecord>> backward =
                NoiseReassigner.assignToNearest(daNangAndHue(), Arrays.asList(laoBao, hoiAn));
        assertEquals(forward.get(1).size(), backward.get(1).size());
        assertEquals(forward.get(2).size(), backward.get(2).size());
        assertTrue(forward.get(2).contains(laoBao));
        assertTrue(backward.get(2).contains(laoBao));
    }

    @Test
    public void testUnlocatedNoiseGoesToLowestId () {
        PoiRecord lost = unlocated("lost");
        SortedMap<Integer, List<PoiRecord>> result =
                NoiseReassigner.assignToNearest(daNangAndHue(), Collections.singletonList(lost));
        assertTrue(result.get(1).contains(lost));
    }

    @Test
    public void testNoClustersIsAnError () {
        assertThrows(IllegalArgumentException.class, () -> NoiseReassigner.assignToNearest(
                new TreeMap<>(), Collections.singletonList(poi("x", 1, 1))));
    }

    @Test
    public void testClusterCenter () {
        Coordinate center = PoiClustering.clusterCenter(Arrays.asList(poi("a", 10, 100), poi("b", 12, 104), unlocated("c")));
        assertEquals(11, center.y, 1e-12);
        assertEquals(102, center.x, 1e-12);
        assertNull(PoiClustering.clusterCenter(Collections.singletonList(unlocated("c"))));
        assertNull(PoiClustering.clusterCenter(Collections.emptyList()));
    }

}

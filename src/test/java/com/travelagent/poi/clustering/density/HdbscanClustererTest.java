package com.travelagent.poi.clustering.density;

import com.travelagent.poi.TestPois;
import com.travelagent.poi.model.CoordinateExtractor;
import com.travelagent.poi.model.LocatedPois;
import com.travelagent.poi.model.PoiRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.travelagent.poi.TestPois.poi;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class HdbscanClustererTest {

    private static LocatedPois locate (List<PoiRecord> pois) {
        return CoordinateExtractor.extractAll(pois);
    }

    @Test
    public void testTwoSeparatedGroups () {
        List<PoiRecord> pois = new ArrayList<>(TestPois.daNang());
        pois.addAll(TestPois.hue());
        int[] labels = new HdbscanClusterer(3, 2).cluster(locate(pois));
        assertArrayEquals(new int[] { 0, 0, 0, 0, 0, 1, 1, 1, 1, 1 }, labels);
    }

    @Test
    public void testDistantPointIsNoise () {
        List<PoiRecord> pois = new ArrayList<>(TestPois.daNang());
        pois.addAll(TestPois.hue());
        pois.add(poi("Hanoi", 21.0285, 105.8542));
        int[] labels = new HdbscanClusterer(3, 2).cluster(locate(pois));
        assertArrayEquals(new int[] { 0, 0, 0, 0, 0, 1, 1, 1, 1, 1, HdbscanClusterer.NOISE }, labels);
    }

    @Test
    public void testSingleDenseGroupIsNotACluster () {
        // The root of the cluster tree is never selected, so one group on its own yields no clusters.
        int[] labels = new HdbscanClusterer(3, 2).cluster(locate(TestPois.daNang()));
        for (int label : labels) {
            assertEquals(HdbscanClusterer.NOISE, label);
        }
    }

    @Test
    public void testFewerPointsThanMinimumClusterSize () {
        int[] labels = new HdbscanClusterer(5, 2).cluster(locate(TestPois.daNang().subList(0, 4)));
        assertArrayEquals(new int[] { -1, -1, -1, -1 }, labels);
    }

    @Test
    public void testCoincidentPoints () {
        // Identical coordinates must not produce infinite or NaN stabilities.
        List<PoiRecord> pois = new ArrayList<>();
        for (int i = 0; i < 4; i++) pois.add(poi("a" + i, 10, 100));
        for (int i = 0; i < 4; i++) pois.add(poi("b" + i, 11, 101));
        int[] labels = new HdbscanClusterer(3, 2).cluster(locate(pois));
        assertArrayEquals(new int[] { 0, 0, 0, 0, 1, 1, 1, 1 }, labels);
    }

    @Test
    public void testDeterministic () {
        List<PoiRecord> pois = TestPois.grid(25, 0.01);
        pois.addAll(TestPois.hue());
        HdbscanClusterer clusterer = new HdbscanClusterer(4, 3);
        assertArrayEquals(clusterer.cluster(locate(pois)), clusterer.cluster(locate(pois)));
    }

    @Test
    public void testCoreDistancesExcludeSelf () {
        double[][] distances = {
                { 0, 1, 4 },
                { 1, 0, 2 },
                { 4, 2, 0 }
        };
        // One sample is the nearest other point, never the zero distance to the point itself.
        assertArrayEquals(new double[] { 1, 1, 2 }, HdbscanClusterer.coreDistances(distances, 1), 0);
        assertArrayEquals(new double[] { 4, 2, 4 }, HdbscanClusterer.coreDistances(distances, 2), 0);
        // More samples than other points falls back to the farthest point.
        assertArrayEquals(new double[] { 4, 2, 4 }, HdbscanClusterer.coreDistances(distances, 3), 0);
        assertArrayEquals(new double[] { 4, 2, 4 }, HdbscanClusterer.coreDistances(distances, 10), 0);
    }

    /** Two triples of POIs about 80 m apart, and one POI 30 km to the north. */
    private static List<PoiRecord> twoTriplesAndOutlier () {
        return new ArrayList<>(Arrays.asList(
                poi("a0", 16.0544, 108.2428),
                poi("a1", 16.0546, 108.2428),
                poi("a2", 16.0544, 108.2430),
                poi("b0", 16.0546, 108.24375),
                poi("b1", 16.0544, 108.24375),
                poi("b2", 16.0545, 108.24395),
                poi("far", 16.3244, 108.2428)
        ));
    }

    @Test
    public void testWithoutEpsilonCloseTriplesSplit () {
        int[] labels = new HdbscanClusterer(3, 2).cluster(locate(twoTriplesAndOutlier()));
        assertArrayEquals(new int[] { 0, 0, 0, 1, 1, 1, HdbscanClusterer.NOISE }, labels);
    }

    @Test
    public void testEpsilonKeepsCloseTriplesTogether () {
        int[] labels = new HdbscanClusterer(3, 2, 0.5).cluster(locate(twoTriplesAndOutlier()));
        // The outlier left the root far beyond epsilon, so it stays noise.
        assertArrayEquals(new int[] { 0, 0, 0, 0, 0, 0, HdbscanClusterer.NOISE }, labels);

        List<PoiRecord> triples = twoTriplesAndOutlier().subList(0, 6);
        assertArrayEquals(new int[] { 0, 0, 0, 0, 0, 0 }, new HdbscanClusterer(3, 2, 0.5).cluster(locate(triples)));
    }

    @Test
    public void testEpsilonLeavesDistantClustersApart () {
        List<PoiRecord> pois = new ArrayList<>(TestPois.daNang());
        pois.addAll(TestPois.hue());
        pois.add(poi("Hanoi", 21.0285, 105.8542));
        int[] labels = new HdbscanClusterer(3, 2, 0.5).cluster(locate(pois));
        assertArrayEquals(new int[] { 0, 0, 0, 0, 0, 1, 1, 1, 1, 1, HdbscanClusterer.NOISE }, labels);
    }

    @Test
    public void testMinimumSpanningTreeUsesMutualReachability () {
        double[][] distances = {
                { 0, 1, 4 },
                { 1, 0, 2 },
                { 4, 2, 0 }
        };
        double[] core = { 1, 1, 3 };
        double[][] edges = HdbscanClusterer.minimumSpanningTree(distances, core);
        assertEquals(2, edges.length);
        // 0-1 at max(1, 1, 1) = 1, then 1-2 at max(1, 3, 2) = 3.
        assertArrayEquals(new double[] { 0, 1, 1 }, edges[0], 0);
        assertArrayEquals(new double[] { 1, 2, 3 }, edges[1], 0);

        HdbscanClusterer.SingleLinkageTree tree = HdbscanClusterer.singleLinkage(edges, 3);
        assertEquals(4, tree.root());
        assertEquals(3, tree.sizeOf(tree.root()));
        assertEquals(3, tree.distance[1], 0);
    }

    @Test
    public void testIllegalParameters () {
        assertThrows(IllegalArgumentException.class, () -> new HdbscanClusterer(1, 2));
        assertThrows(IllegalArgumentException.class, () -> new HdbscanClusterer(3, 0));
        assertThrows(IllegalArgumentException.class, () -> new HdbscanClusterer(3, 2, -1));
        assertThrows(IllegalArgumentException.class, () -> new HdbscanClusterer(3, 2, Double.NaN));
    }

}

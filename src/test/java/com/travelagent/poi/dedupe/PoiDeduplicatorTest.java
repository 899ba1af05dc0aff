package com.travelagent.poi.dedupe;

import com.travelagent.poi.model.PoiRecord;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.travelagent.poi.TestPois.poi;
import static com.travelagent.poi.TestPois.unlocated;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

public class PoiDeduplicatorTest {

    private final PoiDeduplicator deduplicator = new PoiDeduplicator();

    @Test
    public void testWithIdentity () {
        PoiRecord poi = poi("Mỹ Khê Beach", 16.0544, 108.2428);
        PoiRecord identified = deduplicator.withIdentity(poi);
        assertNotSame(poi, identified);
        assertEquals("mykhebeach_w6ugr4s", identified.dedupeKey);
        assertEquals("poi_mykhebeach_w6ugr4s", identified.poiId);
        assertSame(poi.location, identified.location);
        // The input is left alone.
        assertNull(poi.dedupeKey);
        assertNull(poi.poiId);
    }

    @Test
    public void testWithIdentityKeepsExistingFields () {
        PoiRecord poi = poi("Mỹ Khê Beach", 16.0544, 108.2428);
        poi.poiId = "google:ChIJ123";
        poi.dedupeKey = "mykhebeach_w6ugr4t";
        PoiRecord identified = deduplicator.withIdentity(poi);
        assertEquals("google:ChIJ123", identified.poiId);
        assertEquals("mykhebeach_w6ugr4t", identified.dedupeKey);
    }

    @Test
    public void testWithIdentityUnlocated () {
        PoiRecord identified = deduplicator.withIdentity(unlocated("Somewhere"));
        assertNull(identified.dedupeKey);
        assertNull(identified.poiId);
    }

    @Test
    public void testUnnamedPoisKeepSeparateIdentities () {
        PoiRecord bench = deduplicator.withIdentity(poi(null, 16.0544, 108.2428));
        PoiRecord kiosk = deduplicator.withIdentity(poi("", 16.0544, 108.2428));
        assertNull(bench.dedupeKey);
        assertNull(bench.poiId);
        assertEquals(Arrays.asList(bench, kiosk), deduplicator.deduplicate(Arrays.asList(bench, kiosk)));
    }

    @Test
    public void testDeduplicateKeepsFirstOccurrence () {
        PoiRecord first = poi("Mỹ Khê Beach", 16.0544, 108.2428);
        PoiRecord other = poi("Dragon Bridge", 16.0610, 108.2272);
        PoiRecord repeat = poi("My Khe Beach", 16.0545, 108.2429);
        PoiRecord lost = unlocated("My Khe Beach");
        List<PoiRecord> result = deduplicator.deduplicate(Arrays.asList(first, other, repeat, lost));
        assertEquals(Arrays.asList(first, other, lost), result);
    }

    @Test
    public void testMergePrefersCached () {
        PoiRecord cached = deduplicator.withIdentity(poi("Mỹ Khê Beach", 16.0544, 108.2428));
        cached.setAttribute("rating", 4.7);
        PoiRecord freshRepeat = poi("My Khe Beach", 16.0545, 108.2429);
        PoiRecord freshNew = poi("Marble Mountains", 16.0034, 108.2636);
        PoiRecord freshNewAgain = poi("Marble Mountains", 16.0034, 108.2636);

        List<PoiRecord> merged = deduplicator.merge(
                Collections.singletonList(cached),
                Arrays.asList(freshRepeat, freshNew, freshNewAgain));
        assertEquals(Arrays.asList(cached, freshNew), merged);
    }

    @Test
    public void testMergeEmpty () {
        assertEquals(Collections.emptyList(), deduplicator.merge(Collections.emptyList(), Collections.emptyList()));
        PoiRecord poi = poi("Dragon Bridge", 16.0610, 108.2272);
        assertEquals(Collections.singletonList(poi), deduplicator.merge(Collections.emptyList(), Collections.singletonList(poi)));
    }

}

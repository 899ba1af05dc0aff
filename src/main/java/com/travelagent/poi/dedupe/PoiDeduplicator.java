package com.travelagent.poi.dedupe;

import com.travelagent.poi.model.PoiRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Identity handling for POIs on their way into storage: filling in identity fields on freshly fetched records and
 * dropping records that describe places already present.
 *
 * Comparison is pairwise, so removing duplicates from N records is O(N^2) duplicate checks. That is fine for the
 * result sizes returned by a places search.
 */
public class PoiDeduplicator {

    private static final Logger LOG = LoggerFactory.getLogger(PoiDeduplicator.class);

    public static final String POI_ID_PREFIX = "poi_";

    private final DedupeKeyGenerator keyGenerator;

    private final DuplicateMatcher matcher;

    public PoiDeduplicator (DedupeKeyGenerator keyGenerator, DuplicateMatcher matcher) {
        this.keyGenerator = keyGenerator;
        this.matcher = matcher;
    }

    public PoiDeduplicator () {
        this(new DedupeKeyGenerator(), new DuplicateMatcher());
    }

    /**
     * Return a copy of the record with its identity filled in. A missing dedupe key is generated from the name and
     * location (if the location is valid) and a missing poi_id defaults to "poi_" followed by the dedupe key.
     * Fields that are already set are kept as they are. The argument is not modified.
     */
    public PoiRecord withIdentity (PoiRecord poi) {
        PoiRecord result = poi.copy();
        if (result.dedupeKey == null || result.dedupeKey.isEmpty()) {
            result.dedupeKey = keyGenerator.generate(poi);
        }
        if ((result.poiId == null || result.poiId.isEmpty()) && result.dedupeKey != null) {
            result.poiId = POI_ID_PREFIX + result.dedupeKey;
        }
        return result;
    }

    /** Remove later records that duplicate an earlier one, keeping input order. */
    public List<PoiRecord> deduplicate (List<PoiRecord> pois) {
        return appendUnique(new ArrayList<>(pois.size()), pois);
    }

    /**
     * Merge previously stored results with freshly fetched ones. Stored records come first and win over fresh
     * records describing the same place, since they have usually been enriched by several earlier fetches.
     */
    public List<PoiRecord> merge (List<PoiRecord> cached, List<PoiRecord> fresh) {
        List<PoiRecord> merged = deduplicate(cached);
        return appendUnique(merged, fresh);
    }

    private List<PoiRecord> appendUnique (List<PoiRecord> kept, List<PoiRecord> candidates) {
        int dropped = 0;
        for (PoiRecord candidate : candidates) {
            boolean duplicate = false;
            for (PoiRecord existing : kept) {
                if (matcher.areDuplicates(existing, candidate)) {
                    LOG.debug("{} duplicates {}, dropping it.", candidate, existing);
                    duplicate = true;
                    break;
                }
            }
            if (duplicate) {
                dropped += 1;
            } else {
                kept.add(candidate);
            }
        }
        if (dropped > 0) {
            LOG.info("Dropped {} duplicate POIs out of {}.", dropped, candidates.size());
        }
        return kept;
    }

}

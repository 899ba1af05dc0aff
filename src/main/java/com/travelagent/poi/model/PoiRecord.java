package com.travelagent.poi.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A point of interest as delivered by the ingestion or storage layer. Only the identity, name and location are
 * interpreted here. The location is deliberately kept as a loosely typed JSON value because providers disagree on
 * its shape: GeoJSON points carry [lng, lat] arrays while others use keyed latitude/longitude objects. Everything
 * else the provider sent is carried along untouched in the attributes map so it can be handed back to the caller.
 *
 * Clustering never modifies these records. The same instances that go in come back out, grouped.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PoiRecord {

    @JsonProperty("poi_id")
    public String poiId;

    /** Identity key computed at ingestion time. Null until assigned. */
    @JsonProperty("dedupe_key")
    public String dedupeKey;

    public String name;

    /** GeoJSON point, bare [lng, lat] array, or {latitude, longitude} object. May be null or malformed. */
    public JsonNode location;

    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public PoiRecord () { }

    public PoiRecord (String poiId, String name, JsonNode location) {
        this.poiId = poiId;
        this.name = name;
        this.location = location;
    }

    @JsonAnyGetter
    public Map<String, Object> getAttributes () {
        return attributes;
    }

    @JsonAnySetter
    public void setAttribute (String key, Object value) {
        attributes.put(key, value);
    }

    /** Shallow copy: the location node and attribute values are shared, which is fine as they are never mutated. */
    public PoiRecord copy () {
        PoiRecord copy = new PoiRecord(poiId, name, location);
        copy.dedupeKey = dedupeKey;
        copy.attributes.putAll(attributes);
        return copy;
    }

    @Override
    public String toString () {
        return String.format("PoiRecord(%s, '%s')", poiId, name);
    }

}

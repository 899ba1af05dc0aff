package com.travelagent.poi.common;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A library containing static methods for working with JSON.
 */
public abstract class JsonUtilities {

    /**
     * POI records come from many providers and carry fields we don't model. Those are captured by the any-setter on
     * PoiRecord rather than rejected, so this mapper never fails on unknown properties.
     */
    public static final ObjectMapper objectMapper = createBaseObjectMapper();

    private static ObjectMapper createBaseObjectMapper () {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        objectMapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        objectMapper.configure(JsonParser.Feature.ALLOW_COMMENTS, true);
        return objectMapper;
    }

    /** Represent the supplied object as a JSON string. */
    public static String objectToJsonString (Object object) {
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new RuntimeException(e);
        }
    }

    /** A GeoJSON point. Note the GeoJSON axis order: longitude first. */
    public static JsonNode geoJsonPoint (double lat, double lon) {
        ObjectNode point = JsonNodeFactory.instance.objectNode();
        point.put("type", "Point");
        ArrayNode coordinates = point.putArray("coordinates");
        coordinates.add(lon);
        coordinates.add(lat);
        return point;
    }

    /** The keyed location form used by some providers and by request payloads. */
    public static JsonNode latLonObject (double lat, double lon) {
        ObjectNode location = JsonNodeFactory.instance.objectNode();
        location.put("latitude", lat);
        location.put("longitude", lon);
        return location;
    }

}

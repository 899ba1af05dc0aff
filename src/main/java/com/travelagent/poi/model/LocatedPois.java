package com.travelagent.poi.model;

import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The located subset of a list of POIs, as parallel arrays. Point i of this set has latitude lats[i] and
 * longitude lons[i] and is the record at sourceIndexes[i] in the original list. Points keep their input order.
 */
public class LocatedPois {

    /** The full input list, including unlocated records. */
    private final List<PoiRecord> source;

    private final double[] lats;

    private final double[] lons;

    private final int[] sourceIndexes;

    LocatedPois (List<PoiRecord> source, double[] lats, double[] lons, int[] sourceIndexes, int size) {
        this.source = source;
        this.lats = Arrays.copyOf(lats, size);
        this.lons = Arrays.copyOf(lons, size);
        this.sourceIndexes = Arrays.copyOf(sourceIndexes, size);
    }

    /** The number of located points. */
    public int size () {
        return lats.length;
    }

    public boolean isEmpty () {
        return lats.length == 0;
    }

    public double lat (int i) {
        return lats[i];
    }

    public double lon (int i) {
        return lons[i];
    }

    public Coordinate coordinate (int i) {
        return new Coordinate(lons[i], lats[i]);
    }

    public int sourceIndex (int i) {
        return sourceIndexes[i];
    }

    /** The record for located point i. */
    public PoiRecord poi (int i) {
        return source.get(sourceIndexes[i]);
    }

    public List<PoiRecord> source () {
        return source;
    }

    /** Records that were excluded from spatial operations, in input order. */
    public List<PoiRecord> unlocated () {
        List<PoiRecord> unlocated = new ArrayList<>(source.size() - size());
        int next = 0;
        for (int i = 0; i < source.size(); i++) {
            if (next < sourceIndexes.length && sourceIndexes[next] == i) {
                next += 1;
            } else {
                unlocated.add(source.get(i));
            }
        }
        return unlocated;
    }

}

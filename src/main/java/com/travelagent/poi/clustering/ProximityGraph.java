package com.travelagent.poi.clustering;

import com.travelagent.poi.common.GeometryUtils;
import com.travelagent.poi.common.SphericalDistanceLibrary;
import com.travelagent.poi.model.LocatedPois;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Undirected graph connecting every pair of located POIs that lie within a given radius of one another.
 * Vertices are the indexes of points in a LocatedPois set.
 *
 * Distances are measured in degree space: the radius in kilometers is converted with a flat 111 km per degree and
 * compared against the Euclidean distance between (lat, lon) pairs. This ignores the convergence of meridians, which
 * overstates east-west distances away from the equator, but the radius settings in use were tuned with exactly this
 * measure.
 *
 * Construction compares all pairs and is O(N^2). That is fine for the tens to low hundreds of POIs considered for
 * a single trip, and is a real limit for anything larger.
 */
public class ProximityGraph {

    public final double radiusKm;

    private final TIntList[] adjacency;

    private int edgeCount = 0;

    private ProximityGraph (int nVertices, double radiusKm) {
        this.radiusKm = radiusKm;
        this.adjacency = new TIntList[nVertices];
        for (int i = 0; i < nVertices; i++) {
            adjacency[i] = new TIntArrayList();
        }
    }

    public static ProximityGraph build (LocatedPois located, double radiusKm) {
        checkArgument(Double.isFinite(radiusKm) && radiusKm > 0, "Clustering radius must be a positive number of km.");
        ProximityGraph graph = new ProximityGraph(located.size(), radiusKm);
        double radiusDegrees = SphericalDistanceLibrary.kmToPlanarDegrees(radiusKm);
        for (int i = 0; i < located.size(); i++) {
            for (int j = i + 1; j < located.size(); j++) {
                double distance = GeometryUtils.planarDegrees(located.lat(i), located.lon(i), located.lat(j), located.lon(j));
                if (distance <= radiusDegrees) {
                    graph.addEdge(i, j);
                }
            }
        }
        return graph;
    }

    private void addEdge (int a, int b) {
        adjacency[a].add(b);
        adjacency[b].add(a);
        edgeCount += 1;
    }

    public int getVertexCount () {
        return adjacency.length;
    }

    public int getEdgeCount () {
        return edgeCount;
    }

    /** Neighbors of the given vertex in ascending index order. Do not modify the returned list. */
    public TIntList neighbors (int vertex) {
        return adjacency[vertex];
    }

    public boolean hasEdge (int a, int b) {
        return adjacency[a].contains(b);
    }

}

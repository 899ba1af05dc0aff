package com.travelagent.poi.clustering;

import gnu.trove.iterator.TIntIterator;
import gnu.trove.list.array.TIntArrayList;

import java.util.Arrays;

/**
 * Labels the connected components of a proximity graph with a breadth-first flood fill.
 *
 * Vertices are visited in index order. Each vertex not yet labeled starts a new component, so component IDs increase
 * from 1 in order of their lowest vertex. Vertices without edges become components of their own.
 */
public abstract class ConnectedComponentClusterer {

    /** Label value for vertices not yet reached. No vertex carries it once labeling completes. */
    private static final int UNLABELED = 0;

    /**
     * @return an array holding the 1-based component ID of each vertex in the graph.
     */
    public static int[] label (ProximityGraph graph) {
        int nVertices = graph.getVertexCount();
        int[] labels = new int[nVertices];
        Arrays.fill(labels, UNLABELED);
        // An array list used as a FIFO queue: the head index advances instead of removing elements.
        TIntArrayList queue = new TIntArrayList();
        int nextLabel = 1;
        for (int source = 0; source < nVertices; source++) {
            if (labels[source] != UNLABELED) continue;
            int label = nextLabel++;
            labels[source] = label;
            queue.resetQuick();
            queue.add(source);
            for (int head = 0; head < queue.size(); head++) {
                int vertex = queue.get(head);
                for (TIntIterator it = graph.neighbors(vertex).iterator(); it.hasNext(); ) {
                    int neighbor = it.next();
                    if (labels[neighbor] == UNLABELED) {
                        labels[neighbor] = label;
                        queue.add(neighbor);
                    }
                }
            }
        }
        return labels;
    }

}

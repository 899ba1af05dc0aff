package com.travelagent.poi.clustering.density;

import com.travelagent.poi.model.LocatedPois;
import gnu.trove.list.TDoubleList;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TDoubleArrayList;
import gnu.trove.list.array.TIntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Hierarchical density-based clustering (HDBSCAN) over great-circle distances, after
 * Campello, Moulavi and Sander, "Density-Based Clustering Based on Hierarchical Density Estimates" (PAKDD 2013) and
 * McInnes and Healy, "Accelerated Hierarchical Density Based Clustering" (ICDMW 2017).
 *
 * Unlike the proximity graph this needs no radius. It finds the clusters that persist over the widest range of
 * density thresholds, so a dense old town and a sparse beach strip can both come out as clusters, and points that
 * never belong to any sufficiently large dense region are reported as noise.
 *
 * The steps are:
 * <ol>
 *     <li>The core distance of each point is the distance to its minSamples-th nearest other point. With fewer
 *     than minSamples other points it is the distance to the farthest one.</li>
 *     <li>The mutual reachability distance between two points is the largest of their two core distances and the
 *     distance between them. This pushes sparse points away from everything else.</li>
 *     <li>A minimum spanning tree of the complete mutual reachability graph is built with Prim's algorithm.</li>
 *     <li>Adding the tree edges in ascending order with a union-find yields the single linkage hierarchy.</li>
 *     <li>The hierarchy is condensed: a split where one side has fewer than minClusterSize points is not a split but
 *     points falling out of the parent cluster. Heights are expressed as lambda = 1 / distance.</li>
 *     <li>Clusters are selected by excess of mass: a cluster is kept if its stability is at least the total
 *     stability of its selected descendants. The root is not eligible here, so this step finds at least two
 *     clusters or none at all.</li>
 *     <li>If a cluster selection epsilon is set, a selected cluster that split off its parent at a distance below
 *     epsilon is replaced by its nearest ancestor that formed at or above epsilon. This ancestor may be the root,
 *     in which case all points the root holds at distances up to epsilon form a single cluster. Groups of POIs
 *     closer together than epsilon are thus never cut apart.</li>
 * </ol>
 *
 * The distance matrix and Prim's algorithm make this O(N^2) in time and memory, which is fine for trip-sized sets.
 * All tie-breaking is by index, so the same input always produces the same labels.
 */
public class HdbscanClusterer {

    private static final Logger LOG = LoggerFactory.getLogger(HdbscanClusterer.class);

    /** Label given to points that do not belong to any cluster. Cluster labels are 0, 1, 2... */
    public static final int NOISE = -1;

    /** Coincident points would give infinite lambda values and poison the stability sums, so distances are floored. */
    private static final double MIN_DISTANCE_KM = 1e-9;

    public final int minClusterSize;

    public final int minSamples;

    /** Clusters separating at distances below this are kept together. Zero disables the merging. */
    public final double clusterSelectionEpsilonKm;

    public HdbscanClusterer (int minClusterSize, int minSamples, double clusterSelectionEpsilonKm) {
        checkArgument(minClusterSize >= 2, "Minimum cluster size must be at least 2.");
        checkArgument(minSamples >= 1, "Minimum samples must be at least 1.");
        checkArgument(Double.isFinite(clusterSelectionEpsilonKm) && clusterSelectionEpsilonKm >= 0,
                "Cluster selection epsilon must be a non-negative number of km.");
        this.minClusterSize = minClusterSize;
        this.minSamples = minSamples;
        this.clusterSelectionEpsilonKm = clusterSelectionEpsilonKm;
    }

    public HdbscanClusterer (int minClusterSize, int minSamples) {
        this(minClusterSize, minSamples, 0);
    }

    /**
     * @return the cluster label of each located point, or NOISE.
     */
    public int[] cluster (LocatedPois located) {
        int n = located.size();
        int[] labels = new int[n];
        Arrays.fill(labels, NOISE);
        if (n < minClusterSize) {
            LOG.debug("Only {} points, fewer than minimum cluster size {}. All are noise.", n, minClusterSize);
            return labels;
        }
        double[][] distances = distanceMatrix(located);
        double[] coreDistances = coreDistances(distances, minSamples);
        SingleLinkageTree hierarchy = singleLinkage(minimumSpanningTree(distances, coreDistances), n);
        CondensedTree condensed = condense(hierarchy, minClusterSize);
        BitSet selected = condensed.selectClustersByExcessOfMass();
        if (clusterSelectionEpsilonKm > 0) {
            selected = condensed.mergeBelowEpsilon(selected, clusterSelectionEpsilonKm);
        }
        condensed.labelPoints(selected, labels, clusterSelectionEpsilonKm);
        int nClusters = selected.cardinality();
        LOG.debug("HDBSCAN labeled {} points with {} clusters.", n, nClusters);
        return labels;
    }

    private static double[][] distanceMatrix (LocatedPois located) {
        int n = located.size();
        List<LocatedPoint> points = LocatedPoint.wrap(located);
        double[][] distances = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double d = HaversineDistance.INSTANCE.compute(points.get(i).getPoint(), points.get(j).getPoint());
                distances[i][j] = d;
                distances[j][i] = d;
            }
        }
        return distances;
    }

    static double[] coreDistances (double[][] distances, int minSamples) {
        int n = distances.length;
        // Each sorted row starts with the point's zero distance to itself.
        int k = Math.min(minSamples, n - 1);
        double[] core = new double[n];
        for (int i = 0; i < n; i++) {
            double[] row = distances[i].clone();
            Arrays.sort(row);
            core[i] = row[k];
        }
        return core;
    }

    /**
     * Prim's algorithm on the implicit complete graph of mutual reachability distances, starting from point 0.
     * @return n-1 edges as {from, to, weight} rows in the order they were added to the tree.
     */
    static double[][] minimumSpanningTree (double[][] distances, double[] core) {
        int n = distances.length;
        boolean[] inTree = new boolean[n];
        double[] bestWeight = new double[n];
        int[] bestFrom = new int[n];
        Arrays.fill(bestWeight, Double.POSITIVE_INFINITY);
        double[][] edges = new double[n - 1][];
        int current = 0;
        inTree[0] = true;
        for (int e = 0; e < n - 1; e++) {
            int next = -1;
            for (int v = 0; v < n; v++) {
                if (inTree[v]) continue;
                double reachability = Math.max(Math.max(core[current], core[v]), distances[current][v]);
                if (reachability < bestWeight[v]) {
                    bestWeight[v] = reachability;
                    bestFrom[v] = current;
                }
                if (next < 0 || bestWeight[v] < bestWeight[next]) {
                    next = v;
                }
            }
            inTree[next] = true;
            edges[e] = new double[] { bestFrom[next], next, bestWeight[next] };
            current = next;
        }
        return edges;
    }

    /**
     * The single linkage dendrogram in the usual layout: row i describes node n + i, which merges the nodes in
     * columns left and right at the given distance and contains size points. Nodes 0..n-1 are the points.
     */
    static class SingleLinkageTree {
        final int nPoints;
        final int[] left;
        final int[] right;
        final double[] distance;
        final int[] size;

        SingleLinkageTree (int nPoints) {
            this.nPoints = nPoints;
            left = new int[nPoints - 1];
            right = new int[nPoints - 1];
            distance = new double[nPoints - 1];
            size = new int[nPoints - 1];
        }

        int root () {
            return 2 * nPoints - 2;
        }

        int sizeOf (int node) {
            return node < nPoints ? 1 : size[node - nPoints];
        }

        /** All nodes below and including the given one, breadth first, left before right. */
        TIntList breadthFirstFrom (int node) {
            TIntList result = new TIntArrayList();
            result.add(node);
            for (int head = 0; head < result.size(); head++) {
                int current = result.get(head);
                if (current >= nPoints) {
                    result.add(left[current - nPoints]);
                    result.add(right[current - nPoints]);
                }
            }
            return result;
        }
    }

    static SingleLinkageTree singleLinkage (double[][] mstEdges, int n) {
        // Stable sort keeps Prim's insertion order among equal weights.
        Integer[] order = new Integer[mstEdges.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, (a, b) -> Double.compare(mstEdges[a][2], mstEdges[b][2]));

        SingleLinkageTree tree = new SingleLinkageTree(n);
        int[] unionParent = new int[2 * n - 1];
        Arrays.fill(unionParent, -1);
        int nextNode = n;
        for (int i = 0; i < order.length; i++) {
            double[] edge = mstEdges[order[i]];
            int a = find(unionParent, (int) edge[0]);
            int b = find(unionParent, (int) edge[1]);
            tree.left[i] = a;
            tree.right[i] = b;
            tree.distance[i] = edge[2];
            tree.size[i] = tree.sizeOf(a) + tree.sizeOf(b);
            unionParent[a] = nextNode;
            unionParent[b] = nextNode;
            nextNode += 1;
        }
        return tree;
    }

    private static int find (int[] unionParent, int node) {
        int root = node;
        while (unionParent[root] >= 0) root = unionParent[root];
        // Path compression.
        while (unionParent[node] >= 0) {
            int next = unionParent[node];
            unionParent[node] = root;
            node = next;
        }
        return root;
    }

    /**
     * Collapse the single linkage tree into a tree of clusters. Cluster labels start at nPoints for the root. Each
     * row records a child (a point, or a cluster label) leaving its parent cluster at some lambda, with the number of
     * points it takes along.
     */
    static CondensedTree condense (SingleLinkageTree hierarchy, int minClusterSize) {
        int n = hierarchy.nPoints;
        int root = hierarchy.root();
        CondensedTree condensed = new CondensedTree(n);
        int[] relabel = new int[root + 1];
        relabel[root] = n;
        int nextLabel = n + 1;
        BitSet ignore = new BitSet(root + 1);

        TIntList nodes = hierarchy.breadthFirstFrom(root);
        for (int i = 0; i < nodes.size(); i++) {
            int node = nodes.get(i);
            if (node < n || ignore.get(node)) continue;
            int row = node - n;
            int left = hierarchy.left[row];
            int right = hierarchy.right[row];
            double lambda = 1 / Math.max(hierarchy.distance[row], MIN_DISTANCE_KM);
            int leftCount = hierarchy.sizeOf(left);
            int rightCount = hierarchy.sizeOf(right);
            int parent = relabel[node];
            if (leftCount >= minClusterSize && rightCount >= minClusterSize) {
                relabel[left] = nextLabel++;
                condensed.add(parent, relabel[left], lambda, leftCount);
                relabel[right] = nextLabel++;
                condensed.add(parent, relabel[right], lambda, rightCount);
            } else if (leftCount < minClusterSize && rightCount < minClusterSize) {
                condensed.dropPoints(hierarchy, left, parent, lambda, ignore);
                condensed.dropPoints(hierarchy, right, parent, lambda, ignore);
            } else if (leftCount < minClusterSize) {
                relabel[right] = parent;
                condensed.dropPoints(hierarchy, left, parent, lambda, ignore);
            } else {
                relabel[left] = parent;
                condensed.dropPoints(hierarchy, right, parent, lambda, ignore);
            }
        }
        condensed.nClusterLabels = nextLabel - n;
        return condensed;
    }

    static class CondensedTree {
        final int nPoints;
        final TIntList parent = new TIntArrayList();
        final TIntList child = new TIntArrayList();
        final TDoubleList lambda = new TDoubleArrayList();
        final TIntList childSize = new TIntArrayList();
        int nClusterLabels;

        CondensedTree (int nPoints) {
            this.nPoints = nPoints;
        }

        void add (int parentLabel, int childLabel, double lambdaValue, int size) {
            parent.add(parentLabel);
            child.add(childLabel);
            lambda.add(lambdaValue);
            childSize.add(size);
        }

        /** Every point under the given hierarchy node leaves the parent cluster at this lambda. */
        void dropPoints (SingleLinkageTree hierarchy, int node, int parentLabel, double lambdaValue, BitSet ignore) {
            TIntList subNodes = hierarchy.breadthFirstFrom(node);
            for (int i = 0; i < subNodes.size(); i++) {
                int subNode = subNodes.get(i);
                if (subNode < nPoints) {
                    add(parentLabel, subNode, lambdaValue, 1);
                }
                ignore.set(subNode);
            }
        }

        int rootLabel () {
            return nPoints;
        }

        /** The lambda at which each cluster split off its parent, zero for the root. Indexed by label - nPoints. */
        double[] births () {
            double[] births = new double[nClusterLabels];
            for (int r = 0; r < child.size(); r++) {
                if (child.get(r) >= nPoints) {
                    births[child.get(r) - nPoints] = lambda.get(r);
                }
            }
            births[0] = 0;
            return births;
        }

        /**
         * Stability of each cluster: the sum over everything leaving it of (lambda at departure minus lambda at the
         * cluster's birth) times the number of points departing. Indexed by label - nPoints.
         */
        double[] stabilities () {
            double[] births = births();
            double[] stability = new double[nClusterLabels];
            for (int r = 0; r < parent.size(); r++) {
                int p = parent.get(r) - nPoints;
                stability[p] += (lambda.get(r) - births[p]) * childSize.get(r);
            }
            return stability;
        }

        /** @return the label of the cluster containing each cluster, -1 for the root. Indexed by label - nPoints. */
        int[] clusterParents () {
            int[] clusterParent = new int[nClusterLabels];
            clusterParent[0] = -1;
            for (int r = 0; r < child.size(); r++) {
                if (child.get(r) >= nPoints) {
                    clusterParent[child.get(r) - nPoints] = parent.get(r);
                }
            }
            return clusterParent;
        }

        /**
         * Excess of mass selection, visiting clusters from the highest label down so that children are always
         * settled before their parents. The root is not eligible.
         * @return the set of selected clusters, indexed by label - nPoints.
         */
        BitSet selectClustersByExcessOfMass () {
            double[] stability = stabilities();
            int[] clusterParent = clusterParents();
            BitSet selected = new BitSet(nClusterLabels);
            selected.set(1, nClusterLabels);
            for (int c = nClusterLabels - 1; c >= 1; c--) {
                double childStability = 0;
                boolean hasChildren = false;
                for (int d = c + 1; d < nClusterLabels; d++) {
                    if (clusterParent[d] - nPoints == c) {
                        childStability += stability[d];
                        hasChildren = true;
                    }
                }
                if (hasChildren && childStability > stability[c]) {
                    selected.clear(c);
                    stability[c] = childStability;
                } else {
                    // Keep this cluster and discard everything below it.
                    for (int d = c + 1; d < nClusterLabels; d++) {
                        if (isDescendant(d, c, clusterParent)) selected.clear(d);
                    }
                }
            }
            return selected;
        }

        /**
         * Replace every selected cluster born at a distance below epsilon by its nearest ancestor born at or above
         * epsilon, or by the root if there is none. Descendants of a replacement are deselected.
         */
        BitSet mergeBelowEpsilon (BitSet selected, double epsilonKm) {
            double[] births = births();
            int[] clusterParent = clusterParents();
            BitSet result = new BitSet(nClusterLabels);
            for (int c = selected.nextSetBit(0); c >= 0; c = selected.nextSetBit(c + 1)) {
                int target = c;
                while (target > 0 && 1 / births[target] < epsilonKm) {
                    target = clusterParent[target] - nPoints;
                }
                result.set(target);
            }
            for (int c = result.nextSetBit(0); c >= 0; c = result.nextSetBit(c + 1)) {
                for (int d = c + 1; d < nClusterLabels; d++) {
                    if (isDescendant(d, c, clusterParent)) result.clear(d);
                }
            }
            if (result.get(0)) {
                LOG.debug("Top level clusters split below {} km, keeping them together.", epsilonKm);
            }
            return result;
        }

        private boolean isDescendant (int cluster, int ancestor, int[] clusterParent) {
            int p = clusterParent[cluster];
            while (p >= 0) {
                if (p - nPoints == ancestor) return true;
                p = clusterParent[p - nPoints];
            }
            return false;
        }

        /**
         * Give each point the label of the nearest selected cluster at or above the cluster it fell out of.
         * Selected clusters are numbered 0, 1, 2... in label order. Points under no selected cluster are noise.
         * If the root is selected, points that fell out of the root itself only belong to it when they left at a
         * distance no greater than epsilon.
         */
        void labelPoints (BitSet selected, int[] labels, double epsilonKm) {
            int[] clusterParent = clusterParents();
            int[] outputLabel = new int[nClusterLabels];
            int nextOutputLabel = 0;
            for (int c = selected.nextSetBit(0); c >= 0; c = selected.nextSetBit(c + 1)) {
                outputLabel[c] = nextOutputLabel++;
            }
            for (int r = 0; r < child.size(); r++) {
                int point = child.get(r);
                if (point >= nPoints) continue;
                int c = parent.get(r) - nPoints;
                if (c == 0) {
                    boolean inRoot = selected.get(0) && 1 / lambda.get(r) <= epsilonKm;
                    labels[point] = inRoot ? outputLabel[0] : NOISE;
                    continue;
                }
                while (c > 0 && !selected.get(c)) {
                    c = clusterParent[c] - nPoints;
                }
                labels[point] = selected.get(c) ? outputLabel[c] : NOISE;
            }
        }
    }

}

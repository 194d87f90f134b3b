package com.conveyal.catchment.streets;

import gnu.trove.map.TLongDoubleMap;
import gnu.trove.map.hash.TLongDoubleHashMap;

/**
 * The output of a ReachabilityRouter: the minimal arrival cost at every vertex reached within the budget, and the
 * arc through which each vertex was reached. Unreached vertices have cost UNREACHED.
 *
 * A result where no network node was reached (only the synthetic origin nodes) is valid and reported as empty.
 */
public class ReachabilityResult {

    public static final double UNREACHED = Double.POSITIVE_INFINITY;

    public final SubNetwork subNetwork;

    public final double budget;

    private final double[] costs;

    private final int[] backArcs;

    ReachabilityResult (SubNetwork subNetwork, double budget, double[] costs, int[] backArcs) {
        this.subNetwork = subNetwork;
        this.budget = budget;
        this.costs = costs;
        this.backArcs = backArcs;
    }

    /** Arrival cost at the given vertex, UNREACHED if it was not reached within the budget. */
    public double getVertexCost (int vertex) {
        return costs[vertex];
    }

    public boolean isReached (int vertex) {
        return costs[vertex] < UNREACHED;
    }

    /** @return the arc through which the vertex was reached, or -1 for roots and unreached vertices. */
    public int getBackArc (int vertex) {
        return backArcs[vertex];
    }

    /** Arrival cost at the given network node, UNREACHED if it is absent from the sub-network or was not reached. */
    public double getCost (long nodeId) {
        int vertex = subNetwork.getVertexForNode(nodeId);
        return vertex < 0 ? UNREACHED : costs[vertex];
    }

    /** Reached network nodes with their arrival costs. Synthetic origin nodes are excluded. */
    public TLongDoubleMap getCostsByNode () {
        TLongDoubleMap result = new TLongDoubleHashMap();
        for (int v = 0; v < costs.length; v++) {
            long nodeId = subNetwork.getNodeId(v);
            if (isReached(v) && !OriginConnector.isSynthetic(nodeId)) {
                result.put(nodeId, costs[v]);
            }
        }
        return result;
    }

    public int getReachedNodeCount () {
        int count = 0;
        for (int v = 0; v < costs.length; v++) {
            if (isReached(v) && !OriginConnector.isSynthetic(subNetwork.getNodeId(v))) count++;
        }
        return count;
    }

    public boolean isEmpty () {
        return getReachedNodeCount() == 0;
    }

    @Override
    public String toString () {
        return String.format("ReachabilityResult reaching %d nodes within %.1f", getReachedNodeCount(), budget);
    }
}

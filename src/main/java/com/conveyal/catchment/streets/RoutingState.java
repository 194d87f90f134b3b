package com.conveyal.catchment.streets;

/**
 * A search label: having reached a vertex through a given arc at a given cumulative cost.
 */
public class RoutingState {

    public final int vertex;

    /** The arc used to reach the vertex, or -1 for states at the search roots. */
    public final int backArc;

    /** Cumulative cost from the nearest root, seconds or meters depending on the budget. */
    public final double cost;

    /** Number of arcs traversed since the root. Used only to break ties between equal costs. */
    public final int hops;

    /** Create a state at a search root. */
    public RoutingState (int rootVertex) {
        this.vertex = rootVertex;
        this.backArc = -1;
        this.cost = 0;
        this.hops = 0;
    }

    /** Create a state by extending backState along the given arc. */
    public RoutingState (RoutingState backState, int arc, int toVertex, double arcCost) {
        this.vertex = toVertex;
        this.backArc = arc;
        this.cost = backState.cost + arcCost;
        this.hops = backState.hops + 1;
    }

    /**
     * Whether this state should be preferred over the other one at the same vertex: lower cost wins, then fewer
     * hops.
     */
    public boolean betterThan (RoutingState other) {
        if (cost != other.cost) return cost < other.cost;
        return hops < other.hops;
    }

    @Override
    public String toString () {
        return String.format("at vertex %d via arc %d, cost %.2f after %d hops", vertex, backArc, cost, hops);
    }
}

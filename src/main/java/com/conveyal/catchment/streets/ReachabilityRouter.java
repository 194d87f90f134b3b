package com.conveyal.catchment.streets;

import gnu.trove.list.TIntList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Comparator;
import java.util.PriorityQueue;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Budget-bounded, multi-source, label-setting shortest path search over a SubNetwork. All root vertices start at cost
 * zero. Arcs leading to a cost above the budget are never relaxed, so every settled vertex is within the budget.
 *
 * Ties are broken deterministically: among equal costs the state with fewer hops is settled first, then the one with
 * the lower vertex index. This makes the back-arc tree, and therefore which arcs count as traversed, reproducible.
 *
 * This is a throw-away calculator object. Make a new one for each search.
 */
public class ReachabilityRouter {

    private static final Logger LOG = LoggerFactory.getLogger(ReachabilityRouter.class);

    private static final Comparator<RoutingState> STATE_ORDER = Comparator
            .comparingDouble((RoutingState s) -> s.cost)
            .thenComparingInt(s -> s.hops)
            .thenComparingInt(s -> s.vertex);

    private final SubNetwork subNetwork;

    private final double budget;

    /** Best state found so far at each vertex, null where no state has been found. */
    private final RoutingState[] bestStates;

    private boolean routed = false;

    public ReachabilityRouter (SubNetwork subNetwork, double budget) {
        checkArgument(budget >= 0 && Double.isFinite(budget), "Budget must be a finite non-negative number.");
        this.subNetwork = subNetwork;
        this.budget = budget;
        this.bestStates = new RoutingState[subNetwork.getVertexCount()];
    }

    /** Run the search from the sub-network's root vertices and return the settled costs. */
    public ReachabilityResult route () {
        checkState(!routed, "ReachabilityRouter instances must not be reused.");
        routed = true;
        long startTime = System.currentTimeMillis();
        LOG.debug("Using cost limit of {}", budget);

        PriorityQueue<RoutingState> queue = new PriorityQueue<>(STATE_ORDER);
        TIntList roots = subNetwork.getRootVertices();
        if (roots.isEmpty()) {
            LOG.warn("Routing without any origin vertex, no search will happen.");
        }
        roots.forEach(root -> {
            RoutingState state = new RoutingState(root);
            bestStates[root] = state;
            queue.add(state);
            return true;
        });

        boolean[] settled = new boolean[subNetwork.getVertexCount()];
        int settledCount = 0;
        while (!queue.isEmpty()) {
            RoutingState state = queue.poll();
            // Skip states that were superseded after being queued.
            if (settled[state.vertex] || bestStates[state.vertex] != state) continue;
            settled[state.vertex] = true;
            settledCount++;
            TIntList arcs = subNetwork.getOutgoingArcs(state.vertex);
            for (int i = 0; i < arcs.size(); i++) {
                int arc = arcs.get(i);
                int toVertex = subNetwork.getArcDestination(arc);
                if (settled[toVertex]) continue;
                double arcCost = subNetwork.getArcCost(arc);
                if (state.cost + arcCost > budget) continue;
                RoutingState next = new RoutingState(state, arc, toVertex, arcCost);
                RoutingState existing = bestStates[toVertex];
                if (existing == null || next.betterThan(existing)) {
                    bestStates[toVertex] = next;
                    queue.add(next);
                }
            }
        }
        LOG.debug("Settled {} of {} vertices in {} msec", settledCount, subNetwork.getVertexCount(),
                System.currentTimeMillis() - startTime);
        return makeResult();
    }

    private ReachabilityResult makeResult () {
        double[] costs = new double[bestStates.length];
        int[] backArcs = new int[bestStates.length];
        Arrays.fill(costs, ReachabilityResult.UNREACHED);
        Arrays.fill(backArcs, -1);
        for (int v = 0; v < bestStates.length; v++) {
            RoutingState state = bestStates[v];
            if (state != null) {
                costs[v] = state.cost;
                backArcs[v] = state.backArc;
            }
        }
        return new ReachabilityResult(subNetwork, budget, costs, backArcs);
    }
}

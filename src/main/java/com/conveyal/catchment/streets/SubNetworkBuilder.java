package com.conveyal.catchment.streets;

import gnu.trove.list.TLongList;
import gnu.trove.list.array.TLongArrayList;
import gnu.trove.map.TLongIntMap;
import gnu.trove.map.hash.TLongIntHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import static gnu.trove.impl.Constants.DEFAULT_CAPACITY;
import static gnu.trove.impl.Constants.DEFAULT_LOAD_FACTOR;

/**
 * Collects the edges of a request-specific sub-network before costs are known. Edges are only ever appended.
 * Replacing or deleting an edge marks its slot in a bitset instead of removing it, and an index from edge id to slot
 * always points at the live version of each edge. This keeps the base edges shared with the network store untouched
 * while scenario edits are applied on top of them.
 *
 * Not threadsafe: each job uses its own builder.
 */
public class SubNetworkBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(SubNetworkBuilder.class);

    private final List<Edge> edges = new ArrayList<>();

    /** Slot of the live version of each edge id. */
    private final TLongIntMap slotForId = new TLongIntHashMap(DEFAULT_CAPACITY, DEFAULT_LOAD_FACTOR, 0, -1);

    private final BitSet deleted = new BitSet();

    private final TLongList rootNodes = new TLongArrayList();

    private final List<OriginConnector> connectors = new ArrayList<>();

    /**
     * Append an edge. If an edge with the same id is already present, the older one is deleted and this one
     * replaces it.
     */
    public void add (Edge edge) {
        int existing = slotForId.get(edge.id);
        if (existing >= 0) {
            deleted.set(existing);
        }
        slotForId.put(edge.id, edges.size());
        edges.add(edge);
    }

    public void addAll (Iterable<Edge> edges) {
        for (Edge edge : edges) {
            add(edge);
        }
    }

    /**
     * Delete the live edge with the given id.
     * @return false if there was no such edge, which is not an error.
     */
    public boolean delete (long edgeId) {
        int slot = slotForId.remove(edgeId);
        if (slot < 0) {
            return false;
        }
        deleted.set(slot);
        return true;
    }

    /** Add the two halves of an origin connector and record its synthetic node as a search root. */
    public void addConnector (OriginConnector connector) {
        for (Edge edge : connector.getEdges()) {
            add(edge);
        }
        connectors.add(connector);
        if (!rootNodes.contains(connector.nodeId)) {
            rootNodes.add(connector.nodeId);
        }
    }

    public boolean contains (long edgeId) {
        return slotForId.containsKey(edgeId);
    }

    /** @return the live edge with the given id, or null if there is none. */
    public Edge get (long edgeId) {
        int slot = slotForId.get(edgeId);
        return slot < 0 ? null : edges.get(slot);
    }

    /** @return the live edges in the order they were appended. */
    public List<Edge> getLiveEdges () {
        List<Edge> live = new ArrayList<>(getLiveEdgeCount());
        for (int slot = deleted.nextClearBit(0); slot < edges.size(); slot = deleted.nextClearBit(slot + 1)) {
            live.add(edges.get(slot));
        }
        return live;
    }

    public int getLiveEdgeCount () {
        return edges.size() - deleted.cardinality();
    }

    public TLongList getRootNodes () {
        return rootNodes;
    }

    public List<OriginConnector> getConnectors () {
        return connectors;
    }

    /**
     * Compute the cost of every live edge in both directions and produce the routing graph.
     * Each edge is passed to the cost calculator exactly once.
     */
    public SubNetwork build (EdgeCostCalculator costCalculator) {
        SubNetwork subNetwork = new SubNetwork();
        int infeasible = 0;
        for (int slot = deleted.nextClearBit(0); slot < edges.size(); slot = deleted.nextClearBit(slot + 1)) {
            Edge edge = edges.get(slot);
            double forwardCost = costCalculator.forwardCost(edge);
            double reverseCost = costCalculator.reverseCost(edge);
            if (!EdgeCostCalculator.isFeasible(forwardCost) && !EdgeCostCalculator.isFeasible(reverseCost)) {
                infeasible++;
            }
            subNetwork.addEdge(edge, forwardCost, reverseCost);
        }
        rootNodes.forEach(nodeId -> {
            subNetwork.addRootNode(nodeId);
            return true;
        });
        LOG.debug("Built {} ({} edges impassable in both directions).", subNetwork, infeasible);
        return subNetwork;
    }
}

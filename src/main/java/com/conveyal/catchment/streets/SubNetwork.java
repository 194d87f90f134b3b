package com.conveyal.catchment.streets;

import gnu.trove.list.TDoubleList;
import gnu.trove.list.TIntList;
import gnu.trove.list.TLongList;
import gnu.trove.list.array.TDoubleArrayList;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.list.array.TLongArrayList;
import gnu.trove.map.TLongIntMap;
import gnu.trove.map.hash.TLongIntHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static gnu.trove.impl.Constants.DEFAULT_CAPACITY;
import static gnu.trove.impl.Constants.DEFAULT_LOAD_FACTOR;

/**
 * The request-specific routing graph: a column store with parallel arrays, one entry per edge pair and one per vertex.
 * It is built once by SubNetworkBuilder, owned by a single job and never shared or modified afterward.
 *
 * Each edge can be traversed in two directions, giving two directed arcs. Arc 2e runs forward along edge e (source
 * node to target node) and arc 2e+1 runs in reverse. Arcs whose cost is infeasible for the mode do not appear in the
 * outgoing arc lists, so the search never sees them.
 *
 * Vertices are numbered densely in the order they are first encountered. Network node ids are kept alongside so
 * results can be reported in terms of the network database's ids.
 */
public class SubNetwork {

    /** Network node id for each vertex. Synthetic origin nodes have negative ids. */
    private final TLongList nodeIds = new TLongArrayList();

    private final TLongIntMap vertexForNode = new TLongIntHashMap(DEFAULT_CAPACITY, DEFAULT_LOAD_FACTOR, 0, -1);

    private final TIntList vertexFixedLats = new TIntArrayList();

    private final TIntList vertexFixedLons = new TIntArrayList();

    private final List<Edge> edges = new ArrayList<>();

    private final TIntList fromVertices = new TIntArrayList();

    private final TIntList toVertices = new TIntArrayList();

    private final TDoubleList forwardCosts = new TDoubleArrayList();

    private final TDoubleList reverseCosts = new TDoubleArrayList();

    /** For each vertex, the feasible arcs leaving it. */
    private final List<TIntList> outgoingArcs = new ArrayList<>();

    /** The vertices at which the search starts, one per origin connector. */
    private final TIntList rootVertices = new TIntArrayList();

    /** Only SubNetworkBuilder creates these. */
    SubNetwork () { }

    /** Add an edge with its precomputed costs, creating its end vertices if they don't exist yet. */
    void addEdge (Edge edge, double forwardCost, double reverseCost) {
        int edgeIndex = edges.size();
        int last = edge.pointCount() - 1;
        int from = getOrCreateVertex(edge.sourceNode, edge.getFixedLat(0), edge.getFixedLon(0));
        int to = getOrCreateVertex(edge.targetNode, edge.getFixedLat(last), edge.getFixedLon(last));
        edges.add(edge);
        fromVertices.add(from);
        toVertices.add(to);
        forwardCosts.add(forwardCost);
        reverseCosts.add(reverseCost);
        if (EdgeCostCalculator.isFeasible(forwardCost)) {
            outgoingArcs.get(from).add(edgeIndex * 2);
        }
        if (EdgeCostCalculator.isFeasible(reverseCost)) {
            outgoingArcs.get(to).add(edgeIndex * 2 + 1);
        }
    }

    void addRootNode (long nodeId) {
        int vertex = vertexForNode.get(nodeId);
        if (vertex < 0) {
            throw new IllegalStateException("Origin node " + nodeId + " is not part of the sub-network.");
        }
        if (!rootVertices.contains(vertex)) {
            rootVertices.add(vertex);
        }
    }

    private int getOrCreateVertex (long nodeId, int fixedLat, int fixedLon) {
        int vertex = vertexForNode.get(nodeId);
        if (vertex < 0) {
            vertex = nodeIds.size();
            nodeIds.add(nodeId);
            vertexForNode.put(nodeId, vertex);
            vertexFixedLats.add(fixedLat);
            vertexFixedLons.add(fixedLon);
            outgoingArcs.add(new TIntArrayList(4));
        }
        return vertex;
    }

    public int getVertexCount () {
        return nodeIds.size();
    }

    public int getEdgeCount () {
        return edges.size();
    }

    /** @return the vertex index for the given network node id, or -1 if the node is not in this sub-network. */
    public int getVertexForNode (long nodeId) {
        return vertexForNode.get(nodeId);
    }

    public long getNodeId (int vertex) {
        return nodeIds.get(vertex);
    }

    public int getVertexFixedLat (int vertex) {
        return vertexFixedLats.get(vertex);
    }

    public int getVertexFixedLon (int vertex) {
        return vertexFixedLons.get(vertex);
    }

    public Edge getEdge (int edgeIndex) {
        return edges.get(edgeIndex);
    }

    public List<Edge> getEdges () {
        return Collections.unmodifiableList(edges);
    }

    public int getFromVertex (int edgeIndex) {
        return fromVertices.get(edgeIndex);
    }

    public int getToVertex (int edgeIndex) {
        return toVertices.get(edgeIndex);
    }

    public double getForwardCost (int edgeIndex) {
        return forwardCosts.get(edgeIndex);
    }

    public double getReverseCost (int edgeIndex) {
        return reverseCosts.get(edgeIndex);
    }

    public TIntList getOutgoingArcs (int vertex) {
        return outgoingArcs.get(vertex);
    }

    public TIntList getRootVertices () {
        return rootVertices;
    }

    // Arc accessors. Even arcs run forward along their edge, odd arcs in reverse.

    public static int edgeForArc (int arc) {
        return arc / 2;
    }

    public static boolean isReverse (int arc) {
        return (arc & 1) == 1;
    }

    public int getArcOrigin (int arc) {
        int edgeIndex = edgeForArc(arc);
        return isReverse(arc) ? toVertices.get(edgeIndex) : fromVertices.get(edgeIndex);
    }

    public int getArcDestination (int arc) {
        int edgeIndex = edgeForArc(arc);
        return isReverse(arc) ? fromVertices.get(edgeIndex) : toVertices.get(edgeIndex);
    }

    public double getArcCost (int arc) {
        int edgeIndex = edgeForArc(arc);
        return isReverse(arc) ? reverseCosts.get(edgeIndex) : forwardCosts.get(edgeIndex);
    }

    @Override
    public String toString () {
        return String.format("SubNetwork with %d vertices, %d edges and %d roots",
                getVertexCount(), getEdgeCount(), rootVertices.size());
    }
}

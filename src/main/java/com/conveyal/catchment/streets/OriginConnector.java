package com.conveyal.catchment.streets;

import java.util.List;

/**
 * The synthetic node created for one origin point, with the two edges linking it into the network. The edges are the
 * halves of the nearest eligible edge split at the point closest to the origin. Connectors exist for one request
 * only and are never stored in the network.
 *
 * Synthetic nodes and edges have negative ids so they can never collide with ids from the network database.
 */
public class OriginConnector {

    public final int originIndex;

    /** The synthetic node at the split point. The search starts here. */
    public final long nodeId;

    /** Id of the network edge that was split. */
    public final long splitEdgeId;

    /** Straight line distance from the origin point to the split point, in meters. */
    public final double distanceToEdgeMeters;

    /** The half running from the split edge's source node to the synthetic node. */
    public final Edge toSplit;

    /** The half running from the synthetic node to the split edge's target node. */
    public final Edge fromSplit;

    public OriginConnector (int originIndex, long nodeId, long splitEdgeId, double distanceToEdgeMeters,
                            Edge toSplit, Edge fromSplit) {
        this.originIndex = originIndex;
        this.nodeId = nodeId;
        this.splitEdgeId = splitEdgeId;
        this.distanceToEdgeMeters = distanceToEdgeMeters;
        this.toSplit = toSplit;
        this.fromSplit = fromSplit;
    }

    public List<Edge> getEdges () {
        return List.of(toSplit, fromSplit);
    }

    public static long connectorNodeId (int originIndex) {
        return -1L - originIndex;
    }

    /** Each origin gets two edge ids, half is 0 for the edge into the split point and 1 for the edge out of it. */
    public static long connectorEdgeId (int originIndex, int half) {
        return -1L - (2L * originIndex + half);
    }

    public static boolean isSynthetic (long id) {
        return id < 0;
    }
}

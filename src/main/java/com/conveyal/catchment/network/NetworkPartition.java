package com.conveyal.catchment.network;

import com.conveyal.catchment.streets.Edge;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * All edges of the network whose coarse cell is a given cell. Partitions are the unit of loading and caching, and
 * once loaded they are shared read-only by all concurrent requests.
 */
public class NetworkPartition implements Serializable {

    private static final long serialVersionUID = 1L;

    public final int coarseCell;

    // Kept as a plain ArrayList so Kryo can rebuild it, exposed only through an unmodifiable view.
    private final ArrayList<Edge> edges;

    public NetworkPartition (int coarseCell, Collection<Edge> edges) {
        for (Edge edge : edges) {
            checkArgument(edge.coarseCell == coarseCell,
                    "Edge %s belongs to coarse cell %s, not %s.", edge.id, edge.coarseCell, coarseCell);
        }
        this.coarseCell = coarseCell;
        this.edges = new ArrayList<>(edges);
    }

    /** An empty partition for a cell inside the network extent that happens to contain no edges. */
    public static NetworkPartition empty (int coarseCell) {
        return new NetworkPartition(coarseCell, Collections.emptyList());
    }

    public List<Edge> getEdges () {
        return Collections.unmodifiableList(edges);
    }

    public int size () {
        return edges.size();
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NetworkPartition other = (NetworkPartition) o;
        return coarseCell == other.coarseCell && edges.equals(other.edges);
    }

    @Override
    public int hashCode () {
        return 31 * coarseCell + edges.hashCode();
    }

    @Override
    public String toString () {
        return String.format("NetworkPartition %d with %d edges", coarseCell, edges.size());
    }
}

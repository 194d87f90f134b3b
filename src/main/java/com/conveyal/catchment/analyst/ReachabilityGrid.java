package com.conveyal.catchment.analyst;

import com.conveyal.catchment.streets.OriginConnector;
import com.conveyal.catchment.streets.ReachabilityResult;
import com.conveyal.catchment.streets.SubNetwork;
import org.locationtech.jts.geom.Envelope;

import java.util.Arrays;

import static com.conveyal.catchment.common.GeometryUtils.fixedDegreesToFloating;

/**
 * A cost value for every cell of a block of Web Mercator pixels. Cells that were not reached hold UNREACHED.
 * Used both as the output of grid requests and as the raster from which isochrones are traced.
 */
public class ReachabilityGrid {

    public static final double UNREACHED = ReachabilityResult.UNREACHED;

    public final WebMercatorExtents extents;

    /** Row-major costs, index y * width + x. */
    private final double[] costs;

    public ReachabilityGrid (WebMercatorExtents extents) {
        this.extents = extents;
        this.costs = new double[extents.cellCount()];
        Arrays.fill(costs, UNREACHED);
    }

    private ReachabilityGrid (WebMercatorExtents extents, double[] costs) {
        this.extents = extents;
        this.costs = costs;
    }

    /**
     * Build the grid result of a search: each cell takes the minimum arrival cost of the network nodes inside it.
     * Cells containing no reached network node are unreached. Synthetic origin nodes only anchor the extents of the
     * grid, so a search that reached no network node yields a grid with every cell unreached.
     */
    public static ReachabilityGrid forReachedNodes (ReachabilityResult result, int zoom) {
        SubNetwork subNetwork = result.subNetwork;
        Envelope envelope = new Envelope();
        for (int v = 0; v < subNetwork.getVertexCount(); v++) {
            if (result.isReached(v)) {
                envelope.expandToInclude(vertexLon(subNetwork, v), vertexLat(subNetwork, v));
            }
        }
        if (envelope.isNull()) {
            // No roots at all. Return a one-cell unreached grid rather than failing on an empty envelope.
            return new ReachabilityGrid(WebMercatorExtents.forWgsEnvelope(new Envelope(0, 0, 0, 0), zoom));
        }
        ReachabilityGrid grid = new ReachabilityGrid(WebMercatorExtents.forWgsEnvelope(envelope, zoom));
        if (result.isEmpty()) {
            return grid;
        }
        for (int v = 0; v < subNetwork.getVertexCount(); v++) {
            if (result.isReached(v) && !OriginConnector.isSynthetic(subNetwork.getNodeId(v))) {
                grid.lowerCost(vertexLon(subNetwork, v), vertexLat(subNetwork, v), result.getVertexCost(v));
            }
        }
        return grid;
    }

    static double vertexLat (SubNetwork subNetwork, int vertex) {
        return fixedDegreesToFloating(subNetwork.getVertexFixedLat(vertex));
    }

    static double vertexLon (SubNetwork subNetwork, int vertex) {
        return fixedDegreesToFloating(subNetwork.getVertexFixedLon(vertex));
    }

    public double getCost (int x, int y) {
        return costs[y * extents.width + x];
    }

    public boolean isReached (int x, int y) {
        return getCost(x, y) < UNREACHED;
    }

    /** Set the cell at the given local coordinates to the given cost if that is lower than its current cost. */
    public void lowerCost (int x, int y, double cost) {
        int index = y * extents.width + x;
        if (cost < costs[index]) {
            costs[index] = cost;
        }
    }

    /**
     * Lower the cost of the cell containing the given point.
     * @return false if the point is outside the grid, in which case nothing changes.
     */
    public boolean lowerCost (double lon, double lat, double cost) {
        int x = extents.localX(lon);
        int y = extents.localY(lat);
        if (!extents.contains(x, y)) return false;
        lowerCost(x, y, cost);
        return true;
    }

    public int getReachedCellCount () {
        int count = 0;
        for (double cost : costs) {
            if (cost < UNREACHED) count++;
        }
        return count;
    }

    /** A copy of the row-major cost array. */
    public double[] getCosts () {
        return costs.clone();
    }

    /** A copy of this grid with the given costs, which must have the same size. */
    ReachabilityGrid withCosts (double[] newCosts) {
        if (newCosts.length != costs.length) {
            throw new IllegalArgumentException("Cost array does not match the grid size.");
        }
        return new ReachabilityGrid(extents, newCosts);
    }

    @FunctionalInterface
    public interface CellConsumer {
        void accept (int x, int y, double cost);
    }

    /** Call the consumer on each reached cell, row by row from the north west corner. */
    public void forEachReachedCell (CellConsumer consumer) {
        for (int y = 0; y < extents.height; y++) {
            for (int x = 0; x < extents.width; x++) {
                double cost = getCost(x, y);
                if (cost < UNREACHED) consumer.accept(x, y, cost);
            }
        }
    }
}

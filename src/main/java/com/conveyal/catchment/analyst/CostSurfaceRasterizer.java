package com.conveyal.catchment.analyst;

import com.conveyal.catchment.streets.Edge;
import com.conveyal.catchment.streets.EdgeCostCalculator;
import com.conveyal.catchment.streets.ReachabilityResult;
import com.conveyal.catchment.streets.SubNetwork;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.conveyal.catchment.common.GeometryUtils.distance;

/**
 * Turns the per-node costs of a search into a continuous cost surface on a Web Mercator grid, by walking along the
 * geometry of every edge touched by the search and sampling the cost at regular intervals. The cost at a point along
 * an edge is interpolated linearly from the cost at the end(s) it was reached from, and points beyond the budget are
 * left out. Every cell keeps the lowest sampled cost.
 *
 * The grid extends two pixels beyond the touched edges on every side, so contours never run off its edges.
 */
public class CostSurfaceRasterizer {

    private static final Logger LOG = LoggerFactory.getLogger(CostSurfaceRasterizer.class);

    /** Samples are taken at this fraction of the pixel width, so no pixel along an edge is skipped. */
    private static final double SAMPLES_PER_PIXEL = 2;

    private static final int PADDING_PIXELS = 2;

    private final ReachabilityResult result;

    private final SubNetwork subNetwork;

    private final int zoom;

    public CostSurfaceRasterizer (ReachabilityResult result, int zoom) {
        this.result = result;
        this.subNetwork = result.subNetwork;
        this.zoom = zoom;
    }

    /** @return the rasterized surface, or null if no edge was touched by the search. */
    public ReachabilityGrid rasterize () {
        Envelope envelope = new Envelope();
        for (int e = 0; e < subNetwork.getEdgeCount(); e++) {
            if (isTouched(e)) {
                for (Coordinate c : subNetwork.getEdge(e).getCoordinates()) {
                    envelope.expandToInclude(c);
                }
            }
        }
        if (envelope.isNull()) {
            return null;
        }
        WebMercatorExtents extents = WebMercatorExtents.forWgsEnvelope(envelope, zoom).expand(PADDING_PIXELS);
        ReachabilityGrid grid = new ReachabilityGrid(extents);
        double stepMeters = WebMercatorExtents.pixelWidthMeters(envelope.centre().y, zoom) / SAMPLES_PER_PIXEL;
        int samples = 0;
        for (int e = 0; e < subNetwork.getEdgeCount(); e++) {
            if (isTouched(e)) {
                samples += sampleEdge(e, grid, stepMeters);
            }
        }
        LOG.debug("Rasterized {} samples onto grid {}, {} cells reached.", samples, extents, grid.getReachedCellCount());
        return grid;
    }

    private boolean isTouched (int edgeIndex) {
        return result.isReached(subNetwork.getFromVertex(edgeIndex)) || result.isReached(subNetwork.getToVertex(edgeIndex));
    }

    /**
     * Cost at the given fraction of the way from the source to the target of an edge, UNREACHED if that point can
     * not be reached within the budget.
     */
    private double costAlongEdge (int edgeIndex, double fraction) {
        double sourceCost = result.getVertexCost(subNetwork.getFromVertex(edgeIndex));
        double targetCost = result.getVertexCost(subNetwork.getToVertex(edgeIndex));
        double forwardCost = subNetwork.getForwardCost(edgeIndex);
        double reverseCost = subNetwork.getReverseCost(edgeIndex);
        double best = ReachabilityGrid.UNREACHED;
        if (sourceCost < ReachabilityResult.UNREACHED && EdgeCostCalculator.isFeasible(forwardCost)) {
            best = Math.min(best, sourceCost + fraction * forwardCost);
        }
        if (targetCost < ReachabilityResult.UNREACHED && EdgeCostCalculator.isFeasible(reverseCost)) {
            best = Math.min(best, targetCost + (1 - fraction) * reverseCost);
        }
        // Reached end points are always on the surface, even where no arc leads onto the edge from them.
        if (fraction == 0) best = Math.min(best, sourceCost);
        if (fraction == 1) best = Math.min(best, targetCost);
        return best <= result.budget ? best : ReachabilityGrid.UNREACHED;
    }

    private int sampleEdge (int edgeIndex, ReachabilityGrid grid, double stepMeters) {
        Edge edge = subNetwork.getEdge(edgeIndex);
        Coordinate[] coordinates = edge.getCoordinates();
        double[] cumulative = new double[coordinates.length];
        for (int i = 1; i < coordinates.length; i++) {
            cumulative[i] = cumulative[i - 1] + distance(coordinates[i - 1], coordinates[i]);
        }
        double totalLength = cumulative[coordinates.length - 1];
        int steps = Math.max(1, (int) Math.ceil(totalLength / stepMeters));
        int segment = 0;
        int sampled = 0;
        for (int s = 0; s <= steps; s++) {
            double fraction = (double) s / steps;
            double cost = costAlongEdge(edgeIndex, fraction);
            if (cost == ReachabilityGrid.UNREACHED) continue;
            double position = fraction * totalLength;
            while (segment < coordinates.length - 2 && cumulative[segment + 1] < position) {
                segment++;
            }
            Coordinate c0 = coordinates[segment];
            Coordinate c1 = coordinates[segment + 1];
            double segmentLength = cumulative[segment + 1] - cumulative[segment];
            double t = segmentLength > 0 ? (position - cumulative[segment]) / segmentLength : 0;
            t = Math.max(0, Math.min(1, t));
            double lon = c0.x + t * (c1.x - c0.x);
            double lat = c0.y + t * (c1.y - c0.y);
            if (grid.lowerCost(lon, lat, cost)) sampled++;
        }
        return sampled;
    }
}

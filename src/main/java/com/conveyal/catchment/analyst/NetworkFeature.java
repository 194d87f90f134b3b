package com.conveyal.catchment.analyst;

import com.conveyal.catchment.common.GeometryUtils;
import com.conveyal.catchment.streets.Edge;
import com.conveyal.catchment.streets.EdgeCostCalculator;
import com.conveyal.catchment.streets.ReachabilityResult;
import com.conveyal.catchment.streets.SubNetwork;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.linearref.LengthIndexedLine;

import java.util.ArrayList;
import java.util.List;

/**
 * One edge of the reachable network, or the reachable part of an edge, with the arrival cost at the end where the
 * traversal ends. Partly reachable edges are clipped and carry the budget as their cost.
 */
public class NetworkFeature {

    public final long edgeId;

    public final LineString geometry;

    public final double cost;

    /** True if only part of the edge is reachable and the geometry has been clipped. */
    public final boolean partial;

    public NetworkFeature (long edgeId, LineString geometry, double cost, boolean partial) {
        this.edgeId = edgeId;
        this.geometry = geometry;
        this.cost = cost;
        this.partial = partial;
    }

    /**
     * Collect the reachable network of a search. An edge fully traversed in either direction is reported whole, with
     * the lower of the arrival costs at its far ends. Otherwise the parts reachable from each end are reported
     * separately (or merged into the whole edge when they meet).
     */
    public static List<NetworkFeature> forResult (ReachabilityResult result) {
        SubNetwork subNetwork = result.subNetwork;
        double budget = result.budget;
        List<NetworkFeature> features = new ArrayList<>();
        for (int e = 0; e < subNetwork.getEdgeCount(); e++) {
            double sourceCost = result.getVertexCost(subNetwork.getFromVertex(e));
            double targetCost = result.getVertexCost(subNetwork.getToVertex(e));
            double forwardCost = subNetwork.getForwardCost(e);
            double reverseCost = subNetwork.getReverseCost(e);
            boolean forward = sourceCost < ReachabilityResult.UNREACHED && EdgeCostCalculator.isFeasible(forwardCost);
            boolean reverse = targetCost < ReachabilityResult.UNREACHED && EdgeCostCalculator.isFeasible(reverseCost);
            if (!forward && !reverse) continue;
            Edge edge = subNetwork.getEdge(e);
            double fullArrival = Math.min(
                    forward ? sourceCost + forwardCost : ReachabilityResult.UNREACHED,
                    reverse ? targetCost + reverseCost : ReachabilityResult.UNREACHED);
            if (fullArrival <= budget) {
                features.add(new NetworkFeature(edge.id, edge.getGeometry(), fullArrival, false));
                continue;
            }
            // Fractions of the edge reachable from its source and from its target.
            double fromSource = forward ? fraction(budget - sourceCost, forwardCost) : 0;
            double fromTarget = reverse ? fraction(budget - targetCost, reverseCost) : 0;
            if (fromSource + fromTarget >= 1) {
                features.add(new NetworkFeature(edge.id, edge.getGeometry(), budget, true));
                continue;
            }
            if (fromSource > 0) {
                features.add(new NetworkFeature(edge.id, clip(edge, 0, fromSource), budget, true));
            }
            if (fromTarget > 0) {
                features.add(new NetworkFeature(edge.id, clip(edge, 1 - fromTarget, 1), budget, true));
            }
        }
        return features;
    }

    private static double fraction (double remaining, double edgeCost) {
        if (edgeCost <= 0) return 1;
        return Math.max(0, Math.min(1, remaining / edgeCost));
    }

    /** The part of the edge geometry between two fractions of its length. */
    private static LineString clip (Edge edge, double startFraction, double endFraction) {
        LineString line = edge.getGeometry();
        LengthIndexedLine indexedLine = new LengthIndexedLine(line);
        double length = line.getLength();
        Geometry clipped = indexedLine.extractLine(startFraction * length, endFraction * length);
        if (clipped instanceof LineString) {
            return (LineString) clipped;
        }
        return GeometryUtils.geometryFactory.createLineString(clipped.getCoordinates());
    }
}

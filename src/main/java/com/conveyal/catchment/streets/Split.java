package com.conveyal.catchment.streets;

import com.conveyal.catchment.common.GeometryUtils;
import com.conveyal.catchment.profile.StreetMode;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;
import org.apache.commons.math3.util.FastMath;

import static com.conveyal.catchment.common.GeometryUtils.METERS_PER_DEGREE_LAT;
import static com.conveyal.catchment.common.GeometryUtils.fixedDegreesToFloating;
import static com.conveyal.catchment.common.GeometryUtils.floatingDegreesToFixed;

/**
 * Represents a potential split point along an existing edge, retaining some geometric calculation state so that
 * once the best candidate is found more detailed calculations can continue.
 */
public class Split {

    public Edge edge; // the edge being split, null until a candidate is found
    public int seg = 0; // the segment within the edge that is closest to the search point
    public double frac = 0; // the fraction along that segment where a link should occur
    public int fixedLon; // the x coordinate of the split point along the edge
    public int fixedLat; // the y coordinate of the split point along the edge
    // We must use a long because squaring a typical search radius in fixed-point _does_ cause signed int32 overflow.
    public long distanceToEdge_squaredFixedDegrees = Long.MAX_VALUE;

    // The following fields are only set once a best edge is found.

    /** Distance between the requested point and the split point, in meters. */
    public double distanceToEdgeMeters = 0;

    /** Distance along the edge from its source node to the split point, in meters of edge length. */
    public double distance0Meters = 0;

    /** Distance along the edge from the split point to its target node, in meters of edge length. */
    public double distance1Meters = 0;

    /**
     * Copy all the fields in another Split into this one.
     * This avoids creating large amounts of tiny short-lived objects.
     */
    public void setFrom (Split other) {
        edge = other.edge;
        seg = other.seg;
        frac = other.frac;
        fixedLon = other.fixedLon;
        fixedLat = other.fixedLat;
        distanceToEdge_squaredFixedDegrees = other.distanceToEdge_squaredFixedDegrees;
    }

    /**
     * Find the location on the nearest edge usable by the given mode, without creating any nodes or edges.
     * Candidate edges are typically pre-selected with a spatial index and may include edges beyond the radius.
     * @return a new Split object, or null if no eligible edge was found in range.
     */
    public static Split find (double lat, double lon, double searchRadiusMeters, Iterable<Edge> candidateEdges,
                              StreetMode streetMode) {

        // After this conversion, the entire geometric calculation is happening in fixed precision int degrees.
        int fixedLat = floatingDegreesToFixed(lat);
        int fixedLon = floatingDegreesToFixed(lon);
        double cosLat = FastMath.cos(FastMath.toRadians(lat)); // The projection factor, Earth is a "sphere"

        long radiusFixedLat = floatingDegreesToFixed(searchRadiusMeters / METERS_PER_DEGREE_LAT);
        long squaredRadiusFixedLat = radiusFixedLat * radiusFixedLat;

        // The split location currently being examined and the best one seen so far.
        Split curr = new Split();
        Split best = new Split();
        for (Edge edge : candidateEdges) {
            if (!streetMode.allows(edge.streetClass)) continue;
            curr.edge = edge;
            // The distance to this edge is the distance to the closest segment of its geometry.
            edge.forEachSegment((seg, fixedLat0, fixedLon0, fixedLat1, fixedLon1) -> {
                curr.seg = seg;
                curr.frac = GeometryUtils.segmentFraction(
                        fixedLon0, fixedLat0, fixedLon1, fixedLat1, fixedLon, fixedLat, cosLat);
                curr.fixedLon = (int) (fixedLon0 + curr.frac * (fixedLon1 - fixedLon0));
                curr.fixedLat = (int) (fixedLat0 + curr.frac * (fixedLat1 - fixedLat0));
                long dx = (long) ((curr.fixedLon - fixedLon) * cosLat);
                long dy = (long) (curr.fixedLat - fixedLat);
                curr.distanceToEdge_squaredFixedDegrees = dx * dx + dy * dy;
                if (curr.distanceToEdge_squaredFixedDegrees <= squaredRadiusFixedLat) {
                    if (curr.distanceToEdge_squaredFixedDegrees < best.distanceToEdge_squaredFixedDegrees) {
                        best.setFrom(curr);
                    } else if (curr.distanceToEdge_squaredFixedDegrees == best.distanceToEdge_squaredFixedDegrees
                            && curr.edge.id < best.edge.id) {
                        // Break distance ties by favoring lower edge IDs, so snapping is deterministic.
                        best.setFrom(curr);
                    }
                }
            });
        }

        if (best.edge == null) {
            return null;
        }

        // Accumulate projected lengths along the chosen edge up to the split point, then scale the edge's own length
        // by that fraction so the two halves always add up to the original length.
        double[] lengths = new double[2]; // before split, total
        best.edge.forEachSegment((seg, fLat0, fLon0, fLat1, fLon1) -> {
            double dx = (fLon1 - fLon0) * cosLat;
            double dy = (fLat1 - fLat0);
            double length = FastMath.sqrt(dx * dx + dy * dy);
            if (seg < best.seg) {
                lengths[0] += length;
            } else if (seg == best.seg) {
                lengths[0] += length * best.frac;
            }
            lengths[1] += length;
        });
        double fraction = lengths[1] > 0 ? lengths[0] / lengths[1] : 0;
        best.distance0Meters = best.edge.lengthM * fraction;
        best.distance1Meters = best.edge.lengthM - best.distance0Meters;
        best.distanceToEdgeMeters = fixedDegreesToFloating((int) FastMath.sqrt(best.distanceToEdge_squaredFixedDegrees))
                * METERS_PER_DEGREE_LAT;
        return best;
    }

    /**
     * Split the chosen edge at this split point, producing the two halves that link the edge's end nodes to a new
     * synthetic node. The halves keep the direction, class, impedances and speeds of the edge they come from, so
     * one-way restrictions still apply to the origin.
     */
    public OriginConnector toConnector (int originIndex) {
        long nodeId = OriginConnector.connectorNodeId(originIndex);
        TIntList firstHalf = new TIntArrayList();
        TIntList secondHalf = new TIntArrayList();
        for (int p = 0; p <= seg; p++) {
            firstHalf.add(edge.getFixedLat(p));
            firstHalf.add(edge.getFixedLon(p));
        }
        firstHalf.add(fixedLat);
        firstHalf.add(fixedLon);
        secondHalf.add(fixedLat);
        secondHalf.add(fixedLon);
        for (int p = seg + 1; p < edge.pointCount(); p++) {
            secondHalf.add(edge.getFixedLat(p));
            secondHalf.add(edge.getFixedLon(p));
        }
        Edge toSplit = edge.toBuilder()
                .id(OriginConnector.connectorEdgeId(originIndex, 0))
                .targetNode(nodeId)
                .lengthM(distance0Meters)
                .lengthProjected(distance0Meters)
                .fixedGeometry(firstHalf.toArray())
                .build();
        Edge fromSplit = edge.toBuilder()
                .id(OriginConnector.connectorEdgeId(originIndex, 1))
                .sourceNode(nodeId)
                .lengthM(distance1Meters)
                .lengthProjected(distance1Meters)
                .fixedGeometry(secondHalf.toArray())
                .build();
        return new OriginConnector(originIndex, nodeId, edge.id, distanceToEdgeMeters, toSplit, fromSplit);
    }
}

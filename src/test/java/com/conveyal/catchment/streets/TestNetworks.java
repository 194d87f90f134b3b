package com.conveyal.catchment.streets;

import com.conveyal.catchment.common.GeometryUtils;
import com.conveyal.catchment.network.InMemoryNetworkDatabase;
import com.conveyal.catchment.profile.OriginPoint;
import com.conveyal.catchment.profile.StreetMode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Builds small street networks with simple round lengths for tests. Positions are given in meters east and north of
 * a fixed center point, which lies in the middle of a fine cell (and of its coarse cell) so that buffers of up to
 * about 1.4 km around it stay within a single fine cell.
 *
 * In street grids, node (x, y) has id y * n + x + 1, where x grows eastward and y northward. The edge from (x, y) to
 * (x + 1, y) has id HORIZONTAL_EDGE_BASE + y * n + x and the edge from (x, y) to (x, y + 1) has id
 * VERTICAL_EDGE_BASE + y * n + x.
 */
public abstract class TestNetworks {

    public static final double CENTER_LAT = 53.3177;
    public static final double CENTER_LON = 12.6782;

    public static final long HORIZONTAL_EDGE_BASE = 10_000;
    public static final long VERTICAL_EDGE_BASE = 20_000;

    public static double lat (double metersNorth) {
        return CENTER_LAT + GeometryUtils.metersToDegreesLatitude(metersNorth);
    }

    public static double lon (double metersEast) {
        return CENTER_LON + GeometryUtils.metersToDegreesLongitude(metersEast, CENTER_LAT);
    }

    public static OriginPoint origin (double metersEast, double metersNorth) {
        return new OriginPoint(lat(metersNorth), lon(metersEast));
    }

    /** A straight edge between two positions, with an explicit length. */
    public static Edge.Builder straightEdge (long id, long sourceNode, long targetNode,
                                            double fromEast, double fromNorth, double toEast, double toNorth,
                                            double lengthM, StreetClass streetClass) {
        return Edge.builder()
                .id(id)
                .sourceNode(sourceNode)
                .targetNode(targetNode)
                .lengthM(lengthM)
                .streetClass(streetClass)
                .coordinates(new double[][] {
                        {lon(fromEast), lat(fromNorth)},
                        {lon(toEast), lat(toNorth)}
                });
    }

    public static Edge edge (long id, long sourceNode, long targetNode, double fromEast, double fromNorth,
                             double toEast, double toNorth, double lengthM, StreetClass streetClass) {
        return straightEdge(id, sourceNode, targetNode, fromEast, fromNorth, toEast, toNorth, lengthM, streetClass)
                .build();
    }

    public static long gridNode (int n, int x, int y) {
        return (long) y * n + x + 1;
    }

    public static long horizontalEdge (int n, int x, int y) {
        return HORIZONTAL_EDGE_BASE + (long) y * n + x;
    }

    public static long verticalEdge (int n, int x, int y) {
        return VERTICAL_EDGE_BASE + (long) y * n + x;
    }

    /** Meters east (or north) of the center of grid column (or row) i. The grid is centered on the center point. */
    public static double gridOffset (int n, int i, double spacingMeters) {
        return (i - (n - 1) / 2.0) * spacingMeters;
    }

    /** A square grid of n by n intersections, all edges of the given class and exactly spacingMeters long. */
    public static List<Edge> streetGrid (int n, double spacingMeters, StreetClass streetClass) {
        List<Edge> edges = new ArrayList<>();
        for (int y = 0; y < n; y++) {
            for (int x = 0; x < n; x++) {
                double east = gridOffset(n, x, spacingMeters);
                double north = gridOffset(n, y, spacingMeters);
                if (x + 1 < n) {
                    edges.add(edge(horizontalEdge(n, x, y), gridNode(n, x, y), gridNode(n, x + 1, y),
                            east, north, east + spacingMeters, north, spacingMeters, streetClass));
                }
                if (y + 1 < n) {
                    edges.add(edge(verticalEdge(n, x, y), gridNode(n, x, y), gridNode(n, x, y + 1),
                            east, north, east, north + spacingMeters, spacingMeters, streetClass));
                }
            }
        }
        return edges;
    }

    public static InMemoryNetworkDatabase database (Collection<Edge> edges) {
        return new InMemoryNetworkDatabase(() -> 100.0, edges);
    }

    /** Build a sub-network from the given edges, rooted at the origin connector of a point snapped onto them. */
    public static SubNetwork rootedSubNetwork (List<Edge> edges, double originEast, double originNorth,
                                               EdgeCostCalculator costCalculator) {
        SubNetworkBuilder builder = new SubNetworkBuilder();
        builder.addAll(edges);
        OriginPoint origin = origin(originEast, originNorth);
        Split split = Split.find(origin.lat(), origin.lon(), 100, edges, StreetMode.WALK);
        builder.addConnector(split.toConnector(0));
        return builder.build(costCalculator);
    }
}

package com.conveyal.catchment.streets;

import com.conveyal.catchment.profile.OriginPoint;
import com.conveyal.catchment.profile.StreetMode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.conveyal.catchment.streets.TestNetworks.edge;
import static com.conveyal.catchment.streets.TestNetworks.origin;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SplitTest {

    /** Two parallel east-west streets, 40 m and 100 m north of the center. */
    private final Edge near = edge(7, 1, 2, -200, 40, 200, 40, 400, StreetClass.RESIDENTIAL);
    private final Edge far = edge(3, 3, 4, -200, 100, 200, 100, 400, StreetClass.RESIDENTIAL);

    @Test
    void snapsToNearestEdge () {
        OriginPoint point = origin(100, 0);
        Split split = Split.find(point.lat(), point.lon(), 150, List.of(far, near), StreetMode.WALK);
        assertNotNull(split);
        assertEquals(7, split.edge.id);
        assertEquals(40, split.distanceToEdgeMeters, 1);
        // The projected point is three quarters of the way along the edge.
        assertEquals(300, split.distance0Meters, 1);
        assertEquals(100, split.distance1Meters, 1);
        assertEquals(400, split.distance0Meters + split.distance1Meters, 1e-9);
    }

    @Test
    void ignoresEdgesTheModeMayNotUse () {
        Edge motorway = edge(1, 5, 6, -200, 10, 200, 10, 400, StreetClass.MOTORWAY);
        OriginPoint point = origin(0, 0);
        Split split = Split.find(point.lat(), point.lon(), 150, List.of(motorway, near), StreetMode.WALK);
        assertEquals(7, split.edge.id);
        split = Split.find(point.lat(), point.lon(), 150, List.of(motorway, near), StreetMode.CAR);
        assertEquals(1, split.edge.id);
    }

    @Test
    void nothingBeyondRadius () {
        OriginPoint point = origin(0, -100);
        assertNull(Split.find(point.lat(), point.lon(), 100, List.of(near, far), StreetMode.WALK));
        assertNull(Split.find(point.lat(), point.lon(), 100, List.of(), StreetMode.WALK));
    }

    @Test
    void distanceTiesFavorLowerEdgeId () {
        // Both edges run along the same line.
        Edge a = edge(12, 1, 2, -100, 0, 100, 0, 200, StreetClass.FOOTWAY);
        Edge b = edge(11, 3, 4, -100, 0, 100, 0, 200, StreetClass.FOOTWAY);
        OriginPoint point = origin(0, 20);
        assertEquals(11, Split.find(point.lat(), point.lon(), 100, List.of(a, b), StreetMode.WALK).edge.id);
        assertEquals(11, Split.find(point.lat(), point.lon(), 100, List.of(b, a), StreetMode.WALK).edge.id);
    }

    @Test
    void connectorHalvesLinkEndNodesThroughOrigin () {
        Edge oneWay = TestNetworks.straightEdge(9, 1, 2, -200, 0, 200, 0, 400, StreetClass.PRIMARY)
                .maxSpeedForwardKph(50.0)
                .build();
        OriginPoint point = origin(-100, 5);
        OriginConnector connector = Split.find(point.lat(), point.lon(), 100, List.of(oneWay), StreetMode.CAR)
                .toConnector(2);

        assertEquals(2, connector.originIndex);
        assertEquals(OriginConnector.connectorNodeId(2), connector.nodeId);
        assertTrue(OriginConnector.isSynthetic(connector.nodeId));
        assertEquals(9, connector.splitEdgeId);

        Edge toSplit = connector.toSplit;
        Edge fromSplit = connector.fromSplit;
        assertEquals(1, toSplit.sourceNode);
        assertEquals(connector.nodeId, toSplit.targetNode);
        assertEquals(connector.nodeId, fromSplit.sourceNode);
        assertEquals(2, fromSplit.targetNode);
        assertTrue(OriginConnector.isSynthetic(toSplit.id));
        assertTrue(OriginConnector.isSynthetic(fromSplit.id));
        assertEquals(100, toSplit.lengthM, 1);
        assertEquals(300, fromSplit.lengthM, 1);
        // The halves keep the speeds of the edge, so the origin cannot drive against the one-way direction.
        assertEquals(50.0, (double) toSplit.maxSpeedForwardKph);
        assertNull(fromSplit.maxSpeedReverseKph);
        assertEquals(StreetClass.PRIMARY, fromSplit.streetClass);
        // The halves meet at the projected point.
        assertEquals(toSplit.getFixedLat(toSplit.pointCount() - 1), fromSplit.getFixedLat(0));
        assertEquals(toSplit.getFixedLon(toSplit.pointCount() - 1), fromSplit.getFixedLon(0));
    }
}

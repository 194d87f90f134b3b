package com.conveyal.catchment.streets;

import com.conveyal.catchment.common.GeometryUtils;
import com.conveyal.catchment.common.JsonUtilities;
import com.conveyal.catchment.common.SpatialCells;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EdgeTest {

    @Test
    void derivesLengthAndCellsFromGeometry () {
        Edge edge = Edge.builder()
                .id(4)
                .sourceNode(10)
                .targetNode(11)
                .coordinates(new double[][] {
                        {TestNetworks.lon(0), TestNetworks.lat(0)},
                        {TestNetworks.lon(300), TestNetworks.lat(0)},
                        {TestNetworks.lon(300), TestNetworks.lat(400)}
                })
                .build();
        assertEquals(700, edge.lengthM, 2);
        assertEquals(edge.lengthM, edge.lengthProjected, 0);
        assertEquals(3, edge.pointCount());
        assertEquals(SpatialCells.fineCellForPoint(TestNetworks.CENTER_LAT, TestNetworks.CENTER_LON), edge.fineCell);
        assertEquals(SpatialCells.coarseParent(edge.fineCell), edge.coarseCell);
        assertEquals(StreetClass.UNKNOWN, edge.streetClass);
        assertEquals(0, edge.surfaceImpedanceOrZero());
        assertEquals(0, edge.slopeImpedance(true));
    }

    @Test
    void readsFromJson () {
        String json = "{" +
                "id: 77, sourceNode: 1, targetNode: 2, lengthM: 120.5, streetClass: 'living_street'," +
                "slopeImpedanceForward: 0.25, maxSpeedForwardKph: 20," +
                "coordinates: [[12.6782, 53.3177], [12.6800, 53.3177]]" +
                "}";
        Edge edge = JsonUtilities.objectFromJson(json.replace('\'', '"'), Edge.class);
        assertEquals(77, edge.id);
        assertEquals(120.5, edge.lengthM, 0);
        assertEquals(StreetClass.LIVING_STREET, edge.streetClass);
        assertEquals(0.25, edge.slopeImpedance(false), 0);
        assertEquals(0, edge.slopeImpedance(true), 0);
        assertEquals(20, edge.maxSpeedForwardKph, 0);
        assertNull(edge.maxSpeedReverseKph);
        assertEquals(GeometryUtils.floatingDegreesToFixed(53.3177), edge.getFixedLat(1));
        assertEquals(12.68, edge.getGeometry().getCoordinateN(1).x, 1e-9);
    }

    @Test
    void unknownStreetClassesAreKept () {
        assertEquals(StreetClass.UNKNOWN, StreetClass.forName("raceway"));
        assertEquals(StreetClass.MOTORWAY_LINK, StreetClass.forName("Motorway_Link"));
    }

    @Test
    void needsTwoPoints () {
        Edge.Builder builder = Edge.builder().id(1).coordinates(new double[][] {{12.0, 53.0}});
        assertThrows(IllegalStateException.class, builder::build);
        assertThrows(IllegalArgumentException.class,
                () -> Edge.builder().coordinates(new double[][] {{12.0, 89.0}, {12.0, 89.1}}));
    }
}

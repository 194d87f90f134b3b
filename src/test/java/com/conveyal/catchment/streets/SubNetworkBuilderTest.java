package com.conveyal.catchment.streets;

import com.conveyal.catchment.profile.StreetMode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.conveyal.catchment.streets.TestNetworks.edge;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubNetworkBuilderTest {

    private final Edge a = edge(1, 1, 2, 0, 0, 100, 0, 100, StreetClass.RESIDENTIAL);
    private final Edge b = edge(2, 2, 3, 100, 0, 200, 0, 100, StreetClass.RESIDENTIAL);
    private final Edge c = edge(3, 3, 4, 200, 0, 300, 0, 100, StreetClass.RESIDENTIAL);

    @Test
    void addingAnExistingIdReplacesTheEdge () {
        SubNetworkBuilder builder = new SubNetworkBuilder();
        builder.addAll(List.of(a, b, c));
        Edge longerB = b.toBuilder().lengthM(250).build();
        builder.add(longerB);
        assertEquals(3, builder.getLiveEdgeCount());
        assertSame(longerB, builder.get(2));

        SubNetwork subNetwork = builder.build(new EdgeCostCalculator.Distance());
        assertEquals(3, subNetwork.getEdgeCount());
        double total = 0;
        for (int e = 0; e < subNetwork.getEdgeCount(); e++) {
            total += subNetwork.getForwardCost(e);
        }
        assertEquals(450, total, 1e-9);
    }

    @Test
    void deletedEdgesAreLeftOut () {
        SubNetworkBuilder builder = new SubNetworkBuilder();
        builder.addAll(List.of(a, b, c));
        assertTrue(builder.delete(2));
        assertFalse(builder.delete(2));
        assertFalse(builder.delete(99));
        assertFalse(builder.contains(2));
        assertNull(builder.get(2));
        assertEquals(2, builder.getLiveEdgeCount());

        SubNetwork subNetwork = builder.build(new EdgeCostCalculator.Distance());
        for (Edge edge : subNetwork.getEdges()) {
            assertTrue(edge.id != 2);
        }
    }

    @Test
    void costsAreComputedOncePerLiveEdge () {
        SubNetworkBuilder builder = new SubNetworkBuilder();
        builder.addAll(List.of(a, b, c));
        builder.add(b.toBuilder().lengthM(10).build());
        builder.delete(3);
        List<Long> forwardCalls = new ArrayList<>();
        EdgeCostCalculator counting = new EdgeCostCalculator() {
            @Override
            public double forwardCost (Edge edge) {
                forwardCalls.add(edge.id);
                return edge.lengthM;
            }

            @Override
            public double reverseCost (Edge edge) {
                return edge.lengthM;
            }
        };
        builder.build(counting);
        assertEquals(List.of(1L, 2L), forwardCalls);
    }

    @Test
    void infeasibleDirectionsHaveNoArcs () {
        Edge oneWay = TestNetworks.straightEdge(5, 1, 2, 0, 0, 100, 0, 100, StreetClass.PRIMARY)
                .maxSpeedForwardKph(30.0)
                .build();
        Edge closed = edge(6, 2, 3, 100, 0, 200, 0, 100, StreetClass.PRIMARY);
        SubNetworkBuilder builder = new SubNetworkBuilder();
        builder.addAll(List.of(oneWay, closed));
        SubNetwork subNetwork = builder.build(new EdgeCostCalculator.Car());

        int v1 = subNetwork.getVertexForNode(1);
        int v2 = subNetwork.getVertexForNode(2);
        int v3 = subNetwork.getVertexForNode(3);
        assertEquals(1, subNetwork.getOutgoingArcs(v1).size());
        assertEquals(v2, subNetwork.getArcDestination(subNetwork.getOutgoingArcs(v1).get(0)));
        assertEquals(0, subNetwork.getOutgoingArcs(v2).size());
        assertEquals(0, subNetwork.getOutgoingArcs(v3).size());
        assertEquals(-1, subNetwork.getVertexForNode(42));
    }

    @Test
    void connectorsBecomeSearchRoots () {
        SubNetworkBuilder builder = new SubNetworkBuilder();
        builder.addAll(List.of(a, b, c));
        Split split = Split.find(TestNetworks.lat(10), TestNetworks.lon(150), 100, List.of(a, b, c),
                StreetMode.WALK);
        OriginConnector connector = split.toConnector(0);
        builder.addConnector(connector);
        assertEquals(5, builder.getLiveEdgeCount());
        assertEquals(1, builder.getRootNodes().size());
        assertEquals(connector.nodeId, builder.getRootNodes().get(0));

        SubNetwork subNetwork = builder.build(new EdgeCostCalculator.Distance());
        assertEquals(1, subNetwork.getRootVertices().size());
        int root = subNetwork.getRootVertices().get(0);
        assertEquals(connector.nodeId, subNetwork.getNodeId(root));
        // One arc back along the first half to node 2, one forward along the second half to node 3.
        assertEquals(2, subNetwork.getOutgoingArcs(root).size());
    }
}

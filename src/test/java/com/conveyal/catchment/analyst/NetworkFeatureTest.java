package com.conveyal.catchment.analyst;

import com.conveyal.catchment.profile.OriginPoint;
import com.conveyal.catchment.profile.StreetMode;
import com.conveyal.catchment.streets.Edge;
import com.conveyal.catchment.streets.EdgeCostCalculator;
import com.conveyal.catchment.streets.OriginConnector;
import com.conveyal.catchment.streets.ReachabilityResult;
import com.conveyal.catchment.streets.ReachabilityRouter;
import com.conveyal.catchment.streets.Split;
import com.conveyal.catchment.streets.StreetClass;
import com.conveyal.catchment.streets.SubNetworkBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.conveyal.catchment.streets.TestNetworks.edge;
import static com.conveyal.catchment.streets.TestNetworks.origin;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NetworkFeatureTest {

    private static final EdgeCostCalculator ONE_METER_PER_SECOND = new EdgeCostCalculator.Walk(1);

    /** Three 100 m footways in a row running east from the center, nodes 1 to 4. */
    private static final List<Edge> LINE = List.of(
            edge(100, 1, 2, 0, 0, 100, 0, 100, StreetClass.FOOTWAY),
            edge(101, 2, 3, 100, 0, 200, 0, 100, StreetClass.FOOTWAY),
            edge(102, 3, 4, 200, 0, 300, 0, 100, StreetClass.FOOTWAY)
    );

    private static ReachabilityResult search (double budget, double... originsEast) {
        SubNetworkBuilder builder = new SubNetworkBuilder();
        builder.addAll(LINE);
        for (int i = 0; i < originsEast.length; i++) {
            OriginPoint origin = origin(originsEast[i], 0);
            builder.addConnector(Split.find(origin.lat(), origin.lon(), 50, LINE, StreetMode.WALK).toConnector(i));
        }
        return new ReachabilityRouter(builder.build(ONE_METER_PER_SECOND), budget).route();
    }

    private static List<NetworkFeature> featuresFor (List<NetworkFeature> features, long edgeId) {
        return features.stream().filter(f -> f.edgeId == edgeId).collect(Collectors.toList());
    }

    @Test
    void fullyTraversedEdgesAreWhole () {
        List<NetworkFeature> features = NetworkFeature.forResult(search(150, 0));
        List<NetworkFeature> first = featuresFor(features, 100);
        assertEquals(1, first.size());
        assertFalse(first.get(0).partial);
        assertEquals(100, first.get(0).cost, 1e-6);
        assertEquals(LINE.get(0).getGeometry().getLength(), first.get(0).geometry.getLength(), 1e-12);
    }

    @Test
    void partlyReachableEdgesAreClippedAtTheBudget () {
        List<NetworkFeature> features = NetworkFeature.forResult(search(150, 0));
        List<NetworkFeature> second = featuresFor(features, 101);
        assertEquals(1, second.size());
        NetworkFeature clipped = second.get(0);
        assertTrue(clipped.partial);
        assertEquals(150, clipped.cost, 1e-9);
        double fullLength = LINE.get(1).getGeometry().getLength();
        assertEquals(0.5 * fullLength, clipped.geometry.getLength(), fullLength * 0.01);
        // The clipped part starts at the reached end of the edge.
        assertTrue(clipped.geometry.getStartPoint().equalsExact(LINE.get(1).getGeometry().getStartPoint(), 1e-9));

        assertTrue(featuresFor(features, 102).isEmpty());
    }

    @Test
    void connectorHalvesAreReported () {
        List<NetworkFeature> features = NetworkFeature.forResult(search(150, 0));
        assertEquals(1, featuresFor(features, OriginConnector.connectorEdgeId(0, 1)).size());
    }

    @Test
    void partsReachedFromBothEnds () {
        // Origins at both ends of the line reach nodes 2 and 3 after 100 seconds.
        List<NetworkFeature> meeting = featuresFor(NetworkFeature.forResult(search(150, 0, 300)), 101);
        assertEquals(1, meeting.size());
        assertTrue(meeting.get(0).partial);
        assertEquals(LINE.get(1).getGeometry().getLength(), meeting.get(0).geometry.getLength(), 1e-12);

        List<NetworkFeature> gap = featuresFor(NetworkFeature.forResult(search(140, 0, 300)), 101);
        assertEquals(2, gap.size());
        double fullLength = LINE.get(1).getGeometry().getLength();
        for (NetworkFeature part : gap) {
            assertTrue(part.partial);
            assertEquals(0.4 * fullLength, part.geometry.getLength(), fullLength * 0.01);
        }
    }
}

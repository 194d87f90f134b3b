package com.conveyal.catchment.streets;

import com.conveyal.catchment.profile.CostBudget;
import com.conveyal.catchment.profile.StreetMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.conveyal.catchment.streets.TestNetworks.straightEdge;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CostModelTest {

    private static final double DELTA = 1e-9;

    private static Edge.Builder edge (double lengthM, StreetClass streetClass) {
        return straightEdge(1, 1, 2, 0, 0, lengthM, 0, lengthM, streetClass);
    }

    /** A one-way street: 200 m with a 50 km/h limit forward and none in reverse. */
    @Test
    void carRespectsOneWayStreets () {
        Edge oneWay = edge(200, StreetClass.PRIMARY).maxSpeedForwardKph(50.0).build();
        EdgeCostCalculator car = CostModel.forMode(StreetMode.CAR, CostBudget.Kind.TIME, 0, 0);
        assertEquals(200 / (50 * 0.7 / 3.6), car.forwardCost(oneWay), DELTA);
        assertEquals(20.57, car.forwardCost(oneWay), 0.01);
        assertFalse(EdgeCostCalculator.isFeasible(car.reverseCost(oneWay)));
    }

    @Test
    void carUsesReverseSpeedWhenPresent () {
        Edge twoWay = edge(1000, StreetClass.RESIDENTIAL).maxSpeedForwardKph(30.0).maxSpeedReverseKph(50.0).build();
        EdgeCostCalculator car = CostModel.forMode(StreetMode.CAR, CostBudget.Kind.TIME, 0, 0);
        assertEquals(1000 / (30 * 0.7 / 3.6), car.forwardCost(twoWay), DELTA);
        assertEquals(1000 / (50 * 0.7 / 3.6), car.reverseCost(twoWay), DELTA);
    }

    @Test
    void carEdgeWithoutSpeedsIsClosed () {
        Edge noSpeeds = edge(100, StreetClass.SERVICE).build();
        EdgeCostCalculator car = CostModel.forMode(StreetMode.CAR, CostBudget.Kind.TIME, 0, 0);
        assertFalse(EdgeCostCalculator.isFeasible(car.forwardCost(noSpeeds)));
        assertFalse(EdgeCostCalculator.isFeasible(car.reverseCost(noSpeeds)));
    }

    @Test
    void walkingIgnoresImpedances () {
        Edge hill = edge(100, StreetClass.FOOTWAY)
                .slopeImpedanceForward(0.5)
                .slopeImpedanceReverse(-0.2)
                .surfaceImpedance(0.3)
                .build();
        // 5 km/h
        EdgeCostCalculator walk = CostModel.forMode(StreetMode.WALK, CostBudget.Kind.TIME, 5, 5);
        assertEquals(72, walk.forwardCost(hill), DELTA);
        assertEquals(72, walk.reverseCost(hill), DELTA);
    }

    @Test
    void cyclingAppliesSlopePerDirectionAndSurface () {
        Edge hill = edge(100, StreetClass.RESIDENTIAL)
                .slopeImpedanceForward(0.5)
                .slopeImpedanceReverse(-0.2)
                .surfaceImpedance(0.1)
                .build();
        // 18 km/h is 5 m/s.
        EdgeCostCalculator bicycle = CostModel.forMode(StreetMode.BICYCLE, CostBudget.Kind.TIME, 18, 18);
        assertEquals(100 * 1.6 / 5, bicycle.forwardCost(hill), DELTA);
        assertEquals(100 * 0.9 / 5, bicycle.reverseCost(hill), DELTA);

        EdgeCostCalculator pedelec = CostModel.forMode(StreetMode.PEDELEC, CostBudget.Kind.TIME, 18, 18);
        assertEquals(100 * 1.1 / 5, pedelec.forwardCost(hill), DELTA);
        assertEquals(100 * 1.1 / 5, pedelec.reverseCost(hill), DELTA);
    }

    @Test
    void absentImpedancesCountAsZero () {
        Edge flat = edge(90, StreetClass.CYCLEWAY).build();
        EdgeCostCalculator bicycle = CostModel.forMode(StreetMode.BICYCLE, CostBudget.Kind.TIME, 18, 18);
        assertEquals(18, bicycle.forwardCost(flat), DELTA);
        assertEquals(18, bicycle.reverseCost(flat), DELTA);
    }

    @Test
    void cyclistsDismountOnPedestrianClasses () {
        Edge plaza = edge(100, StreetClass.PEDESTRIAN).surfaceImpedance(0.5).slopeImpedanceForward(0.5).build();
        Edge crosswalk = edge(10, StreetClass.CROSSWALK).build();
        // Riding at 18 km/h, pushing at 3.6 km/h which is 1 m/s.
        EdgeCostCalculator bicycle = CostModel.forMode(StreetMode.BICYCLE, CostBudget.Kind.TIME, 18, 3.6);
        assertEquals(100, bicycle.forwardCost(plaza), DELTA);
        assertEquals(100, bicycle.reverseCost(plaza), DELTA);
        assertEquals(10, bicycle.forwardCost(crosswalk), DELTA);
    }

    /** Distance budgets cost every edge its length, even where a car could not drive at all. */
    @ParameterizedTest
    @EnumSource(StreetMode.class)
    void distanceBudgetsUseLength (StreetMode mode) {
        Edge oneWay = edge(250, StreetClass.TERTIARY).maxSpeedForwardKph(50.0).build();
        EdgeCostCalculator distance = CostModel.forMode(mode, CostBudget.Kind.DISTANCE, 0, 0);
        assertEquals(250, distance.forwardCost(oneWay), DELTA);
        assertEquals(250, distance.reverseCost(oneWay), DELTA);
    }

    @Test
    void activeModesNeedPositiveSpeed () {
        assertThrows(IllegalArgumentException.class,
                () -> CostModel.forMode(StreetMode.WALK, CostBudget.Kind.TIME, 0, 5));
        assertThrows(IllegalArgumentException.class,
                () -> CostModel.forMode(StreetMode.BICYCLE, CostBudget.Kind.TIME, 15, -1));
        assertTrue(CostModel.forMode(StreetMode.CAR, CostBudget.Kind.TIME, 0, 0) instanceof EdgeCostCalculator.Car);
    }
}

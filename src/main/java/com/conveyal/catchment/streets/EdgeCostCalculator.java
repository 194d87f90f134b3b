package com.conveyal.catchment.streets;

/**
 * Computes the cost of traversing an edge in each of its two directions. Implementations are pure functions of the
 * edge and the parameters they were constructed with, and are called once per edge after the sub-network has been
 * assembled. Costs are seconds for time budgets and meters for distance budgets.
 */
public interface EdgeCostCalculator {

    /** Returned for a direction that may not be traversed at all. Such arcs are dropped before the search. */
    double INFEASIBLE = Double.POSITIVE_INFINITY;

    /** Cost of traversing the edge from its source node to its target node. */
    double forwardCost (Edge edge);

    /** Cost of traversing the edge from its target node back to its source node. */
    double reverseCost (Edge edge);

    static boolean isFeasible (double cost) {
        return cost < INFEASIBLE;
    }

    /** Walking at a constant speed, the same in both directions. */
    class Walk implements EdgeCostCalculator {
        private final double speedMetersPerSecond;

        public Walk (double speedMetersPerSecond) {
            this.speedMetersPerSecond = speedMetersPerSecond;
        }

        @Override
        public double forwardCost (Edge edge) {
            return edge.lengthM / speedMetersPerSecond;
        }

        @Override
        public double reverseCost (Edge edge) {
            return edge.lengthM / speedMetersPerSecond;
        }
    }

    /**
     * Cycling, slowed down by slope (per direction) and surface impedances. Edges of classes where riders must
     * dismount are traversed at the dismount speed without impedances. Pedelecs ignore the slope impedance.
     */
    class Cycling implements EdgeCostCalculator {
        private final double speedMetersPerSecond;
        private final double dismountSpeedMetersPerSecond;
        private final boolean includeSlope;

        public Cycling (double speedMetersPerSecond, double dismountSpeedMetersPerSecond, boolean includeSlope) {
            this.speedMetersPerSecond = speedMetersPerSecond;
            this.dismountSpeedMetersPerSecond = dismountSpeedMetersPerSecond;
            this.includeSlope = includeSlope;
        }

        @Override
        public double forwardCost (Edge edge) {
            return cost(edge, false);
        }

        @Override
        public double reverseCost (Edge edge) {
            return cost(edge, true);
        }

        private double cost (Edge edge, boolean reverse) {
            if (edge.streetClass.requiresDismount()) {
                return edge.lengthM / dismountSpeedMetersPerSecond;
            }
            double impedance = edge.surfaceImpedanceOrZero();
            if (includeSlope) {
                impedance += edge.slopeImpedance(reverse);
            }
            return edge.lengthM * (1 + impedance) / speedMetersPerSecond;
        }
    }

    /**
     * Driving at a fixed share of the posted speed limit. A direction without a speed limit is closed to cars, which
     * is how one-way streets are represented in the network.
     */
    class Car implements EdgeCostCalculator {
        /** Cars are assumed to average this fraction of the speed limit. */
        public static final double SPEED_LIMIT_FACTOR = 0.7;

        @Override
        public double forwardCost (Edge edge) {
            return cost(edge.lengthM, edge.maxSpeedForwardKph);
        }

        @Override
        public double reverseCost (Edge edge) {
            return cost(edge.lengthM, edge.maxSpeedReverseKph);
        }

        private static double cost (double lengthM, Double maxSpeedKph) {
            if (maxSpeedKph == null || maxSpeedKph <= 0) {
                return INFEASIBLE;
            }
            return lengthM / (maxSpeedKph * SPEED_LIMIT_FACTOR / 3.6);
        }
    }

    /** Distance budgets: the cost is the length in meters, whatever the mode. */
    class Distance implements EdgeCostCalculator {
        @Override
        public double forwardCost (Edge edge) {
            return edge.lengthM;
        }

        @Override
        public double reverseCost (Edge edge) {
            return edge.lengthM;
        }
    }
}

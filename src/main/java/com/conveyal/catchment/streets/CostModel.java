package com.conveyal.catchment.streets;

import com.conveyal.catchment.profile.CostBudget;
import com.conveyal.catchment.profile.StreetMode;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Selects the edge cost function for a request. Time budgets use a table indexed by mode, distance budgets use the
 * edge length for every mode.
 */
public abstract class CostModel {

    /** Speeds are passed to the table in meters per second. */
    private record Speeds (double speed, double dismountSpeed) { }

    private static final Map<StreetMode, Function<Speeds, EdgeCostCalculator>> TIME_COST_FUNCTIONS =
            new EnumMap<>(StreetMode.class);

    static {
        TIME_COST_FUNCTIONS.put(StreetMode.WALK, s -> new EdgeCostCalculator.Walk(s.speed));
        TIME_COST_FUNCTIONS.put(StreetMode.BICYCLE, s -> new EdgeCostCalculator.Cycling(s.speed, s.dismountSpeed, true));
        TIME_COST_FUNCTIONS.put(StreetMode.PEDELEC, s -> new EdgeCostCalculator.Cycling(s.speed, s.dismountSpeed, false));
        TIME_COST_FUNCTIONS.put(StreetMode.CAR, s -> new EdgeCostCalculator.Car());
    }

    /**
     * @param speedKph travel speed for active modes, ignored for cars which use per-edge speed limits.
     * @param dismountSpeedKph speed of cyclists pushing their bikes.
     */
    public static EdgeCostCalculator forMode (StreetMode mode, CostBudget.Kind budgetKind,
                                              double speedKph, double dismountSpeedKph) {
        if (budgetKind == CostBudget.Kind.DISTANCE) {
            return new EdgeCostCalculator.Distance();
        }
        if (mode.isActive()) {
            checkArgument(speedKph > 0, "Speed for %s must be positive, was %s km/h.", mode, speedKph);
            checkArgument(dismountSpeedKph > 0, "Dismount speed must be positive, was %s km/h.", dismountSpeedKph);
        }
        return TIME_COST_FUNCTIONS.get(mode).apply(new Speeds(speedKph / 3.6, dismountSpeedKph / 3.6));
    }

}

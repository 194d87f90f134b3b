package com.conveyal.catchment.profile;

import com.conveyal.catchment.analyst.IsochroneGenerator;
import com.conveyal.catchment.common.JsonUtilities;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * All the parameters of one catchment area computation, as deserialized from JSON. Optional parameters are null when
 * not supplied, and the getters fill in the defaults.
 */
public class CatchmentAreaRequest {

    public static final int DEFAULT_STEPS = 3;

    /** The points travel starts from. All of them start at cost zero. */
    public List<OriginPoint> originPoints = new ArrayList<>();

    public StreetMode mode = StreetMode.WALK;

    public CostBudget costBudget;

    public ResultType resultType = ResultType.POLYGON;

    /** Optional id of a scenario overlay to apply on top of the base network. */
    public String scenarioId;

    /** When true, each persisted isochrone band excludes the band before it. */
    public boolean polygonDifference = false;

    /** Number of isochrone bands, evenly spaced up to the budget. */
    public Integer steps;

    /** Percentile of the 3x3 neighborhood used to smooth the cost surface before contouring. */
    public Integer percentile;

    /** Travel speed for active modes in km/h. Ignored for cars. */
    public Double speedKph;

    /** Speed of cyclists pushing their bikes in km/h, defaults to the travel speed. */
    public Double dismountSpeedKph;

    public static CatchmentAreaRequest fromJson (String json) {
        return JsonUtilities.objectFromJson(json, CatchmentAreaRequest.class);
    }

    public double getSpeedKph () {
        return speedKph != null ? speedKph : mode.defaultSpeedKph;
    }

    public double getDismountSpeedKph () {
        return dismountSpeedKph != null ? dismountSpeedKph : getSpeedKph();
    }

    public int getSteps () {
        return steps != null ? steps : DEFAULT_STEPS;
    }

    public int getPercentile () {
        return percentile != null ? percentile : IsochroneGenerator.DEFAULT_PERCENTILE;
    }

    /** Throws IllegalArgumentException or NullPointerException describing the first problem found. */
    public void validate () {
        checkNotNull(mode, "A travel mode is required.");
        checkNotNull(costBudget, "A cost budget is required.");
        checkNotNull(resultType, "A result type is required.");
        checkArgument(originPoints != null && !originPoints.isEmpty(), "At least one origin point is required.");
        for (OriginPoint origin : originPoints) {
            checkNotNull(origin, "Origin points must not be null.");
        }
        checkArgument(getSteps() >= 1, "Steps must be at least 1, was %s.", getSteps());
        checkArgument(getPercentile() >= 0 && getPercentile() <= 100,
                "Percentile must be between 0 and 100, was %s.", getPercentile());
        if (mode.isActive()) {
            checkArgument(getSpeedKph() > 0, "Speed must be positive, was %s km/h.", getSpeedKph());
            checkArgument(getDismountSpeedKph() > 0, "Dismount speed must be positive.");
        }
    }
}

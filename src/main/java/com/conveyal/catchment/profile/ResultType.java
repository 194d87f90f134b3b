package com.conveyal.catchment.profile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** The shape in which a catchment area is returned. */
public enum ResultType {
    /** Nested isochrone polygons, one per threshold. */
    POLYGON,
    /** The reachable edges with their arrival costs. */
    NETWORK,
    /** Web Mercator grid cells with the lowest arrival cost of the nodes inside them. */
    GRID;

    @JsonValue
    public String jsonName () {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResultType forName (String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}

package com.conveyal.catchment.profile;

import com.conveyal.catchment.streets.StreetClass;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import static com.conveyal.catchment.streets.StreetClass.*;

/**
 * Represents a travel mode used to traverse edges in the street network. Each mode has a fixed set of street classes
 * it may use, and active modes have a default travel speed used when the request does not supply one.
 */
public enum StreetMode {
    WALK(5, 12, EnumSet.complementOf(EnumSet.of(MOTORWAY, MOTORWAY_LINK, CYCLEWAY))),
    BICYCLE(15, 12, EnumSet.complementOf(EnumSet.of(MOTORWAY, MOTORWAY_LINK, TRUNK, STEPS))),
    PEDELEC(23, 12, EnumSet.complementOf(EnumSet.of(MOTORWAY, MOTORWAY_LINK, TRUNK, STEPS))),
    CAR(0, 10, EnumSet.of(MOTORWAY, MOTORWAY_LINK, TRUNK, PRIMARY, SECONDARY, TERTIARY, UNCLASSIFIED, RESIDENTIAL,
            LIVING_STREET, SERVICE, PARKING_AISLE, DRIVEWAY, ALLEY, TRACK, UNKNOWN));

    /** Default speed for active modes in km/h. Car speeds come from the edges, so this is zero for CAR. */
    public final double defaultSpeedKph;

    /** Web Mercator zoom level of grids and isochrone rasters computed for this mode. */
    public final int gridZoom;

    private final Set<StreetClass> allowedClasses;

    StreetMode (double defaultSpeedKph, int gridZoom, Set<StreetClass> allowedClasses) {
        this.defaultSpeedKph = defaultSpeedKph;
        this.gridZoom = gridZoom;
        this.allowedClasses = allowedClasses;
    }

    public boolean allows (StreetClass streetClass) {
        return allowedClasses.contains(streetClass);
    }

    /** Active modes travel at a speed supplied with the request rather than per-edge speed limits. */
    public boolean isActive () {
        return this != CAR;
    }

    @JsonValue
    public String jsonName () {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StreetMode forName (String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}

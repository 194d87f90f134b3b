package com.conveyal.catchment.streets;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Road classes carried on every edge of the network, following the highway classes of the source network data.
 * Which modes may use an edge depends only on its class, see StreetMode.
 */
public enum StreetClass {
    MOTORWAY,
    MOTORWAY_LINK,
    TRUNK,
    PRIMARY,
    SECONDARY,
    TERTIARY,
    UNCLASSIFIED,
    RESIDENTIAL,
    LIVING_STREET,
    SERVICE,
    PARKING_AISLE,
    DRIVEWAY,
    ALLEY,
    TRACK,
    PEDESTRIAN,
    FOOTWAY,
    STEPS,
    PATH,
    CYCLEWAY,
    BRIDLEWAY,
    CROSSWALK,
    UNKNOWN;

    /** Cyclists must push their bike on these classes, so they move at dismount speed. */
    public boolean requiresDismount () {
        return this == PEDESTRIAN || this == CROSSWALK;
    }

    /** The lower case name used in the database and in JSON, e.g. "living_street". */
    @JsonValue
    public String databaseName () {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Unrecognized or missing names map to UNKNOWN rather than failing. */
    @JsonCreator
    public static StreetClass forName (String name) {
        if (name == null) return UNKNOWN;
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}

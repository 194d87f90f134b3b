package com.conveyal.catchment.profile;

import com.conveyal.catchment.common.GeometryUtils;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.locationtech.jts.geom.Coordinate;

/** A point from which travel starts, in WGS84 degrees. */
public record OriginPoint (double lat, double lon) {

    @JsonCreator
    public OriginPoint (@JsonProperty("lat") double lat, @JsonProperty("lon") double lon) {
        GeometryUtils.checkLat(lat);
        GeometryUtils.checkLon(lon);
        this.lat = lat;
        this.lon = lon;
    }

    public Coordinate toCoordinate () {
        return new Coordinate(lon, lat);
    }
}

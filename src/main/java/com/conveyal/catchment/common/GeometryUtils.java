package com.conveyal.catchment.common;

import org.apache.commons.math3.util.FastMath;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineSegment;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Static geometry helpers shared by the network, routing and isochrone code: distances on the sphere, conversions
 * between fixed-point and floating-point degrees, and envelope construction around points.
 */
public abstract class GeometryUtils {

    public static final GeometryFactory geometryFactory = new GeometryFactory();

    /** Average of polar and equatorial radii, https://en.wikipedia.org/wiki/Earth */
    public static final double RADIUS_OF_EARTH_M = 6_367_450;

    // average of equatorial and meriodonal circumferences, https://en.wikipedia.org/wiki/Earth
    public static final double EARTH_CIRCUMFERENCE_METERS = 40041.4385 * 1000;

    /** Rough length of a degree of latitude, used where fixed-point projections only need to be consistent. */
    public static final double METERS_PER_DEGREE_LAT = 111111.111;

    /**
     * Coordinates are stored as fixed-point integers. This is the number of fixed units per degree. Seven decimal
     * places is about 1cm precision at the equator and still fits a full longitude range in a signed int.
     */
    public static final double FIXED_FACTOR = 1e7;

    public static int floatingDegreesToFixed (double degrees) {
        return (int) Math.round(degrees * FIXED_FACTOR);
    }

    public static double fixedDegreesToFloating (int fixed) {
        return fixed / FIXED_FACTOR;
    }

    /**
     * Haversine formula for distance on the sphere.
     * @return distance in meters
     */
    public static double distance (double lat0, double lon0, double lat1, double lon1) {
        double theta0 = FastMath.toRadians(lat0);
        double theta1 = FastMath.toRadians(lat1);
        double lambda0 = FastMath.toRadians(lon0);
        double lambda1 = FastMath.toRadians(lon1);

        double thetaComb = (theta1 - theta0) / 2;
        double lambdaComb = (lambda1 - lambda0) / 2;
        double sin2theta = FastMath.pow(FastMath.sin(thetaComb), 2);
        double sin2lambda = FastMath.pow(FastMath.sin(lambdaComb), 2);

        double underRadical = sin2theta + FastMath.cos(theta0) * FastMath.cos(theta1) * sin2lambda;
        return 2 * RADIUS_OF_EARTH_M * FastMath.asin(FastMath.sqrt(underRadical));
    }

    /** Distance in meters between two coordinates whose x is longitude and y is latitude. */
    public static double distance (Coordinate c0, Coordinate c1) {
        return distance(c0.y, c0.x, c1.y, c1.x);
    }

    /** Convert meters to degrees of latitude */
    public static double metersToDegreesLatitude (double meters) {
        return meters / EARTH_CIRCUMFERENCE_METERS * 360;
    }

    /** Convert meters to degrees of longitude at the specified latitiude */
    public static double metersToDegreesLongitude (double meters, double degreesLatitude) {
        double cosLat = FastMath.cos(FastMath.toRadians(degreesLatitude));
        return metersToDegreesLatitude(meters) / cosLat;
    }

    /**
     * Project the point (fixedLon, fixedLat) onto the line segment from (fixedLon0, fixedLat0) to
     * (fixedLon1, fixedLat1) and return the fractional distance of the projected location along the segment as a
     * double in the range [0, 1]. All coordinates are fixed-precision geographic.
     * Pass in the cosine of the latitude to avoid repeatedly performing the expensive cosine operation.
     */
    public static double segmentFraction (int fixedLon0, int fixedLat0, int fixedLon1, int fixedLat1,
                                          int fixedLon, int fixedLat, double cosLat) {
        // Scale x by the cosine of the latitude so that both axes have roughly the same units.
        LineSegment seg = new LineSegment(fixedLon0 * cosLat, fixedLat0, fixedLon1 * cosLat, fixedLat1);
        return seg.segmentFraction(new Coordinate(fixedLon * cosLat, fixedLat));
    }

    /**
     * Return a WGS84 envelope (x is longitude) containing every point within radiusMeters of the given point.
     * Longitudes are widened using the latitude of the envelope edge farthest from the equator, so the envelope may
     * be slightly larger than the true buffer but never smaller.
     */
    public static Envelope bufferEnvelope (double lat, double lon, double radiusMeters) {
        checkLat(lat);
        checkLon(lon);
        checkArgument(radiusMeters >= 0, "Buffer radius must be non-negative.");
        double dLat = metersToDegreesLatitude(radiusMeters);
        double extremeLat = Math.min(Math.abs(lat) + dLat, 85);
        double dLon = metersToDegreesLongitude(radiusMeters, extremeLat);
        Envelope envelope = new Envelope(lon, lon, lat, lat);
        envelope.expandBy(dLon, dLat);
        return envelope;
    }

    public static void checkLon (double longitude) {
        checkArgument(Double.isFinite(longitude) && Math.abs(longitude) <= 180,
                "Longitude is not a finite number in the range [-180, 180]: %s", longitude);
    }

    public static void checkLat (double latitude) {
        // Web Mercator stops at about 85 degrees, and so do our tile and pixel numbering schemes.
        checkArgument(Double.isFinite(latitude) && Math.abs(latitude) <= 85.0511,
                "Latitude is not a finite number in the Web Mercator range [-85, 85]: %s", latitude);
    }

}

package com.conveyal.catchment.analyst;

import com.conveyal.catchment.analyst.error.CatchmentAreaException;
import com.conveyal.catchment.common.GeometryUtils;
import org.apache.commons.math3.util.FastMath;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Polygon;

import java.io.Serializable;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkState;
import static org.apache.commons.math3.util.FastMath.atan;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.log;
import static org.apache.commons.math3.util.FastMath.sinh;
import static org.apache.commons.math3.util.FastMath.tan;

/**
 * A rectangular block of Web Mercator pixels at some zoom level, on which reachability grids and isochrone rasters
 * are built. Equals and hashcode are semantic.
 *
 * Pixel numbers follow computer graphics conventions, with y increasing toward the south (down) and x to the east.
 * At zoom zero the world is a single tile 256 pixels square, and each zoom level doubles the resolution.
 * Zoom 12 pixels are about 38 meters across at the equator, zoom 10 pixels about 150 meters.
 */
public class WebMercatorExtents implements Serializable {

    public static final int MIN_ZOOM = 9;
    public static final int MAX_ZOOM = 12;
    private static final int MAX_GRID_CELLS = 5_000_000;

    /** The pixel number of the westernmost pixel (smallest x value). */
    public final int west;

    /**
     * The pixel number of the northernmost pixel (smallest y value in web Mercator, because y increases from north to
     * south in web Mercator).
     */
    public final int north;

    /** Width in web Mercator pixels */
    public final int width;

    /** Height in web Mercator pixels */
    public final int height;

    /** Web mercator zoom level. */
    public final int zoom;

    /**
     * All factory methods for WebMercatorExtents call this constructor, which enforces size constraints that prevent
     * straining or stalling the system.
     */
    public WebMercatorExtents (int west, int north, int width, int height, int zoom) {
        this.west = west;
        this.north = north;
        this.width = width;
        this.height = height;
        this.zoom = zoom;
        checkGridSize();
    }

    /**
     * Construct a WebMercatorExtents that contains all the points inside the supplied WGS84 envelope.
     * Conversion of WGS84 to web Mercator pixels truncates intra-pixel coordinates toward the origin (northwest).
     */
    public static WebMercatorExtents forWgsEnvelope (Envelope wgsEnvelope, int zoom) {
        // Note that web Mercator coordinates increase from north to south, so maximum latitude is minimum Mercator y.
        int north = latToPixel(wgsEnvelope.getMaxY(), zoom);
        int west = lonToPixel(wgsEnvelope.getMinX(), zoom);
        // Find width and height in whole pixels, handling the case where the right envelope edge is on a pixel edge.
        int height = (int) Math.ceil(latToFractionalPixel(wgsEnvelope.getMinY(), zoom) - north);
        int width = (int) Math.ceil(lonToFractionalPixel(wgsEnvelope.getMaxX(), zoom) - west);
        // A degenerate envelope (a single point on a pixel edge) still needs one pixel.
        return new WebMercatorExtents(west, north, Math.max(width, 1), Math.max(height, 1), zoom);
    }

    /** The same extents grown by the given number of pixels on every side. */
    public WebMercatorExtents expand (int pixels) {
        return new WebMercatorExtents(west - pixels, north - pixels, width + 2 * pixels, height + 2 * pixels, zoom);
    }

    /**
     * Produces a new Envelope in WGS84 coordinates that tightly encloses the pixels of this WebMercatorExtents.
     * The edges of that Envelope will run exactly down the borders between neighboring web Mercator pixels.
     */
    public Envelope toWgsEnvelope () {
        double westLon = pixelToLon(west, zoom);
        double northLat = pixelToLat(north, zoom);
        double eastLon = pixelToLon(west + width, zoom);
        double southLat = pixelToLat(north + height, zoom);
        return new Envelope(westLon, eastLon, southLat, northLat);
    }

    public int cellCount () {
        return width * height;
    }

    /** Whether the local pixel coordinates fall within these extents. */
    public boolean contains (int localX, int localY) {
        return localX >= 0 && localY >= 0 && localX < width && localY < height;
    }

    /** Local x of the pixel containing the given longitude, which may be outside these extents. */
    public int localX (double lon) {
        return lonToPixel(lon, zoom) - west;
    }

    /** Local y of the pixel containing the given latitude, which may be outside these extents. */
    public int localY (double lat) {
        return latToPixel(lat, zoom) - north;
    }

    /** Longitude of a fractional local x coordinate, where integer coordinates are pixel centers. */
    public double centeredLocalXToLon (double localX) {
        return pixelToLon(west + localX + 0.5, zoom);
    }

    /** Latitude of a fractional local y coordinate, where integer coordinates are pixel centers. */
    public double centeredLocalYToLat (double localY) {
        return pixelToLat(north + localY + 0.5, zoom);
    }

    /** The outline of a pixel in WGS84 coordinates, given its local coordinates within these extents. */
    public Polygon getPixelGeometry (int localX, int localY) {
        int x = localX + west;
        int y = localY + north;
        double minLon = pixelToLon(x, zoom);
        double maxLon = pixelToLon(x + 1, zoom);
        // The y axis increases from north to south in web Mercator.
        double minLat = pixelToLat(y + 1, zoom);
        double maxLat = pixelToLat(y, zoom);
        return GeometryUtils.geometryFactory.createPolygon(new Coordinate[] {
                new Coordinate(minLon, minLat),
                new Coordinate(minLon, maxLat),
                new Coordinate(maxLon, maxLat),
                new Coordinate(maxLon, minLat),
                new Coordinate(minLon, minLat)
        });
    }

    /** Approximate width of one pixel on the ground at the given latitude, in meters. */
    public static double pixelWidthMeters (double lat, int zoom) {
        return GeometryUtils.EARTH_CIRCUMFERENCE_METERS * FastMath.cos(FastMath.toRadians(lat)) / (Math.pow(2, zoom) * 256);
    }

    // Pixel math. Coordinates are absolute (world) pixel numbers at the given zoom.

    /** Return the absolute (world) x pixel number of all pixels the given line of longitude falls within. */
    public static int lonToPixel (double lon, int zoom) {
        return (int) lonToFractionalPixel(lon, zoom);
    }

    public static double lonToFractionalPixel (double lon, int zoom) {
        return (lon + 180) / 360 * Math.pow(2, zoom) * 256;
    }

    /**
     * Return the longitude of the west edge of any pixel at the given zoom level and x pixel number measured from the
     * west edge of the world (assuming an integer pixel). Noninteger pixels will return locations within that pixel.
     */
    public static double pixelToLon (double xPixel, int zoom) {
        return xPixel / (Math.pow(2, zoom) * 256) * 360 - 180;
    }

    /** Return the absolute (world) y pixel number of all pixels the given line of latitude falls within. */
    public static int latToPixel (double lat, int zoom) {
        return (int) latToFractionalPixel(lat, zoom);
    }

    public static double latToFractionalPixel (double lat, int zoom) {
        double latRad = FastMath.toRadians(lat);
        return (1 - log(tan(latRad) + 1 / cos(latRad)) / Math.PI) * Math.pow(2, zoom - 1) * 256;
    }

    /**
     * Return the latitude of the north edge of any pixel at the given zoom level and y coordinate relative to the top
     * edge of the world (assuming an integer pixel). Noninteger pixels will return locations within the pixel.
     */
    public static double pixelToLat (double yPixel, int zoom) {
        return FastMath.toDegrees(atan(sinh(Math.PI - (yPixel / 256d) / Math.pow(2, zoom) * 2 * Math.PI)));
    }

    /**
     * Reject zoom levels outside the supported range and grids with so many cells that building them would strain
     * the system.
     */
    public void checkGridSize () {
        if (this.zoom < MIN_ZOOM || this.zoom > MAX_ZOOM) {
            throw CatchmentAreaException.badRequest(String.format(
                    "Requested zoom (%s) is outside valid range (%s - %s)", this.zoom, MIN_ZOOM, MAX_ZOOM
            ));
        }
        checkState(width > 0 && height > 0, "Web Mercator extents must have positive width and height.");
        if ((long) this.height * this.width > MAX_GRID_CELLS) {
            throw CatchmentAreaException.badRequest(String.format(
                    "Requested number of grid cells (%s) exceeds limit (%s). Use a smaller budget or a lower zoom level.",
                    (long) this.height * this.width, MAX_GRID_CELLS
            ));
        }
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WebMercatorExtents extents = (WebMercatorExtents) o;
        return west == extents.west && north == extents.north && width == extents.width && height == extents.height && zoom == extents.zoom;
    }

    @Override
    public int hashCode () {
        return Arrays.hashCode(new int[] {west, north, width, height, zoom});
    }

    @Override
    public String toString () {
        return String.format("[%d x %d pixels at (%d, %d) zoom %d]", width, height, west, north, zoom);
    }
}

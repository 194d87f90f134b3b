package com.conveyal.catchment.common;

import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;
import org.apache.commons.math3.util.FastMath;
import org.locationtech.jts.geom.Envelope;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The two-level spatial tiling used to partition the network. Cells are Web Mercator tiles (256 pixels on a side at
 * zoom zero, doubling at each level). Coarse cells at zoom 7 are a few hundred kilometers across and define the
 * network partitions that are loaded and cached as a unit. Fine cells at zoom 13 are a few kilometers across and
 * are used to filter edges within a partition down to those near the origins.
 *
 * A cell id packs the tile x and y numbers at the cell's zoom into one int, x in the high bits. The zoom is not
 * stored in the id, so ids are only comparable to other ids at the same zoom.
 */
public abstract class SpatialCells {

    public static final int COARSE_ZOOM = 7;

    public static final int FINE_ZOOM = 13;

    /** Tile x number containing the given longitude, clamped to the valid range at that zoom. */
    public static int lonToTile (double lon, int zoom) {
        int tiles = 1 << zoom;
        int x = (int) Math.floor((lon + 180) / 360 * tiles);
        return clamp(x, tiles);
    }

    /** Tile y number containing the given latitude. Tile y numbers increase from north to south. */
    public static int latToTile (double lat, int zoom) {
        int tiles = 1 << zoom;
        double latRad = FastMath.toRadians(lat);
        double y = (1 - FastMath.log(FastMath.tan(latRad) + 1 / FastMath.cos(latRad)) / Math.PI) / 2 * tiles;
        return clamp((int) Math.floor(y), tiles);
    }

    private static int clamp (int tile, int tiles) {
        if (tile < 0) return 0;
        if (tile >= tiles) return tiles - 1;
        return tile;
    }

    public static int cellId (int x, int y, int zoom) {
        return x << zoom | y;
    }

    public static int cellX (int cellId, int zoom) {
        return cellId >>> zoom;
    }

    public static int cellY (int cellId, int zoom) {
        return cellId & ((1 << zoom) - 1);
    }

    public static int cellForPoint (double lat, double lon, int zoom) {
        return cellId(lonToTile(lon, zoom), latToTile(lat, zoom), zoom);
    }

    public static int coarseCellForPoint (double lat, double lon) {
        return cellForPoint(lat, lon, COARSE_ZOOM);
    }

    public static int fineCellForPoint (double lat, double lon) {
        return cellForPoint(lat, lon, FINE_ZOOM);
    }

    /** The coarse cell containing the given fine cell. */
    public static int coarseParent (int fineCell) {
        int shift = FINE_ZOOM - COARSE_ZOOM;
        int x = cellX(fineCell, FINE_ZOOM) >> shift;
        int y = cellY(fineCell, FINE_ZOOM) >> shift;
        return cellId(x, y, COARSE_ZOOM);
    }

    /**
     * Return the ids of all cells at the given zoom that intersect the given WGS84 envelope (x is longitude).
     */
    public static TIntSet cellsInEnvelope (Envelope wgsEnvelope, int zoom) {
        checkArgument(!wgsEnvelope.isNull(), "Cannot find cells for an empty envelope.");
        // Mercator y increases southward, so the north edge gives the smallest tile y.
        int minX = lonToTile(wgsEnvelope.getMinX(), zoom);
        int maxX = lonToTile(wgsEnvelope.getMaxX(), zoom);
        int minY = latToTile(Math.min(wgsEnvelope.getMaxY(), 85.0511), zoom);
        int maxY = latToTile(Math.max(wgsEnvelope.getMinY(), -85.0511), zoom);
        TIntSet cells = new TIntHashSet();
        for (int x = minX; x <= maxX; x++) {
            for (int y = minY; y <= maxY; y++) {
                cells.add(cellId(x, y, zoom));
            }
        }
        return cells;
    }

    /** Envelope of a cell in WGS84 degrees, x is longitude. */
    public static Envelope cellEnvelope (int cellId, int zoom) {
        int tiles = 1 << zoom;
        int x = cellX(cellId, zoom);
        int y = cellY(cellId, zoom);
        double west = (double) x / tiles * 360 - 180;
        double east = (double) (x + 1) / tiles * 360 - 180;
        double north = tileToLat(y, tiles);
        double south = tileToLat(y + 1, tiles);
        return new Envelope(west, east, south, north);
    }

    private static double tileToLat (double y, int tiles) {
        return FastMath.toDegrees(FastMath.atan(FastMath.sinh(Math.PI - y / tiles * 2 * Math.PI)));
    }

}

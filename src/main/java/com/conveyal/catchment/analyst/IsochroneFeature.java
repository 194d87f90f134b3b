package com.conveyal.catchment.analyst;

import com.conveyal.catchment.common.GeometryUtils;
import com.google.common.collect.HashMultimap;
import com.google.common.collect.Multimap;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The area within one cost threshold of the origins, as a MultiPolygon in WGS84 coordinates.
 * Traced from a cost surface with the marching squares contour algorithm.
 */
public class IsochroneFeature {
    private static final Logger LOG = LoggerFactory.getLogger(IsochroneFeature.class);

    // maximum number of vertices in a ring
    public static final int MAX_RING_SIZE = 25000;

    /** The smallest valid ring: three distinct points plus the closing point. */
    public static final int MIN_RING_SIZE = 4;

    /** Holes smaller than this (in square degrees) are dropped. About 1 square meter at mid latitudes. */
    private static final double MIN_HOLE_AREA = 1e-10;

    public final MultiPolygon geometry;

    /** The threshold in seconds or meters, depending on the kind of budget. */
    public final double cutoff;

    /** Wrap an existing geometry, for instance one derived from a traced isochrone. */
    public IsochroneFeature (double cutoff, MultiPolygon geometry) {
        this.cutoff = cutoff;
        this.geometry = geometry;
    }

    /**
     * Create an isochrone for the given cutoff, using a Marching Squares algorithm.
     * https://en.wikipedia.org/wiki/Marching_squares
     *
     * Grid values are taken at pixel centers. A cell is inside the isochrone when its cost is at most the cutoff,
     * so places reached exactly at the cutoff are included. Unreached cells are treated as having twice the cutoff,
     * so the contour between a reached and an unreached cell is placed part of the way toward the unreached one.
     */
    public IsochroneFeature (double cutoff, ReachabilityGrid surface) {
        this.cutoff = cutoff;
        WebMercatorExtents extents = surface.extents;
        int width = extents.width;
        int height = extents.height;
        double unreached = cutoff * 2;
        double[] costs = surface.getCosts();
        for (int i = 0; i < costs.length; i++) {
            if (!(costs[i] < unreached)) costs[i] = unreached;
        }

        // Set all of the cells around the edges of the grid to unreached so that the isochrone never runs off the
        // edge of the grid.
        for (int x = 0; x < width; x++) {
            costs[x] = unreached;
            costs[(height - 1) * width + x] = unreached;
        }
        for (int y = 0; y < height; y++) {
            costs[width * y] = unreached;
            costs[width * (y + 1) - 1] = unreached;
        }

        LOG.debug("Making isochrone for cutoff {}", cutoff);
        if (width < 3 || height < 3) {
            // Nothing but border cells, which are all unreached.
            this.geometry = GeometryUtils.geometryFactory.createMultiPolygon(new Polygon[0]);
            return;
        }

        // make contouring grid
        byte[][] contour = new byte[width - 1][height - 1];
        for (int y = 0; y < height - 1; y++) {
            for (int x = 0; x < width - 1; x++) {
                boolean topLeft = costs[width * y + x] <= cutoff;
                boolean topRight = costs[width * y + x + 1] <= cutoff;
                boolean botLeft = costs[width * (y + 1) + x] <= cutoff;
                boolean botRight = costs[width * (y + 1) + x + 1] <= cutoff;

                byte idx = 0;

                if (topLeft) idx |= 1 << 3;
                if (topRight) idx |= 1 << 2;
                if (botRight) idx |= 1 << 1;
                if (botLeft) idx |= 1;

                contour[x][y] = idx;
            }
        }

        // Find a cell a line crosses through and follow that line.
        List<LinearRing> outerRings = new ArrayList<>();
        List<LinearRing> innerRings = new ArrayList<>();
        boolean[][] found = new boolean[width - 1][height - 1];

        for (int origy = 0; origy < height - 1; origy++) {
            for (int origx = 0; origx < width - 1; origx++) {
                int x = origx;
                int y = origy;

                if (found[x][y]) continue;

                byte idx = contour[x][y];

                // can't start at a saddle we don't know which way it goes
                if (idx == 0 || idx == 5 || idx == 10 || idx == 15) continue;

                byte prevIdx = -1;

                List<Coordinate> ring = new ArrayList<>();

                // keep track of clockwise/counterclockwise orientation, see http://stackoverflow.com/questions/1165647
                int direction = 0;
                int prevy = 0, prevx = 0;
                CELLS:
                while (true) {
                    idx = contour[x][y];

                    // check for intersecting rings, but know that saddles are supposed to self-intersect.
                    if (found[x][y] && idx != 5 && idx != 10) {
                        LOG.error("Ring crosses another ring (possibly itself). This cell has index {}, the previous cell has index {}.", idx, prevIdx);
                        break CELLS;
                    }

                    found[x][y] = true;

                    // Follow the line keeping the unfilled area to the left. The winding direction then tells shells
                    // from holes.
                    if (ring.size() >= MAX_RING_SIZE) {
                        LOG.error("Ring is too large, bailing");
                        break CELLS;
                    }

                    // Save the position, the next iteration needs to know where we came from. No bounds checking is
                    // needed below: the border cells are all unreached, so no line can cross out of the grid.
                    int startx = x;
                    int starty = y;
                    switch (idx) {
                        case 0:
                            LOG.error("Ran off outside of ring");
                            break CELLS;
                        case 1:
                            x--;
                            break;
                        // NB: +y is down
                        case 2:
                            y++;
                            break;
                        case 3:
                            x--;
                            break;
                        case 4:
                            x++;
                            break;
                        case 5:
                            if (prevy > y)
                                // came from bottom
                                x++;
                            else if (prevy < y)
                                // came from top
                                x--;
                            else
                                LOG.error("Entered case 5 saddle point from wrong direction!");
                            break;
                        case 6:
                            y++;
                            break;
                        case 7:
                            x--;
                            break;
                        case 8:
                            y--;
                            break;
                        case 9:
                            y--;
                            break;
                        case 10:
                            if (prevx < x)
                                // came from left
                                y++;
                            else if (prevx > x)
                                // came from right
                                y--;
                            else {
                                LOG.error("Entered case 10 saddle point from wrong direction.");
                            }
                            break;
                        case 11:
                            y--;
                            break;
                        case 12:
                            x++;
                            break;
                        case 13:
                            x++;
                            break;
                        case 14:
                            y++;
                            break;
                        case 15:
                            LOG.error("Ran off inside of ring");
                            break CELLS;
                    }

                    // this shouldn't happen
                    if (x == startx && y == starty) {
                        LOG.error("Ring position did not update");
                        break CELLS;
                    }

                    // figure out from whence we came
                    double topLeftCost = costs[width * y + x];
                    double botLeftCost = costs[width * (y + 1) + x];
                    double topRightCost = costs[width * y + x + 1];
                    double botRightCost = costs[width * (y + 1) + x + 1];

                    double lat, lon;

                    // Exactly one of the two corners on the crossed side is inside, at most the cutoff, and the other
                    // above it, so the denominators are never zero and the fractions are in [0, 1].
                    if (startx < x) {
                        // came from left
                        double frac = (cutoff - topLeftCost) / (botLeftCost - topLeftCost);
                        lat = extents.centeredLocalYToLat(y + frac);
                        lon = extents.centeredLocalXToLon(x);
                    } else if (startx > x) {
                        // came from right
                        double frac = (cutoff - topRightCost) / (botRightCost - topRightCost);
                        lat = extents.centeredLocalYToLat(y + frac);
                        lon = extents.centeredLocalXToLon(x + 1);
                    } else if (starty < y) {
                        // came from top
                        double frac = (cutoff - topLeftCost) / (topRightCost - topLeftCost);
                        lat = extents.centeredLocalYToLat(y);
                        lon = extents.centeredLocalXToLon(x + frac);
                    } else {
                        // came from bottom
                        double frac = (cutoff - botLeftCost) / (botRightCost - botLeftCost);
                        lat = extents.centeredLocalYToLat(y + 1);
                        lon = extents.centeredLocalXToLon(x + frac);
                    }

                    // keep track of winding direction
                    direction += (x - startx) * (y + starty);

                    ring.add(new Coordinate(lon, lat));

                    // pass previous values to next iteration
                    prevIdx = idx;
                    prevx = startx;
                    prevy = starty;

                    if (x == origx && y == origy) {
                        ring.add(new Coordinate(ring.get(0)));

                        if (ring.size() >= MIN_RING_SIZE) {
                            LinearRing lr = GeometryUtils.geometryFactory.createLinearRing(ring.toArray(new Coordinate[0]));
                            // direction less than 0 means clockwise (NB the y-axis is backwards), since value is to left it is an outer ring
                            if (direction > 0) {
                                outerRings.add(lr);
                            } else {
                                innerRings.add(lr);
                            }
                        }

                        break CELLS;
                    }
                }
            }
        }

        this.geometry = assemblePolygons(outerRings, innerRings);
        LOG.debug("Found {} outer rings and {} inner rings for cutoff {}", outerRings.size(), innerRings.size(), cutoff);
    }

    /**
     * Assign every hole to the shell containing it and build the polygons. The result is repaired if the tracing
     * produced an invalid geometry, which can happen where saddle cells make rings touch.
     */
    private MultiPolygon assemblePolygons (List<LinearRing> outerRings, List<LinearRing> innerRings) {
        Multimap<LinearRing, LinearRing> holesForRing = HashMultimap.create();

        // create polygons so we can test containment
        Map<LinearRing, Polygon> polygonsForOuterRing = outerRings.stream().collect(Collectors.toMap(
                r -> r,
                r -> GeometryUtils.geometryFactory.createPolygon(r)
        ));

        // put the biggest ring first because most holes are in the biggest ring, reduces number of point in polygon tests below
        outerRings.sort(Comparator.comparing((LinearRing ring) -> polygonsForOuterRing.get(ring).getArea()).reversed());

        int holeIdx = -1;
        HOLES: for (LinearRing hole : innerRings) {
            holeIdx++;

            // get rid of tiny holes
            if (GeometryUtils.geometryFactory.createPolygon(hole).getArea() < MIN_HOLE_AREA) continue;

            for (LinearRing ring : outerRings) {
                // fine to test membership of first coordinate only since shells and holes are disjoint, and holes
                // nest completely in shells
                if (polygonsForOuterRing.get(ring).contains(hole.getPointN(0))) {
                    holesForRing.put(ring, hole);
                    continue HOLES;
                }
            }

            LOG.warn("Found no fitting shell for isochrone hole {} at cutoff {}, dropping this hole.", holeIdx, cutoff);
        }

        Polygon[] polygons = outerRings.stream().map(shell -> {
            Collection<LinearRing> holes = holesForRing.get(shell);
            return GeometryUtils.geometryFactory.createPolygon(shell, holes.toArray(new LinearRing[0]));
        }).toArray(Polygon[]::new);

        MultiPolygon multiPolygon = GeometryUtils.geometryFactory.createMultiPolygon(polygons);
        if (!multiPolygon.isValid()) {
            LOG.debug("Repairing invalid isochrone geometry at cutoff {}", cutoff);
            return toMultiPolygon(multiPolygon.buffer(0));
        }
        return multiPolygon;
    }

    /** Coerce the result of a JTS overlay operation into a MultiPolygon, keeping only its polygonal parts. */
    public static MultiPolygon toMultiPolygon (Geometry geometry) {
        if (geometry instanceof MultiPolygon) {
            return (MultiPolygon) geometry;
        }
        List<Polygon> polygons = new ArrayList<>();
        for (int i = 0; i < geometry.getNumGeometries(); i++) {
            Geometry part = geometry.getGeometryN(i);
            if (part instanceof Polygon && !part.isEmpty()) {
                polygons.add((Polygon) part);
            }
        }
        return GeometryUtils.geometryFactory.createMultiPolygon(polygons.toArray(new Polygon[0]));
    }

    public boolean isEmpty () {
        return geometry.isEmpty();
    }
}

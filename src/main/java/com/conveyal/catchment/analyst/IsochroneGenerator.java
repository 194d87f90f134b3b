package com.conveyal.catchment.analyst;

import com.conveyal.catchment.common.GeometryUtils;
import com.conveyal.catchment.streets.ReachabilityResult;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Converts the result of a search into isochrone bands: the cost field is rasterized, smoothed and contoured once for
 * each of a series of evenly spaced thresholds up to the budget.
 */
public class IsochroneGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(IsochroneGenerator.class);

    public static final int DEFAULT_PERCENTILE = 5;

    private final int zoom;

    private final int steps;

    private final int percentile;

    public IsochroneGenerator (int zoom, int steps, int percentile) {
        checkArgument(steps >= 1, "At least one isochrone step is required.");
        checkArgument(percentile >= 0 && percentile <= 100, "Percentile must be between 0 and 100.");
        this.zoom = zoom;
        this.steps = steps;
        this.percentile = percentile;
    }

    /**
     * Thresholds budget * k / steps for k = 1 to steps, strictly increasing and ending exactly at the budget.
     */
    public static double[] thresholds (double budget, int steps) {
        double[] thresholds = new double[steps];
        for (int k = 1; k <= steps; k++) {
            thresholds[k - 1] = budget * k / steps;
        }
        return thresholds;
    }

    /**
     * @return one feature per threshold in increasing order, omitting empty bands. Empty if nothing was reached.
     */
    public List<IsochroneFeature> generate (ReachabilityResult result) {
        List<IsochroneFeature> features = new ArrayList<>();
        if (result.isEmpty()) {
            // Only the connector stretches next to the origins were covered, that is no catchment area.
            LOG.info("No network node reachable within the budget, the isochrone is empty.");
            return features;
        }
        ReachabilityGrid surface = new CostSurfaceRasterizer(result, zoom).rasterize();
        if (surface == null || surface.getReachedCellCount() == 0) {
            LOG.info("Nothing reachable, the isochrone is empty.");
            return features;
        }
        ReachabilityGrid smoothed = smooth(surface, percentile);
        for (double threshold : thresholds(result.budget, steps)) {
            IsochroneFeature feature = new IsochroneFeature(threshold, smoothed);
            if (feature.isEmpty()) {
                LOG.debug("Dropping empty band at threshold {}", threshold);
            } else {
                features.add(feature);
            }
        }
        return features;
    }

    /**
     * Replace every cell with the given percentile of the costs in its 3x3 neighborhood (cells outside the grid are
     * left out). Low percentiles close small gaps between sampled edges, the median removes isolated spikes.
     */
    public static ReachabilityGrid smooth (ReachabilityGrid grid, int percentile) {
        WebMercatorExtents extents = grid.extents;
        double[] smoothed = new double[extents.cellCount()];
        double[] neighborhood = new double[9];
        for (int y = 0; y < extents.height; y++) {
            for (int x = 0; x < extents.width; x++) {
                int n = 0;
                for (int dy = -1; dy <= 1; dy++) {
                    for (int dx = -1; dx <= 1; dx++) {
                        if (extents.contains(x + dx, y + dy)) {
                            neighborhood[n++] = grid.getCost(x + dx, y + dy);
                        }
                    }
                }
                Arrays.sort(neighborhood, 0, n);
                int rank = (int) Math.floor(percentile / 100.0 * (n - 1));
                smoothed[y * extents.width + x] = neighborhood[rank];
            }
        }
        return grid.withCosts(smoothed);
    }

    /**
     * Shape the bands for persistence: fill the holes of every band, then optionally subtract from each band the
     * band before it so that the persisted bands are disjoint rings.
     */
    public static List<IsochroneFeature> prepareForPersistence (List<IsochroneFeature> features,
                                                                boolean polygonDifference) {
        List<IsochroneFeature> filled = new ArrayList<>();
        for (IsochroneFeature feature : features) {
            filled.add(new IsochroneFeature(feature.cutoff, fillHoles(feature.geometry)));
        }
        if (!polygonDifference) {
            return filled;
        }
        List<IsochroneFeature> bands = new ArrayList<>();
        MultiPolygon previous = null;
        for (IsochroneFeature feature : filled) {
            MultiPolygon band = feature.geometry;
            if (previous != null) {
                band = IsochroneFeature.toMultiPolygon(feature.geometry.difference(previous));
            }
            if (!band.isEmpty()) {
                bands.add(new IsochroneFeature(feature.cutoff, band));
            }
            previous = feature.geometry;
        }
        return bands;
    }

    /** The same polygons keeping only their exterior rings. */
    public static MultiPolygon fillHoles (MultiPolygon multiPolygon) {
        Polygon[] shells = new Polygon[multiPolygon.getNumGeometries()];
        for (int i = 0; i < shells.length; i++) {
            Polygon polygon = (Polygon) multiPolygon.getGeometryN(i);
            shells[i] = GeometryUtils.geometryFactory.createPolygon(polygon.getExteriorRing().getCoordinates());
        }
        MultiPolygon result = GeometryUtils.geometryFactory.createMultiPolygon(shells);
        if (!result.isValid()) {
            // Shells that were separate before filling may now overlap, e.g. an island inside another polygon's hole.
            Geometry union = result.union();
            return IsochroneFeature.toMultiPolygon(union);
        }
        return result;
    }
}

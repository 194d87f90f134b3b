package com.conveyal.catchment.analyst.cluster;

import com.conveyal.catchment.analyst.IsochroneFeature;
import com.conveyal.catchment.analyst.NetworkFeature;
import com.conveyal.catchment.analyst.ReachabilityGrid;

import java.util.List;

/**
 * Receives the final results of successful jobs. Each job persists exactly one result through exactly one call, and
 * failed jobs persist nothing.
 */
public interface ResultPersistence {

    /** Isochrone bands in increasing threshold order, holes already filled. */
    void persistPolygons (String jobId, List<IsochroneFeature> bands);

    void persistNetwork (String jobId, List<NetworkFeature> features);

    void persistGrid (String jobId, ReachabilityGrid grid);

}

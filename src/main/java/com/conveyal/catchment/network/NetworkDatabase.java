package com.conveyal.catchment.network;

import com.conveyal.catchment.analyst.scenario.ScenarioOverlay;
import com.conveyal.catchment.profile.OriginPoint;
import com.conveyal.catchment.streets.Edge;
import gnu.trove.set.TIntSet;

import java.util.List;

/**
 * The external store holding the full routing network, scenario overlays and request-scoped origin points. All
 * methods throw NetworkDatabaseException when the database cannot be reached. Implementations must be threadsafe.
 */
public interface NetworkDatabase {

    /** The coarse cells covering the network region, whether or not they contain edges. */
    TIntSet coarseCells ();

    /** All edges stored in the given coarse cell, in a stable order. Empty for cells outside the network region. */
    List<Edge> fetchPartition (int coarseCell);

    /** @return the overlay with the given id, or null if there is no such overlay. */
    ScenarioOverlay fetchScenarioOverlay (String scenarioId);

    /** Store the origin points of one request, for linking them to the network. */
    OriginSession openOriginSession (List<OriginPoint> origins);

}

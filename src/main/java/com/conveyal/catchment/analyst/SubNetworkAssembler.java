package com.conveyal.catchment.analyst;

import com.conveyal.catchment.analyst.error.BufferExceedsNetworkException;
import com.conveyal.catchment.analyst.error.DisconnectedOriginException;
import com.conveyal.catchment.analyst.error.InvalidScenarioException;
import com.conveyal.catchment.analyst.error.NetworkUnavailableException;
import com.conveyal.catchment.analyst.scenario.ScenarioOverlay;
import com.conveyal.catchment.common.GeometryUtils;
import com.conveyal.catchment.common.SpatialCells;
import com.conveyal.catchment.components.Component;
import com.conveyal.catchment.network.NetworkDatabase;
import com.conveyal.catchment.network.NetworkDatabaseException;
import com.conveyal.catchment.network.NetworkPartition;
import com.conveyal.catchment.network.NetworkStore;
import com.conveyal.catchment.network.OriginSession;
import com.conveyal.catchment.profile.CatchmentAreaRequest;
import com.conveyal.catchment.profile.CostBudget;
import com.conveyal.catchment.profile.OriginPoint;
import com.conveyal.catchment.profile.StreetMode;
import com.conveyal.catchment.streets.Edge;
import com.conveyal.catchment.streets.OriginConnector;
import com.conveyal.catchment.streets.Split;
import com.conveyal.catchment.streets.SubNetworkBuilder;
import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Assembles the sub-network needed for one request: the edges near the origins that the mode may use, with the
 * scenario overlay applied and the origins linked in by connector edges. Costs are not computed here.
 *
 * Each origin is linked on the base network. If the overlay then deletes or modifies the edge an origin was linked
 * to, the origin is linked again to the live sub-network, so connectors never carry the attributes of an edge the
 * scenario has changed. The edge an origin is linked to is replaced by the two connector halves.
 *
 * The area searched is a buffer around each origin whose radius is the farthest the budget could possibly reach:
 * the budget itself for distance budgets, and the budget at the request speed for time budgets (for cars, at a
 * configured speed since car speeds vary per edge).
 */
public class SubNetworkAssembler implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(SubNetworkAssembler.class);

    public interface Config {
        /** Speed in km/h used to size the search buffer of car requests with a time budget. */
        double carBufferSpeedKph ();
        /** Search radius in meters when an origin is linked again after a scenario changed its street. */
        double snapRadiusMeters ();
    }

    private final Config config;

    private final NetworkStore networkStore;

    private final NetworkDatabase database;

    public SubNetworkAssembler (Config config, NetworkStore networkStore, NetworkDatabase database) {
        this.config = config;
        this.networkStore = networkStore;
        this.database = database;
    }

    /** Radius in meters of the area around each origin that could be reached within the budget. */
    public double bufferRadiusMeters (CatchmentAreaRequest request) {
        CostBudget budget = request.costBudget;
        if (budget.kind == CostBudget.Kind.DISTANCE) {
            return budget.value;
        }
        double speedKph = request.mode.isActive() ? request.getSpeedKph() : config.carBufferSpeedKph();
        double metersPerMinute = speedKph * 1000 / 60;
        return budget.value / 60 * metersPerMinute;
    }

    /**
     * @throws BufferExceedsNetworkException if the search area reaches beyond the network region.
     * @throws DisconnectedOriginException if some origin cannot be linked to an edge the mode may use.
     * @throws InvalidScenarioException if the scenario does not exist or cannot be applied.
     * @throws NetworkUnavailableException if the network database cannot be reached.
     */
    public SubNetworkBuilder assemble (CatchmentAreaRequest request) {
        long startTime = System.currentTimeMillis();
        StreetMode mode = request.mode;
        double radius = bufferRadiusMeters(request);

        TIntSet coarseCells = new TIntHashSet();
        TIntSet fineCells = new TIntHashSet();
        for (OriginPoint origin : request.originPoints) {
            Envelope buffer = GeometryUtils.bufferEnvelope(origin.lat(), origin.lon(), radius);
            coarseCells.addAll(SpatialCells.cellsInEnvelope(buffer, SpatialCells.COARSE_ZOOM));
            fineCells.addAll(SpatialCells.cellsInEnvelope(buffer, SpatialCells.FINE_ZOOM));
        }
        TIntSet missingCells = new TIntHashSet();
        coarseCells.forEach(cell -> {
            if (!networkStore.coversCell(cell)) missingCells.add(cell);
            return true;
        });
        if (!missingCells.isEmpty()) {
            throw new BufferExceedsNetworkException(missingCells);
        }

        // Fetch the overlay before opening a session, so that a missing scenario fails without touching the origins.
        ScenarioOverlay overlay = null;
        if (request.scenarioId != null) {
            overlay = fetchOverlay(request.scenarioId);
        }

        SubNetworkBuilder builder = new SubNetworkBuilder();
        // Sorting makes the edge order, and therefore tie breaking during the search, independent of hashing.
        int[] sortedCells = coarseCells.toArray();
        Arrays.sort(sortedCells);
        int candidates = 0;
        for (int cell : sortedCells) {
            NetworkPartition partition = networkStore.getPartition(cell);
            candidates += partition.size();
            for (Edge edge : partition.getEdges()) {
                if (fineCells.contains(edge.fineCell) && mode.allows(edge.streetClass)) {
                    builder.add(edge);
                }
            }
        }
        LOG.debug("Buffer of {} m covers {} coarse and {} fine cells, kept {} of {} edges.",
                Math.round(radius), coarseCells.size(), fineCells.size(), builder.getLiveEdgeCount(), candidates);

        List<OriginConnector> connectors = snapOrigins(request, overlay != null);
        if (overlay != null) {
            // Remember which edge each origin was linked to, to see afterward whether the overlay changed it.
            Edge[] splitEdges = new Edge[connectors.size()];
            for (int i = 0; i < splitEdges.length; i++) {
                OriginConnector connector = connectors.get(i);
                splitEdges[i] = connector == null ? null : builder.get(connector.splitEdgeId);
            }
            overlay.applyTo(builder, mode);
            connectors = relinkChangedOrigins(request, builder, connectors, splitEdges);
        }
        for (OriginConnector connector : connectors) {
            // Paths along the split edge pass through the halves, the whole edge would only duplicate them.
            builder.delete(connector.splitEdgeId);
            builder.addConnector(connector);
        }
        LOG.info("Assembled sub-network of {} edges for {} origins in {} msec.", builder.getLiveEdgeCount(),
                connectors.size(), System.currentTimeMillis() - startTime);
        return builder;
    }

    private ScenarioOverlay fetchOverlay (String scenarioId) {
        ScenarioOverlay overlay;
        try {
            overlay = database.fetchScenarioOverlay(scenarioId);
        } catch (NetworkDatabaseException e) {
            throw new NetworkUnavailableException("Could not fetch scenario " + scenarioId, e);
        }
        if (overlay == null) {
            throw new InvalidScenarioException(scenarioId, List.of("no scenario overlay exists with this id"));
        }
        return overlay;
    }

    /**
     * Link every origin to the network. The origin session is closed on every path out of this method.
     * @param allowUnlinked when true, an origin with no street in range yields a null entry instead of an exception,
     *                      because a scenario may still add a street near it.
     */
    private List<OriginConnector> snapOrigins (CatchmentAreaRequest request, boolean allowUnlinked) {
        List<OriginConnector> connectors = new ArrayList<>();
        try (OriginSession session = database.openOriginSession(request.originPoints)) {
            for (int i = 0; i < request.originPoints.size(); i++) {
                OriginConnector connector = session.snap(i, request.mode);
                if (connector == null && !allowUnlinked) {
                    OriginPoint origin = request.originPoints.get(i);
                    throw new DisconnectedOriginException(i, origin.lat(), origin.lon());
                }
                connectors.add(connector);
            }
        } catch (NetworkDatabaseException e) {
            throw new NetworkUnavailableException("Could not link origins to the network.", e);
        }
        return connectors;
    }

    /**
     * Link again every origin whose edge the overlay deleted or replaced, or which had no edge in range before the
     * overlay was applied. The new link is made to the nearest live edge of the sub-network the mode may use.
     */
    private List<OriginConnector> relinkChangedOrigins (CatchmentAreaRequest request, SubNetworkBuilder builder,
                                                        List<OriginConnector> connectors, Edge[] splitEdges) {
        List<OriginConnector> relinked = new ArrayList<>(connectors.size());
        List<Edge> liveEdges = null;
        for (int i = 0; i < connectors.size(); i++) {
            OriginConnector connector = connectors.get(i);
            if (connector != null && builder.get(connector.splitEdgeId) == splitEdges[i]) {
                relinked.add(connector);
                continue;
            }
            if (liveEdges == null) {
                liveEdges = builder.getLiveEdges();
            }
            OriginPoint origin = request.originPoints.get(i);
            Split split = Split.find(origin.lat(), origin.lon(), config.snapRadiusMeters(), liveEdges, request.mode);
            if (split == null) {
                throw new DisconnectedOriginException(i, origin.lat(), origin.lon());
            }
            LOG.debug("Scenario changed the street near origin {}, linked it to edge {} instead.", i, split.edge.id);
            relinked.add(split.toConnector(i));
        }
        return relinked;
    }
}

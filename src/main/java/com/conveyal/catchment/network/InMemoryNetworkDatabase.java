package com.conveyal.catchment.network;

import com.conveyal.catchment.analyst.scenario.ScenarioOverlay;
import com.conveyal.catchment.common.GeometryUtils;
import com.conveyal.catchment.profile.OriginPoint;
import com.conveyal.catchment.profile.StreetMode;
import com.conveyal.catchment.streets.Edge;
import com.conveyal.catchment.streets.OriginConnector;
import com.conveyal.catchment.streets.Split;
import gnu.trove.TCollections;
import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * A NetworkDatabase holding its whole network in memory, for local runs and tests. Origins are linked to the network
 * with a JTS spatial index over the edge envelopes.
 *
 * The network region can be made larger than the cells that actually contain edges, and the database can be switched
 * off to simulate an outage. It counts partition fetches and open origin sessions so callers can check how it is used.
 */
public class InMemoryNetworkDatabase implements NetworkDatabase {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryNetworkDatabase.class);

    public interface Config {
        /** Maximum distance in meters between an origin point and the edge it is linked to. */
        double snapRadiusMeters ();
    }

    private final double snapRadiusMeters;

    private final TIntObjectMap<List<Edge>> edgesByCell = new TIntObjectHashMap<>();

    private final TIntSet regionCells = new TIntHashSet();

    private final STRtree spatialIndex = new STRtree();

    private final Map<String, ScenarioOverlay> overlays = new ConcurrentHashMap<>();

    private final AtomicInteger partitionFetchCount = new AtomicInteger();

    private final AtomicInteger openSessionCount = new AtomicInteger();

    private volatile boolean available = true;

    public InMemoryNetworkDatabase (Config config, Collection<Edge> edges) {
        checkArgument(config.snapRadiusMeters() > 0, "Snap radius must be positive.");
        this.snapRadiusMeters = config.snapRadiusMeters();
        for (Edge edge : edges) {
            List<Edge> cellEdges = edgesByCell.get(edge.coarseCell);
            if (cellEdges == null) {
                cellEdges = new ArrayList<>();
                edgesByCell.put(edge.coarseCell, cellEdges);
            }
            cellEdges.add(edge);
            regionCells.add(edge.coarseCell);
            spatialIndex.insert(envelopeFor(edge), edge);
        }
        for (List<Edge> cellEdges : edgesByCell.valueCollection()) {
            cellEdges.sort(Comparator.comparingLong(e -> e.id));
        }
        // Build the index now, STRtree lazily builds itself on the first query which is not threadsafe.
        spatialIndex.build();
        LOG.info("In-memory network database holds {} edges in {} coarse cells.", edges.size(), regionCells.size());
    }

    private static Envelope envelopeFor (Edge edge) {
        Envelope envelope = new Envelope();
        for (int p = 0; p < edge.pointCount(); p++) {
            envelope.expandToInclude(
                    GeometryUtils.fixedDegreesToFloating(edge.getFixedLon(p)),
                    GeometryUtils.fixedDegreesToFloating(edge.getFixedLat(p)));
        }
        return envelope;
    }

    /** Declare additional coarse cells as part of the network region even though they contain no edges. */
    public synchronized void addRegionCells (int... coarseCells) {
        regionCells.addAll(coarseCells);
    }

    public void putScenarioOverlay (ScenarioOverlay overlay) {
        overlays.put(overlay.id, overlay);
    }

    /** Switch the database off (or back on). While off, every method throws NetworkDatabaseException. */
    public void setAvailable (boolean available) {
        this.available = available;
    }

    public int getPartitionFetchCount () {
        return partitionFetchCount.get();
    }

    public int getOpenSessionCount () {
        return openSessionCount.get();
    }

    private void checkAvailable () {
        if (!available) {
            throw new NetworkDatabaseException("Network database is not reachable.");
        }
    }

    @Override
    public synchronized TIntSet coarseCells () {
        checkAvailable();
        return TCollections.unmodifiableSet(new TIntHashSet(regionCells));
    }

    @Override
    public List<Edge> fetchPartition (int coarseCell) {
        checkAvailable();
        partitionFetchCount.incrementAndGet();
        List<Edge> edges = edgesByCell.get(coarseCell);
        return edges == null ? List.of() : List.copyOf(edges);
    }

    @Override
    public ScenarioOverlay fetchScenarioOverlay (String scenarioId) {
        checkAvailable();
        return overlays.get(scenarioId);
    }

    @Override
    public OriginSession openOriginSession (List<OriginPoint> origins) {
        checkAvailable();
        openSessionCount.incrementAndGet();
        return new InMemoryOriginSession(List.copyOf(origins));
    }

    private class InMemoryOriginSession implements OriginSession {

        private final List<OriginPoint> origins;

        private boolean closed = false;

        InMemoryOriginSession (List<OriginPoint> origins) {
            this.origins = origins;
        }

        @Override
        @SuppressWarnings("unchecked")
        public synchronized OriginConnector snap (int originIndex, StreetMode mode) {
            checkState(!closed, "Origin session is already closed.");
            checkAvailable();
            OriginPoint origin = origins.get(originIndex);
            Envelope searchEnvelope = GeometryUtils.bufferEnvelope(origin.lat(), origin.lon(), snapRadiusMeters);
            List<Edge> candidates = spatialIndex.query(searchEnvelope);
            Split split = Split.find(origin.lat(), origin.lon(), snapRadiusMeters, candidates, mode);
            if (split == null) {
                LOG.debug("No {} edge within {} m of origin {}.", mode, snapRadiusMeters, originIndex);
                return null;
            }
            return split.toConnector(originIndex);
        }

        @Override
        public synchronized void close () {
            if (!closed) {
                closed = true;
                openSessionCount.decrementAndGet();
            }
        }
    }
}

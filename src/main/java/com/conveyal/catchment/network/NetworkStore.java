package com.conveyal.catchment.network;

import com.conveyal.catchment.analyst.error.CatchmentAreaException;
import com.conveyal.catchment.analyst.error.NetworkUnavailableException;
import com.conveyal.catchment.components.Component;
import com.conveyal.catchment.kryo.KryoPartitionSerializer;
import com.conveyal.catchment.streets.Edge;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import gnu.trove.TCollections;
import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.List;

import static com.google.common.base.Preconditions.checkState;

/**
 * Holds the routing network, partitioned into coarse spatial cells and loaded one partition at a time.
 * Because deserializing a partition is much faster than querying it from the database, partitions are cached on the
 * local filesystem as Kryo files, one per coarse cell, and kept in memory once loaded.
 *
 * Loaded partitions are never evicted while the store is open. They are shared read-only by all concurrent jobs.
 * Concurrent requests for the same partition trigger only one load, the others wait for it.
 *
 * The store has an explicit lifecycle: open() fetches the list of cells covering the network region, close() drops
 * everything that was loaded. The database is never retried inside the store: if it cannot be reached the caller
 * receives a NetworkUnavailableException.
 */
public class NetworkStore implements Component, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(NetworkStore.class);

    public interface Config {
        /** Local directory where partition files are cached. Created if it does not exist. */
        String cacheDir ();
    }

    private final NetworkDatabase database;

    private final File cacheDir;

    private final LoadingCache<Integer, NetworkPartition> partitionCache;

    /** The coarse cells covering the network region, null while the store is closed. */
    private volatile TIntSet networkCells;

    public NetworkStore (Config config, NetworkDatabase database) {
        this.database = database;
        this.cacheDir = new File(config.cacheDir());
        this.partitionCache = Caffeine.newBuilder().build(this::loadPartition);
    }

    /**
     * Prepare the store for use by fetching the set of cells covering the network. Calling open() on an open store
     * has no effect.
     */
    public synchronized void open () {
        if (networkCells != null) return;
        if (!cacheDir.isDirectory() && !cacheDir.mkdirs()) {
            throw new IllegalStateException("Could not create partition cache directory " + cacheDir);
        }
        try {
            TIntSet cells = new TIntHashSet(database.coarseCells());
            networkCells = TCollections.unmodifiableSet(cells);
        } catch (RuntimeException e) {
            throw new NetworkUnavailableException("Could not fetch the network region from the database.", e);
        }
        LOG.info("Opened network store covering {} coarse cells, caching partitions in {}", networkCells.size(), cacheDir);
    }

    public boolean isOpen () {
        return networkCells != null;
    }

    /** The coarse cells covering the network region. */
    public TIntSet getNetworkCells () {
        checkState(isOpen(), "Network store is not open.");
        return networkCells;
    }

    /** Whether the given coarse cell is part of the network region, whether or not it has been loaded. */
    public boolean coversCell (int coarseCell) {
        return getNetworkCells().contains(coarseCell);
    }

    /**
     * Return the partition for the given coarse cell, loading it on first access. For a cell outside the network
     * region this returns an empty partition without touching the database or the disk cache.
     * @throws NetworkUnavailableException if the partition had to be fetched and the database could not be reached.
     */
    public NetworkPartition getPartition (int coarseCell) {
        if (!coversCell(coarseCell)) {
            return NetworkPartition.empty(coarseCell);
        }
        try {
            return partitionCache.get(coarseCell);
        } catch (CatchmentAreaException e) {
            throw e;
        } catch (Exception e) {
            throw new NetworkUnavailableException("Could not load network partition " + coarseCell + " into cache.", e);
        }
    }

    /** Load every partition of the network region, for deployments that prefer a slow start to slow first jobs. */
    public void preload () {
        long startTime = System.currentTimeMillis();
        int[] cells = getNetworkCells().toArray();
        int edgeCount = 0;
        for (int cell : cells) {
            edgeCount += getPartition(cell).size();
        }
        LOG.info("Preloaded {} partitions with {} edges in {} msec", cells.length, edgeCount,
                System.currentTimeMillis() - startTime);
    }

    /** The number of partitions currently held in memory. */
    public long getLoadedPartitionCount () {
        return partitionCache.estimatedSize();
    }

    /** Drop all loaded partitions. Files in the disk cache are kept for the next time the store is opened. */
    @Override
    public synchronized void close () {
        partitionCache.invalidateAll();
        networkCells = null;
        LOG.info("Closed network store.");
    }

    /**
     * Cache loader: read the partition from the disk cache if a compatible file exists, otherwise fetch it from the
     * database and write the file. A file that cannot be read is replaced. A file that cannot be written does not
     * prevent the partition from being used.
     */
    private NetworkPartition loadPartition (Integer coarseCell) {
        File file = new File(cacheDir, KryoPartitionSerializer.cacheFileName(coarseCell));
        if (file.exists()) {
            try {
                NetworkPartition partition = KryoPartitionSerializer.read(file);
                LOG.debug("Loaded partition {} ({} edges) from disk cache.", coarseCell, partition.size());
                return partition;
            } catch (IOException e) {
                LOG.warn("Ignoring unreadable partition cache file {}, fetching from database instead.", file, e);
            }
        }
        long startTime = System.currentTimeMillis();
        List<Edge> edges = database.fetchPartition(coarseCell);
        NetworkPartition partition = new NetworkPartition(coarseCell, edges);
        LOG.info("Fetched partition {} with {} edges from database in {} msec.", coarseCell, partition.size(),
                System.currentTimeMillis() - startTime);
        try {
            KryoPartitionSerializer.write(partition, file);
        } catch (IOException e) {
            LOG.error("Could not write partition {} to disk cache, continuing with the in-memory copy.", coarseCell, e);
        }
        return partition;
    }
}

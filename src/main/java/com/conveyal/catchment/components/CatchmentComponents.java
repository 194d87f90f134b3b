package com.conveyal.catchment.components;

import com.conveyal.catchment.CatchmentConfig;
import com.conveyal.catchment.analyst.SubNetworkAssembler;
import com.conveyal.catchment.analyst.cluster.CatchmentAreaWorker;
import com.conveyal.catchment.analyst.cluster.JobStatusStore;
import com.conveyal.catchment.analyst.cluster.ResultPersistence;
import com.conveyal.catchment.network.NetworkDatabase;
import com.conveyal.catchment.network.NetworkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires up the components of the catchment area core by hand, in dependency order. The external collaborators (the
 * network database, the job status store and result persistence) are supplied by the embedding application.
 * No conditional logic should be present here.
 */
public class CatchmentComponents implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CatchmentComponents.class);

    public final CatchmentConfig config;
    public final NetworkStore networkStore;
    public final SubNetworkAssembler assembler;
    public final CatchmentAreaWorker worker;

    public CatchmentComponents (CatchmentConfig config, NetworkDatabase database, JobStatusStore statusStore,
                                ResultPersistence persistence) {
        this.config = config;
        networkStore = new NetworkStore(config, database);
        assembler = new SubNetworkAssembler(config, networkStore, database);
        worker = new CatchmentAreaWorker(config, assembler, statusStore, persistence);
        networkStore.open();
        LOG.info("Catchment area components ready with {} worker threads.", config.workerThreads());
    }

    /** Stop accepting jobs and release loaded partitions. */
    @Override
    public void close () {
        worker.shutdown();
        networkStore.close();
    }
}

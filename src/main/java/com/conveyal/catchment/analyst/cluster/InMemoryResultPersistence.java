package com.conveyal.catchment.analyst.cluster;

import com.conveyal.catchment.analyst.IsochroneFeature;
import com.conveyal.catchment.analyst.NetworkFeature;
import com.conveyal.catchment.analyst.ReachabilityGrid;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Holds persisted results in memory, keyed on job id, for local runs and tests. */
public class InMemoryResultPersistence implements ResultPersistence {

    private final Map<String, Object> results = new ConcurrentHashMap<>();

    @Override
    public void persistPolygons (String jobId, List<IsochroneFeature> bands) {
        store(jobId, List.copyOf(bands));
    }

    @Override
    public void persistNetwork (String jobId, List<NetworkFeature> features) {
        store(jobId, List.copyOf(features));
    }

    @Override
    public void persistGrid (String jobId, ReachabilityGrid grid) {
        store(jobId, grid);
    }

    private void store (String jobId, Object result) {
        if (results.putIfAbsent(jobId, result) != null) {
            throw new IllegalStateException("A result was already persisted for job " + jobId);
        }
    }

    public boolean hasResult (String jobId) {
        return results.containsKey(jobId);
    }

    /** @return the persisted result, a List of features or a ReachabilityGrid, or null if none was persisted. */
    public Object getResult (String jobId) {
        return results.get(jobId);
    }
}

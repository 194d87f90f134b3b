package com.conveyal.catchment.analyst.cluster;

import com.conveyal.catchment.analyst.IsochroneFeature;
import com.conveyal.catchment.analyst.NetworkFeature;
import com.conveyal.catchment.analyst.ReachabilityGrid;

import java.util.List;

/**
 * What a worker hands back after running a job: its terminal status and, for successful jobs, the one result that was
 * persisted. Only the field matching the request's result type is non-null.
 */
public class CatchmentAreaResult {

    public final String jobId;

    public final JobStatus status;

    /** Human readable reason for failures, null on success. */
    public final String reason;

    public final List<IsochroneFeature> polygons;

    public final List<NetworkFeature> network;

    public final ReachabilityGrid grid;

    private CatchmentAreaResult (String jobId, JobStatus status, String reason, List<IsochroneFeature> polygons,
                                 List<NetworkFeature> network, ReachabilityGrid grid) {
        this.jobId = jobId;
        this.status = status;
        this.reason = reason;
        this.polygons = polygons;
        this.network = network;
        this.grid = grid;
    }

    public static CatchmentAreaResult polygons (String jobId, List<IsochroneFeature> polygons) {
        return new CatchmentAreaResult(jobId, JobStatus.SUCCESS, null, List.copyOf(polygons), null, null);
    }

    public static CatchmentAreaResult network (String jobId, List<NetworkFeature> network) {
        return new CatchmentAreaResult(jobId, JobStatus.SUCCESS, null, null, List.copyOf(network), null);
    }

    public static CatchmentAreaResult grid (String jobId, ReachabilityGrid grid) {
        return new CatchmentAreaResult(jobId, JobStatus.SUCCESS, null, null, null, grid);
    }

    public static CatchmentAreaResult failed (String jobId, JobStatus status, String reason) {
        return new CatchmentAreaResult(jobId, status, reason, null, null, null);
    }

    public boolean isSuccess () {
        return status == JobStatus.SUCCESS;
    }

    @Override
    public String toString () {
        return String.format("CatchmentAreaResult{job=%s, status=%s, reason=%s}", jobId, status, reason);
    }
}

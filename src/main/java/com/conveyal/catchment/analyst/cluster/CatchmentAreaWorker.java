package com.conveyal.catchment.analyst.cluster;

import com.conveyal.catchment.analyst.IsochroneFeature;
import com.conveyal.catchment.analyst.IsochroneGenerator;
import com.conveyal.catchment.analyst.NetworkFeature;
import com.conveyal.catchment.analyst.ReachabilityGrid;
import com.conveyal.catchment.analyst.SubNetworkAssembler;
import com.conveyal.catchment.analyst.error.DisconnectedOriginException;
import com.conveyal.catchment.common.JsonUtilities;
import com.conveyal.catchment.components.Component;
import com.conveyal.catchment.profile.CatchmentAreaRequest;
import com.conveyal.catchment.streets.CostModel;
import com.conveyal.catchment.streets.EdgeCostCalculator;
import com.conveyal.catchment.streets.ReachabilityResult;
import com.conveyal.catchment.streets.ReachabilityRouter;
import com.conveyal.catchment.streets.SubNetwork;
import com.conveyal.catchment.streets.SubNetworkBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Runs catchment area jobs end to end: assemble the sub-network, search it, turn the search into the requested kind
 * of result and persist it. Every job gets an in_progress status on acceptance and then exactly one terminal status.
 * Jobs share nothing mutable, so any number of them may run at once on the worker pool.
 */
public class CatchmentAreaWorker implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(CatchmentAreaWorker.class);

    public interface Config {
        int workerThreads ();
    }

    private final SubNetworkAssembler assembler;
    private final JobStatusStore statusStore;
    private final ResultPersistence persistence;
    private final ExecutorService executor;

    public CatchmentAreaWorker (Config config, SubNetworkAssembler assembler, JobStatusStore statusStore,
                                ResultPersistence persistence) {
        this.assembler = assembler;
        this.statusStore = statusStore;
        this.persistence = persistence;
        this.executor = Executors.newFixedThreadPool(config.workerThreads());
    }

    /** Run the job on the worker pool. The returned future never completes exceptionally for job failures. */
    public Future<CatchmentAreaResult> submit (String jobId, CatchmentAreaRequest request) {
        checkNotNull(jobId);
        return executor.submit(() -> run(jobId, request));
    }

    /** Run the job on the calling thread. Failures are reported through the status store and the returned result. */
    public CatchmentAreaResult run (String jobId, CatchmentAreaRequest request) {
        checkNotNull(jobId);
        statusStore.setStatus(jobId, JobStatus.IN_PROGRESS);
        Job job = new Job(jobId);
        CatchmentAreaResult result = null;
        try {
            result = runStages(job, request);
        } catch (DisconnectedOriginException e) {
            LOG.info("Job {} failed: {}", jobId, e.getMessage());
            job.advance(JobStage.DISCONNECTED_ORIGIN);
            result = CatchmentAreaResult.failed(jobId, JobStatus.DISCONNECTED_ORIGIN, e.getMessage());
        } catch (Exception e) {
            LOG.error("Job {} failed in stage {}", jobId, job.stage, e);
            job.advance(JobStage.FAILURE);
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            result = CatchmentAreaResult.failed(jobId, JobStatus.FAILURE, reason);
        } finally {
            if (result == null) {
                // An error is escaping. The job must still end in a terminal status.
                LOG.error("Job {} aborted in stage {}, recording it as failed.", jobId, job.stage);
                statusStore.setStatus(jobId, JobStatus.FAILURE);
            }
        }
        statusStore.setStatus(jobId, job.stage.toStatus());
        LOG.info("Job {} finished with status {} in {} ms.", jobId, result.status, job.elapsedMillis());
        return result;
    }

    private CatchmentAreaResult runStages (Job job, CatchmentAreaRequest request) {
        checkNotNull(request, "A request is required.");
        request.validate();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Job {} request: {}", job.jobId, JsonUtilities.objectToJsonString(request));
        }

        job.advance(JobStage.ASSEMBLING);
        SubNetworkBuilder builder = assembler.assemble(request);
        EdgeCostCalculator costCalculator = CostModel.forMode(request.mode, request.costBudget.kind,
                request.getSpeedKph(), request.getDismountSpeedKph());
        SubNetwork subNetwork = builder.build(costCalculator);

        job.advance(JobStage.SEARCHING);
        ReachabilityResult reachability = new ReachabilityRouter(subNetwork, request.costBudget.value).route();

        int zoom = request.mode.gridZoom;
        switch (request.resultType) {
            case POLYGON: {
                job.advance(JobStage.CONTOURING);
                IsochroneGenerator generator = new IsochroneGenerator(zoom, request.getSteps(), request.getPercentile());
                List<IsochroneFeature> bands = IsochroneGenerator.prepareForPersistence(
                        generator.generate(reachability), request.polygonDifference);
                job.advance(JobStage.PERSISTING);
                persistence.persistPolygons(job.jobId, bands);
                job.advance(JobStage.SUCCESS);
                return CatchmentAreaResult.polygons(job.jobId, bands);
            }
            case NETWORK: {
                List<NetworkFeature> features = NetworkFeature.forResult(reachability);
                job.advance(JobStage.PERSISTING);
                persistence.persistNetwork(job.jobId, features);
                job.advance(JobStage.SUCCESS);
                return CatchmentAreaResult.network(job.jobId, features);
            }
            case GRID: {
                ReachabilityGrid grid = ReachabilityGrid.forReachedNodes(reachability, zoom);
                job.advance(JobStage.PERSISTING);
                persistence.persistGrid(job.jobId, grid);
                job.advance(JobStage.SUCCESS);
                return CatchmentAreaResult.grid(job.jobId, grid);
            }
            default:
                throw new IllegalArgumentException("Unsupported result type " + request.resultType);
        }
    }

    public void shutdown () {
        executor.shutdown();
    }

    /** Tracks the stage of a single job and the time spent in each stage. */
    private static class Job {
        final String jobId;
        final long startTime = System.currentTimeMillis();
        JobStage stage = JobStage.ACCEPTED;
        long stageStartTime = startTime;

        Job (String jobId) {
            this.jobId = jobId;
        }

        void advance (JobStage next) {
            checkState(stage.canMoveTo(next), "Job %s cannot move from %s to %s.", jobId, stage, next);
            long now = System.currentTimeMillis();
            LOG.debug("Job {} spent {} ms in stage {}.", jobId, now - stageStartTime, stage);
            stage = next;
            stageStartTime = now;
        }

        long elapsedMillis () {
            return System.currentTimeMillis() - startTime;
        }
    }
}

package com.conveyal.catchment.analyst.cluster;

import java.util.EnumSet;
import java.util.Set;

/**
 * The internal stages of a job as it moves through the pipeline. Polygon requests pass through CONTOURING, other
 * result types go straight from SEARCHING to PERSISTING. Any non-terminal stage may fail, and only assembly can find
 * that an origin is disconnected.
 */
public enum JobStage {
    ACCEPTED,
    ASSEMBLING,
    SEARCHING,
    CONTOURING,
    PERSISTING,
    SUCCESS,
    FAILURE,
    DISCONNECTED_ORIGIN;

    private Set<JobStage> successors () {
        switch (this) {
            case ACCEPTED: return EnumSet.of(ASSEMBLING, FAILURE);
            case ASSEMBLING: return EnumSet.of(SEARCHING, FAILURE, DISCONNECTED_ORIGIN);
            case SEARCHING: return EnumSet.of(CONTOURING, PERSISTING, FAILURE);
            case CONTOURING: return EnumSet.of(PERSISTING, FAILURE);
            case PERSISTING: return EnumSet.of(SUCCESS, FAILURE);
            default: return EnumSet.noneOf(JobStage.class);
        }
    }

    public boolean canMoveTo (JobStage next) {
        return successors().contains(next);
    }

    public boolean isTerminal () {
        return this == SUCCESS || this == FAILURE || this == DISCONNECTED_ORIGIN;
    }

    /** The status reported for a job ending in this stage. */
    public JobStatus toStatus () {
        switch (this) {
            case SUCCESS: return JobStatus.SUCCESS;
            case FAILURE: return JobStatus.FAILURE;
            case DISCONNECTED_ORIGIN: return JobStatus.DISCONNECTED_ORIGIN;
            default: return JobStatus.IN_PROGRESS;
        }
    }
}

package com.conveyal.catchment.analyst.cluster;

/** Where job statuses are published for clients to poll. Implementations must be threadsafe. */
public interface JobStatusStore {

    void setStatus (String jobId, JobStatus status);

    /** @return the last status set for the job, or null if the job is unknown. */
    JobStatus getStatus (String jobId);

}

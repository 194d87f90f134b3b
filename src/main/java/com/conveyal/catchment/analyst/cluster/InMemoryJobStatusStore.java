package com.conveyal.catchment.analyst.cluster;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps job statuses in memory, along with every status each job went through. Refuses to change a terminal status.
 * Histories are immutable lists replaced as a whole, so readers never see one being changed.
 */
public class InMemoryJobStatusStore implements JobStatusStore {

    private final Map<String, List<JobStatus>> statusHistory = new ConcurrentHashMap<>();

    @Override
    public void setStatus (String jobId, JobStatus status) {
        statusHistory.compute(jobId, (id, history) -> {
            List<JobStatus> updated = new ArrayList<>();
            if (history != null) {
                JobStatus current = history.get(history.size() - 1);
                if (current.isTerminal()) {
                    throw new IllegalStateException(String.format(
                            "Job %s already has terminal status %s, cannot set %s.", id, current, status));
                }
                updated.addAll(history);
            }
            updated.add(status);
            return List.copyOf(updated);
        });
    }

    @Override
    public JobStatus getStatus (String jobId) {
        List<JobStatus> history = statusHistory.get(jobId);
        return history == null ? null : history.get(history.size() - 1);
    }

    /** Every status set for the job, in order. Empty for unknown jobs. */
    public List<JobStatus> getHistory (String jobId) {
        return statusHistory.getOrDefault(jobId, List.of());
    }
}

package com.uptimesentinel.service.store;

import com.uptimesentinel.core.model.JobState;
import com.uptimesentinel.core.model.QueueJob;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public interface JobQueue {
    long enqueue(String monitorId, Instant scheduledAt);

    List<QueueJob> fetchDue(int limit);

    QueueJob markProcessing(long jobId);

    void markCompleted(long jobId);

    void markFailed(long jobId);

    int purgeTerminalOlderThan(int days);

    Optional<QueueJob> get(long jobId);

    List<QueueJob> findByState(JobState state);

    /**
     * Fetches due jobs and moves each to processing. This default is the two-step form and is
     * only safe with a single consumer; implementations may override it with a single atomic claim.
     */
    default List<QueueJob> claimDue(int limit) {
        List<QueueJob> claimed = new ArrayList<>();
        for (QueueJob job : fetchDue(limit)) {
            claimed.add(markProcessing(job.id()));
        }
        return claimed;
    }
}

package com.uptimesentinel.core.model;

import java.time.Instant;
import java.util.Objects;

public record QueueJob(
        long id,
        String monitorId,
        JobState state,
        Instant scheduledAt,
        int attempts,
        Instant processedAt,
        Instant createdAt
) {
    public QueueJob {
        Objects.requireNonNull(monitorId, "monitorId is required");
        Objects.requireNonNull(state, "state is required");
        Objects.requireNonNull(scheduledAt, "scheduledAt is required");
    }

    public static QueueJob pending(long id, String monitorId, Instant scheduledAt, Instant createdAt) {
        return new QueueJob(id, monitorId, JobState.PENDING, scheduledAt, 0, null, createdAt);
    }

    public boolean isDue(Instant now) {
        return state == JobState.PENDING && !scheduledAt.isAfter(now);
    }

    public QueueJob claimed() {
        requireTransition(JobState.PROCESSING);
        return new QueueJob(id, monitorId, JobState.PROCESSING, scheduledAt, attempts + 1, null, createdAt);
    }

    public QueueJob finished(JobState terminal, Instant at) {
        requireTransition(terminal);
        return new QueueJob(id, monitorId, terminal, scheduledAt, attempts, at, createdAt);
    }

    private void requireTransition(JobState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Job " + id + " cannot move from " + state + " to " + next);
        }
    }
}

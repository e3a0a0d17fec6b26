package com.uptimesentinel.core.model;

import java.time.Instant;
import java.util.Objects;

public record CheckOutcome(
        Long id,
        String monitorId,
        CheckStatus status,
        Instant checkedAt,
        Long responseTimeMs,
        Integer httpStatusCode,
        String errorMessage
) {
    public CheckOutcome {
        Objects.requireNonNull(monitorId, "monitorId is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(checkedAt, "checkedAt is required");
    }

    public CheckOutcome withId(long assignedId) {
        return new CheckOutcome(assignedId, monitorId, status, checkedAt, responseTimeMs, httpStatusCode, errorMessage);
    }
}

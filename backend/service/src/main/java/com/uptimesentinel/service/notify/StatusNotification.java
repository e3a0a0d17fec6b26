package com.uptimesentinel.service.notify;

import com.uptimesentinel.core.model.CheckOutcome;
import com.uptimesentinel.core.model.CheckStatus;
import com.uptimesentinel.core.model.Monitor;

import java.time.Instant;
import java.util.Objects;

public record StatusNotification(
        String monitorId,
        String ownerId,
        String url,
        CheckStatus status,
        CheckStatus previousStatus,
        Instant checkedAt,
        Long responseTimeMs,
        Integer httpStatusCode,
        String errorMessage
) {
    public StatusNotification {
        Objects.requireNonNull(monitorId, "monitorId is required");
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(checkedAt, "checkedAt is required");
    }

    public static StatusNotification of(Monitor monitor, CheckOutcome outcome, CheckStatus previousStatus) {
        return new StatusNotification(
                monitor.id(),
                monitor.ownerId(),
                monitor.url(),
                outcome.status(),
                previousStatus,
                outcome.checkedAt(),
                outcome.responseTimeMs(),
                outcome.httpStatusCode(),
                outcome.errorMessage()
        );
    }

    public boolean isUp() {
        return status == CheckStatus.UP;
    }

    public String headline() {
        if (status == CheckStatus.DOWN) {
            return "Monitor " + url + " is DOWN";
        }
        if (previousStatus == CheckStatus.DOWN) {
            return "Monitor " + url + " is back UP";
        }
        return "Monitor " + url + " is UP";
    }
}

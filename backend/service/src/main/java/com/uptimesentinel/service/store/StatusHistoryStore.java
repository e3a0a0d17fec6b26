package com.uptimesentinel.service.store;

import com.uptimesentinel.core.model.CheckOutcome;

import java.util.List;
import java.util.Optional;

// latest is by checkedAt, ties go to the later append
public interface StatusHistoryStore {
    CheckOutcome append(CheckOutcome outcome);

    Optional<CheckOutcome> latest(String monitorId);

    List<CheckOutcome> recent(String monitorId, int limit);
}

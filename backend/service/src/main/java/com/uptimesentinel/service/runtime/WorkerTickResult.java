package com.uptimesentinel.service.runtime;

public record WorkerTickResult(int claimed, int recorded, int completed, int failed, int purged) {
    public static WorkerTickResult idle(int purged) {
        return new WorkerTickResult(0, 0, 0, 0, purged);
    }
}

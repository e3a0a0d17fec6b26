package com.uptimesentinel.service.notify;

public record DispatchSummary(boolean notified, int attempted, int delivered) {
    public static DispatchSummary skipped() {
        return new DispatchSummary(false, 0, 0);
    }

    public int failed() {
        return attempted - delivered;
    }
}

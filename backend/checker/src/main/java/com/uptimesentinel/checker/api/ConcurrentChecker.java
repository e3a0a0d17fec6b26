package com.uptimesentinel.checker.api;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Executes a batch of probes in parallel. The returned future completes once every probe has
 * finished or hit its own timeout, with exactly one result per distinct request key. Transport
 * failures are reported as unsuccessful results, never as an exceptional completion.
 */
public interface ConcurrentChecker {
    CompletableFuture<Map<String, ProbeResult>> checkAll(List<ProbeRequest> requests);
}

package com.uptimesentinel.checker.http;

import com.uptimesentinel.checker.api.ConcurrentChecker;
import com.uptimesentinel.checker.api.ProbeRequest;
import com.uptimesentinel.checker.api.ProbeResult;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

public class HttpProbeChecker implements ConcurrentChecker {
    private static final Logger LOGGER = Logger.getLogger(HttpProbeChecker.class.getName());
    static final String USER_AGENT = "UptimeSentinel/1.0";

    private final HttpClient httpClient;

    public HttpProbeChecker(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
    }

    @Override
    public CompletableFuture<Map<String, ProbeResult>> checkAll(List<ProbeRequest> requests) {
        Map<String, ProbeRequest> distinct = new LinkedHashMap<>();
        for (ProbeRequest request : requests) {
            distinct.putIfAbsent(request.key(), request);
        }

        List<CompletableFuture<ProbeResult>> probes = distinct.values().stream()
                .map(this::probe)
                .toList();

        return CompletableFuture.allOf(probes.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> {
                    Map<String, ProbeResult> results = new LinkedHashMap<>();
                    for (CompletableFuture<ProbeResult> probe : probes) {
                        ProbeResult result = probe.join();
                        results.put(result.key(), result);
                    }
                    return results;
                });
    }

    private CompletableFuture<ProbeResult> probe(ProbeRequest request) {
        long startedNanos = System.nanoTime();
        CompletableFuture<HttpResponse<Void>> exchange;
        try {
            HttpRequest httpRequest = HttpRequest.newBuilder(URI.create(request.url()))
                    .GET()
                    .timeout(request.timeout())
                    .header("User-Agent", USER_AGENT)
                    .build();
            exchange = httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.discarding());
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(
                    ProbeResult.down(request.key(), null, 0, "Invalid URL: " + request.url()));
        }

        return exchange
                .orTimeout(request.timeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
                    if (error != null) {
                        String message = FailureClassifier.describe(request.url(), request.timeout(), error);
                        LOGGER.log(Level.FINE, () -> "Probe " + request.key() + " failed: " + message);
                        return ProbeResult.down(request.key(), null, elapsedMillis, message);
                    }
                    int status = response.statusCode();
                    if (status >= 200 && status < 400) {
                        return ProbeResult.up(request.key(), status, elapsedMillis);
                    }
                    LOGGER.log(Level.FINE, () -> "Probe " + request.key() + " returned HTTP " + status);
                    return ProbeResult.down(request.key(), status, elapsedMillis, "HTTP " + status);
                });
    }
}

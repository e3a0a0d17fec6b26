package com.uptimesentinel.checker.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.uptimesentinel.checker.api.ProbeRequest;
import com.uptimesentinel.checker.api.ProbeResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpProbeCheckerTest {
    private HttpServer server;
    private ExecutorService serverExecutor;
    private HttpProbeChecker checker;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        serverExecutor = Executors.newFixedThreadPool(16);
        server.setExecutor(serverExecutor);
        checker = new HttpProbeChecker(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(1))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    @Test
    void successfulResponseIsUpWithStatusCodeAndTiming() {
        server.createContext("/ok", exchange -> respond(exchange, 200, "fine"));
        server.start();

        ProbeResult result = checkOne(new ProbeRequest("a", url("/ok"), Duration.ofSeconds(2)));

        assertTrue(result.success());
        assertEquals(200, result.httpStatusCode());
        assertNull(result.errorMessage());
        assertTrue(result.responseTimeMs() >= 0);
    }

    @Test
    void serverErrorIsDownWithStatusCodeInMessage() {
        server.createContext("/unavailable", exchange -> respond(exchange, 503, "maintenance"));
        server.start();

        ProbeResult result = checkOne(new ProbeRequest("a", url("/unavailable"), Duration.ofSeconds(2)));

        assertFalse(result.success());
        assertEquals(503, result.httpStatusCode());
        assertTrue(result.errorMessage().contains("503"));
    }

    @Test
    void redirectsAreFollowedToTheFinalStatus() {
        server.createContext("/moved", exchange -> {
            exchange.getResponseHeaders().add("Location", url("/landing"));
            exchange.sendResponseHeaders(302, -1);
            exchange.close();
        });
        server.createContext("/landing", exchange -> respond(exchange, 200, "landed"));
        server.start();

        ProbeResult result = checkOne(new ProbeRequest("a", url("/moved"), Duration.ofSeconds(2)));

        assertTrue(result.success());
        assertEquals(200, result.httpStatusCode());
    }

    @Test
    void stalledTargetDoesNotHoldBackTheRestOfTheBatch() {
        server.createContext("/fast", exchange -> respond(exchange, 200, "fast"));
        server.createContext("/stall", exchange -> {
            sleep(3_000);
            respond(exchange, 200, "too late");
        });
        server.start();

        long started = System.nanoTime();
        Map<String, ProbeResult> results = checker.checkAll(List.of(
                new ProbeRequest("fast-1", url("/fast"), Duration.ofSeconds(2)),
                new ProbeRequest("stall", url("/stall"), Duration.ofMillis(300)),
                new ProbeRequest("fast-2", url("/fast"), Duration.ofSeconds(2))
        )).join();
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertEquals(3, results.size());
        assertTrue(results.get("fast-1").success());
        assertTrue(results.get("fast-2").success());
        ProbeResult stalled = results.get("stall");
        assertFalse(stalled.success());
        assertNull(stalled.httpStatusCode());
        assertTrue(stalled.errorMessage().toLowerCase(Locale.ROOT).contains("timed out"));
        assertTrue(elapsedMillis < 2_500, "batch took " + elapsedMillis + " ms");
    }

    @Test
    void probesInABatchRunConcurrently() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        server.createContext("/slow", exchange -> {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            sleep(400);
            inFlight.decrementAndGet();
            respond(exchange, 204, "");
        });
        server.start();

        List<ProbeRequest> batch = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            batch.add(new ProbeRequest("slow-" + i, url("/slow?i=" + i), Duration.ofSeconds(5)));
        }

        long started = System.nanoTime();
        Map<String, ProbeResult> results = checker.checkAll(batch).join();
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertEquals(8, results.size());
        assertTrue(results.values().stream().allMatch(ProbeResult::success));
        assertTrue(peak.get() > 1, "expected overlapping probes, peak was " + peak.get());
        assertTrue(elapsedMillis < 8 * 400, "batch took " + elapsedMillis + " ms");
    }

    @Test
    void unknownHostIsReportedAsDnsFailure() {
        ProbeResult result = checkOne(new ProbeRequest("dns", "http://does-not-exist.invalid/health", Duration.ofSeconds(2)));

        assertFalse(result.success());
        assertNull(result.httpStatusCode());
        String message = result.errorMessage().toLowerCase(Locale.ROOT);
        assertTrue(message.contains("dns") || message.contains("unknown host"), message);
    }

    @Test
    void refusedConnectionIsDownWithoutStatusCode() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        ProbeResult result = checkOne(new ProbeRequest("refused", "http://127.0.0.1:" + closedPort + "/", Duration.ofSeconds(2)));

        assertFalse(result.success());
        assertNull(result.httpStatusCode());
        assertFalse(result.errorMessage().isBlank());
    }

    @Test
    void malformedUrlIsAResultNotAnException() {
        ProbeResult result = checkOne(new ProbeRequest("bad", "not a url", Duration.ofSeconds(1)));

        assertFalse(result.success());
        assertTrue(result.errorMessage().startsWith("Invalid URL"));
    }

    @Test
    void duplicateKeysAreProbedOnce() {
        AtomicInteger hits = new AtomicInteger();
        server.createContext("/count", exchange -> {
            hits.incrementAndGet();
            respond(exchange, 200, "ok");
        });
        server.start();

        Map<String, ProbeResult> results = checker.checkAll(List.of(
                new ProbeRequest("same", url("/count"), Duration.ofSeconds(2)),
                new ProbeRequest("same", url("/count"), Duration.ofSeconds(2))
        )).join();

        assertEquals(1, results.size());
        assertEquals(1, hits.get());
    }

    @Test
    void emptyBatchCompletesImmediately() {
        assertTrue(checker.checkAll(List.of()).join().isEmpty());
    }

    private ProbeResult checkOne(ProbeRequest request) {
        return checker.checkAll(List.of(request)).join().get(request.key());
    }

    private String url(String path) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    private static void respond(HttpExchange exchange, int code, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(code, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

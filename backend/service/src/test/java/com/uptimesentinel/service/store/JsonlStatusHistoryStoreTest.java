package com.uptimesentinel.service.store;

import com.uptimesentinel.core.model.CheckOutcome;
import com.uptimesentinel.core.model.CheckStatus;
import com.uptimesentinel.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonlStatusHistoryStoreTest {
    private static final Instant T0 = Instant.parse("2026-03-02T12:00:00Z");

    @Test
    void latestIsByCheckTimeWithAppendOrderBreakingTies() throws Exception {
        JsonlStatusHistoryStore store = new JsonlStatusHistoryStore(tempFile());
        store.append(outcome("m1", CheckStatus.UP, T0.plusSeconds(60)));
        store.append(outcome("m1", CheckStatus.DOWN, T0));
        assertEquals(CheckStatus.UP, store.latest("m1").orElseThrow().status());

        store.append(outcome("m1", CheckStatus.DOWN, T0.plusSeconds(60)));
        assertEquals(CheckStatus.DOWN, store.latest("m1").orElseThrow().status());
        assertTrue(store.latest("other").isEmpty());
    }

    @Test
    void assignsSequentialIdsAndReturnsRecentNewestFirst() throws Exception {
        JsonlStatusHistoryStore store = new JsonlStatusHistoryStore(tempFile());
        CheckOutcome first = store.append(outcome("m1", CheckStatus.UP, T0));
        store.append(outcome("m2", CheckStatus.UP, T0));
        CheckOutcome third = store.append(outcome("m1", CheckStatus.DOWN, T0.plusSeconds(30)));

        assertEquals(1L, first.id());
        assertEquals(3L, third.id());
        List<CheckOutcome> recent = store.recent("m1", 5);
        assertEquals(List.of(third, first), recent);
    }

    @Test
    void secondInstanceSeesAppendsFromFirst() throws Exception {
        Path file = tempFile();
        JsonlStatusHistoryStore writer = new JsonlStatusHistoryStore(file);
        JsonlStatusHistoryStore reader = new JsonlStatusHistoryStore(file);
        assertTrue(reader.latest("m1").isEmpty());

        writer.append(outcome("m1", CheckStatus.DOWN, T0));

        assertEquals(CheckStatus.DOWN, reader.latest("m1").orElseThrow().status());
        assertEquals(2L, reader.append(outcome("m1", CheckStatus.UP, T0.plusSeconds(60))).id());
    }

    @Test
    void corruptLineFailsWithLocation() throws Exception {
        Path file = tempFile();
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{not json}\n", StandardCharsets.UTF_8, StandardOpenOption.CREATE);

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new JsonlStatusHistoryStore(file).latest("m1"));
        assertTrue(ex.getMessage().contains("line 1"));
    }

    @Test
    void readsHistoryLargerThanTwoGigabytes() throws Exception {
        Path file = tempFile();
        Files.createDirectories(file.getParent());
        Files.writeString(file, JsonUtils.toJson(outcome("m1", CheckStatus.UP, T0)) + "\n", StandardCharsets.UTF_8);
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "rw")) {
            raf.setLength((2L << 30) + 10);
            raf.seek(raf.length());
            raf.write(("\n" + JsonUtils.toJson(outcome("m1", CheckStatus.DOWN, T0.plusSeconds(60))) + "\n")
                    .getBytes(StandardCharsets.UTF_8));
        }

        JsonlStatusHistoryStore store = new JsonlStatusHistoryStore(file);
        CheckOutcome latest = store.latest("m1").orElseThrow();

        assertEquals(CheckStatus.DOWN, latest.status());
        assertEquals(3L, latest.id());
        assertEquals(4L, store.append(outcome("m1", CheckStatus.UP, T0.plusSeconds(120))).id());
    }

    @Test
    void keepsOnlyNewestOutcomesPerMonitorInMemory() throws Exception {
        JsonlStatusHistoryStore store = new JsonlStatusHistoryStore(tempFile(), 3);
        for (int i = 0; i < 10; i++) {
            store.append(outcome("m1", CheckStatus.UP, T0.plusSeconds(60L * i)));
        }
        store.append(outcome("m1", CheckStatus.DOWN, T0.minusSeconds(60)));

        List<CheckOutcome> recent = store.recent("m1", 10);
        assertEquals(List.of(10L, 9L, 8L), recent.stream().map(CheckOutcome::id).toList());
        assertEquals(List.of(10L), store.recent("m1", 1).stream().map(CheckOutcome::id).toList());
    }

    @Test
    void unterminatedTrailingLineIsReplacedByNextAppend() throws Exception {
        Path file = tempFile();
        JsonlStatusHistoryStore store = new JsonlStatusHistoryStore(file);
        store.append(outcome("m1", CheckStatus.UP, T0));
        Files.writeString(file, "{\"monitor_id\":\"m1\"", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        JsonlStatusHistoryStore other = new JsonlStatusHistoryStore(file);
        assertEquals(1L, other.latest("m1").orElseThrow().id());
        assertEquals(2L, other.append(outcome("m1", CheckStatus.DOWN, T0.plusSeconds(60))).id());
        assertEquals(2, Files.readAllLines(file).size());
    }

    private static CheckOutcome outcome(String monitorId, CheckStatus status, Instant at) {
        return new CheckOutcome(null, monitorId, status, at, 10L, status == CheckStatus.UP ? 200 : 500, null);
    }

    private static Path tempFile() throws Exception {
        return Files.createTempDirectory("status-history-").resolve("data/history.jsonl");
    }
}

package com.uptimesentinel.service.store;

import com.uptimesentinel.core.model.CheckOutcome;
import com.uptimesentinel.core.util.JsonUtils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

// One outcome per line; the line number is the outcome id. Only the newest outcomes of each
// monitor are kept in memory, so recent() never sees more than that many.
public class JsonlStatusHistoryStore implements StatusHistoryStore {
    private static final Comparator<CheckOutcome> NEWEST_FIRST =
            Comparator.comparing(CheckOutcome::checkedAt).thenComparing(CheckOutcome::id).reversed();

    static final int DEFAULT_RETAINED_PER_MONITOR = 100;
    private static final int READ_CHUNK_BYTES = 1 << 20;
    private static final int MAX_LINE_BYTES = 1 << 20;

    private final Path file;
    private final int retainedPerMonitor;
    private final ReentrantLock lock;
    private final Map<String, List<CheckOutcome>> byMonitor = new HashMap<>();
    private long readOffset;
    private long lineCount;

    public JsonlStatusHistoryStore(Path file) {
        this(file, DEFAULT_RETAINED_PER_MONITOR);
    }

    JsonlStatusHistoryStore(Path file, int retainedPerMonitor) {
        if (retainedPerMonitor < 1) {
            throw new IllegalArgumentException("retainedPerMonitor must be >= 1");
        }
        this.file = file.toAbsolutePath();
        this.retainedPerMonitor = retainedPerMonitor;
        this.lock = FileLocks.forPath(this.file);
    }

    @Override
    public CheckOutcome append(CheckOutcome outcome) {
        lock.lock();
        try {
            Files.createDirectories(file.getParent());
            try (FileChannel channel = FileChannel.open(file,
                    StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                // same channel: closing a second descriptor on this file would drop the OS lock
                catchUp(channel);
                CheckOutcome stored = outcome.withId(lineCount + 1);
                byte[] line = (JsonUtils.toJson(stored) + "\n").getBytes(StandardCharsets.UTF_8);
                channel.truncate(readOffset);
                channel.position(readOffset);
                ByteBuffer buffer = ByteBuffer.wrap(line);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(false);
                readOffset += line.length;
                lineCount++;
                index(stored);
                return stored;
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending status record to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<CheckOutcome> latest(String monitorId) {
        return recent(monitorId, 1).stream().findFirst();
    }

    @Override
    public List<CheckOutcome> recent(String monitorId, int limit) {
        lock.lock();
        try {
            if (Files.exists(file)) {
                try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
                    catchUp(channel);
                }
            }
            List<CheckOutcome> outcomes = byMonitor.getOrDefault(monitorId, List.of());
            return List.copyOf(outcomes.subList(0, Math.min(outcomes.size(), Math.max(0, limit))));
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading status history from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    // Reads whole lines past readOffset in fixed-size chunks. NUL bytes never occur in a JSON record
    // and are dropped, so zero-filled gaps left by an interrupted write read as blank lines.
    private void catchUp(FileChannel channel) throws IOException {
        if (channel.size() <= readOffset) {
            return;
        }
        channel.position(readOffset);
        ByteBuffer buffer = ByteBuffer.allocate(READ_CHUNK_BYTES);
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        long position = readOffset;
        while (channel.read(buffer) > 0) {
            buffer.flip();
            byte[] chunk = buffer.array();
            int end = buffer.limit();
            for (int i = 0; i < end; i++) {
                byte value = chunk[i];
                position++;
                if (value == '\n') {
                    consumeLine(line.toString(StandardCharsets.UTF_8), position);
                    line.reset();
                } else if (value != 0) {
                    if (line.size() >= MAX_LINE_BYTES) {
                        throw new IllegalStateException("Status record at line " + (lineCount + 1)
                                + " of " + file + " exceeds " + MAX_LINE_BYTES + " bytes");
                    }
                    line.write(value);
                }
            }
            buffer.clear();
        }
    }

    private void consumeLine(String line, long endOffset) {
        long lineNumber = lineCount + 1;
        if (!line.isBlank()) {
            CheckOutcome outcome;
            try {
                outcome = JsonUtils.fromJson(line, CheckOutcome.class);
            } catch (RuntimeException decodeError) {
                throw new IllegalStateException("Invalid status record at line " + lineNumber + " of " + file, decodeError);
            }
            index(outcome.id() == null ? outcome.withId(lineNumber) : outcome);
        }
        lineCount = lineNumber;
        readOffset = endOffset;
    }

    private void index(CheckOutcome outcome) {
        List<CheckOutcome> outcomes = byMonitor.computeIfAbsent(outcome.monitorId(), ignored -> new ArrayList<>());
        int slot = Collections.binarySearch(outcomes, outcome, NEWEST_FIRST);
        outcomes.add(slot < 0 ? -slot - 1 : slot, outcome);
        if (outcomes.size() > retainedPerMonitor) {
            outcomes.remove(outcomes.size() - 1);
        }
    }
}

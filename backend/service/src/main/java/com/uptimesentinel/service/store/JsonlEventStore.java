package com.uptimesentinel.service.store;

import com.uptimesentinel.core.events.Event;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

// Rolls to a single .1 generation past maxBytes. The scheduler and worker processes share the file,
// so rollover and append run under an OS lock on a sidecar .lock file.
public class JsonlEventStore implements EventStore {
    static final long DEFAULT_MAX_BYTES = 16L * 1024 * 1024;

    private final Path file;
    private final Path rolled;
    private final Path lockFile;
    private final long maxBytes;
    private final ReentrantLock lock;

    public JsonlEventStore(Path file) {
        this(file, DEFAULT_MAX_BYTES);
    }

    JsonlEventStore(Path file, long maxBytes) {
        this.file = file.toAbsolutePath();
        this.rolled = this.file.resolveSibling(this.file.getFileName() + ".1");
        this.lockFile = this.file.resolveSibling(this.file.getFileName() + ".lock");
        this.lock = FileLocks.forPath(this.file);
        this.maxBytes = maxBytes;
    }

    @Override
    public void append(Event event) {
        String line = EventCodec.toJsonLine(event);
        try {
            exclusively(() -> {
                if (Files.exists(file) && Files.size(file) >= maxBytes) {
                    Files.move(file, rolled, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                }
                try (BufferedWriter writer = Files.newBufferedWriter(
                        file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                    writer.write(line);
                    writer.newLine();
                }
            });
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending event to " + file, e);
        }
    }

    // Newest limit matches, oldest first.
    @Override
    public List<Event> query(Instant since, Optional<String> type, int limit) {
        Deque<Event> window = new ArrayDeque<>();
        try {
            exclusively(() -> {
                collect(rolled, since, type, limit, window);
                collect(file, since, type, limit, window);
            });
        } catch (IOException e) {
            throw new IllegalStateException("Failed locking " + file, e);
        }
        return new ArrayList<>(window);
    }

    private void exclusively(IoAction action) throws IOException {
        lock.lock();
        try {
            Files.createDirectories(file.getParent());
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                action.run();
            }
        } finally {
            lock.unlock();
        }
    }

    private static void collect(Path source, Instant since, Optional<String> type, int limit, Deque<Event> window) {
        if (limit <= 0 || !Files.exists(source)) {
            return;
        }
        try (BufferedReader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                Event event;
                try {
                    event = EventCodec.fromJsonLine(line);
                } catch (RuntimeException decodeError) {
                    throw new IllegalStateException("Invalid event at line " + lineNumber + " of " + source, decodeError);
                }
                if (event.timestamp().isBefore(since) || type.map(t -> !t.equals(event.type())).orElse(false)) {
                    continue;
                }
                window.addLast(event);
                if (window.size() > limit) {
                    window.removeFirst();
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading events from " + source, e);
        }
    }

    @FunctionalInterface
    private interface IoAction {
        void run() throws IOException;
    }
}

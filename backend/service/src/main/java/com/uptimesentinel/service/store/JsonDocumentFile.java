package com.uptimesentinel.service.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.uptimesentinel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

// Shared between processes: updates hold an OS lock on a sidecar .lock file, re-read the document,
// and replace the file atomically.
final class JsonDocumentFile<T> {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final Path lockFile;
    private final TypeReference<T> type;
    private final Supplier<T> emptyDocument;
    private final ReentrantLock lock;
    private T document;
    private Version loadedVersion;

    JsonDocumentFile(Path file, TypeReference<T> type, Supplier<T> emptyDocument) {
        this.file = file.toAbsolutePath();
        this.lockFile = this.file.resolveSibling(this.file.getFileName() + ".lock");
        this.lock = FileLocks.forPath(this.file);
        this.type = type;
        this.emptyDocument = emptyDocument;
        this.document = emptyDocument.get();
    }

    T read() {
        lock.lock();
        try {
            refreshIfChanged();
            return document;
        } finally {
            lock.unlock();
        }
    }

    <R> R update(Function<T, Change<T, R>> mutation) {
        return update(mutation, result -> {
        });
    }

    // committed runs after the new document is on disk, still inside the lock.
    <R> R update(Function<T, Change<T, R>> mutation, Consumer<R> committed) {
        return locked(() -> {
            refreshIfChanged();
            Change<T, R> change = mutation.apply(document);
            if (change.document() != document) {
                write(change.document());
            }
            committed.accept(change.result());
            return change.result();
        });
    }

    <R> R locked(LockedAction<R> action) {
        lock.lock();
        try {
            Files.createDirectories(file.getParent());
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return action.run();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed updating " + file, e);
        } finally {
            lock.unlock();
        }
    }

    Path path() {
        return file;
    }

    private void refreshIfChanged() {
        try {
            if (!Files.exists(file)) {
                if (loadedVersion != null) {
                    document = emptyDocument.get();
                    loadedVersion = null;
                }
                return;
            }
            Version current = Version.of(file);
            if (current.equals(loadedVersion)) {
                return;
            }
            try (InputStream in = Files.newInputStream(file)) {
                T loaded = current.size() == 0 ? null : MAPPER.readValue(in, type);
                document = loaded == null ? emptyDocument.get() : loaded;
            }
            loadedVersion = current;
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading " + file, e);
        }
    }

    private void write(T next) throws IOException {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try (OutputStream out = Files.newOutputStream(temp)) {
            MAPPER.writeValue(out, next);
        }
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        document = next;
        loadedVersion = Version.of(file);
    }

    private record Version(Object fileKey, long modifiedMillis, long size) {
        static Version of(Path path) throws IOException {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            return new Version(attributes.fileKey(), attributes.lastModifiedTime().toMillis(), attributes.size());
        }
    }

    record Change<T, R>(T document, R result) {
        Change {
            Objects.requireNonNull(document, "document is required");
        }

        static <T, R> Change<T, R> of(T document, R result) {
            return new Change<>(document, result);
        }
    }

    @FunctionalInterface
    interface LockedAction<R> {
        R run() throws IOException;
    }
}

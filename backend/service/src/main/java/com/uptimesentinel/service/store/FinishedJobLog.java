package com.uptimesentinel.service.store;

import com.uptimesentinel.core.model.QueueJob;
import com.uptimesentinel.core.util.JsonUtils;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

// Completed and failed jobs, one per line. Callers hold the queue document's lock.
final class FinishedJobLog {
    private final Path file;

    FinishedJobLog(Path file) {
        this.file = file.toAbsolutePath();
    }

    void append(QueueJob job) throws IOException {
        Files.createDirectories(file.getParent());
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            writer.write(JsonUtils.toJson(job));
            writer.newLine();
        }
    }

    Optional<QueueJob> find(long jobId) throws IOException {
        List<QueueJob> matches = select(job -> job.id() == jobId);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(matches.size() - 1));
    }

    List<QueueJob> select(Predicate<QueueJob> filter) throws IOException {
        List<QueueJob> selected = new ArrayList<>();
        if (!Files.exists(file)) {
            return selected;
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            long lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                QueueJob job = decode(line, lineNumber);
                if (filter.test(job)) {
                    selected.add(job);
                }
            }
        }
        return selected;
    }

    int purgeProcessedBefore(Instant cutoff) throws IOException {
        if (!Files.exists(file)) {
            return 0;
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        int removed = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
            String line;
            long lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                QueueJob job = decode(line, lineNumber);
                if (job.processedAt() != null && job.processedAt().isBefore(cutoff)) {
                    removed++;
                } else {
                    writer.write(line);
                    writer.newLine();
                }
            }
        }
        if (removed == 0) {
            Files.delete(temp);
            return 0;
        }
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        return removed;
    }

    private QueueJob decode(String line, long lineNumber) {
        try {
            return JsonUtils.fromJson(line, QueueJob.class);
        } catch (RuntimeException e) {
            throw new IllegalStateException("Invalid finished job record at line " + lineNumber + " of " + file, e);
        }
    }
}

package com.uptimesentinel.service.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.uptimesentinel.core.model.JobState;
import com.uptimesentinel.core.model.QueueJob;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

// queue.json holds pending and processing jobs only; finished jobs move to a JSON lines log next to
// it, so the rewritten document stays the size of the backlog.
public class JsonFileJobQueue implements JobQueue {
    private static final Comparator<QueueJob> DUE_ORDER =
            Comparator.comparing(QueueJob::scheduledAt).thenComparingLong(QueueJob::id);

    private final JsonDocumentFile<QueueFile> document;
    private final FinishedJobLog finished;
    private final Clock clock;

    public JsonFileJobQueue(Path file, Clock clock) {
        this.document = new JsonDocumentFile<>(file, new TypeReference<>() {
        }, QueueFile::empty);
        this.finished = new FinishedJobLog(finishedLogPath(document.path()));
        this.clock = clock;
    }

    static Path finishedLogPath(Path queueFile) {
        String name = queueFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return queueFile.resolveSibling(base + "-finished.jsonl");
    }

    @Override
    public long enqueue(String monitorId, Instant scheduledAt) {
        Instant now = clock.instant();
        return document.<Long>update(queue -> {
            long id = queue.nextId();
            List<QueueJob> jobs = new ArrayList<>(queue.jobs());
            jobs.add(QueueJob.pending(id, monitorId, scheduledAt, now));
            return JsonDocumentFile.Change.of(new QueueFile(id + 1, jobs), id);
        });
    }

    @Override
    public List<QueueJob> fetchDue(int limit) {
        return due(document.read(), clock.instant(), limit);
    }

    @Override
    public QueueJob markProcessing(long jobId) {
        return transition(jobId, QueueJob::claimed);
    }

    @Override
    public void markCompleted(long jobId) {
        Instant now = clock.instant();
        transition(jobId, job -> job.finished(JobState.COMPLETED, now));
    }

    @Override
    public void markFailed(long jobId) {
        Instant now = clock.instant();
        transition(jobId, job -> job.finished(JobState.FAILED, now));
    }

    @Override
    public List<QueueJob> claimDue(int limit) {
        Instant now = clock.instant();
        return document.<List<QueueJob>>update(queue -> {
            List<QueueJob> selected = due(queue, now, limit);
            if (selected.isEmpty()) {
                return JsonDocumentFile.Change.of(queue, List.of());
            }
            List<QueueJob> claimed = new ArrayList<>();
            List<QueueJob> jobs = new ArrayList<>(queue.jobs());
            for (QueueJob job : selected) {
                QueueJob next = job.claimed();
                jobs.set(jobs.indexOf(job), next);
                claimed.add(next);
            }
            return JsonDocumentFile.Change.of(new QueueFile(queue.nextId(), jobs), List.copyOf(claimed));
        });
    }

    @Override
    public int purgeTerminalOlderThan(int days) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        int fromLog = document.locked(() -> finished.purgeProcessedBefore(cutoff));
        int fromDocument = document.<Integer>update(queue -> {
            List<QueueJob> kept = queue.jobs().stream()
                    .filter(job -> !isExpired(job, cutoff))
                    .toList();
            int deleted = queue.jobs().size() - kept.size();
            if (deleted == 0) {
                return JsonDocumentFile.Change.of(queue, 0);
            }
            return JsonDocumentFile.Change.of(new QueueFile(queue.nextId(), kept), deleted);
        });
        return fromLog + fromDocument;
    }

    @Override
    public Optional<QueueJob> get(long jobId) {
        Optional<QueueJob> active = document.read().jobs().stream().filter(job -> job.id() == jobId).findFirst();
        if (active.isPresent()) {
            return active;
        }
        return document.locked(() -> finished.find(jobId));
    }

    @Override
    public List<QueueJob> findByState(JobState state) {
        List<QueueJob> matches = new ArrayList<>(document.read().jobs().stream()
                .filter(job -> job.state() == state)
                .toList());
        if (state.isTerminal()) {
            matches.addAll(document.locked(() -> finished.select(job -> job.state() == state)));
        }
        matches.sort(DUE_ORDER);
        return List.copyOf(matches);
    }

    private QueueJob transition(long jobId, UnaryOperator<QueueJob> step) {
        return document.<QueueJob>update(queue -> {
            List<QueueJob> jobs = new ArrayList<>(queue.jobs());
            for (int i = 0; i < jobs.size(); i++) {
                if (jobs.get(i).id() == jobId) {
                    QueueJob next = step.apply(jobs.get(i));
                    if (next.state().isTerminal()) {
                        jobs.remove(i);
                    } else {
                        jobs.set(i, next);
                    }
                    return JsonDocumentFile.Change.of(new QueueFile(queue.nextId(), jobs), next);
                }
            }
            QueueJob done = findFinished(jobId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown job id: " + jobId));
            // a finished job never moves again; the state machine rejects it
            return JsonDocumentFile.Change.of(queue, step.apply(done));
        }, next -> {
            if (next.state().isTerminal()) {
                appendFinished(next);
            }
        });
    }

    private Optional<QueueJob> findFinished(long jobId) {
        try {
            return finished.find(jobId);
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading finished jobs", e);
        }
    }

    private void appendFinished(QueueJob job) {
        try {
            finished.append(job);
        } catch (IOException e) {
            throw new IllegalStateException("Failed recording finished job " + job.id(), e);
        }
    }

    private static List<QueueJob> due(QueueFile queue, Instant now, int limit) {
        return queue.jobs().stream()
                .filter(job -> job.isDue(now))
                .sorted(DUE_ORDER)
                .limit(Math.max(0, limit))
                .toList();
    }

    private static boolean isExpired(QueueJob job, Instant cutoff) {
        return job.state().isTerminal() && job.processedAt() != null && job.processedAt().isBefore(cutoff);
    }

    record QueueFile(long nextId, List<QueueJob> jobs) {
        QueueFile {
            jobs = jobs == null ? List.of() : List.copyOf(jobs);
            nextId = Math.max(1, nextId);
        }

        static QueueFile empty() {
            return new QueueFile(1, List.of());
        }
    }
}

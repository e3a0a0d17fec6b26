package com.uptimesentinel.service.store;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

// OS file locks are per JVM, so instances on one path serialize here before taking the OS lock.
final class FileLocks {
    private static final Map<Path, ReentrantLock> LOCKS = new ConcurrentHashMap<>();

    private FileLocks() {
    }

    static ReentrantLock forPath(Path file) {
        return LOCKS.computeIfAbsent(file.toAbsolutePath().normalize(), ignored -> new ReentrantLock());
    }
}

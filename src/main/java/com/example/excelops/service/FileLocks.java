package com.example.excelops.service;

import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per workbook file. A load-change-save cycle holds its file's lock throughout, so
 * operations on the same file run one at a time while different files proceed in parallel.
 * <p>
 * Entries are counted by the threads holding or waiting for them and removed when the last one
 * leaves, so the map only ever holds files that are in use.
 */
@Component
public class FileLocks {

    private final ConcurrentMap<Path, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(Path file, Supplier<T> action) {
        Path key = key(file);
        Entry entry = locks.compute(key, (k, existing) -> {
            Entry e = existing == null ? new Entry() : existing;
            e.users++;
            return e;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
        }
    }

    boolean isLocked(Path file) {
        Entry entry = locks.get(key(file));
        return entry != null && entry.lock.isLocked();
    }

    int trackedFiles() {
        return locks.size();
    }

    private static Path key(Path file) {
        return file.toAbsolutePath().normalize();
    }

    // users is only touched inside compute/computeIfPresent, which run atomically per key
    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}

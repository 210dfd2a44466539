package com.phillippitts.speechmaker.service.error;

import com.phillippitts.speechmaker.domain.ErrorCategory;
import com.phillippitts.speechmaker.domain.ErrorRecord;
import com.phillippitts.speechmaker.domain.Severity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded in-memory audit trail of classified errors. When full, the oldest record is evicted.
 * Per-category and per-severity counters are cumulative until {@link #clear()}.
 *
 * <p>This is the only mutable diagnostics state; one instance is owned by the application context
 * and injected where needed. Thread-safe.
 */
public final class ErrorLog {

    private final int capacity;
    private final Deque<ErrorRecord> entries;
    private final Map<ErrorCategory, Long> byCategory = new EnumMap<>(ErrorCategory.class);
    private final Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
    private final ReentrantLock lock = new ReentrantLock();
    private long total;

    public ErrorLog(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public void append(ErrorRecord record) {
        lock.lock();
        try {
            if (entries.size() == capacity) {
                entries.removeFirst();
            }
            entries.addLast(record);
            byCategory.merge(record.category(), 1L, Long::sum);
            bySeverity.merge(record.severity(), 1L, Long::sum);
            total++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param limit maximum number of records
     * @return newest records first
     */
    public List<ErrorRecord> recent(int limit) {
        lock.lock();
        try {
            List<ErrorRecord> out = new ArrayList<>(Math.min(Math.max(limit, 0), entries.size()));
            Iterator<ErrorRecord> it = entries.descendingIterator();
            while (it.hasNext() && out.size() < limit) {
                out.add(it.next());
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public ErrorStats stats() {
        lock.lock();
        try {
            ErrorRecord newest = entries.peekLast();
            return new ErrorStats(total, entries.size(), byCategory, bySeverity,
                    bySeverity.getOrDefault(Severity.CRITICAL, 0L),
                    newest == null ? null : newest.timestamp());
        } finally {
            lock.unlock();
        }
    }

    /** Drops all records and counters. */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            byCategory.clear();
            bySeverity.clear();
            total = 0;
        } finally {
            lock.unlock();
        }
    }
}

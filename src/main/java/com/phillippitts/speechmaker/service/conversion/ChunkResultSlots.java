package com.phillippitts.speechmaker.service.conversion;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Per-index result slots for one session. Workers fill slots in completion order; the merge reads
 * them in index order.
 */
final class ChunkResultSlots {

    private final AtomicReferenceArray<Path> slots;
    private final AtomicInteger filled = new AtomicInteger();

    ChunkResultSlots(int size) {
        this.slots = new AtomicReferenceArray<>(size);
    }

    /**
     * @throws IllegalStateException if the slot was already filled
     */
    void fill(int index, Path output) {
        if (!slots.compareAndSet(index, null, output)) {
            throw new IllegalStateException("Chunk " + index + " already has a result");
        }
        filled.incrementAndGet();
    }

    int filledCount() {
        return filled.get();
    }

    int size() {
        return slots.length();
    }

    boolean isComplete() {
        return filled.get() == slots.length();
    }

    /**
     * Outputs ordered by chunk index.
     *
     * @throws IllegalStateException if any slot is still empty
     */
    List<Path> inOrder() {
        List<Path> ordered = new ArrayList<>(slots.length());
        for (int i = 0; i < slots.length(); i++) {
            Path p = slots.get(i);
            if (p == null) {
                throw new IllegalStateException("Chunk " + i + " has no result");
            }
            ordered.add(p);
        }
        return ordered;
    }
}

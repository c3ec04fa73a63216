package com.acme.furfolio.eventlog.queue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity, insertion-ordered buffer that evicts its oldest element when full.
 *
 * <p>All mutation and snapshot copying happen under one lock, so {@link #snapshot()} never
 * observes a partially applied append and {@link #size()} never exceeds {@link #capacity()}.
 * The backing deque is never handed out.</p>
 */
public final class BoundedEventBuffer<E> implements BoundedBuffer<E> {
    private final int capacity;
    private final ArrayDeque<E> elements;
    private final ReentrantLock lock = new ReentrantLock();

    public BoundedEventBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.elements = new ArrayDeque<>(capacity);
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return elements.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public AppendResult<E> append(E e) {
        Objects.requireNonNull(e, "e");
        lock.lock();
        try {
            E oldest = null;
            if (elements.size() >= capacity) {
                oldest = elements.pollFirst();
            }
            elements.addLast(e);
            if (oldest != null) {
                return new AppendResult.Evicted<>(oldest, elements.size());
            }
            return new AppendResult.Appended<>(elements.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns an unmodifiable oldest-first copy taken under the buffer lock.
     */
    @Override
    public List<E> snapshot() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(elements));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            elements.clear();
        } finally {
            lock.unlock();
        }
    }
}

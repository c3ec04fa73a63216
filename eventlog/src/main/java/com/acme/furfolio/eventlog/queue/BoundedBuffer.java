package com.acme.furfolio.eventlog.queue;

import java.util.List;

public interface BoundedBuffer<E> {
    int capacity();
    int size();
    AppendResult<E> append(E e);
    List<E> snapshot();
    void clear();
}

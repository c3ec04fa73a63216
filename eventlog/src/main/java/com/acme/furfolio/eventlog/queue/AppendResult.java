package com.acme.furfolio.eventlog.queue;

public sealed interface AppendResult<E> permits AppendResult.Appended, AppendResult.Evicted {
    int depth();

    record Appended<E>(int depth) implements AppendResult<E> {}
    record Evicted<E>(E evicted, int depth) implements AppendResult<E> {}
}

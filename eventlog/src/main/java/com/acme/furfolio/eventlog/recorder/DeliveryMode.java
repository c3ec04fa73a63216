package com.acme.furfolio.eventlog.recorder;

public enum DeliveryMode {
    /** Delivery runs on the recording thread after the buffer lock is released. */
    INLINE,
    /** Delivery runs on a per-recorder worker fed by a bounded queue. */
    ASYNC
}

package com.acme.furfolio.eventlog.queue;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoundedEventBufferConcurrencyTest {

    @Test
    void shouldNeverExceedCapacityUnderConcurrentAppendsAndSnapshots() throws Exception {
        int capacity = 50;
        int producers = 4;
        int perProducer = 5_000;
        BoundedEventBuffer<Integer> buffer = new BoundedEventBuffer<>(capacity);
        ExecutorService pool = Executors.newFixedThreadPool(producers + 1);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger nextId = new AtomicInteger();
        AtomicInteger evictions = new AtomicInteger();
        AtomicBoolean done = new AtomicBoolean(false);
        AtomicBoolean oversized = new AtomicBoolean(false);
        try {
            Future<?>[] writers = new Future<?>[producers];
            for (int i = 0; i < producers; i++) {
                writers[i] = pool.submit(() -> {
                    start.await();
                    for (int n = 0; n < perProducer; n++) {
                        if (buffer.append(nextId.getAndIncrement()) instanceof AppendResult.Evicted) {
                            evictions.incrementAndGet();
                        }
                    }
                    return null;
                });
            }
            Future<?> reader = pool.submit(() -> {
                start.await();
                while (!done.get()) {
                    List<Integer> snapshot = buffer.snapshot();
                    if (snapshot.size() > capacity || new HashSet<>(snapshot).size() != snapshot.size()) {
                        oversized.set(true);
                    }
                }
                return null;
            });

            start.countDown();
            for (Future<?> writer : writers) {
                writer.get(20, TimeUnit.SECONDS);
            }
            done.set(true);
            reader.get(20, TimeUnit.SECONDS);

            List<Integer> snapshot = buffer.snapshot();
            Set<Integer> distinct = new HashSet<>(snapshot);
            assertFalse(oversized.get(), "snapshot observed a torn or oversized buffer");
            assertEquals(capacity, snapshot.size());
            assertEquals(capacity, distinct.size());
            assertEquals(producers * perProducer, nextId.get());
            assertEquals(producers * perProducer - capacity, evictions.get());
            assertTrue(snapshot.stream().allMatch(v -> v >= 0 && v < producers * perProducer));
        } finally {
            pool.shutdownNow();
            pool.awaitTermination(2, TimeUnit.SECONDS);
        }
    }
}

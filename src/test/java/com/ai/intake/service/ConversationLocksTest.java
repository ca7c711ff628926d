package com.ai.intake.service;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConversationLocksTest {

    private final ConversationLocks locks = new ConversationLocks();

    @Test
    void serializesWorkOnTheSameId() throws Exception {
        int[] counter = {0};
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            futures.add(pool.submit(() -> locks.withLock("c1", () -> {
                int v = counter[0];
                Thread.yield();
                counter[0] = v + 1;
                return v;
            })));
        }
        for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
        pool.shutdown();

        assertEquals(200, counter[0]);
        assertEquals(0, locks.activeCount());
    }

    @Test
    void differentIdsDoNotBlockEachOther() throws Exception {
        CountDownLatch insideA = new CountDownLatch(1);
        CountDownLatch releaseA = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        Future<String> a = pool.submit(() -> locks.withLock("a", () -> {
            insideA.countDown();
            try {
                releaseA.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "a";
        }));
        assertTrue(insideA.await(5, TimeUnit.SECONDS));

        assertEquals("b", locks.withLock("b", () -> "b"));
        assertEquals(1, locks.activeCount());

        releaseA.countDown();
        assertEquals("a", a.get(5, TimeUnit.SECONDS));
        pool.shutdown();
        assertEquals(0, locks.activeCount());
    }

    @Test
    void lockIsReleasedWhenWorkThrows() {
        assertThrows(IllegalStateException.class, () -> locks.withLock("c1", () -> {
            throw new IllegalStateException("boom");
        }));
        assertEquals(0, locks.activeCount());
        assertEquals("ok", locks.withLock("c1", () -> "ok"));
    }
}

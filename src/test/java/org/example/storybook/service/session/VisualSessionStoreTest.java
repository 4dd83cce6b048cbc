package org.example.storybook.service.session;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VisualSessionStoreTest {

    private VisualSessionStore store;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        store = new VisualSessionStore();
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void get_nullStoryIdIsEmpty() {
        assertTrue(store.get(null).isEmpty());
    }

    @Test
    void removeLocked_retiresTheStoryLock() {
        ReentrantLock lock = store.acquire("story-1");
        try {
            store.put(VisualSession.partial("story-1", "conv-1"));
            assertEquals(1, store.lockCount());

            assertEquals("conv-1", store.removeLocked("story-1", lock).orElseThrow().sessionId());
        } finally {
            lock.unlock();
        }

        assertEquals(0, store.lockCount());
        assertEquals(0, store.size());
    }

    @Test
    void removeLocked_requiresTheHeldLock() {
        ReentrantLock lock = store.acquire("story-1");
        lock.unlock();

        assertThrows(IllegalStateException.class, () -> store.removeLocked("story-1", lock));
    }

    @Test
    void waiterOnRetiredLockMovesToTheCurrentLock() throws Exception {
        ReentrantLock first = store.acquire("story-1");
        CountDownLatch waiting = new CountDownLatch(1);
        Future<ReentrantLock> waiter = executor.submit(() -> {
            waiting.countDown();
            ReentrantLock acquired = store.acquire("story-1");
            acquired.unlock();
            return acquired;
        });
        assertTrue(waiting.await(5, TimeUnit.SECONDS));
        // give the waiter time to block on the first lock
        Thread.sleep(50);

        store.removeLocked("story-1", first);
        ReentrantLock replacement = store.acquire("story-1");
        try {
            assertNotSame(first, replacement);
            first.unlock();
            Thread.sleep(50);
            assertFalse(waiter.isDone(), "waiter must not run while the current lock is held");
        } finally {
            replacement.unlock();
        }

        assertEquals(replacement, waiter.get(5, TimeUnit.SECONDS));
    }
}

package dev.maxim.testrun;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ConcurrencyGateTest {
    private final List<String> keys = new ArrayList<>();

    @AfterEach
    void tearDown() {
        keys.forEach(ConcurrencyGate::evict);
    }

    private String key(String suffix) {
        var key = ConcurrencyGate.key("ws", "gate-test", suffix);
        keys.add(key);
        return key;
    }

    @Test
    void sameKeySharesGate() {
        var key = key("run-1");
        var first = ConcurrencyGate.forKey(key, 2);
        var second = ConcurrencyGate.forKey(key, 5);

        assertSame(first, second);
        assertEquals(2, second.permits());
    }

    @Test
    void differentKeysAreIndependent() {
        var first = ConcurrencyGate.forKey(key("run-1"), 1);
        var second = ConcurrencyGate.forKey(key("run-2"), 1);

        assertNotSame(first, second);
    }

    @Test
    void keyJoinsWorkspaceNameAndRun() {
        assertEquals("ws-1:nightly:run-3", ConcurrencyGate.key("ws-1", "nightly", "run-3"));
    }

    @Test
    void evictForgetsGate() {
        var key = key("run-1");
        var first = ConcurrencyGate.forKey(key, 1);
        ConcurrencyGate.evict(key);

        assertFalse(ConcurrencyGate.isRegistered(key));
        assertNotSame(first, ConcurrencyGate.forKey(key, 1));
    }

    @Test
    void releaseWithoutAcquireFails() {
        var gate = new ConcurrencyGate(1);

        assertThrows(IllegalStateException.class, gate::release);
    }

    @Test
    void rejectsNonPositivePermits() {
        assertThrows(IllegalArgumentException.class, () -> new ConcurrencyGate(0));
    }

    @Test
    void neverAdmitsMoreThanPermits() throws Exception {
        var gate = new ConcurrencyGate(3);
        var executor = Executors.newFixedThreadPool(10);
        var active = new AtomicInteger();
        var peak = new AtomicInteger();
        var done = new CountDownLatch(30);
        try {
            for (int i = 0; i < 30; i++) {
                executor.submit(
                        () -> {
                            try {
                                gate.acquire();
                                try {
                                    int now = active.incrementAndGet();
                                    peak.accumulateAndGet(now, Math::max);
                                    Thread.sleep(5);
                                    active.decrementAndGet();
                                } finally {
                                    gate.release();
                                }
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            } finally {
                                done.countDown();
                            }
                        });
            }
            assertTrue(done.await(30, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertTrue(peak.get() <= 3, "peak concurrency was " + peak.get());
        assertEquals(0, gate.activeCount());
    }

    @Test
    void blockedAcquireProceedsAfterRelease() throws Exception {
        var gate = new ConcurrencyGate(1);
        gate.acquire();
        var acquired = new CountDownLatch(1);
        var waiter =
                new Thread(
                        () -> {
                            try {
                                gate.acquire();
                                acquired.countDown();
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            }
                        });
        waiter.start();

        assertFalse(acquired.await(100, TimeUnit.MILLISECONDS));
        gate.release();
        assertTrue(acquired.await(5, TimeUnit.SECONDS));
        assertEquals(1, gate.activeCount());
        waiter.join();
    }

    @Test
    void releaseAdmitsWaitersInArrivalOrder() throws Exception {
        var gate = new ConcurrencyGate(1);
        gate.acquire();
        var admitted = new CopyOnWriteArrayList<Integer>();
        var waiters = new ArrayList<Thread>();
        for (int i = 0; i < 3; i++) {
            final int id = i;
            var waiter =
                    new Thread(
                            () -> {
                                try {
                                    gate.acquire();
                                    admitted.add(id);
                                    gate.release();
                                } catch (InterruptedException e) {
                                    Thread.currentThread().interrupt();
                                }
                            });
            waiter.start();
            waiters.add(waiter);
            awaitWaiting(gate, i + 1);
        }

        assertEquals(List.of(), admitted);
        gate.release();
        for (var waiter : waiters) {
            waiter.join(5_000);
        }

        assertEquals(List.of(0, 1, 2), admitted);
        assertEquals(0, gate.activeCount());
    }

    private static void awaitWaiting(ConcurrencyGate gate, int expected) throws Exception {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (gate.waitingCount() < expected) {
            assertTrue(System.nanoTime() < deadline, "waiter " + expected + " never blocked");
            Thread.sleep(1);
        }
    }
}

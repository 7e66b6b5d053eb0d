package dev.maxim.testrun;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Admits at most a fixed number of holders at a time. Waiters are admitted in arrival order.
 *
 * <p>Gates live in a process-wide registry keyed by workspace, run name and run id, so every
 * lookup for the same run shares one gate. A run evicts its gate once all of its rows have been
 * submitted and finished.
 */
@Slf4j
public final class ConcurrencyGate {
    private static final Map<String, ConcurrencyGate> REGISTRY = new ConcurrentHashMap<>();

    private final int permits;
    private final Semaphore semaphore;
    private final AtomicInteger active = new AtomicInteger();

    ConcurrencyGate(int permits) {
        if (permits < 1) {
            throw new IllegalArgumentException("permits must be at least 1: " + permits);
        }
        this.permits = permits;
        this.semaphore = new Semaphore(permits, true);
    }

    /** Get the gate registered under the key, creating it with the given permits if absent. */
    public static ConcurrencyGate forKey(String key, int permits) {
        return REGISTRY.computeIfAbsent(
                key,
                k -> {
                    log.debug("creating concurrency gate {} with {} permits", k, permits);
                    return new ConcurrencyGate(permits);
                });
    }

    public static String key(String workspaceId, String runName, String testRunId) {
        return workspaceId + ":" + runName + ":" + testRunId;
    }

    /** Remove the gate registered under the key. Holders of the removed gate are unaffected. */
    public static void evict(String key) {
        REGISTRY.remove(key);
    }

    static boolean isRegistered(String key) {
        return REGISTRY.containsKey(key);
    }

    /** Block until a slot is free and take it. */
    public void acquire() throws InterruptedException {
        semaphore.acquire();
        active.incrementAndGet();
    }

    /**
     * Give back a slot taken with {@link #acquire()}.
     *
     * @throws IllegalStateException if no slot is held
     */
    public void release() {
        int previous = active.getAndUpdate(count -> count > 0 ? count - 1 : count);
        if (previous == 0) {
            throw new IllegalStateException("release() without a matching acquire()");
        }
        semaphore.release();
    }

    /** estimate of the threads blocked in {@link #acquire()} */
    int waitingCount() {
        return semaphore.getQueueLength();
    }

    public int permits() {
        return permits;
    }

    /** number of slots currently held */
    public int activeCount() {
        return active.get();
    }
}

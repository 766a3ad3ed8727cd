package com.stableledger.common;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs mutating requests one at a time in arrival order (fair lock). Reads do not go through here.
 */
public class LedgerSerializer {

    private final ReentrantLock lock = new ReentrantLock(true);

    public <T> T execute(Supplier<T> work) {
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public void run(Runnable work) {
        execute(() -> {
            work.run();
            return null;
        });
    }

    /** Number of requests waiting for their turn. */
    public int queueLength() {
        return lock.getQueueLength();
    }
}

/* (C)2026 */
package com.ammann.intervals.store;

import jakarta.enterprise.context.ApplicationScoped;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Critical-section guard shared by {@link ProgramStore} and {@link IntervalStore}.
 *
 * <p>Readers are isolated from writers: any number of readers (queries, integrity
 * validation) may hold the lock together, while a synchronizer mutation holds it
 * exclusively for the whole write to both stores. A reader therefore sees the pair of
 * stores either before or after a mutation, never in between.
 *
 * <p>The write side is package-private so that only {@link ProgramSynchronizer} can open
 * a write section.
 */
@ApplicationScoped
public class StoreLock {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    /**
     * Runs {@code action} while holding the shared read lock.
     *
     * @param action read-only action over the stores
     * @return the action's result
     */
    public <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    void checkWriteLocked() {
        if (!lock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("Store mutation outside of a write section");
        }
    }
}

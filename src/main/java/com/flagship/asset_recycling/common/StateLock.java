package com.flagship.asset_recycling.common;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Single lock over all registry and ledger state.
 *
 * Every mutation runs under the write lock as one indivisible step; queries
 * run under the read lock and so never observe half of a recycle commit.
 * The write lock is reentrant, so a write step may read through the same
 * components it is updating.
 */
@Component
public class StateLock {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void write(Runnable action) {
        write(() -> {
            action.run();
            return null;
        });
    }
}

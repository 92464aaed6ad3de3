package com.flagship.asset_recycling.recycle;

import com.flagship.asset_recycling.exception.ReentrantCallException;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-progress guard around an exchange section.
 *
 * A second entry from the thread that already holds the guard (a collaborator
 * calling back into the service) is rejected with
 * {@link ReentrantCallException}. Entries from other threads wait, which
 * serializes exchanges.
 */
public class ExchangeGuard {

    private final String name;
    private final ReentrantLock lock = new ReentrantLock();

    public ExchangeGuard(String name) {
        this.name = name;
    }

    public <T> T call(Supplier<T> body) {
        if (lock.isHeldByCurrentThread()) {
            throw new ReentrantCallException(name + " already in progress");
        }
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }
}

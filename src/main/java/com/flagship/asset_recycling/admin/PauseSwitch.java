package com.flagship.asset_recycling.admin;

import com.flagship.asset_recycling.exception.PausedException;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Global halt for recycle operations. Registry mutation, queries and
 * emergency rescue ignore it.
 */
@Component
public class PauseSwitch {

    private final AtomicBoolean paused = new AtomicBoolean(false);

    /**
     * @return true if the state changed
     */
    public boolean pause() {
        return paused.compareAndSet(false, true);
    }

    /**
     * @return true if the state changed
     */
    public boolean unpause() {
        return paused.compareAndSet(true, false);
    }

    public boolean isPaused() {
        return paused.get();
    }

    public void ensureNotPaused() {
        if (paused.get()) {
            throw new PausedException("Recycling is paused");
        }
    }
}

package com.benchwise.domain.agent.model.valobj;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-way cancellation flag owned by a single execution.
 */
public final class CancellationSignal {

    private final AtomicBoolean tripped = new AtomicBoolean(false);

    public void trip() {
        tripped.set(true);
    }

    public boolean isTripped() {
        return tripped.get();
    }
}

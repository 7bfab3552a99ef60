package com.codesandbox.engine.admission;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One admitted request that has not completed yet.
 * Closing releases its place under the in-flight ceiling; only the first close counts.
 */
public final class AdmissionTicket implements AutoCloseable {

    private final Runnable      onRelease;
    private final AtomicBoolean released = new AtomicBoolean();

    AdmissionTicket(Runnable onRelease) {
        this.onRelease = onRelease;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            onRelease.run();
        }
    }
}

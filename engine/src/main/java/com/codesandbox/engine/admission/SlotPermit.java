package com.codesandbox.engine.admission;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/** One held unit of execution concurrency. Released once, on the first close. */
public final class SlotPermit implements AutoCloseable {

    private final Semaphore     semaphore;
    private final AtomicBoolean released = new AtomicBoolean();

    SlotPermit(Semaphore semaphore) {
        this.semaphore = semaphore;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            semaphore.release();
        }
    }
}

package com.codesandbox.engine.worker;

import com.codesandbox.engine.worker.dto.WorkerResponse;
import com.codesandbox.engine.worker.dto.WorkerRequest;

/**
 * A live execution process owned by one {@link WorkerSlot}.
 *
 * {@link #handle} blocks for the whole execution. It is only ever called by
 * one thread at a time; {@link #terminate} may be called concurrently from
 * the timeout supervisor to abort it.
 */
public interface Worker {

    /**
     * Run one request and wait for its reply.
     *
     * A reply flagged {@code retire} is returned normally, but the worker is unhealthy afterwards.
     *
     * @throws WorkerException CRASHED or PROTOCOL_ERROR; the worker is unhealthy afterwards
     */
    WorkerResponse handle(WorkerRequest request);

    /** False once the process died or was terminated; an unhealthy worker is never reused. */
    boolean isHealthy();

    /** Kill the process and everything it spawned. Idempotent. */
    void terminate();

    /** Short label for logs, e.g. "worker-3 (pid 4711)". */
    String describe();
}

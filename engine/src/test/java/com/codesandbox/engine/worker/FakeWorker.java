package com.codesandbox.engine.worker;

import com.codesandbox.engine.worker.dto.WorkerRequest;
import com.codesandbox.engine.worker.dto.WorkerResponse;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * In-memory Worker for pool and supervisor tests.
 * The behaviour decides what {@link #handle} does; terminate() releases a blocked {@link #hang()}.
 */
class FakeWorker implements Worker {

    final int id;
    final AtomicInteger handled = new AtomicInteger();

    private final BiFunction<FakeWorker, WorkerRequest, WorkerResponse> behaviour;
    private final CountDownLatch killed = new CountDownLatch(1);
    private volatile boolean terminated;

    FakeWorker(int id, BiFunction<FakeWorker, WorkerRequest, WorkerResponse> behaviour) {
        this.id        = id;
        this.behaviour = behaviour;
    }

    static WorkerResponse echo(FakeWorker self, WorkerRequest request) {
        return new WorkerResponse(request.id(), true, request.source(), null, null, false);
    }

    @Override
    public WorkerResponse handle(WorkerRequest request) {
        handled.incrementAndGet();
        return behaviour.apply(this, request);
    }

    /** Blocks like a hung snippet until this worker is terminated, then fails like a dead pipe. */
    WorkerResponse hang() {
        try {
            killed.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        throw new WorkerException(WorkerException.Kind.CRASHED, describe() + " killed");
    }

    /** Fails like a process that died mid-request. */
    WorkerResponse crash() {
        terminate();
        throw new WorkerException(WorkerException.Kind.CRASHED, describe() + " crashed");
    }

    @Override
    public boolean isHealthy() {
        return !terminated;
    }

    @Override
    public void terminate() {
        terminated = true;
        killed.countDown();
    }

    boolean isTerminated() {
        return terminated;
    }

    @Override
    public String describe() {
        return "fake-worker-" + id;
    }
}

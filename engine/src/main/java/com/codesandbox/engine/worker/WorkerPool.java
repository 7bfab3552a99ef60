package com.codesandbox.engine.worker;

import com.codesandbox.engine.model.ExecutionResult;
import com.codesandbox.engine.worker.dto.WorkerRequest;
import com.codesandbox.engine.worker.dto.WorkerResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Fixed set of worker slots, each backed by one long-lived worker process.
 *
 * A dispatch takes an idle slot (waiting if none is idle), runs exactly one
 * request on its worker under the timeout supervisor, and always returns the
 * slot to the idle queue. A slot whose worker died is repaired before it is
 * handed out again, so the pool keeps its full size across crashes and
 * timeouts.
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final List<WorkerSlot>          slots;
    private final BlockingQueue<WorkerSlot> idle;
    private final TimeoutSupervisor         supervisor;

    private volatile boolean closed;

    public WorkerPool(int size, WorkerLauncher launcher, TimeoutSupervisor supervisor) {
        if (size < 1) {
            throw new IllegalArgumentException("pool size must be at least 1, got " + size);
        }
        this.supervisor = supervisor;
        this.slots      = new ArrayList<>(size);
        this.idle       = new ArrayBlockingQueue<>(size);
        for (int i = 0; i < size; i++) {
            WorkerSlot slot = new WorkerSlot(i, launcher);
            slots.add(slot);
            idle.add(slot);
        }
    }

    /** Launch every worker up front so the first requests don't pay JVM start-up. */
    public void start() {
        slots.forEach(WorkerSlot::warmUp);
        long ready = slots.stream().filter(WorkerSlot::hasHealthyWorker).count();
        log.info("Worker pool started: {}/{} workers ready", ready, slots.size());
    }

    /**
     * Run one request on the next free worker.
     *
     * @return the worker's result; code errors are results, not exceptions
     * @throws WorkerException      if the worker could not produce a result
     * @throws InterruptedException if interrupted while waiting for a slot or a reply
     */
    public ExecutionResult execute(WorkerRequest request, Duration timeout) throws InterruptedException {
        ensureOpen();
        WorkerSlot slot = idle.take();
        try {
            ensureOpen();
            Worker worker = slot.ensureWorker();
            log.debug("Dispatching request {} to {}", request.id(), worker.describe());
            WorkerResponse response = supervisor.supervise(worker, request, timeout);
            return response.toResult();
        } finally {
            if (!closed) {
                slot.recycle();
            }
            idle.offer(slot);
        }
    }

    public int size() {
        return slots.size();
    }

    public int idleCount() {
        return idle.size();
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        log.info("Shutting down worker pool ({} slots)", slots.size());
        slots.forEach(WorkerSlot::shutdown);
    }

    private void ensureOpen() {
        if (closed) {
            throw new WorkerException(WorkerException.Kind.SHUTDOWN, "worker pool is closed");
        }
    }
}

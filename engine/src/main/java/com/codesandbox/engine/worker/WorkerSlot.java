package com.codesandbox.engine.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * One unit of pool capacity and the worker process currently behind it.
 *
 * A slot outlives its workers: when a worker crashes, times out or is
 * otherwise unhealthy, the slot discards it and launches a replacement. If
 * the replacement cannot be started, the slot stays empty and the next
 * dispatch tries again, so capacity is never lost to a failed spawn.
 */
class WorkerSlot {

    private static final Logger log = LoggerFactory.getLogger(WorkerSlot.class);

    private final int            id;
    private final WorkerLauncher launcher;

    private Worker worker;

    WorkerSlot(int id, WorkerLauncher launcher) {
        this.id       = id;
        this.launcher = launcher;
    }

    int id() { return id; }

    /** Start the worker ahead of the first request. Failures are logged; the first dispatch retries. */
    synchronized void warmUp() {
        try {
            ensureWorker();
        } catch (WorkerException e) {
            log.warn("Slot {} could not pre-start its worker: {}", id, e.getMessage());
        }
    }

    /**
     * The healthy worker of this slot, launching one if needed.
     *
     * @throws WorkerException SPAWN_FAILED if no process could be started
     */
    synchronized Worker ensureWorker() {
        if (worker != null && worker.isHealthy()) {
            return worker;
        }
        discard();
        try {
            worker = launcher.launch(id);
        } catch (IOException e) {
            throw new WorkerException(WorkerException.Kind.SPAWN_FAILED,
                    "slot " + id + " could not start a worker: " + e.getMessage(), e);
        }
        return worker;
    }

    /** Called when a dispatch ends; replaces the worker if the dispatch left it unhealthy. */
    synchronized void recycle() {
        if (worker == null || worker.isHealthy()) {
            return;
        }
        log.warn("Replacing {}, no longer healthy after its last execution", worker.describe());
        discard();
        try {
            worker = launcher.launch(id);
        } catch (IOException e) {
            log.error("Slot {} could not start a replacement worker; retrying on next use: {}",
                    id, e.getMessage());
        }
    }

    synchronized void shutdown() {
        discard();
    }

    synchronized boolean hasHealthyWorker() {
        return worker != null && worker.isHealthy();
    }

    private void discard() {
        if (worker != null) {
            worker.terminate();
            worker = null;
        }
    }
}

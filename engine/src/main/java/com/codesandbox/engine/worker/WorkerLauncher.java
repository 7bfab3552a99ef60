package com.codesandbox.engine.worker;

import java.io.IOException;

/**
 * Starts the process behind a worker slot.
 *
 * The production implementation forks a JVM; a container- or
 * namespace-based launcher would plug in here without touching the pool.
 */
public interface WorkerLauncher {

    Worker launch(int slotId) throws IOException;
}

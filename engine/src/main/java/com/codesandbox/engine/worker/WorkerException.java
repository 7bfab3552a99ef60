package com.codesandbox.engine.worker;

/**
 * Thrown when a dispatch to a worker process does not produce a result.
 *
 * Unchecked so the pool and supervisor can let it travel to the coordinator,
 * which is the one place that turns it into an ExecutionResult.
 */
public class WorkerException extends RuntimeException {

    public enum Kind { SPAWN_FAILED, CRASHED, PROTOCOL_ERROR, TIMEOUT, SHUTDOWN }

    private final Kind kind;

    public WorkerException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public WorkerException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}

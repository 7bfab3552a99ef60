package com.codesandbox.engine.model;

/**
 * How a language's code is executed inside a worker process.
 *
 * EMBEDDED: evaluated by an interpreter that lives inside the worker JVM
 *            itself (JShell); stdout/stderr are captured by redirecting
 *            System.out / System.err for the duration of the call.
 *
 * EXTERNAL: the worker writes the source to a temporary file and spawns a
 *            separate interpreter binary against it, capturing the child's
 *            stdout, stderr and exit code.
 */
public enum RunnerKind {
    EMBEDDED,
    EXTERNAL
}

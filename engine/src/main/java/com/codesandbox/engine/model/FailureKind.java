package com.codesandbox.engine.model;

/**
 * Why an execution did not succeed.
 *
 * CODE_ERROR is user-caused and expected. INFRASTRUCTURE means something in
 * the engine itself broke (spawn error, worker crash, I/O failure) and is
 * worth alerting on separately.
 */
public enum FailureKind {
    UNSUPPORTED_LANGUAGE,
    RUNTIME_UNAVAILABLE,
    CODE_ERROR,
    TIMEOUT,
    INFRASTRUCTURE
}

package com.codesandbox.engine.model;

/**
 * Normalized outcome of one execution, whatever happened along the way.
 *
 * success is true exactly when failure is null. On success, error may still
 * carry stderr output as a warning.
 */
public record ExecutionResult(
        boolean     success,
        String      stdout,
        String      error,
        FailureKind failure
) {
    public ExecutionResult {
        if (stdout == null) stdout = "";
        if (success != (failure == null)) {
            throw new IllegalArgumentException(
                    "success=" + success + " is inconsistent with failure=" + failure);
        }
    }

    public static ExecutionResult ok(String stdout, String warnings) {
        return new ExecutionResult(true, stdout, emptyToNull(warnings), null);
    }

    /** The submitted code raised, was rejected by the compiler, or exited non-zero. */
    public static ExecutionResult codeFailure(String stdout, String error) {
        return new ExecutionResult(false, stdout, error, FailureKind.CODE_ERROR);
    }

    /** Failure decided before or around the run; no output was captured. */
    public static ExecutionResult failure(FailureKind kind, String error) {
        return new ExecutionResult(false, "", error, kind);
    }

    /** Error text for the response body, where absent is written as "". */
    public String errorOrEmpty() {
        return error == null ? "" : error;
    }

    private static String emptyToNull(String s) {
        return (s == null || s.isEmpty()) ? null : s;
    }
}
